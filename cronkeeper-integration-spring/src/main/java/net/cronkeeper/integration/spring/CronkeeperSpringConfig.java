package net.cronkeeper.integration.spring;

import net.cronkeeper.adapter.jdbc.repo.JdbcScheduledJobStore;
import net.cronkeeper.core.service.ReconcilerConfig;
import net.cronkeeper.core.spi.Clock;
import net.cronkeeper.core.spi.CronCalculator;
import net.cronkeeper.core.spi.ScheduledJobStore;
import net.cronkeeper.core.spi.TxRunner;
import net.cronkeeper.integration.spring.cron.CronUtilsCalculator;
import net.cronkeeper.integration.spring.tx.SpringTxRunner;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Duration;

/** TxRunner / 스토어 / 시계 / cron 계산기 배선. ReconcilerConfig 는 앱(또는 bootstrap) 이 준다 */
@Configuration
public class CronkeeperSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean
    public ScheduledJobStore scheduledJobStore(TxRunner tx,
                                               ReconcilerConfig config,
                                               Clock clock,
                                               @Value("${cronkeeper.store.query-timeout-ms:10000}") long queryTimeoutMs) {
        return new JdbcScheduledJobStore(tx, config, clock, Duration.ofMillis(queryTimeoutMs));
    }

    @Bean
    public Clock systemClock() { return Clock.system(); }

    @Bean
    public CronCalculator cronCalculator() { return new CronUtilsCalculator(); }
}
