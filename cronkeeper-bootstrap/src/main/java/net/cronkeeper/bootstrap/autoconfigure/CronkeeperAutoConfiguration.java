package net.cronkeeper.bootstrap.autoconfigure;

import net.cronkeeper.bootstrap.catalog.CatalogRegistrar;
import net.cronkeeper.bootstrap.props.CronkeeperProperties;
import net.cronkeeper.core.service.ReconcilerConfig;
import net.cronkeeper.core.service.ScheduledJobReconciler;
import net.cronkeeper.core.spi.Clock;
import net.cronkeeper.core.spi.CronCalculator;
import net.cronkeeper.core.spi.ScheduledJobStore;
import net.cronkeeper.integration.spring.CronkeeperSpringConfig;
import net.cronkeeper.integration.spring.sched.ReconcileLoop;
import net.cronkeeper.integration.spring.sched.RequeueTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.ZoneId;

@AutoConfiguration(after = DataSourceTransactionManagerAutoConfiguration.class)
@EnableConfigurationProperties(CronkeeperProperties.class)
@Import(CronkeeperSpringConfig.class) // integration-spring: store/tx/clock/cron 배선
public class CronkeeperAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(CronkeeperAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ReconcilerConfig reconcilerConfig(CronkeeperProperties props) {
        var owner = props.getOwner();
        return new ReconcilerConfig(
                owner.getApiGroup(),
                owner.getKind(),
                owner.getChildKind(),
                owner.getIndexKey(),
                props.getAnnotation().getScheduledAt(),
                ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduledJobReconciler scheduledJobReconciler(ScheduledJobStore store,
                                                         Clock clock,
                                                         CronCalculator cron,
                                                         ReconcilerConfig config) {
        return new ScheduledJobReconciler(store, clock, cron, config);
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(ScheduledJobStore store) {
        return new CatalogRegistrar(store);
    }

    @Bean
    @ConditionalOnProperty(prefix = "cronkeeper.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar, CronkeeperProperties props) {
        log.info("catalogRunner start: jobs={}", props.getCatalog().getJobs());
        return args -> registrar.register(props.getCatalog());
    }

    // --- 재조정 루프 (프로퍼티로 on/off, 주기는 cronkeeper.loop.tick-delay-ms) ---

    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "cronkeeper.loop", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class LoopConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public RequeueTracker requeueTracker(CronkeeperProperties props) {
            return new RequeueTracker(props.getLoop().getBackoffBase(), props.getLoop().getBackoffMax());
        }

        @Bean
        @ConditionalOnMissingBean
        public ReconcileLoop reconcileLoop(ScheduledJobStore store,
                                           ScheduledJobReconciler reconciler,
                                           Clock clock,
                                           RequeueTracker tracker) {
            return new ReconcileLoop(store, reconciler, clock, tracker);
        }
    }
}
