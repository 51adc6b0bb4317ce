package net.cronkeeper.integration.spring.tx;

import net.cronkeeper.adapter.jdbc.TxContext;
import net.cronkeeper.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.lang.reflect.UndeclaredThrowableException;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 위의 TxRunner.
 * 스토어가 던진 검사 예외(StoreException, SQLException) 는 감싸지 않고 그대로 다시 던진다.
 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        Connection outer = TxContext.get();
        try {
            return tpl.execute(status -> {
                // 스프링 트랜잭션의 물리 커넥션을 TxContext 에 꽂는다
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return body.call();
                } catch (RuntimeException re) {
                    throw re;
                } catch (Exception e) {
                    throw sneakyThrow(e);
                } finally {
                    TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds);
                }
            });
        } catch (UndeclaredThrowableException e) {
            // TransactionTemplate 은 롤백 후 검사 예외를 이걸로 감싼다
            if (e.getUndeclaredThrowable() instanceof Exception checked) throw checked;
            throw e;
        } finally {
            if (outer != null) TxContext.set(outer);
        }
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> RuntimeException sneakyThrow(Throwable t) throws E { throw (E) t; }
}
