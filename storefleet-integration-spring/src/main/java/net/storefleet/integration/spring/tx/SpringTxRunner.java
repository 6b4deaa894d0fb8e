package net.storefleet.integration.spring.tx;

import net.storefleet.adapter.jdbc.TxContext;
import net.storefleet.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 매니저 위에서 TxRunner 를 구현한다.
 * 스프링이 바인딩한 커넥션을 TxContext 에 꽂아 JDBC 저장소가 그대로 쓰게 한다.
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
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        Connection outer = TxContext.get();
        try {
            return tpl.execute(status -> {
                // REQUIRED 로 바깥 트랜잭션에 참여하면 같은 커넥션, REQUIRES_NEW 면 새 커넥션
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return body.call();
                } catch (RuntimeException re) {
                    throw re;
                } catch (Exception e) {
                    throw new CheckedFailure(e);
                } finally {
                    DataSourceUtils.releaseConnection(con, ds);
                }
            });
        } catch (CheckedFailure f) {
            throw f.checked;
        } finally {
            if (outer != null) TxContext.set(outer);
            else TxContext.clear();
        }
    }

    /** 콜백 밖으로 checked 예외를 옮기는 운반용. 롤백 규칙상 RuntimeException 이어야 한다 */
    private static final class CheckedFailure extends RuntimeException {
        final Exception checked;

        CheckedFailure(Exception checked) {
            super(checked);
            this.checked = checked;
        }
    }
}
