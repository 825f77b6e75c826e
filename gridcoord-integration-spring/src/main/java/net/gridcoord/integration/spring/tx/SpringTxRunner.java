package net.gridcoord.integration.spring.tx;

import net.gridcoord.adapter.jdbc.TxContext;
import net.gridcoord.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 매니저 위의 TxRunner. 물리 커넥션을 TxContext에 꽂아 JDBC 저장소가 그대로 쓰게 한다.
 * 검사 예외는 롤백을 위해 잠시 감쌌다가 밖에서 원래 예외로 다시 던진다.
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

        try {
            return tpl.execute(status -> {
                // 바깥 트랜잭션에 참여 중이면 같은 커넥션을 그대로 쓴다
                if (TxContext.get() != null) {
                    return call(body);
                }

                // 스프링 트랜잭션의 물리 커넥션을 끌어와 TxContext에 꽂아줌
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return call(body);
                } finally {
                    TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds); // 스프링이 관리하는 방식으로 반납
                }
            });
        } catch (CheckedCarrier carrier) {
            throw carrier.checked;
        }
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new CheckedCarrier(e);
        }
    }

    /** 검사 예외 운반용. 트랜잭션 경계 밖으로는 나가지 않는다 */
    private static final class CheckedCarrier extends RuntimeException {
        private final Exception checked;

        CheckedCarrier(Exception checked) {
            super(checked.getMessage(), checked, false, false);
            this.checked = checked;
        }
    }
}
