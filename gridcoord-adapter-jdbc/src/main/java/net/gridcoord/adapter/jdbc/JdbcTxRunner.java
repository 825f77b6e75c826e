package net.gridcoord.adapter.jdbc;

import net.gridcoord.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

/** 스프링 없이 쓰는 TxRunner. 커넥션 하나를 TxContext에 꽂고 커밋/롤백한다. */
public final class JdbcTxRunner implements TxRunner {
    private static final Logger log = LoggerFactory.getLogger(JdbcTxRunner.class);

    private final DataSource ds;

    public JdbcTxRunner(DataSource ds) { this.ds = ds; }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        if (TxContext.get() != null) {
            // 이미 진행 중인 트랜잭션에 참여
            return body.call();
        }
        return inNewTransaction(body);
    }

    private <T> T inNewTransaction(Callable<T> body) throws Exception {
        try (Connection c = ds.getConnection()) {
            boolean prevAuto = c.getAutoCommit();
            c.setAutoCommit(false);
            TxContext.set(c);
            try {
                T r = body.call();
                c.commit();
                return r;
            } catch (Throwable t) {            // Throwable로 롤백 보장
                rollbackQuietly(c, t);
                sneakyThrow(t);                 // 검사/비검사 구분없이 재던짐
                return null; // unreachable
            } finally {
                TxContext.clear();
                restoreAutoCommit(c, prevAuto);
            }
        }
    }

    private static void rollbackQuietly(Connection c, Throwable cause) {
        try {
            c.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private static void restoreAutoCommit(Connection c, boolean prevAuto) {
        try {
            c.setAutoCommit(prevAuto);
        } catch (SQLException e) {
            log.warn("Could not restore autoCommit on pooled connection: {}", e.getMessage());
        }
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> void sneakyThrow(Throwable t) throws E { throw (E) t; }
}
