package net.gridcoord.adapter.jdbc.repo;

import net.gridcoord.adapter.jdbc.JdbcUtil;
import net.gridcoord.adapter.jdbc.TxContext;
import net.gridcoord.adapter.jdbc.mapper.RowMappers;
import net.gridcoord.core.model.Worker;
import net.gridcoord.core.spi.WorkerRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcWorkerRepository implements WorkerRepository {
    private final DataSource ds;

    public JdbcWorkerRepository(DataSource ds) { this.ds = ds; }

    private Connection mustConn() {
        return TxContext.mustGet();
    }

    /** 이름 중복은 UNIQUE 제약 위반(SQLIntegrityConstraintViolationException)으로 올라간다 */
    @Override
    public void insert(Worker w) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_WORKER(ID, OWNER_ID, NAME, MODELS, MAX_CONCURRENT, MAX_PIXELS, MAX_TOKENS,
                                  ACCEPTS_NSFW, PAUSED, MAINTENANCE, HEALTH, AUTO_PAUSED_UNTIL,
                                  SUCCESSES, FAULTS, FAULT_STREAK, LAST_CHECK_IN_AT, ACTIVE, CREATED_AT, VERSION)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """)) {
            ps.setString(1, w.id());
            ps.setString(2, w.ownerId());
            ps.setString(3, w.name());
            ps.setString(4, JdbcUtil.joinList(w.capabilities().models()));
            ps.setInt(5, w.capabilities().maxConcurrent());
            ps.setLong(6, w.capabilities().maxPixels());
            ps.setInt(7, w.capabilities().maxTokens());
            ps.setString(8, JdbcUtil.yn(w.capabilities().acceptsNsfw()));
            ps.setString(9, JdbcUtil.yn(w.paused()));
            ps.setString(10, JdbcUtil.yn(w.maintenance()));
            ps.setString(11, w.health().code());
            ps.setTimestamp(12, JdbcUtil.ts(w.autoPausedUntil()));
            ps.setLong(13, w.successes());
            ps.setLong(14, w.faults());
            ps.setInt(15, w.faultStreak());
            ps.setTimestamp(16, JdbcUtil.ts(w.lastCheckInAt()));
            ps.setString(17, JdbcUtil.yn(w.active()));
            ps.setTimestamp(18, JdbcUtil.ts(w.createdAt()));
            ps.setLong(19, w.version());
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<Worker> findById(String id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_WORKER WHERE ID=?")) {
            ps.setString(1, id);
            return single(ps);
        }
    }

    @Override
    public Optional<Worker> lockById(String id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_WORKER WHERE ID=? FOR UPDATE")) {
            ps.setString(1, id);
            return single(ps);
        }
    }

    @Override
    public Optional<Worker> findByName(String name) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_WORKER WHERE NAME=?")) {
            ps.setString(1, name);
            return single(ps);
        }
    }

    @Override
    public List<Worker> findAll() throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_WORKER ORDER BY CREATED_AT ASC, ID ASC")) {
            List<Worker> out = new ArrayList<>();
            try (var rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toWorker(rs));
            }
            return out;
        }
    }

    @Override
    public boolean update(Worker w, long expectedVersion) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_WORKER
               SET MODELS            = ?,
                   MAX_CONCURRENT    = ?,
                   MAX_PIXELS        = ?,
                   MAX_TOKENS        = ?,
                   ACCEPTS_NSFW      = ?,
                   PAUSED            = ?,
                   MAINTENANCE       = ?,
                   HEALTH            = ?,
                   AUTO_PAUSED_UNTIL = ?,
                   SUCCESSES         = ?,
                   FAULTS            = ?,
                   FAULT_STREAK      = ?,
                   LAST_CHECK_IN_AT  = ?,
                   ACTIVE            = ?,
                   VERSION           = VERSION + 1
             WHERE ID = ?
               AND VERSION = ?
        """)) {
            ps.setString(1, JdbcUtil.joinList(w.capabilities().models()));
            ps.setInt(2, w.capabilities().maxConcurrent());
            ps.setLong(3, w.capabilities().maxPixels());
            ps.setInt(4, w.capabilities().maxTokens());
            ps.setString(5, JdbcUtil.yn(w.capabilities().acceptsNsfw()));
            ps.setString(6, JdbcUtil.yn(w.paused()));
            ps.setString(7, JdbcUtil.yn(w.maintenance()));
            ps.setString(8, w.health().code());
            ps.setTimestamp(9, JdbcUtil.ts(w.autoPausedUntil()));
            ps.setLong(10, w.successes());
            ps.setLong(11, w.faults());
            ps.setInt(12, w.faultStreak());
            ps.setTimestamp(13, JdbcUtil.ts(w.lastCheckInAt()));
            ps.setString(14, JdbcUtil.yn(w.active()));
            ps.setString(15, w.id());
            ps.setLong(16, expectedVersion);
            return ps.executeUpdate() == 1;
        }
    }

    private static Optional<Worker> single(PreparedStatement ps) throws SQLException {
        try (var rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(RowMappers.toWorker(rs)) : Optional.empty();
        }
    }
}
