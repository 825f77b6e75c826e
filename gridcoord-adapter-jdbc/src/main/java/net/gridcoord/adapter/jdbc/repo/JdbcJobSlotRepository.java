package net.gridcoord.adapter.jdbc.repo;

import net.gridcoord.adapter.jdbc.JdbcUtil;
import net.gridcoord.adapter.jdbc.TxContext;
import net.gridcoord.adapter.jdbc.mapper.RowMappers;
import net.gridcoord.core.model.JobSlot;
import net.gridcoord.core.model.WorkerCapabilities;
import net.gridcoord.core.spi.JobSlotRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcJobSlotRepository implements JobSlotRepository {
    private final DataSource ds;

    public JdbcJobSlotRepository(DataSource ds) { this.ds = ds; }

    private Connection mustConn() {
        return TxContext.mustGet();
    }

    @Override
    public void insertAll(List<JobSlot> slots) throws Exception {
        if (slots.isEmpty()) return;
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_JOB_SLOT(ID, REQUEST_ID, REQUESTER_ID, TRUST_TIER, SLOT_INDEX, STATE,
                                    KIND, WIDTH, HEIGHT, MAX_TOKENS, STEPS, SAMPLER, MODELS, NSFW,
                                    ATTEMPT, PROGRESS_PERCENT, CREATED_AT, VERSION)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """)) {
            for (JobSlot s : slots) {
                ps.setString(1, s.id());
                ps.setString(2, s.requestId());
                ps.setString(3, s.requesterId());
                ps.setInt(4, s.trustTier());
                ps.setInt(5, s.slotIndex());
                ps.setString(6, s.state().code());
                ps.setString(7, s.params().kind().code());
                ps.setInt(8, s.params().width());
                ps.setInt(9, s.params().height());
                ps.setInt(10, s.params().maxTokens());
                ps.setInt(11, s.params().steps());
                ps.setString(12, s.params().sampler());
                ps.setString(13, JdbcUtil.joinList(s.models()));
                ps.setString(14, JdbcUtil.yn(s.nsfw()));
                ps.setInt(15, s.attempt());
                ps.setInt(16, s.progressPercent());
                ps.setTimestamp(17, JdbcUtil.ts(s.createdAt()));
                ps.setLong(18, s.version());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    @Override
    public Optional<JobSlot> findById(String id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_JOB_SLOT WHERE ID=?")) {
            ps.setString(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toJobSlot(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<JobSlot> findByRequest(String requestId) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM TB_JOB_SLOT WHERE REQUEST_ID=? ORDER BY SLOT_INDEX ASC")) {
            ps.setString(1, requestId);
            return list(ps);
        }
    }

    @Override
    public List<JobSlot> findPending(int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
              FROM TB_JOB_SLOT
             WHERE STATE = 'PENDING'
             ORDER BY CREATED_AT ASC, REQUEST_ID ASC, SLOT_INDEX ASC
             FETCH FIRST ? ROWS ONLY
        """)) {
            ps.setInt(1, limit);
            return list(ps);
        }
    }

    /**
     * 모델/크기/NSFW 조건은 워커 능력으로 조립해 DB에서 거른다.
     * 처리할 수 있는 종류가 없거나 모델이 없으면 조회하지 않는다.
     */
    @Override
    public List<JobSlot> findPendingFor(WorkerCapabilities worker, int limit) throws Exception {
        if (worker.models().isEmpty()) return List.of();

        List<Object> binds = new ArrayList<>();
        StringBuilder where = new StringBuilder("STATE = 'PENDING'");

        StringBuilder model = new StringBuilder("MODELS IS NULL");
        for (String m : worker.models()) {
            model.append(" OR INSTR(',' || MODELS || ',', ',' || ? || ',') > 0");
            binds.add(m);
        }
        where.append(" AND (").append(model).append(')');

        List<String> kinds = new ArrayList<>();
        if (worker.maxPixels() > 0) {
            kinds.add("(KIND = 'IMAGE' AND WIDTH * HEIGHT <= ?)");
            binds.add(worker.maxPixels());
        }
        if (worker.maxTokens() > 0) {
            kinds.add("(KIND = 'TEXT' AND MAX_TOKENS <= ?)");
            binds.add(worker.maxTokens());
        }
        if (kinds.isEmpty()) return List.of();
        where.append(" AND (").append(String.join(" OR ", kinds)).append(')');

        if (!worker.acceptsNsfw()) where.append(" AND NSFW = 'N'");

        String sql = """
            SELECT *
              FROM (SELECT s.*,
                           ROW_NUMBER() OVER (PARTITION BY REQUESTER_ID
                                              ORDER BY CREATED_AT, REQUEST_ID, SLOT_INDEX) AS REQUESTER_RANK
                      FROM TB_JOB_SLOT s
                     WHERE %s)
             ORDER BY REQUESTER_RANK ASC, CREATED_AT ASC, REQUEST_ID ASC, SLOT_INDEX ASC
             FETCH FIRST ? ROWS ONLY
        """.formatted(where);
        try (var ps = mustConn().prepareStatement(sql)) {
            int i = 1;
            for (Object b : binds) {
                if (b instanceof Long l) ps.setLong(i++, l);
                else if (b instanceof Integer n) ps.setInt(i++, n);
                else ps.setString(i++, (String) b);
            }
            ps.setInt(i, limit);
            return list(ps);
        }
    }

    /** LEASE_EXPIRES_AT = 부여 시각 + TTL (갱신 시 자바에서 계산해 저장) */
    @Override
    public List<JobSlot> findLeaseExpiredAt(Instant now, int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
              FROM TB_JOB_SLOT
             WHERE STATE = 'LEASED'
               AND LEASE_EXPIRES_AT < ?
             ORDER BY LEASE_EXPIRES_AT ASC
             FETCH FIRST ? ROWS ONLY
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(now));
            ps.setInt(2, limit);
            return list(ps);
        }
    }

    @Override
    public List<JobSlot> findLeased(int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
              FROM TB_JOB_SLOT
             WHERE STATE = 'LEASED'
             ORDER BY LEASE_GRANTED_AT ASC
             FETCH FIRST ? ROWS ONLY
        """)) {
            ps.setInt(1, limit);
            return list(ps);
        }
    }

    @Override
    public int countLeasedByWorker(String workerId) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT COUNT(*) FROM TB_JOB_SLOT WHERE STATE = 'LEASED' AND WORKER_ID = ?")) {
            ps.setString(1, workerId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    /** 가변 필드 전체를 버전 조건부로 덮어쓴다 */
    @Override
    public boolean update(JobSlot s, long expectedVersion) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_JOB_SLOT
               SET STATE                = ?,
                   ASSIGNED_MODEL       = ?,
                   WORKER_ID            = ?,
                   LEASE_GRANTED_AT     = ?,
                   LEASE_TTL_MS         = ?,
                   LEASE_EXPIRES_AT     = ?,
                   ATTEMPT              = ?,
                   RESULT_REF           = ?,
                   SEED                 = ?,
                   RESULT_METADATA      = ?,
                   FAULT_REASON         = ?,
                   LAST_FAULT_KIND      = ?,
                   LAST_FAULT_WORKER_ID = ?,
                   LAST_FAULT_AT        = ?,
                   PROGRESS_PERCENT     = ?,
                   PROGRESS_UPDATED_AT  = ?,
                   FINISHED_AT          = ?,
                   VERSION              = VERSION + 1
             WHERE ID = ?
               AND VERSION = ?
        """)) {
            ps.setString(1, s.state().code());
            ps.setString(2, s.assignedModel());
            ps.setString(3, s.workerId());
            ps.setTimestamp(4, JdbcUtil.ts(s.leaseGrantedAt()));
            JdbcUtil.setLong(ps, 5, JdbcUtil.millis(s.leaseTtl()));
            ps.setTimestamp(6, JdbcUtil.ts(s.leaseExpiresAt()));
            ps.setInt(7, s.attempt());
            ps.setString(8, s.resultRef());
            JdbcUtil.setLong(ps, 9, s.seed());
            ps.setString(10, s.resultMetadata());
            ps.setString(11, s.faultReason());
            ps.setString(12, s.lastFaultKind() == null ? null : s.lastFaultKind().code());
            ps.setString(13, s.lastFaultWorkerId());
            ps.setTimestamp(14, JdbcUtil.ts(s.lastFaultAt()));
            ps.setInt(15, s.progressPercent());
            ps.setTimestamp(16, JdbcUtil.ts(s.progressUpdatedAt()));
            ps.setTimestamp(17, JdbcUtil.ts(s.finishedAt()));
            ps.setString(18, s.id());
            ps.setLong(19, expectedVersion);
            return ps.executeUpdate() == 1;
        }
    }

    private static List<JobSlot> list(PreparedStatement ps) throws SQLException {
        List<JobSlot> out = new ArrayList<>();
        try (var rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toJobSlot(rs));
        }
        return out;
    }
}
