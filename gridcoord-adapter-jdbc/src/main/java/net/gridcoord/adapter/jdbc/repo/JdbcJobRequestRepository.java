package net.gridcoord.adapter.jdbc.repo;

import net.gridcoord.adapter.jdbc.JdbcUtil;
import net.gridcoord.adapter.jdbc.TxContext;
import net.gridcoord.adapter.jdbc.mapper.RowMappers;
import net.gridcoord.core.model.JobRequest;
import net.gridcoord.core.spi.JobRequestRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcJobRequestRepository implements JobRequestRepository {
    private final DataSource ds;

    public JdbcJobRequestRepository(DataSource ds) { this.ds = ds; }

    private Connection mustConn() {
        return TxContext.mustGet();
    }

    @Override
    public void insert(JobRequest r) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_JOB_REQUEST(ID, REQUESTER_ID, TRUST_TIER, SLOT_COUNT,
                                       KIND, WIDTH, HEIGHT, MAX_TOKENS, STEPS, SAMPLER,
                                       MODELS, NSFW, WEBHOOK_URL, STATE, CLOSE_REASON,
                                       CREATED_AT, EXPIRES_AT, FINISHED_AT, VERSION)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """)) {
            ps.setString(1, r.id());
            ps.setString(2, r.requesterId());
            ps.setInt(3, r.trustTier());
            ps.setInt(4, r.slotCount());
            ps.setString(5, r.params().kind().code());
            ps.setInt(6, r.params().width());
            ps.setInt(7, r.params().height());
            ps.setInt(8, r.params().maxTokens());
            ps.setInt(9, r.params().steps());
            ps.setString(10, r.params().sampler());
            ps.setString(11, JdbcUtil.joinList(r.models()));
            ps.setString(12, JdbcUtil.yn(r.nsfw()));
            ps.setString(13, r.webhookUrl());
            ps.setString(14, r.state().code());
            ps.setString(15, r.closeReason() == null ? null : r.closeReason().code());
            ps.setTimestamp(16, JdbcUtil.ts(r.createdAt()));
            ps.setTimestamp(17, JdbcUtil.ts(r.expiresAt()));
            ps.setTimestamp(18, JdbcUtil.ts(r.finishedAt()));
            ps.setLong(19, r.version());
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<JobRequest> findById(String id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_JOB_REQUEST WHERE ID=?")) {
            return single(ps, id);
        }
    }

    /** 행 잠금: 같은 요청의 슬롯 종료 전이는 이 잠금을 잡은 순서대로 진행된다 */
    @Override
    public Optional<JobRequest> lockById(String id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_JOB_REQUEST WHERE ID=? FOR UPDATE")) {
            return single(ps, id);
        }
    }

    /** 상태 필드만 갱신 (생성 시 고정된 값은 건드리지 않는다) */
    @Override
    public boolean update(JobRequest r, long expectedVersion) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_JOB_REQUEST
               SET STATE        = ?,
                   CLOSE_REASON = ?,
                   FINISHED_AT  = ?,
                   VERSION      = VERSION + 1
             WHERE ID = ?
               AND VERSION = ?
        """)) {
            ps.setString(1, r.state().code());
            ps.setString(2, r.closeReason() == null ? null : r.closeReason().code());
            ps.setTimestamp(3, JdbcUtil.ts(r.finishedAt()));
            ps.setString(4, r.id());
            ps.setLong(5, expectedVersion);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public List<JobRequest> findOpenExpiredAt(Instant now, int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
              FROM TB_JOB_REQUEST
             WHERE STATE = 'ACTIVE'
               AND CLOSE_REASON IS NULL
               AND EXPIRES_AT <= ?
             ORDER BY EXPIRES_AT ASC
             FETCH FIRST ? ROWS ONLY
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(now));
            ps.setInt(2, limit);
            List<JobRequest> out = new ArrayList<>();
            try (var rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toJobRequest(rs));
            }
            return out;
        }
    }

    @Override
    public int deleteFinishedBefore(Instant threshold) throws Exception {
        Connection c = mustConn();
        // 1) 슬롯 먼저 (FK)
        try (var ps = c.prepareStatement("""
            DELETE FROM TB_JOB_SLOT
             WHERE REQUEST_ID IN (
                   SELECT ID FROM TB_JOB_REQUEST
                    WHERE STATE <> 'ACTIVE'
                      AND FINISHED_AT IS NOT NULL
                      AND FINISHED_AT < ?)
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(threshold));
            ps.executeUpdate();
        }
        // 2) 요청
        try (var ps = c.prepareStatement("""
            DELETE FROM TB_JOB_REQUEST
             WHERE STATE <> 'ACTIVE'
               AND FINISHED_AT IS NOT NULL
               AND FINISHED_AT < ?
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(threshold));
            return ps.executeUpdate();
        }
    }

    private static Optional<JobRequest> single(PreparedStatement ps, String id) throws SQLException {
        ps.setString(1, id);
        try (var rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(RowMappers.toJobRequest(rs)) : Optional.empty();
        }
    }
}
