package net.gridcoord.adapter.jdbc;

import net.gridcoord.adapter.jdbc.mapper.RowMappers;
import net.gridcoord.core.model.RequesterStats;
import net.gridcoord.core.service.UsageDecay;
import net.gridcoord.core.spi.UsageLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Duration;
import java.time.Instant;

/**
 * TB_REQUESTER_USAGE 기반 사용량 원장. 호출자의 트랜잭션(TxContext) 안에서 돈다.
 * 기록은 행을 잠근 뒤 감쇠 → 가산 순으로 갱신한다.
 */
public final class JdbcUsageLedger implements UsageLedger {
    private static final Logger log = LoggerFactory.getLogger(JdbcUsageLedger.class);

    private final Duration halfLife;

    public JdbcUsageLedger(Duration halfLife) {
        this.halfLife = halfLife;
    }

    @Override
    public RequesterStats statsFor(String requesterId) throws Exception {
        try (var ps = TxContext.mustGet().prepareStatement(
                "SELECT * FROM TB_REQUESTER_USAGE WHERE REQUESTER_ID=?")) {
            ps.setString(1, requesterId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? RowMappers.toRequesterStats(rs) : RequesterStats.fresh(requesterId, 0);
            }
        }
    }

    @Override
    public void recordUsage(String requesterId, double workloadUnits, Instant at) throws Exception {
        Connection c = TxContext.mustGet();

        // 1) 행 보장
        try (var ps = c.prepareStatement("""
            MERGE INTO TB_REQUESTER_USAGE u
            USING (SELECT ? AS REQUESTER_ID FROM DUAL) src
               ON (u.REQUESTER_ID = src.REQUESTER_ID)
            WHEN NOT MATCHED THEN
                INSERT (REQUESTER_ID, RECENT_USAGE, LAST_USAGE_AT) VALUES (src.REQUESTER_ID, 0, NULL)
        """)) {
            ps.setString(1, requesterId);
            ps.executeUpdate();
        } catch (SQLIntegrityConstraintViolationException e) {
            // 동시 MERGE가 먼저 넣었다. 문장 단위 롤백이라 트랜잭션은 유지된다
            log.debug("Usage row for {} inserted concurrently: {}", requesterId, e.getMessage());
        }

        // 2) 잠금 조회
        RequesterStats prev;
        try (var ps = c.prepareStatement("SELECT * FROM TB_REQUESTER_USAGE WHERE REQUESTER_ID=? FOR UPDATE")) {
            ps.setString(1, requesterId);
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) throw new IllegalStateException("usage row vanished for " + requesterId);
                prev = RowMappers.toRequesterStats(rs);
            }
        }

        // 3) 감쇠 후 가산
        double decayed = UsageDecay.decay(prev.recentUsage(), prev.lastUsageAt(), at, halfLife);
        Instant last = prev.lastUsageAt() != null && prev.lastUsageAt().isAfter(at) ? prev.lastUsageAt() : at;
        try (var ps = c.prepareStatement("""
            UPDATE TB_REQUESTER_USAGE
               SET RECENT_USAGE  = ?,
                   LAST_USAGE_AT = ?
             WHERE REQUESTER_ID = ?
        """)) {
            ps.setDouble(1, decayed + workloadUnits);
            ps.setTimestamp(2, JdbcUtil.ts(last));
            ps.setString(3, requesterId);
            ps.executeUpdate();
        }
    }
}
