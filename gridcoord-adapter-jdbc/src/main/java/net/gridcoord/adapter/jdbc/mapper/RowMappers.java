package net.gridcoord.adapter.jdbc.mapper;

import net.gridcoord.adapter.jdbc.JdbcUtil;
import net.gridcoord.core.model.CloseReason;
import net.gridcoord.core.model.FaultKind;
import net.gridcoord.core.model.GenerationParams;
import net.gridcoord.core.model.JobRequest;
import net.gridcoord.core.model.JobSlot;
import net.gridcoord.core.model.RequestState;
import net.gridcoord.core.model.RequesterStats;
import net.gridcoord.core.model.SlotState;
import net.gridcoord.core.model.Worker;
import net.gridcoord.core.model.WorkerCapabilities;
import net.gridcoord.core.model.WorkerHealth;
import net.gridcoord.core.model.WorkloadKind;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- GenerationParams (요청/슬롯 공통 컬럼) ---
    public static GenerationParams toParams(ResultSet rs) throws SQLException {
        return new GenerationParams(
                WorkloadKind.from(rs.getString("KIND")),
                rs.getInt("WIDTH"),
                rs.getInt("HEIGHT"),
                rs.getInt("MAX_TOKENS"),
                rs.getInt("STEPS"),
                rs.getString("SAMPLER")
        );
    }

    // --- JobRequest ---
    public static JobRequest toJobRequest(ResultSet rs) throws SQLException {
        return new JobRequest(
                rs.getString("ID"),
                rs.getString("REQUESTER_ID"),
                rs.getInt("TRUST_TIER"),
                rs.getInt("SLOT_COUNT"),
                toParams(rs),
                JdbcUtil.splitList(rs.getString("MODELS")),
                JdbcUtil.isY(rs.getString("NSFW")),
                rs.getString("WEBHOOK_URL"),
                RequestState.from(rs.getString("STATE")),
                CloseReason.from(rs.getString("CLOSE_REASON")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("EXPIRES_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("FINISHED_AT")),
                rs.getLong("VERSION")
        );
    }

    // --- JobSlot ---
    public static JobSlot toJobSlot(ResultSet rs) throws SQLException {
        return new JobSlot(
                rs.getString("ID"),
                rs.getString("REQUEST_ID"),
                rs.getString("REQUESTER_ID"),
                rs.getInt("TRUST_TIER"),
                rs.getInt("SLOT_INDEX"),
                SlotState.from(rs.getString("STATE")),
                toParams(rs),
                JdbcUtil.splitList(rs.getString("MODELS")),
                JdbcUtil.isY(rs.getString("NSFW")),
                rs.getString("ASSIGNED_MODEL"),
                rs.getString("WORKER_ID"),
                JdbcUtil.toInstant(rs.getTimestamp("LEASE_GRANTED_AT")),
                JdbcUtil.duration(rs, "LEASE_TTL_MS"),
                rs.getInt("ATTEMPT"),
                rs.getString("RESULT_REF"),
                JdbcUtil.nullableLong(rs, "SEED"),
                rs.getString("RESULT_METADATA"),
                rs.getString("FAULT_REASON"),
                FaultKind.from(rs.getString("LAST_FAULT_KIND")),
                rs.getString("LAST_FAULT_WORKER_ID"),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_FAULT_AT")),
                rs.getInt("PROGRESS_PERCENT"),
                JdbcUtil.toInstant(rs.getTimestamp("PROGRESS_UPDATED_AT")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("FINISHED_AT")),
                rs.getLong("VERSION")
        );
    }

    // --- Worker ---
    public static Worker toWorker(ResultSet rs) throws SQLException {
        var caps = new WorkerCapabilities(
                JdbcUtil.splitList(rs.getString("MODELS")),
                rs.getInt("MAX_CONCURRENT"),
                rs.getLong("MAX_PIXELS"),
                rs.getInt("MAX_TOKENS"),
                JdbcUtil.isY(rs.getString("ACCEPTS_NSFW"))
        );
        return new Worker(
                rs.getString("ID"),
                rs.getString("OWNER_ID"),
                rs.getString("NAME"),
                caps,
                JdbcUtil.isY(rs.getString("PAUSED")),
                JdbcUtil.isY(rs.getString("MAINTENANCE")),
                WorkerHealth.from(rs.getString("HEALTH")),
                JdbcUtil.toInstant(rs.getTimestamp("AUTO_PAUSED_UNTIL")),
                rs.getLong("SUCCESSES"),
                rs.getLong("FAULTS"),
                rs.getInt("FAULT_STREAK"),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_CHECK_IN_AT")),
                JdbcUtil.isY(rs.getString("ACTIVE")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getLong("VERSION")
        );
    }

    // --- RequesterStats (신뢰 등급은 호출자가 채운다) ---
    public static RequesterStats toRequesterStats(ResultSet rs) throws SQLException {
        return new RequesterStats(
                rs.getString("REQUESTER_ID"),
                0,
                rs.getDouble("RECENT_USAGE"),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_USAGE_AT"))
        );
    }
}
