package net.gridcoord.core.model;

import java.time.Instant;

public record Worker(
        String id,
        String ownerId,
        String name,
        WorkerCapabilities capabilities,
        boolean paused,          // 사용자 지정
        boolean maintenance,
        WorkerHealth health,     // 자동 서킷 브레이커
        Instant autoPausedUntil,
        long successes,
        long faults,
        int faultStreak,
        Instant lastCheckInAt,
        boolean active,          // false = 비활성화 (물리 삭제는 하지 않음)
        Instant createdAt,
        long version
) {
    public static Worker ofNew(String id, String ownerId, String name, WorkerCapabilities caps, Instant now) {
        return new Worker(id, ownerId, name, caps, false, false, WorkerHealth.HEALTHY, null,
                0, 0, 0, now, true, now, 0L);
    }

    public boolean dispatchable() {
        return active && !paused && !maintenance && health != WorkerHealth.AUTO_PAUSED;
    }

    /** 프로베이션 중에는 시험 슬롯 1개만 허용 */
    public int effectiveCapacity() {
        return health == WorkerHealth.PROBATION ? 1 : capabilities.maxConcurrent();
    }

    public Worker withCheckIn(WorkerCapabilities caps, Instant at) {
        return new Worker(id, ownerId, name, caps, paused, maintenance, health, autoPausedUntil,
                successes, faults, faultStreak, at, active, createdAt, version);
    }

    public Worker withHealth(WorkerHealth h, Instant pausedUntil) {
        return new Worker(id, ownerId, name, capabilities, paused, maintenance, h, pausedUntil,
                successes, faults, faultStreak, lastCheckInAt, active, createdAt, version);
    }

    public Worker withCounters(long ok, long failed, int streak) {
        return new Worker(id, ownerId, name, capabilities, paused, maintenance, health, autoPausedUntil,
                ok, failed, streak, lastCheckInAt, active, createdAt, version);
    }

    public Worker withFlags(boolean pausedFlag, boolean maintenanceFlag, boolean activeFlag) {
        return new Worker(id, ownerId, name, capabilities, pausedFlag, maintenanceFlag, health, autoPausedUntil,
                successes, faults, faultStreak, lastCheckInAt, activeFlag, createdAt, version);
    }

    public Worker withVersion(long v) {
        return new Worker(id, ownerId, name, capabilities, paused, maintenance, health, autoPausedUntil,
                successes, faults, faultStreak, lastCheckInAt, active, createdAt, v);
    }
}
