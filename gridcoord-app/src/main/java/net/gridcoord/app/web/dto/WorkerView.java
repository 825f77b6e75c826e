package net.gridcoord.app.web.dto;

import net.gridcoord.core.model.Worker;
import net.gridcoord.core.model.WorkerHealth;

import java.time.Instant;
import java.util.List;

public record WorkerView(
        String id,
        String name,
        List<String> models,
        int maxConcurrent,
        boolean paused,
        boolean maintenance,
        boolean active,
        WorkerHealth health,
        Instant autoPausedUntil,
        long successes,
        long faults,
        int faultStreak,
        Instant lastCheckInAt
) {
    public static WorkerView of(Worker w) {
        return new WorkerView(w.id(), w.name(), w.capabilities().models(), w.capabilities().maxConcurrent(),
                w.paused(), w.maintenance(), w.active(), w.health(), w.autoPausedUntil(),
                w.successes(), w.faults(), w.faultStreak(), w.lastCheckInAt());
    }
}
