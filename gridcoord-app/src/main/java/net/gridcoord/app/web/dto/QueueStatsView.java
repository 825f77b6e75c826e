package net.gridcoord.app.web.dto;

import net.gridcoord.core.model.ModelQueueStats;

public record QueueStatsView(String model, int pending, int leased, long oldestPendingSeconds) {
    public static QueueStatsView of(ModelQueueStats s) {
        return new QueueStatsView(s.model(), s.pending(), s.leased(), s.oldestPendingAge().toSeconds());
    }
}
