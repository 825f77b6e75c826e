package net.gridcoord.adapter.memory;

import net.gridcoord.core.model.RequesterStats;
import net.gridcoord.core.service.UsageDecay;
import net.gridcoord.core.spi.UsageLedger;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/** 요청자별 감쇠 누적 사용량. 기록 시점에 이전 값을 감쇠시킨 뒤 더한다. */
public final class InMemoryUsageLedger implements UsageLedger {
    private final ConcurrentHashMap<String, RequesterStats> stats = new ConcurrentHashMap<>();
    private final Duration halfLife;

    public InMemoryUsageLedger(Duration halfLife) {
        this.halfLife = halfLife;
    }

    @Override
    public RequesterStats statsFor(String requesterId) {
        RequesterStats s = stats.get(requesterId);
        return s == null ? RequesterStats.fresh(requesterId, 0) : s;
    }

    @Override
    public void recordUsage(String requesterId, double workloadUnits, Instant at) {
        stats.compute(requesterId, (id, prev) -> {
            if (prev == null) return new RequesterStats(id, 0, workloadUnits, at);
            double decayed = UsageDecay.decay(prev.recentUsage(), prev.lastUsageAt(), at, halfLife);
            Instant last = prev.lastUsageAt() != null && prev.lastUsageAt().isAfter(at) ? prev.lastUsageAt() : at;
            return new RequesterStats(id, prev.trustTier(), decayed + workloadUnits, last);
        });
    }
}
