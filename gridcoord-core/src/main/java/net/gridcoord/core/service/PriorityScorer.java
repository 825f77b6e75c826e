package net.gridcoord.core.service;

import net.gridcoord.core.model.PriorityKey;
import net.gridcoord.core.model.RequesterStats;

import java.time.Duration;
import java.time.Instant;

/**
 * 요청자 공정성 키. 최근(감쇠된) 사용량이 많을수록 키가 커져 뒤로 밀린다.
 * 신뢰 등급은 사용량을 나누는 가중치로만 작용하므로 사용량에 대해 단조성이 유지된다.
 */
public final class PriorityScorer {
    private final Duration usageHalfLife;

    public PriorityScorer(Duration usageHalfLife) {
        this.usageHalfLife = usageHalfLife;
    }

    public PriorityKey score(RequesterStats stats, Instant now) {
        double decayed = UsageDecay.decay(stats.recentUsage(), stats.lastUsageAt(), now, usageHalfLife);
        return new PriorityKey(decayed / tierWeight(stats.trustTier()));
    }

    static double tierWeight(int trustTier) {
        return 1.0 + 0.5 * Math.max(trustTier, 0);
    }
}
