package net.gridcoord.core.model;

import java.time.Instant;

/**
 * 우선순위 계산 입력. recentUsage는 lastUsageAt 시점 기준의 감쇠 누적 사용량(워크로드 단위)이다.
 */
public record RequesterStats(
        String requesterId,
        int trustTier,
        double recentUsage,
        Instant lastUsageAt
) {
    public static RequesterStats fresh(String requesterId, int trustTier) {
        return new RequesterStats(requesterId, trustTier, 0.0, null);
    }

    public RequesterStats withTrustTier(int tier) {
        return new RequesterStats(requesterId, tier, recentUsage, lastUsageAt);
    }
}
