package net.gridcoord.core.service;

import java.time.Duration;
import java.time.Instant;

/** 반감기 기반 지수 감쇠. 원장 구현과 PriorityScorer가 같은 식을 써야 순서가 일관된다. */
public final class UsageDecay {
    private UsageDecay() {}

    public static double decay(double value, Instant from, Instant to, Duration halfLife) {
        if (value <= 0.0 || from == null || to == null || !to.isAfter(from)) return Math.max(value, 0.0);
        double elapsed = Duration.between(from, to).toMillis();
        return value * Math.pow(0.5, elapsed / halfLife.toMillis());
    }
}
