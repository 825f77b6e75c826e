package net.gridcoord.core.service;

import java.time.Duration;
import java.util.Objects;

/**
 * 코디네이터 튜닝 파라미터. 운영 중 경험적으로 조정하는 값이므로 전부 설정으로 노출한다.
 */
public record CoordinatorSettings(
        int faultThreshold,
        int maxAttempts,
        Duration faultCooldown,
        Duration probationDelay,
        Duration minLeaseTtl,
        Duration baseLeaseTtl,
        Duration perUnitLeaseCost,
        long imageUnitPixels,
        int textUnitTokens,
        Duration defaultRequestLifetime,
        Duration maxRequestLifetime,
        Duration usageHalfLife,
        int maxSlotsPerRequest,
        int matcherScanLimit,
        int maxLeaseRaces
) {
    public CoordinatorSettings {
        Objects.requireNonNull(faultCooldown, "faultCooldown");
        Objects.requireNonNull(probationDelay, "probationDelay");
        Objects.requireNonNull(minLeaseTtl, "minLeaseTtl");
        Objects.requireNonNull(baseLeaseTtl, "baseLeaseTtl");
        Objects.requireNonNull(perUnitLeaseCost, "perUnitLeaseCost");
        Objects.requireNonNull(defaultRequestLifetime, "defaultRequestLifetime");
        Objects.requireNonNull(maxRequestLifetime, "maxRequestLifetime");
        Objects.requireNonNull(usageHalfLife, "usageHalfLife");
        if (faultThreshold < 1) throw new IllegalArgumentException("faultThreshold must be >= 1");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (imageUnitPixels < 1 || textUnitTokens < 1) throw new IllegalArgumentException("workload units must be positive");
        if (maxSlotsPerRequest < 1) throw new IllegalArgumentException("maxSlotsPerRequest must be >= 1");
        if (matcherScanLimit < 1 || maxLeaseRaces < 1) throw new IllegalArgumentException("matcher limits must be positive");
        if (usageHalfLife.isZero() || usageHalfLife.isNegative()) throw new IllegalArgumentException("usageHalfLife must be positive");
    }

    public static CoordinatorSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .faultThreshold(faultThreshold).maxAttempts(maxAttempts)
                .faultCooldown(faultCooldown).probationDelay(probationDelay)
                .minLeaseTtl(minLeaseTtl).baseLeaseTtl(baseLeaseTtl).perUnitLeaseCost(perUnitLeaseCost)
                .imageUnitPixels(imageUnitPixels).textUnitTokens(textUnitTokens)
                .defaultRequestLifetime(defaultRequestLifetime).maxRequestLifetime(maxRequestLifetime)
                .usageHalfLife(usageHalfLife).maxSlotsPerRequest(maxSlotsPerRequest)
                .matcherScanLimit(matcherScanLimit).maxLeaseRaces(maxLeaseRaces);
    }

    public static final class Builder {
        private int faultThreshold = 5;
        private int maxAttempts = 3;
        private Duration faultCooldown = Duration.ofMinutes(5);
        private Duration probationDelay = Duration.ofMinutes(10);
        private Duration minLeaseTtl = Duration.ofSeconds(150);
        private Duration baseLeaseTtl = Duration.ofSeconds(60);
        private Duration perUnitLeaseCost = Duration.ofSeconds(30);
        private long imageUnitPixels = 512L * 512L;
        private int textUnitTokens = 512;
        private Duration defaultRequestLifetime = Duration.ofMinutes(20);
        private Duration maxRequestLifetime = Duration.ofHours(2);
        private Duration usageHalfLife = Duration.ofHours(1);
        private int maxSlotsPerRequest = 20;
        private int matcherScanLimit = 500;
        private int maxLeaseRaces = 3;

        private Builder() {}

        public Builder faultThreshold(int v) { this.faultThreshold = v; return this; }
        public Builder maxAttempts(int v) { this.maxAttempts = v; return this; }
        public Builder faultCooldown(Duration v) { this.faultCooldown = v; return this; }
        public Builder probationDelay(Duration v) { this.probationDelay = v; return this; }
        public Builder minLeaseTtl(Duration v) { this.minLeaseTtl = v; return this; }
        public Builder baseLeaseTtl(Duration v) { this.baseLeaseTtl = v; return this; }
        public Builder perUnitLeaseCost(Duration v) { this.perUnitLeaseCost = v; return this; }
        public Builder imageUnitPixels(long v) { this.imageUnitPixels = v; return this; }
        public Builder textUnitTokens(int v) { this.textUnitTokens = v; return this; }
        public Builder defaultRequestLifetime(Duration v) { this.defaultRequestLifetime = v; return this; }
        public Builder maxRequestLifetime(Duration v) { this.maxRequestLifetime = v; return this; }
        public Builder usageHalfLife(Duration v) { this.usageHalfLife = v; return this; }
        public Builder maxSlotsPerRequest(int v) { this.maxSlotsPerRequest = v; return this; }
        public Builder matcherScanLimit(int v) { this.matcherScanLimit = v; return this; }
        public Builder maxLeaseRaces(int v) { this.maxLeaseRaces = v; return this; }

        public CoordinatorSettings build() {
            return new CoordinatorSettings(faultThreshold, maxAttempts, faultCooldown, probationDelay,
                    minLeaseTtl, baseLeaseTtl, perUnitLeaseCost, imageUnitPixels, textUnitTokens,
                    defaultRequestLifetime, maxRequestLifetime, usageHalfLife, maxSlotsPerRequest,
                    matcherScanLimit, maxLeaseRaces);
        }
    }
}
