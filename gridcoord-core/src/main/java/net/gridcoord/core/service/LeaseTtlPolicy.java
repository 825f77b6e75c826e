package net.gridcoord.core.service;

import net.gridcoord.core.model.GenerationParams;

import java.time.Duration;

/**
 * TTL = max(MIN_TTL, BASE + perUnitCost * workload).
 * workload는 이미지면 픽셀 수 / imageUnitPixels, 텍스트면 토큰 수 / textUnitTokens.
 */
public final class LeaseTtlPolicy {
    private final CoordinatorSettings settings;

    public LeaseTtlPolicy(CoordinatorSettings settings) {
        this.settings = settings;
    }

    public double workloadUnits(GenerationParams params) {
        return switch (params.kind()) {
            case IMAGE -> (double) params.pixels() / settings.imageUnitPixels();
            case TEXT -> (double) params.maxTokens() / settings.textUnitTokens();
            case UNKNOWN -> 1.0;
        };
    }

    public Duration ttlFor(GenerationParams params) {
        long perUnitMillis = settings.perUnitLeaseCost().toMillis();
        long variable = Math.round(perUnitMillis * workloadUnits(params));
        Duration ttl = settings.baseLeaseTtl().plusMillis(variable);
        return ttl.compareTo(settings.minLeaseTtl()) < 0 ? settings.minLeaseTtl() : ttl;
    }
}
