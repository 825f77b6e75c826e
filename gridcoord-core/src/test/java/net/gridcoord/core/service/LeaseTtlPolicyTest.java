package net.gridcoord.core.service;

import net.gridcoord.core.model.GenerationParams;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LeaseTtlPolicyTest {
    private final LeaseTtlPolicy defaults = new LeaseTtlPolicy(CoordinatorSettings.defaults());

    @Test
    void smallImage_getsTheFloor() {
        // 512x512 = 1 unit → 60s + 30s = 90s < 150s
        assertEquals(Duration.ofSeconds(150), defaults.ttlFor(GenerationParams.image(512, 512, 30, "k_euler")));
    }

    @Test
    void largeImage_scalesWithPixels() {
        // 1024x1024 = 4 units → 60s + 120s
        assertEquals(4.0, defaults.workloadUnits(GenerationParams.image(1024, 1024, 30, "k_euler")));
        assertEquals(Duration.ofSeconds(180), defaults.ttlFor(GenerationParams.image(1024, 1024, 30, "k_euler")));
    }

    @Test
    void text_scalesWithTokens() {
        assertEquals(Duration.ofSeconds(150), defaults.ttlFor(GenerationParams.text(512)));
        // 4096 tokens = 8 units → 60s + 240s
        assertEquals(Duration.ofSeconds(300), defaults.ttlFor(GenerationParams.text(4096)));
    }

    @Test
    void fractionalUnits_withoutFloor() {
        var policy = new LeaseTtlPolicy(CoordinatorSettings.builder()
                .minLeaseTtl(Duration.ZERO)
                .build());
        // 256x256 = 0.25 unit → 60s + 7.5s
        assertEquals(Duration.ofMillis(67_500), policy.ttlFor(GenerationParams.image(256, 256, 20, null)));
    }
}
