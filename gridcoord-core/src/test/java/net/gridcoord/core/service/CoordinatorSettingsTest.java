package net.gridcoord.core.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoordinatorSettingsTest {

    @Test
    void defaults_areConservative() {
        var s = CoordinatorSettings.defaults();

        assertThat(s.faultThreshold()).isEqualTo(5);
        assertThat(s.maxAttempts()).isEqualTo(3);
        assertThat(s.faultCooldown()).isEqualTo(Duration.ofMinutes(5));
        assertThat(s.minLeaseTtl()).isEqualTo(Duration.ofSeconds(150));
        assertThat(s.imageUnitPixels()).isEqualTo(262_144L);
        assertThat(s.maxRequestLifetime()).isEqualTo(Duration.ofHours(2));
    }

    @Test
    void toBuilder_keepsUntouchedValues() {
        var s = CoordinatorSettings.defaults().toBuilder().maxAttempts(7).build();

        assertThat(s.maxAttempts()).isEqualTo(7);
        assertThat(s).isEqualTo(CoordinatorSettings.builder().maxAttempts(7).build());
    }

    @Test
    void rejectsNonsense() {
        assertThatThrownBy(() -> CoordinatorSettings.builder().maxAttempts(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CoordinatorSettings.builder().usageHalfLife(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CoordinatorSettings.builder().faultCooldown(null).build())
                .isInstanceOf(NullPointerException.class);
    }
}
