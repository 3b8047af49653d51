package com.crowdsentinel.core.alert;

import com.crowdsentinel.core.config.AlertSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HysteresisPolicyFactory}.
 */
class HysteresisPolicyFactoryTest {

    @Test
    @DisplayName("Should create the threshold policy by default")
    void shouldCreateThresholdPolicy() {
        assertThat(HysteresisPolicyFactory.create(new AlertSettings()))
                .isInstanceOf(ThresholdHysteresisPolicy.class);
    }

    @Test
    @DisplayName("Policy names should be case-insensitive")
    void shouldCreateHoldPolicyCaseInsensitive() {
        AlertSettings settings = new AlertSettings();
        settings.setPolicy("HOLD");

        HysteresisPolicy policy = HysteresisPolicyFactory.create(settings);

        assertThat(policy).isInstanceOf(MinimumHoldPolicy.class);
        assertThat(policy.getName()).isEqualTo("hold");
    }

    @Test
    @DisplayName("Should throw for an unknown policy name")
    void shouldThrowForUnknownPolicy() {
        AlertSettings settings = new AlertSettings();
        settings.setPolicy("sometimes");

        assertThatThrownBy(() -> HysteresisPolicyFactory.create(settings))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown alert policy");
    }

    @Test
    @DisplayName("Should throw for null settings")
    void shouldThrowForNull() {
        assertThatThrownBy(() -> HysteresisPolicyFactory.create(null))
                .isInstanceOf(NullPointerException.class);
    }
}
