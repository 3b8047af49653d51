package com.crowdsentinel.core.alert;

import com.crowdsentinel.core.config.AlertSettings;
import com.crowdsentinel.core.model.AlertLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertStateMachine} with the threshold policy.
 */
class AlertStateMachineTest {

    private static final Instant T0 = Instant.parse("2028-04-22T05:00:00Z");

    private AlertStateMachine machine;
    private AlertState state;

    @BeforeEach
    void setUp() {
        machine = AlertStateMachine.fromSettings(new AlertSettings());
        state = new AlertState();
    }

    @Test
    @DisplayName("Should start at GREEN")
    void shouldStartGreen() {
        assertThat(state.getLevel()).isEqualTo(AlertLevel.GREEN);
        assertThat(state.getSince()).isNull();
    }

    @Test
    @DisplayName("Should hold ORANGE above its fall-back and drop below it")
    void shouldApplyFallbackThreshold() {
        assertThat(machine.advance(state, 0.62, T0)).isEqualTo(AlertLevel.ORANGE);
        assertThat(machine.advance(state, 0.58, T0.plusSeconds(60))).isEqualTo(AlertLevel.ORANGE);
        assertThat(machine.advance(state, 0.50, T0.plusSeconds(120))).isEqualTo(AlertLevel.YELLOW);
    }

    @Test
    @DisplayName("Upgrades should skip intermediate levels")
    void shouldUpgradeImmediately() {
        assertThat(machine.advance(state, 0.80, T0)).isEqualTo(AlertLevel.RED);
        assertThat(state.getSince()).isEqualTo(T0);
    }

    @Test
    @DisplayName("A sharp drop should cascade down to the target")
    void shouldCascadeToTarget() {
        machine.advance(state, 0.80, T0);

        assertThat(machine.advance(state, 0.10, T0.plusSeconds(60))).isEqualTo(AlertLevel.GREEN);
    }

    @Test
    @DisplayName("A downgrade should wait until every fall-back above the target is crossed")
    void shouldHoldUntilEveryFallbackIsCrossed() {
        machine.advance(state, 0.80, T0);

        assertThat(machine.advance(state, 0.72, T0.plusSeconds(60))).isEqualTo(AlertLevel.RED);
        assertThat(machine.advance(state, 0.60, T0.plusSeconds(120))).isEqualTo(AlertLevel.ORANGE);
        assertThat(machine.advance(state, 0.38, T0.plusSeconds(180))).isEqualTo(AlertLevel.ORANGE);
        assertThat(machine.advance(state, 0.30, T0.plusSeconds(240))).isEqualTo(AlertLevel.GREEN);
    }

    @Test
    @DisplayName("RED should hold when the score is still above ORANGE's fall-back")
    void shouldKeepRedAboveOrangeFallback() {
        machine.advance(state, 0.80, T0);

        assertThat(machine.advance(state, 0.58, T0.plusSeconds(60))).isEqualTo(AlertLevel.RED);
        assertThat(state.getSince()).isEqualTo(T0);
        assertThat(machine.advance(state, 0.50, T0.plusSeconds(120))).isEqualTo(AlertLevel.YELLOW);
    }

    @Test
    @DisplayName("Oscillating around a rising threshold should not flap")
    void shouldNotFlap() {
        machine.advance(state, 0.61, T0);
        for (int i = 1; i <= 10; i++) {
            double score = i % 2 == 0 ? 0.61 : 0.57;
            assertThat(machine.advance(state, score, T0.plusSeconds(i * 60L))).isEqualTo(AlertLevel.ORANGE);
        }
        assertThat(state.getSince()).isEqualTo(T0);
    }

    @Test
    @DisplayName("Out-of-range scores should be clamped")
    void shouldClampScores() {
        assertThat(machine.advance(state, 1.7, T0)).isEqualTo(AlertLevel.RED);
        assertThat(machine.advance(state, -3.0, T0.plusSeconds(60))).isEqualTo(AlertLevel.GREEN);
    }

    @Test
    @DisplayName("A NaN score should leave the level unchanged")
    void shouldIgnoreNaN() {
        machine.advance(state, 0.80, T0);

        assertThat(machine.advance(state, Double.NaN, T0.plusSeconds(60))).isEqualTo(AlertLevel.RED);
        assertThat(state.getSince()).isEqualTo(T0);
    }
}
