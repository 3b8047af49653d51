package com.crowdsentinel.core.normalize;

import com.crowdsentinel.core.model.RawSample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SampleSanitizer}.
 */
class SampleSanitizerTest {

    private SampleSanitizer sanitizer;

    @BeforeEach
    void setUp() {
        sanitizer = new SampleSanitizer(1.2);
    }

    @Test
    @DisplayName("A complete, in-range sample should pass through untouched")
    void shouldPassCleanSample() {
        SensorReading reading = sanitizer.sanitize(complete().build());

        assertThat(reading.getDegradedFields()).isEmpty();
        assertThat(reading.getTemperature()).isEqualTo(30.0);
        assertThat(reading.getDensity()).isEqualTo(2.5);
        assertThat(reading.hasAnxietySignals()).isFalse();
    }

    @Test
    @DisplayName("Missing fields before any good reading should take neutral values")
    void shouldUseNeutralValuesInitially() {
        RawSample sample = RawSample.builder().timestamp(Instant.EPOCH).build();

        SensorReading reading = sanitizer.sanitize(sample);

        assertThat(reading.getTemperature()).isEqualTo(20.0);
        assertThat(reading.getHumidity()).isEqualTo(50.0);
        assertThat(reading.getDensity()).isEqualTo(0.5);
        assertThat(reading.getSpeed()).isEqualTo(1.2);
        assertThat(reading.getAttitude()).isEqualTo(0.5);
        assertThat(reading.getDegradedFields()).containsExactly(
                "attitude", "density", "humidity", "perceivedControl", "speed",
                "subjectiveNorm", "temperature");
    }

    @Test
    @DisplayName("Missing or NaN fields should reuse the last known good value")
    void shouldCarryForwardLastKnownGood() {
        sanitizer.sanitize(complete().build());

        SensorReading reading = sanitizer.sanitize(complete()
                .temperature(null)
                .density(Double.NaN)
                .build());

        assertThat(reading.getTemperature()).isEqualTo(30.0);
        assertThat(reading.getDensity()).isEqualTo(2.5);
        assertThat(reading.getDegradedFields()).containsExactly("density", "temperature");
    }

    @Test
    @DisplayName("Out-of-range values should be clamped and flagged")
    void shouldClampOutOfRange() {
        SensorReading reading = sanitizer.sanitize(complete()
                .humidity(120.0)
                .speed(-0.4)
                .attitude(1.7)
                .build());

        assertThat(reading.getHumidity()).isEqualTo(100.0);
        assertThat(reading.getSpeed()).isEqualTo(0.0);
        assertThat(reading.getAttitude()).isEqualTo(1.0);
        assertThat(reading.getDegradedFields()).containsExactly("attitude", "humidity", "speed");
    }

    @Test
    @DisplayName("Invalid optional signals should be dropped and flagged")
    void shouldDropInvalidOptionalSignals() {
        SensorReading reading = sanitizer.sanitize(complete()
                .pushRate(-3.0)
                .shoutRate(12.0)
                .build());

        assertThat(reading.getPushRate()).isNull();
        assertThat(reading.getShoutRate()).isEqualTo(12.0);
        assertThat(reading.hasAnxietySignals()).isTrue();
        assertThat(reading.getDegradedFields()).containsExactly("pushRate");
    }

    // ---- Helpers

    private static RawSample.Builder complete() {
        return RawSample.builder()
                .timestamp(Instant.parse("2028-04-22T05:00:00Z"))
                .temperature(30.0)
                .humidity(60.0)
                .density(2.5)
                .speed(0.6)
                .attitude(0.3)
                .subjectiveNorm(0.4)
                .perceivedControl(0.6);
    }
}
