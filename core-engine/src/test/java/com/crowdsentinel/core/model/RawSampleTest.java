package com.crowdsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RawSample#fromFields(Map)}.
 */
class RawSampleTest {

    @Test
    @DisplayName("Should read numbers and numeric strings")
    void shouldReadNumericFields() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("timestamp", "2028-04-22T05:00:00Z");
        fields.put("zone", "ghat-7");
        fields.put("temperature", 31);
        fields.put("humidity", "65.5");
        fields.put("density", 2.4);

        RawSample sample = RawSample.fromFields(fields);

        assertThat(sample.getTimestamp()).isEqualTo(Instant.parse("2028-04-22T05:00:00Z"));
        assertThat(sample.getZone()).isEqualTo("ghat-7");
        assertThat(sample.getTemperature()).isEqualTo(31.0);
        assertThat(sample.getHumidity()).isEqualTo(65.5);
        assertThat(sample.getDensity()).isEqualTo(2.4);
        assertThat(sample.getSpeed()).isNull();
    }

    @Test
    @DisplayName("Ill-typed values should be treated as absent")
    void shouldTreatIllTypedValuesAsAbsent() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("timestamp", "2028-04-22T05:00:00Z");
        fields.put("speed", "fast");
        fields.put("attitude", List.of(0.3));

        RawSample sample = RawSample.fromFields(fields);

        assertThat(sample.getSpeed()).isNull();
        assertThat(sample.getAttitude()).isNull();
    }

    @Test
    @DisplayName("Should accept epoch millis and local date-times as timestamps")
    void shouldAcceptAlternativeTimestampFormats() {
        Instant expected = Instant.parse("2028-04-22T05:00:00Z");

        assertThat(RawSample.timestampField(expected.toEpochMilli())).isEqualTo(expected);
        assertThat(RawSample.timestampField("2028-04-22T05:00:00")).isEqualTo(expected);
        assertThat(RawSample.timestampField("yesterday")).isNull();
        assertThat(RawSample.timestampField(null)).isNull();
    }

    @Test
    @DisplayName("Blank or missing zone should fall back to the default zone")
    void shouldDefaultZone() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("zone", "  ");

        assertThat(RawSample.fromFields(fields).getZone()).isEqualTo(RawSample.DEFAULT_ZONE);
        assertThat(RawSample.builder().build().getZone()).isEqualTo(RawSample.DEFAULT_ZONE);
    }

    @Test
    @DisplayName("Should accept sensor-gateway field names as aliases")
    void shouldAcceptGatewayFieldNames() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("timestamp", "2028-04-22T05:00:00Z");
        fields.put("temp_c", 31.5);
        fields.put("rh", "68");
        fields.put("density_p_m2", 3.2);
        fields.put("speed_mps", 0.6);
        fields.put("ATI", 0.4);
        fields.put("SNI", 0.5);
        fields.put("PCI", 0.3);
        fields.put("push_rate", 0.2);
        fields.put("shout_rate", 0.1);
        fields.put("near_falls", 2);

        RawSample sample = RawSample.fromFields(fields);

        assertThat(sample.getTemperature()).isEqualTo(31.5);
        assertThat(sample.getHumidity()).isEqualTo(68.0);
        assertThat(sample.getDensity()).isEqualTo(3.2);
        assertThat(sample.getSpeed()).isEqualTo(0.6);
        assertThat(sample.getAttitude()).isEqualTo(0.4);
        assertThat(sample.getSubjectiveNorm()).isEqualTo(0.5);
        assertThat(sample.getPerceivedControl()).isEqualTo(0.3);
        assertThat(sample.getPushRate()).isEqualTo(0.2);
        assertThat(sample.getShoutRate()).isEqualTo(0.1);
        assertThat(sample.getNearFalls()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("The camelCase name should win over its alias")
    void camelCaseShouldWinOverAlias() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("temperature", 25.0);
        fields.put("temp_c", 40.0);

        assertThat(RawSample.fromFields(fields).getTemperature()).isEqualTo(25.0);
    }
}
