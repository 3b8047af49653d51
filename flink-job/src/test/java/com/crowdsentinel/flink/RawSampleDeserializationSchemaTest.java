package com.crowdsentinel.flink;

import com.crowdsentinel.core.model.RawSample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RawSampleDeserializationSchema}.
 */
class RawSampleDeserializationSchemaTest {

    private RawSampleDeserializationSchema schema;

    @BeforeEach
    void setUp() {
        schema = new RawSampleDeserializationSchema();
    }

    @Test
    @DisplayName("Should decode a well-formed sample")
    void shouldDecodeSample() throws Exception {
        RawSample sample = schema.deserialize(bytes("{"
                + "\"timestamp\":\"2028-04-22T05:00:00Z\",\"zone\":\"ghat-7\",\"phase\":\"surge\","
                + "\"temperature\":31.5,\"humidity\":70,\"density\":3.2,\"speed\":0.4,"
                + "\"attitude\":0.6,\"subjectiveNorm\":0.7,\"perceivedControl\":0.3,\"pushRate\":4}"));

        assertThat(sample).isNotNull();
        assertThat(sample.getTimestamp()).isEqualTo(Instant.parse("2028-04-22T05:00:00Z"));
        assertThat(sample.getZone()).isEqualTo("ghat-7");
        assertThat(sample.getPhase()).isEqualTo("surge");
        assertThat(sample.getHumidity()).isEqualTo(70.0);
        assertThat(sample.getPushRate()).isEqualTo(4.0);
        assertThat(sample.getShoutRate()).isNull();
    }

    @Test
    @DisplayName("Ill-typed fields should be kept as absent rather than dropping the record")
    void shouldKeepRecordWithIllTypedFields() throws Exception {
        RawSample sample = schema.deserialize(bytes(
                "{\"timestamp\":1840683600000,\"density\":\"n/a\",\"speed\":\"0.9\",\"extra\":true}"));

        assertThat(sample).isNotNull();
        assertThat(sample.getTimestamp()).isEqualTo(Instant.ofEpochMilli(1840683600000L));
        assertThat(sample.getDensity()).isNull();
        assertThat(sample.getSpeed()).isEqualTo(0.9);
        assertThat(sample.getZone()).isEqualTo(RawSample.DEFAULT_ZONE);
    }

    @Test
    @DisplayName("Malformed, empty or non-object payloads should return null")
    void shouldDropMalformedPayloads() throws Exception {
        assertThat(schema.deserialize(bytes("{not json"))).isNull();
        assertThat(schema.deserialize(bytes("[1,2,3]"))).isNull();
        assertThat(schema.deserialize(bytes("null"))).isNull();
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.deserialize(null)).isNull();
    }

    @Test
    @DisplayName("Stream should never end")
    void shouldBeUnbounded() {
        assertThat(schema.isEndOfStream(RawSample.builder().build())).isFalse();
        assertThat(schema.getProducedType().getTypeClass()).isEqualTo(RawSample.class);
    }

    // ---- Helpers

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
