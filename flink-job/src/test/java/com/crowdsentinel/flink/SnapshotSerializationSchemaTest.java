package com.crowdsentinel.flink;

import com.crowdsentinel.core.model.AlertLevel;
import com.crowdsentinel.core.model.IndexSet;
import com.crowdsentinel.core.model.RiskSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SnapshotSerializationSchema} and
 * {@link ZoneKeySerializationSchema}.
 */
class SnapshotSerializationSchemaTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    @DisplayName("Should write snapshot fields with ISO timestamps and index names")
    void shouldSerializeSnapshot() throws Exception {
        byte[] json = new SnapshotSerializationSchema().serialize(snapshot());

        JsonNode node = MAPPER.readTree(json);
        assertThat(node.get("sequence").asLong()).isEqualTo(42L);
        assertThat(node.get("timestamp").asText()).isEqualTo("2028-04-22T05:00:00Z");
        assertThat(node.get("zone").asText()).isEqualTo("ghat-7");
        assertThat(node.get("alertLevel").asText()).isEqualTo("ORANGE");
        assertThat(node.get("BI").asDouble()).isCloseTo(0.7, within(1e-9));
        assertThat(node.get("extendedRisk").asDouble()).isCloseTo(0.63, within(1e-9));
        assertThat(node.get("indices").get("CDI").asDouble()).isCloseTo(0.8, within(1e-9));
        assertThat(node.get("degraded").asBoolean()).isTrue();
        assertThat(node.get("degradedFields").get(0).asText()).isEqualTo("humidity");
    }

    @Test
    @DisplayName("Record key should be the zone name")
    void shouldKeyByZone() {
        byte[] key = new ZoneKeySerializationSchema().serialize(snapshot());

        assertThat(new String(key, StandardCharsets.UTF_8)).isEqualTo("ghat-7");
    }

    // ---- Helpers

    private static RiskSnapshot snapshot() {
        return RiskSnapshot.builder()
                .sequence(42)
                .timestamp(Instant.parse("2028-04-22T05:00:00Z"))
                .zone("ghat-7")
                .phase("surge")
                .indices(new IndexSet(0.6, 0.8, 0.4, 0.9, 0.2, 0.6, 0.8, 0.6))
                .behavioralIntention(0.7)
                .physicalRisk(0.58)
                .extendedRisk(0.63)
                .alertLevel(AlertLevel.ORANGE)
                .degradedFields(List.of("humidity"))
                .build();
    }
}
