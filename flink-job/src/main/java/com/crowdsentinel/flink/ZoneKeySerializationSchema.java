package com.crowdsentinel.flink;

import com.crowdsentinel.core.model.RiskSnapshot;
import org.apache.flink.api.common.serialization.SerializationSchema;

import java.nio.charset.StandardCharsets;

/**
 * Kafka record key for snapshots: the zone name, so one zone's snapshots stay
 * ordered within a partition.
 */
public class ZoneKeySerializationSchema implements SerializationSchema<RiskSnapshot> {

    private static final long serialVersionUID = 1L;

    @Override
    public byte[] serialize(RiskSnapshot snapshot) {
        return String.valueOf(snapshot.getZone()).getBytes(StandardCharsets.UTF_8);
    }
}
