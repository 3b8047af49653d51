package com.crowdsentinel.flink;

import com.crowdsentinel.core.model.RiskSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that converts {@link RiskSnapshot} → JSON
 * bytes for publishing to the snapshot and alert topics.
 *
 * <p>
 * Timestamps are written as ISO-8601 strings.
 * </p>
 */
public class SnapshotSerializationSchema implements SerializationSchema<RiskSnapshot> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SnapshotSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(RiskSnapshot snapshot) {
        try {
            return objectMapper().writeValueAsBytes(snapshot);
        } catch (Exception e) {
            LOG.error("Failed to serialize snapshot: {}", e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
