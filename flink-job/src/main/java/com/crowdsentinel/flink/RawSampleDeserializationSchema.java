package com.crowdsentinel.flink;

import com.crowdsentinel.core.model.RawSample;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes → {@link RawSample}.
 * <p>
 * The JSON object is read as a plain map and coerced field by field, so an
 * ill-typed sensor value degrades the sample instead of dropping it. Messages
 * that are not a JSON object at all are logged and dropped (returns
 * {@code null}), ensuring that a single bad record does not crash the
 * pipeline.
 * </p>
 */
public class RawSampleDeserializationSchema implements DeserializationSchema<RawSample> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RawSampleDeserializationSchema.class);
    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {
    };

    private transient ObjectMapper mapper;

    @Override
    public RawSample deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            Map<String, Object> fields = objectMapper().readValue(message, FIELDS);
            if (fields == null) {
                LOG.warn("Received JSON null sample - skipping");
                return null;
            }
            return RawSample.fromFields(fields);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize sample - skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(RawSample nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<RawSample> getProducedType() {
        return TypeInformation.of(RawSample.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
        }
        return mapper;
    }
}
