package com.crowdsentinel.flink;

import java.io.Serializable;
import java.util.function.Function;

/**
 * Kafka and Flink settings for {@link CrowdRiskJob}, read from environment
 * variables. Engine tuning lives in the engine YAML named by
 * {@code ENGINE_CONFIG_PATH}, not here.
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaSnapshotTopic;
    private final String kafkaAlertTopic;
    private final String kafkaGroupId;
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final long maxOutOfOrdernessMs;
    private final String engineConfigPath;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = requireNonBlank(b.kafkaBootstrapServers, "kafkaBootstrapServers");
        this.kafkaInputTopic = requireNonBlank(b.kafkaInputTopic, "kafkaInputTopic");
        this.kafkaSnapshotTopic = requireNonBlank(b.kafkaSnapshotTopic, "kafkaSnapshotTopic");
        this.kafkaAlertTopic = requireNonBlank(b.kafkaAlertTopic, "kafkaAlertTopic");
        this.kafkaGroupId = requireNonBlank(b.kafkaGroupId, "kafkaGroupId");
        this.parallelism = requireAtLeast(b.parallelism, 1, "parallelism");
        this.checkpointIntervalMs = requireAtLeast(b.checkpointIntervalMs, 1, "checkpointIntervalMs");
        this.maxOutOfOrdernessMs = requireAtLeast(b.maxOutOfOrdernessMs, 0, "maxOutOfOrdernessMs");
        this.engineConfigPath = b.engineConfigPath == null ? "" : b.engineConfigPath;
        if (kafkaSnapshotTopic.equals(kafkaAlertTopic)) {
            throw new IllegalArgumentException(
                    "kafkaSnapshotTopic and kafkaAlertTopic must differ, both are: " + kafkaAlertTopic);
        }
    }

    /**
     * @return configuration from the process environment
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromVariables(System::getenv);
    }

    /**
     * Resolve the configuration through {@code lookup}; unset or blank
     * variables keep the {@link Builder} defaults.
     */
    static JobConfig fromVariables(Function<String, String> lookup) {
        Builder b = new Builder();
        b.kafkaBootstrapServers = lookup(lookup, "KAFKA_BOOTSTRAP_SERVERS", b.kafkaBootstrapServers);
        b.kafkaInputTopic = lookup(lookup, "KAFKA_INPUT_TOPIC", b.kafkaInputTopic);
        b.kafkaSnapshotTopic = lookup(lookup, "KAFKA_SNAPSHOT_TOPIC", b.kafkaSnapshotTopic);
        b.kafkaAlertTopic = lookup(lookup, "KAFKA_ALERT_TOPIC", b.kafkaAlertTopic);
        b.kafkaGroupId = lookup(lookup, "KAFKA_GROUP_ID", b.kafkaGroupId);
        b.engineConfigPath = lookup(lookup, "ENGINE_CONFIG_PATH", b.engineConfigPath);
        String name = null;
        try {
            name = "FLINK_PARALLELISM";
            b.parallelism = Integer.parseInt(lookup(lookup, name, String.valueOf(b.parallelism)));
            name = "FLINK_CHECKPOINT_INTERVAL_MS";
            b.checkpointIntervalMs = Long.parseLong(lookup(lookup, name, String.valueOf(b.checkpointIntervalMs)));
            name = "FLINK_MAX_OUT_OF_ORDERNESS_MS";
            b.maxOutOfOrdernessMs = Long.parseLong(lookup(lookup, name, String.valueOf(b.maxOutOfOrdernessMs)));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Environment variable " + name + " is not a number: " + e.getMessage(), e);
        }
        return b.build();
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaSnapshotTopic() {
        return kafkaSnapshotTopic;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public long getMaxOutOfOrdernessMs() {
        return maxOutOfOrdernessMs;
    }

    /**
     * @return engine YAML path, or an empty string for the bundled
     *         {@code engine.yml}
     */
    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    /**
     * Programmatic construction; {@link #build()} validates.
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "crowd-samples";
        private String kafkaSnapshotTopic = "risk-snapshots";
        private String kafkaAlertTopic = "risk-alerts";
        private String kafkaGroupId = "crowd-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private long maxOutOfOrdernessMs = 5_000;
        private String engineConfigPath = "";

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaSnapshotTopic(String v) {
            this.kafkaSnapshotTopic = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder maxOutOfOrdernessMs(long v) {
            this.maxOutOfOrdernessMs = v;
            return this;
        }

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is out of range
         */
        public JobConfig build() {
            return new JobConfig(this);
        }
    }

    private static String lookup(Function<String, String> lookup, String name, String defaultValue) {
        String value = lookup.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value;
    }

    private static int requireAtLeast(int value, int min, String name) {
        return (int) requireAtLeast((long) value, min, name);
    }

    private static long requireAtLeast(long value, long min, String name) {
        if (value < min) {
            throw new IllegalArgumentException(name + " must be >= " + min + ", got: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "JobConfig{kafka=" + kafkaBootstrapServers
                + ", topics=" + kafkaInputTopic + "->" + kafkaSnapshotTopic + "/" + kafkaAlertTopic
                + ", groupId=" + kafkaGroupId
                + ", parallelism=" + parallelism
                + ", checkpointIntervalMs=" + checkpointIntervalMs
                + ", maxOutOfOrdernessMs=" + maxOutOfOrdernessMs
                + ", engineConfigPath='" + engineConfigPath + "'}";
    }
}
