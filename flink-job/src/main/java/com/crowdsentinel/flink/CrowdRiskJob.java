package com.crowdsentinel.flink;

import com.crowdsentinel.core.config.EngineConfig;
import com.crowdsentinel.core.config.EngineConfigLoader;
import com.crowdsentinel.core.engine.RiskEngine;
import com.crowdsentinel.core.model.RawSample;
import com.crowdsentinel.core.model.RiskSnapshot;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.api.java.typeutils.runtime.kryo.JavaSerializer;
import org.apache.flink.connector.base.DeliveryGuarantee;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Main entry point for the Crowd Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (samples topic)
 *     → Deserialize JSON → RawSample
 *     → Key by zone
 *     → RiskScoringProcessFunction (one RiskEngine per zone)
 *     → Serialize RiskSnapshot → JSON
 *     → Kafka (snapshot topic), level changes also → Kafka (alert topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job settings are resolved from environment variables via {@link JobConfig};
 * engine weights and thresholds come from the engine YAML loaded by
 * {@link EngineConfigLoader}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once semantics are enabled. Per-zone engines live in keyed state and
 * are serialized with Java serialization, so alert levels and history survive
 * failures.
 * </p>
 *
 * @since 1.0.0
 */
public final class CrowdRiskJob {

        private static final Logger LOG = LoggerFactory.getLogger(CrowdRiskJob.class);

        private CrowdRiskJob() {
                // entry-point class - not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Crowd Sentinel with config: {}", config);

                // 2. Load and validate engine configuration
                EngineConfig engineConfig = loadEngineConfig(config);

                // 3. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                registerJavaSerialization(env);
                configureCheckpointing(env, config);

                // 4. Build pipeline
                buildPipeline(env, config, engineConfig);

                // 5. Execute
                env.execute("Crowd Sentinel - Crowd Risk Scoring");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        EngineConfig engineConfig) {
                KafkaSource<RawSample> kafkaSource = KafkaSource.<RawSample>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new RawSampleDeserializationSchema())
                                .build();

                DataStream<RawSample> samples = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.<RawSample>forBoundedOutOfOrderness(
                                                Duration.ofMillis(config.getMaxOutOfOrdernessMs()))
                                                .withTimestampAssigner((sample, recordTs) -> sample
                                                                .getTimestamp() != null
                                                                                ? sample.getTimestamp().toEpochMilli()
                                                                                : recordTs)
                                                .withIdleness(Duration.ofMinutes(1)),
                                "kafka-samples-source");

                SingleOutputStreamOperator<RiskSnapshot> snapshots = samples
                                .filter(Objects::nonNull) // drop deserialization failures
                                .keyBy(RawSample::getZone, Types.STRING)
                                .process(new RiskScoringProcessFunction(engineConfig))
                                .name("risk-scoring");

                snapshots.sinkTo(kafkaSink(config, config.getKafkaSnapshotTopic(), "crowd-sentinel-snapshots"))
                                .name("kafka-snapshots-sink");

                snapshots.getSideOutput(RiskScoringProcessFunction.LEVEL_CHANGES)
                                .sinkTo(kafkaSink(config, config.getKafkaAlertTopic(), "crowd-sentinel-alerts"))
                                .name("kafka-alerts-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static KafkaSink<RiskSnapshot> kafkaSink(JobConfig config, String topic, String transactionalIdPrefix) {
                return KafkaSink.<RiskSnapshot>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setKafkaProducerConfig(producerProperties())
                                .setDeliveryGuarantee(DeliveryGuarantee.EXACTLY_ONCE)
                                .setTransactionalIdPrefix(transactionalIdPrefix)
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.<RiskSnapshot>builder()
                                                                .setTopic(topic)
                                                                .setKeySerializationSchema(
                                                                                new ZoneKeySerializationSchema())
                                                                .setValueSerializationSchema(
                                                                                new SnapshotSerializationSchema())
                                                                .build())
                                .build();
        }

        /**
         * Route engine state and records through Java serialization; they hold
         * {@code java.time} values and immutable JDK collections that Kryo's
         * field serializer cannot rebuild.
         */
        static void registerJavaSerialization(StreamExecutionEnvironment env) {
                env.getConfig().registerTypeWithKryoSerializer(RiskEngine.class, JavaSerializer.class);
                env.getConfig().registerTypeWithKryoSerializer(RawSample.class, JavaSerializer.class);
                env.getConfig().registerTypeWithKryoSerializer(RiskSnapshot.class, JavaSerializer.class);
        }

        private static Properties producerProperties() {
                Properties props = new Properties();
                // Must not exceed the broker's transaction.max.timeout.ms
                props.setProperty("transaction.timeout.ms", "900000");
                return props;
        }

        private static EngineConfig loadEngineConfig(JobConfig config) {
                String path = config.getEngineConfigPath();
                if (path != null && !path.isBlank()) {
                        return EngineConfigLoader.fromFile(path);
                }
                return EngineConfigLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                // Retain checkpoints on cancellation so state can be restored
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
