package com.crowdsentinel.flink;

import com.crowdsentinel.core.config.EngineConfig;
import com.crowdsentinel.core.engine.RiskEngine;
import com.crowdsentinel.core.model.AlertLevel;
import com.crowdsentinel.core.model.IngestResult;
import com.crowdsentinel.core.model.RawSample;
import com.crowdsentinel.core.model.RiskSnapshot;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Core Flink {@link KeyedProcessFunction} that scores each zone's samples
 * with its own {@link RiskEngine}.
 *
 * <p>
 * Each key (the sample zone) gets its own engine via Flink managed keyed
 * state, so sanitizer memory, the variability window, the alert level and the
 * history are isolated per zone and checkpointed with the job.
 * </p>
 *
 * <h3>Outputs</h3>
 * <ul>
 * <li>main output: one {@link RiskSnapshot} per accepted sample</li>
 * <li>{@link #LEVEL_CHANGES} side output: snapshots whose alert level differs
 * from the previous one</li>
 * </ul>
 *
 * <p>
 * Rejected samples are counted and logged by the engine; nothing is emitted
 * for them.
 * </p>
 *
 * @since 1.0.0
 */
public class RiskScoringProcessFunction
        extends KeyedProcessFunction<String, RawSample, RiskSnapshot> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RiskScoringProcessFunction.class);

    /** Side output carrying alert-level transitions. */
    public static final OutputTag<RiskSnapshot> LEVEL_CHANGES =
            new OutputTag<RiskSnapshot>("alert-level-changes") {
            };

    /** Engine configuration shared by every key (serializable config, not runtime state). */
    private final EngineConfig engineConfig;

    /** Flink keyed state holding the per-zone engine. */
    private transient ValueState<RiskEngine> engineState;

    /** Custom Flink metrics. */
    private transient RiskMetrics metrics;

    /**
     * @param engineConfig engine configuration; validated here
     * @throws NullPointerException  if {@code engineConfig} is {@code null}
     * @throws IllegalStateException if the configuration is invalid
     */
    public RiskScoringProcessFunction(EngineConfig engineConfig) {
        this.engineConfig = Objects.requireNonNull(engineConfig, "Engine configuration must not be null");
        engineConfig.validate();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        ValueStateDescriptor<RiskEngine> descriptor = new ValueStateDescriptor<>(
                "risk-engine", TypeInformation.of(RiskEngine.class));
        engineState = getRuntimeContext().getState(descriptor);

        metrics = new RiskMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("RiskScoringProcessFunction opened with policy '{}'", engineConfig.getAlert().getPolicy());
    }

    @Override
    public void close() {
        LOG.info("RiskScoringProcessFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(RawSample sample,
            KeyedProcessFunction<String, RawSample, RiskSnapshot>.Context ctx,
            Collector<RiskSnapshot> out) throws Exception {
        long startNanos = System.nanoTime();

        // Lazily create the engine for this zone on its first sample
        RiskEngine engine = engineState.value();
        if (engine == null) {
            engine = RiskEngine.create(engineConfig);
            LOG.info("Created risk engine for zone '{}'", ctx.getCurrentKey());
        }

        AlertLevel before = engine.currentLevel();
        IngestResult result = engine.ingest(sample);

        if (result.isRejected()) {
            metrics.incrementRejected();
        } else {
            RiskSnapshot snapshot = result.getSnapshot().orElseThrow();
            out.collect(snapshot);
            metrics.incrementProcessed();
            if (result.getStatus() == IngestResult.Status.DEGRADED) {
                metrics.incrementDegraded();
            }
            if (result.isLevelChanged()) {
                ctx.output(LEVEL_CHANGES, snapshot);
                if (snapshot.getAlertLevel().isAbove(before)) {
                    metrics.incrementEscalations();
                }
            }
        }

        // Persist the engine: ingest mutates it in place
        engineState.update(engine);

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        metrics.recordLatency(durationMs);
    }
}
