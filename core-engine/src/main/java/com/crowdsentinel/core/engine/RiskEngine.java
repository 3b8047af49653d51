package com.crowdsentinel.core.engine;

import com.crowdsentinel.core.alert.AlertState;
import com.crowdsentinel.core.alert.AlertStateMachine;
import com.crowdsentinel.core.config.EngineConfig;
import com.crowdsentinel.core.history.SnapshotHistory;
import com.crowdsentinel.core.model.AlertLevel;
import com.crowdsentinel.core.model.IndexSet;
import com.crowdsentinel.core.model.IngestResult;
import com.crowdsentinel.core.model.RawSample;
import com.crowdsentinel.core.model.RiskSnapshot;
import com.crowdsentinel.core.normalize.IndexNormalizer;
import com.crowdsentinel.core.normalize.SampleSanitizer;
import com.crowdsentinel.core.normalize.SensorReading;
import com.crowdsentinel.core.normalize.VariabilityWindow;
import com.crowdsentinel.core.risk.CompositeRiskCalculator;
import com.crowdsentinel.core.risk.RiskScores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Scores one zone's sensor feed and tracks its alert level.
 *
 * <p>
 * Each call to {@link #ingest(RawSample)} runs the full pipeline inside one
 * critical section:
 * </p>
 * <ol>
 * <li>reject samples with no timestamp or one not strictly after the last
 * accepted sample;</li>
 * <li>sanitize fields, substituting last-known-good or neutral values;</li>
 * <li>normalize into the eight indices;</li>
 * <li>compute physical, behavioral and extended risk;</li>
 * <li>advance the alert state machine;</li>
 * <li>append the snapshot to history and publish it as the latest.</li>
 * </ol>
 *
 * <p>
 * {@link #latest()} reads a volatile reference and never blocks, so readers
 * always see either the previous or the new snapshot in full.
 * </p>
 *
 * <p>
 * The engine is {@link Serializable} so it can live in Flink keyed state.
 * </p>
 *
 * @since 1.0.0
 */
public class RiskEngine implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RiskEngine.class);

    private final Clock clock;
    private final boolean sampleTimeBasis;
    private final SampleSanitizer sanitizer;
    private final VariabilityWindow window;
    private final IndexNormalizer normalizer;
    private final CompositeRiskCalculator calculator;
    private final AlertStateMachine stateMachine;
    private final AlertState alertState = new AlertState();
    private final SnapshotHistory history;

    private Instant lastTimestamp;
    private long sequence;
    private volatile RiskSnapshot latest;

    /**
     * @param config engine configuration; validated here
     * @param clock  source of "now" for the time and event indices when the
     *               time basis is {@code wall_clock}
     * @throws IllegalStateException if the configuration is invalid
     */
    public RiskEngine(EngineConfig config, Clock clock) {
        Objects.requireNonNull(config, "EngineConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        config.validate();

        this.sampleTimeBasis = config.getNormalization().usesSampleTime();
        this.sanitizer = new SampleSanitizer(config.getNormalization().getFreeFlowSpeed());
        this.window = new VariabilityWindow(config.getNormalization().getVolatilityWindow());
        this.normalizer = new IndexNormalizer(config.getNormalization());
        this.calculator = CompositeRiskCalculator.fromConfig(config);
        this.stateMachine = AlertStateMachine.fromSettings(config.getAlert());
        this.history = new SnapshotHistory(config.getHistoryCapacity());

        LOG.info("Risk engine initialised: policy={}, timeBasis={}, historyCapacity={}",
                stateMachine.getPolicy().getName(),
                config.getNormalization().getTimeBasis(),
                config.getHistoryCapacity());
    }

    /**
     * Create an engine reading the system UTC clock.
     */
    public static RiskEngine create(EngineConfig config) {
        return new RiskEngine(config, Clock.systemUTC());
    }

    /**
     * Ingest one sample.
     *
     * <p>
     * Never throws for bad input: malformed or out-of-order samples come back
     * as {@link IngestResult.Status#REJECTED} with engine state untouched.
     * </p>
     *
     * @param sample the raw sample
     * @return the outcome, carrying the new snapshot unless rejected
     */
    public synchronized IngestResult ingest(RawSample sample) {
        if (sample == null) {
            return reject("sample is null");
        }
        Instant timestamp = sample.getTimestamp();
        if (timestamp == null) {
            return reject("missing or unparseable timestamp");
        }
        if (lastTimestamp != null && !timestamp.isAfter(lastTimestamp)) {
            return reject("timestamp " + timestamp + " is not after last accepted " + lastTimestamp);
        }

        SensorReading reading = sanitizer.sanitize(sample);
        window.add(reading.getDensity(), reading.getSpeed());

        Instant reference = sampleTimeBasis ? timestamp : clock.instant();
        IndexSet indices = normalizer.normalize(reading, window, reference);
        RiskScores scores = calculator.score(indices);

        AlertLevel before = alertState.getLevel();
        AlertLevel level = stateMachine.advance(alertState, scores.getExtendedRisk(), timestamp);

        RiskSnapshot snapshot = RiskSnapshot.builder()
                .sequence(++sequence)
                .timestamp(timestamp)
                .zone(sample.getZone())
                .phase(sample.getPhase())
                .indices(indices)
                .physicalRisk(scores.getPhysicalRisk())
                .behavioralIntention(scores.getBehavioralIntention())
                .extendedRisk(scores.getExtendedRisk())
                .alertLevel(level)
                .degradedFields(reading.getDegradedFields())
                .build();

        history.append(snapshot);
        lastTimestamp = timestamp;
        latest = snapshot;

        if (snapshot.isDegraded()) {
            LOG.warn("Degraded sample for zone '{}' at {}: substituted {}",
                    snapshot.getZone(), timestamp, snapshot.getDegradedFields());
        }
        LOG.debug("Scored zone '{}' #{}: {} physical={} BI={} extended={} level={}",
                snapshot.getZone(), snapshot.getSequence(), indices,
                scores.getPhysicalRisk(), scores.getBehavioralIntention(),
                scores.getExtendedRisk(), level);

        return IngestResult.scored(snapshot, level != before);
    }

    /**
     * @return the most recently published snapshot; empty before the first
     *         accepted sample. Repeated calls with no intervening ingest
     *         return the same snapshot.
     */
    public Optional<RiskSnapshot> latest() {
        return Optional.ofNullable(latest);
    }

    /**
     * @param k maximum number of snapshots
     * @return up to {@code k} most recent snapshots, oldest first
     * @throws IllegalArgumentException if {@code k} is negative
     */
    public synchronized List<RiskSnapshot> history(int k) {
        return history.last(k);
    }

    public synchronized AlertLevel currentLevel() {
        return alertState.getLevel();
    }

    public synchronized int historySize() {
        return history.size();
    }

    private IngestResult reject(String reason) {
        LOG.warn("Rejected sample: {}", reason);
        return IngestResult.rejected(reason);
    }
}
