package com.crowdsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable result of scoring one {@link RawSample}.
 *
 * <p>
 * A snapshot is created exactly once per accepted sample and carries the
 * alert level that was current <em>after</em> its own extended risk score was
 * applied to the alert state machine.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code timestamp}, {@code indices} and
 * {@code alertLevel} are required; omitting any of them throws a
 * {@link NullPointerException} at build time. Scores are clamped to [0,1].
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "sequence", "timestamp", "zone", "phase", "indices", "BI",
        "physicalRisk", "extendedRisk", "alertLevel", "degraded", "degradedFields" })
public final class RiskSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long sequence;
    private final Instant timestamp;
    private final String zone;
    private final String phase;
    private final IndexSet indices;
    private final double behavioralIntention;
    private final double physicalRisk;
    private final double extendedRisk;
    private final AlertLevel alertLevel;
    private final List<String> degradedFields;

    private RiskSnapshot(Builder b) {
        this.sequence = b.sequence;
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.zone = b.zone;
        this.phase = b.phase;
        this.indices = Objects.requireNonNull(b.indices, "indices must not be null");
        this.behavioralIntention = IndexSet.clamp01(b.behavioralIntention);
        this.physicalRisk = IndexSet.clamp01(b.physicalRisk);
        this.extendedRisk = IndexSet.clamp01(b.extendedRisk);
        this.alertLevel = Objects.requireNonNull(b.alertLevel, "alertLevel must not be null");
        this.degradedFields = b.degradedFields.isEmpty()
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(b.degradedFields));
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return 1-based position of this snapshot in its engine's output
     */
    public long getSequence() {
        return sequence;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getZone() {
        return zone;
    }

    public String getPhase() {
        return phase;
    }

    public IndexSet getIndices() {
        return indices;
    }

    @JsonProperty("BI")
    public double getBehavioralIntention() {
        return behavioralIntention;
    }

    public double getPhysicalRisk() {
        return physicalRisk;
    }

    public double getExtendedRisk() {
        return extendedRisk;
    }

    public AlertLevel getAlertLevel() {
        return alertLevel;
    }

    /**
     * @return {@code true} if any raw field was substituted or clamped
     */
    public boolean isDegraded() {
        return !degradedFields.isEmpty();
    }

    /**
     * @return unmodifiable, sorted names of the repaired raw fields
     */
    public List<String> getDegradedFields() {
        return degradedFields;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RiskSnapshot} instances.
     */
    public static class Builder {
        private long sequence;
        private Instant timestamp;
        private String zone;
        private String phase;
        private IndexSet indices;
        private double behavioralIntention;
        private double physicalRisk;
        private double extendedRisk;
        private AlertLevel alertLevel;
        private List<String> degradedFields = Collections.emptyList();

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder zone(String zone) {
            this.zone = zone;
            return this;
        }

        public Builder phase(String phase) {
            this.phase = phase;
            return this;
        }

        public Builder indices(IndexSet indices) {
            this.indices = indices;
            return this;
        }

        public Builder behavioralIntention(double behavioralIntention) {
            this.behavioralIntention = behavioralIntention;
            return this;
        }

        public Builder physicalRisk(double physicalRisk) {
            this.physicalRisk = physicalRisk;
            return this;
        }

        public Builder extendedRisk(double extendedRisk) {
            this.extendedRisk = extendedRisk;
            return this;
        }

        public Builder alertLevel(AlertLevel alertLevel) {
            this.alertLevel = alertLevel;
            return this;
        }

        public Builder degradedFields(List<String> degradedFields) {
            this.degradedFields = degradedFields != null ? degradedFields : Collections.emptyList();
            return this;
        }

        /**
         * @return a new {@link RiskSnapshot}
         * @throws NullPointerException if a required field is missing
         */
        public RiskSnapshot build() {
            return new RiskSnapshot(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RiskSnapshot that))
            return false;
        return sequence == that.sequence
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(zone, that.zone)
                && Objects.equals(indices, that.indices)
                && Double.compare(extendedRisk, that.extendedRisk) == 0
                && alertLevel == that.alertLevel;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequence, timestamp, zone, indices, extendedRisk, alertLevel);
    }

    @Override
    public String toString() {
        return String.format("RiskSnapshot{seq=%d, timestamp=%s, zone='%s', physical=%.3f, BI=%.3f, "
                + "extended=%.3f, level=%s, degraded=%s}",
                sequence, timestamp, zone, physicalRisk, behavioralIntention,
                extendedRisk, alertLevel, degradedFields);
    }
}
