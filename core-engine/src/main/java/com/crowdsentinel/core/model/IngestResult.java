package com.crowdsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured outcome of ingesting one {@link RawSample}.
 *
 * <p>
 * The engine never throws for bad input; it reports one of three statuses
 * instead.
 * </p>
 *
 * @since 1.0.0
 */
public final class IngestResult implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Ingestion outcome. */
    public enum Status {
        /** Sample scored with no repairs. */
        ACCEPTED,
        /** Sample scored after substituting or clamping one or more fields. */
        DEGRADED,
        /** Sample refused; engine state is unchanged. */
        REJECTED
    }

    private final Status status;
    private final RiskSnapshot snapshot;
    private final String reason;
    private final boolean levelChanged;

    private IngestResult(Status status, RiskSnapshot snapshot, String reason, boolean levelChanged) {
        this.status = status;
        this.snapshot = snapshot;
        this.reason = reason;
        this.levelChanged = levelChanged;
    }

    /**
     * @param snapshot     the published snapshot; must not be {@code null}
     * @param levelChanged whether the alert level moved on this sample
     * @return an ACCEPTED or DEGRADED result depending on the snapshot
     */
    public static IngestResult scored(RiskSnapshot snapshot, boolean levelChanged) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Status status = snapshot.isDegraded() ? Status.DEGRADED : Status.ACCEPTED;
        return new IngestResult(status, snapshot, null, levelChanged);
    }

    /**
     * @param reason human-readable rejection reason
     * @return a REJECTED result
     */
    public static IngestResult rejected(String reason) {
        return new IngestResult(Status.REJECTED, null, reason, false);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }

    /**
     * @return the snapshot, empty when the sample was rejected
     */
    public Optional<RiskSnapshot> getSnapshot() {
        return Optional.ofNullable(snapshot);
    }

    /**
     * @return rejection reason, or {@code null} for scored samples
     */
    public String getReason() {
        return reason;
    }

    public boolean isLevelChanged() {
        return levelChanged;
    }

    @Override
    public String toString() {
        return "IngestResult{" +
                "status=" + status +
                (reason != null ? ", reason='" + reason + '\'' : "") +
                (snapshot != null ? ", level=" + snapshot.getAlertLevel() : "") +
                ", levelChanged=" + levelChanged +
                '}';
    }
}
