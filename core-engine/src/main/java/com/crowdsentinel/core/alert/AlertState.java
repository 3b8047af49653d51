package com.crowdsentinel.core.alert;

import com.crowdsentinel.core.model.AlertLevel;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * The current alert level of one engine and when it was entered.
 *
 * <p>
 * Starts at {@link AlertLevel#GREEN} with no transition time. Only
 * {@link AlertStateMachine} mutates it. Not thread-safe; the owning engine
 * guards access.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertState implements Serializable {

    private static final long serialVersionUID = 1L;

    private AlertLevel level = AlertLevel.GREEN;
    private Instant since;

    public AlertLevel getLevel() {
        return level;
    }

    /**
     * @return timestamp of the sample that caused the last transition, or
     *         {@code null} if the level has never changed
     */
    public Instant getSince() {
        return since;
    }

    void transitionTo(AlertLevel next, Instant at) {
        this.level = Objects.requireNonNull(next, "Alert level must not be null");
        this.since = at;
    }

    @Override
    public String toString() {
        return "AlertState{level=" + level + ", since=" + since + '}';
    }
}
