package com.crowdsentinel.core.alert;

import com.crowdsentinel.core.config.AlertSettings;
import com.crowdsentinel.core.model.AlertLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Dwell-time hysteresis: after any transition the level is held for a
 * minimum duration before a downgrade is allowed.
 *
 * <p>
 * Elapsed time is measured between sample timestamps, not wall-clock time,
 * so replays behave the same as live feeds. Once the hold has elapsed the
 * level falls straight to the raw target.
 * </p>
 *
 * @since 1.0.0
 */
public class MinimumHoldPolicy implements HysteresisPolicy {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MinimumHoldPolicy.class);

    private final Duration hold;

    /**
     * @param settings validated alert settings; must not be {@code null}
     * @throws IllegalArgumentException if the hold duration is negative
     */
    public MinimumHoldPolicy(AlertSettings settings) {
        Objects.requireNonNull(settings, "AlertSettings must not be null");
        if (settings.getHoldSeconds() < 0) {
            throw new IllegalArgumentException("holdSeconds must be >= 0, got: " + settings.getHoldSeconds());
        }
        this.hold = Duration.ofSeconds(settings.getHoldSeconds());
    }

    @Override
    public AlertLevel resolveDowngrade(AlertState state, AlertLevel target, double score, Instant at) {
        Instant since = state.getSince();
        if (since == null || at == null) {
            return target;
        }
        Duration held = Duration.between(since, at);
        if (held.compareTo(hold) >= 0) {
            return target;
        }
        LOG.debug("Holding at {} (target {}): held {} of {}", state.getLevel(), target, held, hold);
        return state.getLevel();
    }

    @Override
    public String getName() {
        return AlertSettings.POLICY_HOLD;
    }

    public Duration getHold() {
        return hold;
    }
}
