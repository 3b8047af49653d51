package com.crowdsentinel.core.alert;

import com.crowdsentinel.core.config.AlertSettings;
import com.crowdsentinel.core.model.AlertLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

import static com.crowdsentinel.core.model.IndexSet.clamp01;

/**
 * Converts a stream of extended risk scores into one of four alert levels
 * without flapping.
 *
 * <p>
 * On each score {@code r} (clamped to [0,1] first; {@code NaN} leaves the
 * level unchanged):
 * </p>
 * <ol>
 * <li>the raw target {@code T} is the highest level whose rising threshold is
 * {@code <= r};</li>
 * <li>if {@code T} is above the current level the machine moves to {@code T}
 * at once;</li>
 * <li>if {@code T} is below, the {@link HysteresisPolicy} decides how far to
 * fall;</li>
 * <li>otherwise nothing changes.</li>
 * </ol>
 *
 * <p>
 * The machine itself holds only configuration; the mutable level lives in an
 * {@link AlertState} owned by the caller.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertStateMachine implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AlertStateMachine.class);

    private final double[] rising;
    private final HysteresisPolicy policy;

    /**
     * @param rising enter-Yellow, enter-Orange and enter-Red thresholds;
     *               must not be {@code null}
     * @param policy downgrade policy; must not be {@code null}
     */
    public AlertStateMachine(AlertSettings.Thresholds rising, HysteresisPolicy policy) {
        this.rising = Objects.requireNonNull(rising, "Rising thresholds must not be null").toArray();
        this.policy = Objects.requireNonNull(policy, "HysteresisPolicy must not be null");
    }

    /**
     * @param settings validated alert settings
     * @return a state machine with the configured thresholds and policy
     */
    public static AlertStateMachine fromSettings(AlertSettings settings) {
        Objects.requireNonNull(settings, "AlertSettings must not be null");
        return new AlertStateMachine(settings.getRising(), HysteresisPolicyFactory.create(settings));
    }

    /**
     * Apply one score to the state.
     *
     * @param state the alert state to update; must not be {@code null}
     * @param score extended risk score; out-of-range values are clamped and
     *              {@code NaN} is ignored
     * @param at    timestamp of the sample that produced the score
     * @return the level after this step
     */
    public AlertLevel advance(AlertState state, double score, Instant at) {
        Objects.requireNonNull(state, "AlertState must not be null");
        AlertLevel current = state.getLevel();
        if (Double.isNaN(score)) {
            LOG.warn("Ignoring NaN risk score, alert level stays {}", current);
            return current;
        }
        double r = clamp01(score);
        AlertLevel target = AlertLevel.fromScore(r, rising);

        AlertLevel next = current;
        if (target.isAbove(current)) {
            next = target;
        } else if (current.isAbove(target)) {
            next = policy.resolveDowngrade(state, target, r, at);
        }

        if (next != current) {
            state.transitionTo(next, at);
            if (next.isAbove(current)) {
                LOG.info("Alert escalated {} -> {} (risk={})", current, next, String.format("%.3f", r));
            } else {
                LOG.info("Alert de-escalated {} -> {} (risk={})", current, next, String.format("%.3f", r));
            }
        }
        return next;
    }

    public HysteresisPolicy getPolicy() {
        return policy;
    }
}
