package com.crowdsentinel.core.alert;

import com.crowdsentinel.core.config.AlertSettings;
import com.crowdsentinel.core.model.AlertLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Threshold hysteresis: each level has a fall-back threshold strictly below
 * its rising threshold.
 *
 * <p>
 * A downgrade to the raw target is allowed only when the score is below the
 * fall-back threshold of every level above the target; otherwise the current
 * level is kept. With Orange entered at 0.60 and a fall-back of 0.55, a score
 * of 0.58 keeps Orange while 0.50 drops to Yellow. A score of 0.38 from
 * Orange keeps Orange, because it has not fallen below Yellow's fall-back of
 * 0.35.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdHysteresisPolicy implements HysteresisPolicy {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ThresholdHysteresisPolicy.class);

    /** Fall-back thresholds for Yellow, Orange and Red. */
    private final double[] fallback;

    /**
     * @param settings validated alert settings; must not be {@code null}
     */
    public ThresholdHysteresisPolicy(AlertSettings settings) {
        Objects.requireNonNull(settings, "AlertSettings must not be null");
        this.fallback = Objects.requireNonNull(settings.getFallback(),
                "Fall-back thresholds must not be null for the threshold policy").toArray();
    }

    @Override
    public AlertLevel resolveDowngrade(AlertState state, AlertLevel target, double score, Instant at) {
        for (AlertLevel level : AlertLevel.values()) {
            if (level.isAbove(target) && score >= fallbackOf(level)) {
                LOG.debug("Holding at {} (target {}): score {} not below {} fall-back {}",
                        state.getLevel(), target, score, level, fallbackOf(level));
                return state.getLevel();
            }
        }
        return target;
    }

    @Override
    public String getName() {
        return AlertSettings.POLICY_THRESHOLD;
    }

    double fallbackOf(AlertLevel level) {
        return level == AlertLevel.GREEN ? 0.0 : fallback[level.ordinal() - 1];
    }
}
