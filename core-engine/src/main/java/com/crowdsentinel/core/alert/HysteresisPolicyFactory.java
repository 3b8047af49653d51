package com.crowdsentinel.core.alert;

import com.crowdsentinel.core.config.AlertSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link HysteresisPolicy} instances from
 * {@link AlertSettings}.
 *
 * <p>
 * This is the single point of extension when adding new downgrade policies:
 * register the new policy name here and create the corresponding
 * implementation.
 * </p>
 *
 * @since 1.0.0
 */
public final class HysteresisPolicyFactory {

    private static final Logger LOG = LoggerFactory.getLogger(HysteresisPolicyFactory.class);

    private HysteresisPolicyFactory() {
        // utility class - not instantiable
    }

    /**
     * Create the policy named by the settings.
     *
     * @param settings alert settings; must not be {@code null}
     * @return the policy
     * @throws NullPointerException     if {@code settings} or its policy is
     *                                  {@code null}
     * @throws IllegalArgumentException if the policy name is unknown
     */
    public static HysteresisPolicy create(AlertSettings settings) {
        Objects.requireNonNull(settings, "AlertSettings must not be null");
        Objects.requireNonNull(settings.getPolicy(), "Alert policy must not be null");

        String policy = settings.getPolicy().toLowerCase(Locale.ROOT);
        HysteresisPolicy created = switch (policy) {
            case AlertSettings.POLICY_THRESHOLD -> new ThresholdHysteresisPolicy(settings);
            case AlertSettings.POLICY_HOLD -> new MinimumHoldPolicy(settings);
            default -> throw new IllegalArgumentException(
                    "Unknown alert policy: '" + settings.getPolicy()
                            + "'. Supported policies: threshold, hold");
        };
        LOG.info("Using '{}' hysteresis policy", created.getName());
        return created;
    }
}
