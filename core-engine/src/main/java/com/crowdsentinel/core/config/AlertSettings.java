package com.crowdsentinel.core.config;

import java.io.Serializable;
import java.util.List;
import java.util.Locale;

/**
 * Alert ladder configuration: rising thresholds, fall-back thresholds and
 * the hysteresis policy that applies them.
 *
 * <pre>
 * alert:
 *   policy: threshold        # or "hold"
 *   rising:   { yellow: 0.40, orange: 0.60, red: 0.75 }
 *   fallback: { yellow: 0.35, orange: 0.55, red: 0.70 }
 *   holdSeconds: 600
 * </pre>
 *
 * <p>
 * The fall-back defaults are a calibration starting point, not field-tested
 * values.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Fall-back thresholds applied on the way down. */
    public static final String POLICY_THRESHOLD = "threshold";

    /** Minimum hold duration before a downgrade. */
    public static final String POLICY_HOLD = "hold";

    private String policy = POLICY_THRESHOLD;
    private Thresholds rising = new Thresholds(0.40, 0.60, 0.75);
    private Thresholds fallback = new Thresholds(0.35, 0.55, 0.70);
    private long holdSeconds = 600;

    void collectErrors(List<String> errors) {
        if (policy == null || !(POLICY_THRESHOLD.equals(policy) || POLICY_HOLD.equals(policy))) {
            errors.add("Unknown alert policy: '" + policy + "'. Supported: threshold, hold");
        }
        if (rising == null) {
            errors.add("alert.rising is required");
            return;
        }
        double[] up = rising.toArray();
        if (!(up[0] > 0.0 && up[0] < up[1] && up[1] < up[2] && up[2] <= 1.0)) {
            errors.add(String.format(Locale.ROOT,
                    "Rising thresholds must be strictly increasing inside (0,1], got yellow=%s orange=%s red=%s",
                    up[0], up[1], up[2]));
        }
        if (POLICY_THRESHOLD.equals(policy)) {
            if (fallback == null) {
                errors.add("alert.fallback is required for the threshold policy");
                return;
            }
            double[] down = fallback.toArray();
            String[] names = { "yellow", "orange", "red" };
            for (int i = 0; i < down.length; i++) {
                if (!(down[i] >= 0.0 && down[i] < up[i])) {
                    errors.add(String.format(Locale.ROOT,
                            "Fall-back threshold for %s must be in [0, %s), got %s", names[i], up[i], down[i]));
                }
            }
            if (!(down[0] < down[1] && down[1] < down[2])) {
                errors.add("Fall-back thresholds must be strictly increasing");
            }
        }
        if (holdSeconds < 0) {
            errors.add("alert.holdSeconds must be >= 0, got: " + holdSeconds);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getPolicy() {
        return policy;
    }

    /**
     * Set the policy name, normalised to lowercase.
     *
     * @param policy policy name
     */
    public void setPolicy(String policy) {
        this.policy = policy != null ? policy.toLowerCase(Locale.ROOT) : null;
    }

    public Thresholds getRising() {
        return rising;
    }

    public void setRising(Thresholds rising) {
        this.rising = rising;
    }

    public Thresholds getFallback() {
        return fallback;
    }

    public void setFallback(Thresholds fallback) {
        this.fallback = fallback;
    }

    public long getHoldSeconds() {
        return holdSeconds;
    }

    public void setHoldSeconds(long holdSeconds) {
        this.holdSeconds = holdSeconds;
    }

    @Override
    public String toString() {
        return "AlertSettings{" +
                "policy='" + policy + '\'' +
                ", rising=" + rising +
                ", fallback=" + fallback +
                ", holdSeconds=" + holdSeconds +
                '}';
    }

    /**
     * One threshold per non-green level.
     */
    public static class Thresholds implements Serializable {

        private static final long serialVersionUID = 1L;

        private double yellow;
        private double orange;
        private double red;

        /** No-arg constructor required by SnakeYAML. */
        public Thresholds() {
        }

        public Thresholds(double yellow, double orange, double red) {
            this.yellow = yellow;
            this.orange = orange;
            this.red = red;
        }

        /**
         * @return {yellow, orange, red}
         */
        public double[] toArray() {
            return new double[] { yellow, orange, red };
        }

        public double getYellow() {
            return yellow;
        }

        public void setYellow(double yellow) {
            this.yellow = yellow;
        }

        public double getOrange() {
            return orange;
        }

        public void setOrange(double orange) {
            this.orange = orange;
        }

        public double getRed() {
            return red;
        }

        public void setRed(double red) {
            this.red = red;
        }

        @Override
        public String toString() {
            return "{yellow=" + yellow + ", orange=" + orange + ", red=" + red + '}';
        }
    }
}
