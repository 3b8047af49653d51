package com.crowdsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every section is optional and falls back to the
 * defaults shown):
 * </p>
 *
 * <pre>
 * weights:  { cai: 0.18841, cdi: 0.22613, thi: 0.12954, ti: 0.21530, ei: 0.24063 }
 * behavior: { attitude: 0.3, subjectiveNorm: 0.5, perceivedControl: 0.2 }
 * blend:    { physical: 0.6, behavioral: 0.4 }
 * alert:    ...   # see AlertSettings
 * normalization: ...   # see NormalizationSettings
 * historyCapacity: 288
 * </pre>
 *
 * <p>
 * The default physical weights are the DANP limit weights of the field
 * prototype. Call {@link #validate()} after loading; an invalid
 * configuration must stop the engine from starting.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Allowed deviation of a weight vector's sum from 1. */
    public static final double WEIGHT_SUM_TOLERANCE = 1e-3;

    /** 24 hours at a 5-minute cadence. */
    public static final int DEFAULT_HISTORY_CAPACITY = 288;

    private IndexWeights weights = new IndexWeights();
    private BehaviorWeights behavior = new BehaviorWeights();
    private RiskBlend blend = new RiskBlend();
    private AlertSettings alert = new AlertSettings();
    private NormalizationSettings normalization = new NormalizationSettings();
    private int historyCapacity = DEFAULT_HISTORY_CAPACITY;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every section.
     *
     * <p>
     * Collects all errors and throws a single exception listing them.
     * </p>
     *
     * @throws IllegalStateException if the configuration is inconsistent
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (weights == null) {
            errors.add("weights section is required");
        } else {
            checkWeightVector("weights", weights.toArray(), errors);
        }
        if (behavior == null) {
            errors.add("behavior section is required");
        } else {
            checkWeightVector("behavior", behavior.toArray(), errors);
        }
        if (blend == null) {
            errors.add("blend section is required");
        } else {
            checkWeightVector("blend", blend.toArray(), errors);
        }
        if (alert == null) {
            errors.add("alert section is required");
        } else {
            alert.collectErrors(errors);
        }
        if (normalization == null) {
            errors.add("normalization section is required");
        } else {
            normalization.collectErrors(errors);
        }
        if (historyCapacity < 1) {
            errors.add("historyCapacity must be >= 1, got: " + historyCapacity);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static void checkWeightVector(String name, double[] vector, List<String> errors) {
        double sum = 0;
        for (double w : vector) {
            if (!(w >= 0)) {
                errors.add(name + " weights must be non-negative, got: " + w);
            }
            sum += w;
        }
        if (!(Math.abs(sum - 1.0) <= WEIGHT_SUM_TOLERANCE)) {
            errors.add(String.format(Locale.ROOT, "%s weights must sum to 1 (±%s), got: %.5f",
                    name, WEIGHT_SUM_TOLERANCE, sum));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public IndexWeights getWeights() {
        return weights;
    }

    public void setWeights(IndexWeights weights) {
        this.weights = weights;
    }

    public BehaviorWeights getBehavior() {
        return behavior;
    }

    public void setBehavior(BehaviorWeights behavior) {
        this.behavior = behavior;
    }

    public RiskBlend getBlend() {
        return blend;
    }

    public void setBlend(RiskBlend blend) {
        this.blend = blend;
    }

    public AlertSettings getAlert() {
        return alert;
    }

    public void setAlert(AlertSettings alert) {
        this.alert = alert;
    }

    public NormalizationSettings getNormalization() {
        return normalization;
    }

    public void setNormalization(NormalizationSettings normalization) {
        this.normalization = normalization;
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
        this.historyCapacity = historyCapacity;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "weights=" + weights +
                ", behavior=" + behavior +
                ", blend=" + blend +
                ", alert=" + alert +
                ", normalization=" + normalization +
                ", historyCapacity=" + historyCapacity +
                '}';
    }

    // ---------------------------------------------------------------
    // Weight sections
    // ---------------------------------------------------------------

    /**
     * DANP weights of the five physical indices.
     */
    public static class IndexWeights implements Serializable {

        private static final long serialVersionUID = 1L;

        private double cai = 0.18841;
        private double cdi = 0.22613;
        private double thi = 0.12954;
        private double ti = 0.21530;
        private double ei = 0.24063;

        /** No-arg constructor required by SnakeYAML. */
        public IndexWeights() {
        }

        public IndexWeights(double cai, double cdi, double thi, double ti, double ei) {
            this.cai = cai;
            this.cdi = cdi;
            this.thi = thi;
            this.ti = ti;
            this.ei = ei;
        }

        /**
         * @return {cai, cdi, thi, ti, ei}
         */
        public double[] toArray() {
            return new double[] { cai, cdi, thi, ti, ei };
        }

        public double getCai() {
            return cai;
        }

        public void setCai(double cai) {
            this.cai = cai;
        }

        public double getCdi() {
            return cdi;
        }

        public void setCdi(double cdi) {
            this.cdi = cdi;
        }

        public double getThi() {
            return thi;
        }

        public void setThi(double thi) {
            this.thi = thi;
        }

        public double getTi() {
            return ti;
        }

        public void setTi(double ti) {
            this.ti = ti;
        }

        public double getEi() {
            return ei;
        }

        public void setEi(double ei) {
            this.ei = ei;
        }

        @Override
        public String toString() {
            return "{cai=" + cai + ", cdi=" + cdi + ", thi=" + thi + ", ti=" + ti + ", ei=" + ei + '}';
        }
    }

    /**
     * Behavioral-intention weights (attitude, subjective norm, perceived
     * control).
     */
    public static class BehaviorWeights implements Serializable {

        private static final long serialVersionUID = 1L;

        private double attitude = 0.3;
        private double subjectiveNorm = 0.5;
        private double perceivedControl = 0.2;

        /** No-arg constructor required by SnakeYAML. */
        public BehaviorWeights() {
        }

        public BehaviorWeights(double attitude, double subjectiveNorm, double perceivedControl) {
            this.attitude = attitude;
            this.subjectiveNorm = subjectiveNorm;
            this.perceivedControl = perceivedControl;
        }

        /**
         * @return {attitude, subjectiveNorm, perceivedControl}
         */
        public double[] toArray() {
            return new double[] { attitude, subjectiveNorm, perceivedControl };
        }

        public double getAttitude() {
            return attitude;
        }

        public void setAttitude(double attitude) {
            this.attitude = attitude;
        }

        public double getSubjectiveNorm() {
            return subjectiveNorm;
        }

        public void setSubjectiveNorm(double subjectiveNorm) {
            this.subjectiveNorm = subjectiveNorm;
        }

        public double getPerceivedControl() {
            return perceivedControl;
        }

        public void setPerceivedControl(double perceivedControl) {
            this.perceivedControl = perceivedControl;
        }

        @Override
        public String toString() {
            return "{attitude=" + attitude + ", subjectiveNorm=" + subjectiveNorm
                    + ", perceivedControl=" + perceivedControl + '}';
        }
    }

    /**
     * Split between physical risk and behavioral intention in the extended
     * risk score.
     */
    public static class RiskBlend implements Serializable {

        private static final long serialVersionUID = 1L;

        private double physical = 0.6;
        private double behavioral = 0.4;

        /** No-arg constructor required by SnakeYAML. */
        public RiskBlend() {
        }

        public RiskBlend(double physical, double behavioral) {
            this.physical = physical;
            this.behavioral = behavioral;
        }

        /**
         * @return {physical, behavioral}
         */
        public double[] toArray() {
            return new double[] { physical, behavioral };
        }

        public double getPhysical() {
            return physical;
        }

        public void setPhysical(double physical) {
            this.physical = physical;
        }

        public double getBehavioral() {
            return behavioral;
        }

        public void setBehavioral(double behavioral) {
            this.behavioral = behavioral;
        }

        @Override
        public String toString() {
            return "{physical=" + physical + ", behavioral=" + behavioral + '}';
        }
    }
}
