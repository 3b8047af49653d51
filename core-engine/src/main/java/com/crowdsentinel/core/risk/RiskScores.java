package com.crowdsentinel.core.risk;

import java.io.Serializable;

import static com.crowdsentinel.core.model.IndexSet.clamp01;

/**
 * Output of {@link CompositeRiskCalculator}: physical risk, behavioral
 * intention and extended risk, each clamped to [0,1].
 *
 * @since 1.0.0
 */
public final class RiskScores implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double physicalRisk;
    private final double behavioralIntention;
    private final double extendedRisk;

    public RiskScores(double physicalRisk, double behavioralIntention, double extendedRisk) {
        this.physicalRisk = clamp01(physicalRisk);
        this.behavioralIntention = clamp01(behavioralIntention);
        this.extendedRisk = clamp01(extendedRisk);
    }

    public double getPhysicalRisk() {
        return physicalRisk;
    }

    public double getBehavioralIntention() {
        return behavioralIntention;
    }

    public double getExtendedRisk() {
        return extendedRisk;
    }

    @Override
    public String toString() {
        return String.format("RiskScores{physical=%.4f, BI=%.4f, extended=%.4f}",
                physicalRisk, behavioralIntention, extendedRisk);
    }
}
