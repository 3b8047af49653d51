package com.crowdsentinel.core.risk;

import com.crowdsentinel.core.config.EngineConfig;
import com.crowdsentinel.core.model.IndexSet;

import java.io.Serializable;
import java.util.Objects;

import static com.crowdsentinel.core.model.IndexSet.clamp01;

/**
 * Combines an {@link IndexSet} into composite risk scores.
 *
 * <pre>
 *   physical = Σ w_i · {CAI, CDI, THI, TI, EI}          (DANP weights)
 *   BI       = a·ATI + b·SNI + c·PCI                    (default 0.3/0.5/0.2)
 *   extended = blend_p · physical + blend_b · BI        (default 0.6/0.4)
 * </pre>
 *
 * <p>
 * Weights are captured once at construction. The calculator is stateless and
 * side-effect free.
 * </p>
 *
 * @since 1.0.0
 */
public class CompositeRiskCalculator implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double[] indexWeights;
    private final double[] behaviorWeights;
    private final double physicalShare;
    private final double behavioralShare;

    /**
     * @param indexWeights    DANP weights; must not be {@code null}
     * @param behaviorWeights behavioral-intention weights; must not be
     *                        {@code null}
     * @param blend           physical/behavioral split; must not be
     *                        {@code null}
     */
    public CompositeRiskCalculator(EngineConfig.IndexWeights indexWeights,
            EngineConfig.BehaviorWeights behaviorWeights,
            EngineConfig.RiskBlend blend) {
        this.indexWeights = Objects.requireNonNull(indexWeights, "Index weights must not be null").toArray();
        this.behaviorWeights = Objects.requireNonNull(behaviorWeights, "Behavior weights must not be null")
                .toArray();
        Objects.requireNonNull(blend, "Risk blend must not be null");
        this.physicalShare = blend.getPhysical();
        this.behavioralShare = blend.getBehavioral();
    }

    /**
     * @param config validated engine configuration
     * @return a calculator using the configured weights
     */
    public static CompositeRiskCalculator fromConfig(EngineConfig config) {
        Objects.requireNonNull(config, "EngineConfig must not be null");
        return new CompositeRiskCalculator(config.getWeights(), config.getBehavior(), config.getBlend());
    }

    public double physicalRisk(IndexSet indices) {
        return clamp01(indexWeights[0] * indices.getCai()
                + indexWeights[1] * indices.getCdi()
                + indexWeights[2] * indices.getThi()
                + indexWeights[3] * indices.getTi()
                + indexWeights[4] * indices.getEi());
    }

    public double behavioralIntention(IndexSet indices) {
        return clamp01(behaviorWeights[0] * indices.getAti()
                + behaviorWeights[1] * indices.getSni()
                + behaviorWeights[2] * indices.getPci());
    }

    public double extendedRisk(double physicalRisk, double behavioralIntention) {
        return clamp01(physicalShare * physicalRisk + behavioralShare * behavioralIntention);
    }

    /**
     * @param indices the index set; must not be {@code null}
     * @return physical risk, behavioral intention and extended risk
     */
    public RiskScores score(IndexSet indices) {
        Objects.requireNonNull(indices, "IndexSet must not be null");
        double physical = physicalRisk(indices);
        double bi = behavioralIntention(indices);
        return new RiskScores(physical, bi, extendedRisk(physical, bi));
    }
}
