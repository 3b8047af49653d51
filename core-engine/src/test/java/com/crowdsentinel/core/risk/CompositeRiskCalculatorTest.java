package com.crowdsentinel.core.risk;

import com.crowdsentinel.core.config.AlertSettings;
import com.crowdsentinel.core.config.EngineConfig;
import com.crowdsentinel.core.model.AlertLevel;
import com.crowdsentinel.core.model.IndexSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link CompositeRiskCalculator}.
 */
class CompositeRiskCalculatorTest {

    private static final double EPS = 1e-9;

    @Test
    @DisplayName("Worked example should score Green")
    void shouldScoreWorkedExample() {
        CompositeRiskCalculator calculator = new CompositeRiskCalculator(
                new EngineConfig.IndexWeights(0.25, 0.25, 0.20, 0.15, 0.15),
                new EngineConfig.BehaviorWeights(0.3, 0.5, 0.2),
                new EngineConfig.RiskBlend(0.6, 0.4));
        IndexSet indices = new IndexSet(0.136, 0.175, 0.0, 0.2, 0.2, 0.233, 0.468, 0.655);

        RiskScores scores = calculator.score(indices);

        assertThat(scores.getPhysicalRisk()).isCloseTo(0.13775, within(EPS));
        assertThat(scores.getBehavioralIntention()).isCloseTo(0.4349, within(EPS));
        assertThat(scores.getExtendedRisk()).isCloseTo(0.25661, within(EPS));
        assertThat(AlertLevel.fromScore(scores.getExtendedRisk(), new AlertSettings().getRising().toArray()))
                .isEqualTo(AlertLevel.GREEN);
    }

    @Test
    @DisplayName("All-zero and all-one indices should give the bounds")
    void shouldHitBounds() {
        CompositeRiskCalculator calculator = CompositeRiskCalculator.fromConfig(new EngineConfig());

        RiskScores low = calculator.score(new IndexSet(0, 0, 0, 0, 0, 0, 0, 0));
        RiskScores high = calculator.score(new IndexSet(1, 1, 1, 1, 1, 1, 1, 1));

        assertThat(low.getExtendedRisk()).isZero();
        assertThat(high.getExtendedRisk()).isEqualTo(1.0);
        assertThat(high.getPhysicalRisk()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Default DANP weights should favour the event index")
    void shouldWeightEventIndexHighest() {
        CompositeRiskCalculator calculator = CompositeRiskCalculator.fromConfig(new EngineConfig());

        double eventOnly = calculator.physicalRisk(new IndexSet(0, 0, 0, 0, 1, 0, 0, 0));
        double heatOnly = calculator.physicalRisk(new IndexSet(0, 0, 1, 0, 0, 0, 0, 0));

        assertThat(eventOnly).isCloseTo(0.24063, within(EPS));
        assertThat(heatOnly).isCloseTo(0.12954, within(EPS));
    }
}
