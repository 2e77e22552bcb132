package com.deepknow.abis.interview.domain.scoring;

import com.deepknow.abis.interview.domain.assessment.model.Indicator;
import com.deepknow.abis.interview.domain.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoreCombinerTest {

    private static final ScoringWeights WEIGHTS = ScoringWeights.of(60, 40);

    @Test
    void missingManualScoreReturnsAiScore() {
        assertThat(ScoreCombiner.combine(70, null, WEIGHTS)).isEqualTo(70.0);
        assertThat(ScoreCombiner.combine(70, 0.0, WEIGHTS)).isEqualTo(70.0);
    }

    @Test
    void manualScoreIsBlendedByWeights() {
        assertThat(ScoreCombiner.combine(70, 80.0, WEIGHTS)).isEqualTo(74.0);
        assertThat(ScoreCombiner.combine(66.6, 71.3, ScoringWeights.of(50, 50))).isEqualTo(69.0);
    }

    @Test
    void combineWithoutWeightsIsRefused() {
        assertThatThrownBy(() -> ScoreCombiner.combine(70, 80.0, null))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void overallSkipsUnassessedIndicators() {
        Indicator a = Indicator.of(1L, "Communication", "", 1.0);
        Indicator b = Indicator.of(2L, "Leadership", "", 1.0);
        Map<Long, Double> scores = new HashMap<>();
        scores.put(1L, 80.0);

        assertThat(ScoreCombiner.overall(scores, List.of(a, b))).isEqualTo(OptionalDouble.of(80.0));
    }

    @Test
    void overallIsWeightedAverage() {
        Indicator a = Indicator.of(1L, "Communication", "", 3.0);
        Indicator b = Indicator.of(2L, "Leadership", "", 1.0);

        OptionalDouble overall = ScoreCombiner.overall(Map.of(1L, 80.0, 2L, 40.0), List.of(a, b));

        assertThat(overall).isEqualTo(OptionalDouble.of(70.0));
    }

    @Test
    void overallIsEmptyWhenNothingAssessed() {
        Indicator a = Indicator.of(1L, "Communication", "", 1.0);

        assertThat(ScoreCombiner.overall(Map.of(), List.of(a))).isEmpty();
    }

    @Test
    void recommendationBands() {
        assertThat(Recommendation.forOverall(80.0)).isEqualTo(Recommendation.RECOMMENDED);
        assertThat(Recommendation.forOverall(79.9)).isEqualTo(Recommendation.CONSIDER);
        assertThat(Recommendation.forOverall(60.0)).isEqualTo(Recommendation.CONSIDER);
        assertThat(Recommendation.forOverall(59.9)).isEqualTo(Recommendation.NOT_RECOMMENDED);
    }
}
