package com.deepknow.abis.interview.domain.scoring;

import com.deepknow.abis.interview.domain.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoringWeightsTest {

    @Test
    void acceptsPairSummingToHundred() {
        ScoringWeights weights = ScoringWeights.of(70, 30);

        assertThat(weights.getAiWeight()).isEqualTo(70);
        assertThat(weights.getManualWeight()).isEqualTo(30);
        assertThat(weights).isEqualTo(ScoringWeights.of(70, 30));
    }

    @Test
    void rejectsPairNotSummingToHundred() {
        assertThatThrownBy(() -> ScoringWeights.of(70, 40))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("sum=110");
    }

    @Test
    void rejectsNegativeWeight() {
        assertThatThrownBy(() -> ScoringWeights.of(110, -10))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void defaultIsSixtyForty() {
        assertThat(ScoringWeights.DEFAULT).isEqualTo(ScoringWeights.of(60, 40));
    }
}
