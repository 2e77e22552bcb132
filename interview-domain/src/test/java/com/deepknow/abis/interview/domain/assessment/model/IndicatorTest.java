package com.deepknow.abis.interview.domain.assessment.model;

import com.deepknow.abis.interview.domain.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndicatorTest {

    @Test
    void rejectsNonPositiveWeight() {
        assertThatThrownBy(() -> Indicator.of(1L, "Teamwork", "", 0))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> Indicator.of(1L, "Teamwork", "", Double.NaN))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void rejectsMissingIdOrName() {
        assertThatThrownBy(() -> new Indicator(null, "Teamwork", "", 1, null))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> Indicator.of(1L, "  ", "", 1))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void blankKeywordsAreDropped() {
        Indicator indicator = new Indicator(2L, " Ownership ", null, 2.0, Arrays.asList("owned", " ", null, " drove "));

        assertThat(indicator.getName()).isEqualTo("Ownership");
        assertThat(indicator.getDescription()).isEmpty();
        assertThat(indicator.getKeywords()).containsExactly("owned", "drove");
    }

    @Test
    void evidenceTextRoundTripsThroughSeparator() {
        ExtractionResult result = new ExtractionResult(55.0, List.of("first quote", "second quote"), "r", 2, 0, 0.7);

        assertThat(result.evidenceText()).isEqualTo("first quote | second quote");
        assertThat(ExtractionResult.splitEvidence(result.evidenceText())).containsExactly("first quote", "second quote");
        assertThat(ExtractionResult.splitEvidence(ExtractionResult.NO_EVIDENCE)).isEmpty();
    }
}
