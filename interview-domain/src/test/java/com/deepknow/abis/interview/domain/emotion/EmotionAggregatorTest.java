package com.deepknow.abis.interview.domain.emotion;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EmotionAggregatorTest {

    @Test
    void fourOfFiveIdenticalLabelsGiveStabilityPointEight() {
        EmotionAggregator aggregator = new EmotionAggregator("s-1");
        String[] labels = {"happy", "happy", "happy", "sad", "happy"};
        for (int i = 0; i < labels.length; i++) {
            aggregator.record(Modality.FACIAL, labels[i], 0.9, i * 0.5);
        }

        assertThat(aggregator.stability(Modality.FACIAL)).isCloseTo(0.8, within(1e-9));
        assertThat(aggregator.dominantLabel(Modality.FACIAL)).isEqualTo("happy");

        ModalitySnapshot facial = aggregator.snapshot().getFacial();
        assertThat(facial.getLabel()).isEqualTo("happy");
        assertThat(facial.getWindowSamples()).isEqualTo(5);
        assertThat(aggregator.snapshot().getTotalSamples()).isEqualTo(5);
    }

    @Test
    void emptyWindowDefaultsToFullyStable() {
        EmotionAggregator aggregator = new EmotionAggregator("s-2");

        assertThat(aggregator.stability(Modality.VOICE)).isEqualTo(1.0);
        ModalitySnapshot voice = aggregator.snapshot().getVoice();
        assertThat(voice.isEmpty()).isTrue();
        assertThat(voice.getStability()).isEqualTo(1.0);
        assertThat(voice.getWindowSamples()).isZero();
    }

    @Test
    void undefinedPolicyLeavesEmptyWindowWithoutStability() {
        EmotionAggregator aggregator = new EmotionAggregator("s-3", 30.0, 100, EmptyWindowPolicy.UNDEFINED);

        assertThat(aggregator.stability(Modality.FACIAL)).isNaN();
        assertThat(aggregator.snapshot().getFacial().getStability()).isNull();
    }

    @Test
    void stabilityGrowsWithIdenticalLabelsInFixedWindow() {
        double previous = -1;
        for (int identical = 1; identical <= 6; identical++) {
            EmotionAggregator aggregator = new EmotionAggregator("s-4", 30.0, 6, EmptyWindowPolicy.STABLE);
            for (int i = 0; i < 6; i++) {
                String label = i < identical ? "neutral" : "label-" + i;
                aggregator.record(Modality.VOICE, label, 0.7, i);
            }
            double stability = aggregator.stability(Modality.VOICE);
            assertThat(stability).isGreaterThanOrEqualTo(previous);
            previous = stability;
        }
        assertThat(previous).isEqualTo(1.0);
    }

    @Test
    void samplesOlderThanWindowAreIgnored() {
        EmotionAggregator aggregator = new EmotionAggregator("s-5", 10.0, 100, EmptyWindowPolicy.STABLE);
        aggregator.record(Modality.FACIAL, "sad", 0.8, 0.0);
        aggregator.record(Modality.FACIAL, "sad", 0.8, 1.0);
        aggregator.record(Modality.FACIAL, "happy", 0.8, 20.0);

        assertThat(aggregator.stability(Modality.FACIAL)).isEqualTo(1.0);
        assertThat(aggregator.dominantLabel(Modality.FACIAL)).isEqualTo("happy");
        // 日志保留全部样本
        assertThat(aggregator.samples()).hasSize(3);
    }

    @Test
    void tiesResolveToMostRecentLabel() {
        EmotionAggregator aggregator = new EmotionAggregator("s-6");
        aggregator.record(Modality.FACIAL, "happy", 0.8, 0.0);
        aggregator.record(Modality.FACIAL, "sad", 0.8, 1.0);

        assertThat(aggregator.dominantLabel(Modality.FACIAL)).isEqualTo("sad");
        assertThat(aggregator.stability(Modality.FACIAL)).isEqualTo(0.5);
    }

    @Test
    void timestampsNeverGoBackwardsWithinModality() {
        EmotionAggregator aggregator = new EmotionAggregator("s-7");
        aggregator.record(Modality.VOICE, "calm", 0.6, 5.0);
        EmotionSample late = aggregator.record(Modality.VOICE, "calm", 0.6, 3.0).orElseThrow();

        assertThat(late.getTimestampSeconds()).isEqualTo(5.0);
    }

    @Test
    void sealRejectsFurtherSamples() {
        EmotionAggregator aggregator = new EmotionAggregator("s-8");
        aggregator.record(Modality.FACIAL, "happy", 0.9, 0.0);

        List<EmotionSample> log = aggregator.seal();

        assertThat(aggregator.record(Modality.FACIAL, "sad", 0.9, 1.0)).isEmpty();
        assertThat(aggregator.isSealed()).isTrue();
        assertThat(log).hasSize(1);
        assertThat(aggregator.seal()).isEqualTo(log);
    }

    @Test
    void detectionConfidenceIsClampedToUnitRange() {
        assertThat(EmotionDetection.of("Happy", 1.7).getConfidence()).isEqualTo(1.0);
        assertThat(EmotionDetection.of("sad", -0.2).getConfidence()).isEqualTo(0.0);
        assertThat(EmotionDetection.of(" Happy ", 0.5).getLabel()).isEqualTo("happy");
    }
}
