package com.deepknow.abis.interview.service;

import com.deepknow.abis.interview.api.InterviewApiException;
import com.deepknow.abis.interview.api.model.ScoringWeightsView;
import com.deepknow.abis.interview.api.request.UpdateWeightsRequest;
import com.deepknow.abis.interview.domain.error.ConfigurationException;
import com.deepknow.abis.interview.domain.scoring.ScoringWeights;
import com.deepknow.abis.interview.domain.scoring.ScoringWeightsStore;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ScoringSettingsServiceImplTest {

    private final ScoringWeightsStore store = mock(ScoringWeightsStore.class);
    private final ScoringSettingsServiceImpl service = new ScoringSettingsServiceImpl(store);

    @Test
    void updateReturnsNewPair() {
        when(store.update(70, 30)).thenReturn(ScoringWeights.of(70, 30));

        ScoringWeightsView view = service.updateWeights(request(70, 30));

        assertThat(view.getAiWeight()).isEqualTo(70);
        assertThat(view.getManualWeight()).isEqualTo(30);
    }

    @Test
    void invalidPairIsRejectedWithConfigurationCode() {
        when(store.update(70, 40)).thenThrow(new ConfigurationException("Weights must sum to 100: 70+40"));

        assertThatThrownBy(() -> service.updateWeights(request(70, 40)))
                .isInstanceOfSatisfying(InterviewApiException.class,
                        e -> assertThat(e.getCode()).isEqualTo("CONFIGURATION"));
    }

    @Test
    void readsCurrentPair() {
        when(store.current()).thenReturn(ScoringWeights.DEFAULT);

        assertThat(service.getWeights().getAiWeight()).isEqualTo(60);
    }

    private static UpdateWeightsRequest request(int ai, int manual) {
        UpdateWeightsRequest req = new UpdateWeightsRequest();
        req.setAiWeight(ai);
        req.setManualWeight(manual);
        return req;
    }
}
