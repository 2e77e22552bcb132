package com.deepknow.abis.interview.service;

import com.deepknow.abis.interview.api.ScoringSettingsService;
import com.deepknow.abis.interview.api.model.ScoringWeightsView;
import com.deepknow.abis.interview.api.request.UpdateWeightsRequest;
import com.deepknow.abis.interview.domain.error.InterviewException;
import com.deepknow.abis.interview.domain.scoring.ScoringWeightsStore;
import org.apache.dubbo.config.annotation.DubboService;
import org.springframework.stereotype.Service;

@DubboService
@Service
public class ScoringSettingsServiceImpl implements ScoringSettingsService {
    private final ScoringWeightsStore weightsStore;

    public ScoringSettingsServiceImpl(ScoringWeightsStore weightsStore) {
        this.weightsStore = weightsStore;
    }

    @Override
    public ScoringWeightsView getWeights() {
        return ViewConverter.toView(weightsStore.current());
    }

    @Override
    public ScoringWeightsView updateWeights(UpdateWeightsRequest req) {
        try {
            return ViewConverter.toView(weightsStore.update(req.getAiWeight(), req.getManualWeight()));
        } catch (InterviewException e) {
            throw ViewConverter.toApi(e);
        }
    }
}
