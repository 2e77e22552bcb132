package com.deepknow.abis.interview.api;

import com.deepknow.abis.interview.api.model.ScoringWeightsView;
import com.deepknow.abis.interview.api.request.UpdateWeightsRequest;

public interface ScoringSettingsService {
    ScoringWeightsView getWeights();

    /**
     * 两个权重须为非负整数且和为 100，否则抛出 CONFIGURATION 异常并保留原权重。
     */
    ScoringWeightsView updateWeights(UpdateWeightsRequest req);
}
