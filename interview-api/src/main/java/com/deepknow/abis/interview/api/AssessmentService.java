package com.deepknow.abis.interview.api;

import com.deepknow.abis.interview.api.model.AssessmentRunView;
import com.deepknow.abis.interview.api.model.AssessmentSummaryView;
import com.deepknow.abis.interview.api.model.AssessmentView;
import com.deepknow.abis.interview.api.request.ManualScoreRequest;
import com.deepknow.abis.interview.api.request.ReassessRequest;
import com.deepknow.abis.interview.api.request.RunAssessmentRequest;
import com.deepknow.abis.interview.api.request.SummaryRequest;

public interface AssessmentService {

    /**
     * 同步评估返回完整结果；async=true 时只返回 PROCESSING 状态，结果通过 getSummary 轮询。
     */
    AssessmentRunView runAssessment(RunAssessmentRequest req);

    AssessmentView reassessIndicator(ReassessRequest req);

    AssessmentView submitManualScore(ManualScoreRequest req);

    AssessmentSummaryView getSummary(SummaryRequest req);
}
