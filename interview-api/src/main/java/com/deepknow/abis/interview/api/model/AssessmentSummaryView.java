package com.deepknow.abis.interview.api.model;

import lombok.Data;

import java.io.Serializable;
import java.util.List;

@Data
public class AssessmentSummaryView implements Serializable {
    private static final long serialVersionUID = 1187263329050741528L;

    private String sessionId;
    private String processingStatus;
    private List<IndicatorScoreView> indicators;
    private Double overallScore;
    /** RECOMMENDED | CONSIDER | NOT_RECOMMENDED；无已评估指标时为空 */
    private String recommendation;
    private int aiWeight;
    private int manualWeight;
}
