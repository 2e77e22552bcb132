package com.deepknow.abis.interview.api.model;

import lombok.Data;

import java.io.Serializable;
import java.util.List;

@Data
public class AssessmentRunView implements Serializable {
    private static final long serialVersionUID = 8837720915006328466L;

    private String sessionId;
    /** RECORDING | PROCESSING | COMPLETED | FAILED */
    private String status;
    private List<IndicatorOutcomeView> outcomes;
    private Double overallAiScore;
    private int transcriptSegments;
    private String error;
}
