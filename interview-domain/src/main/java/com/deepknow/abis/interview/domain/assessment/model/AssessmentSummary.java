package com.deepknow.abis.interview.domain.assessment.model;

import com.deepknow.abis.interview.domain.scoring.Recommendation;
import com.deepknow.abis.interview.domain.scoring.ScoringWeights;

import java.util.List;

public final class AssessmentSummary {
    private final String sessionId;
    private final String processingStatus;
    private final List<IndicatorScore> indicators;
    private final Double overallScore;
    private final Recommendation recommendation;
    private final ScoringWeights weights;

    public AssessmentSummary(String sessionId, String processingStatus, List<IndicatorScore> indicators,
                             Double overallScore, Recommendation recommendation, ScoringWeights weights) {
        this.sessionId = sessionId;
        this.processingStatus = processingStatus;
        this.indicators = indicators == null ? List.of() : List.copyOf(indicators);
        this.overallScore = overallScore;
        this.recommendation = recommendation;
        this.weights = weights;
    }

    public String getSessionId() { return sessionId; }
    public String getProcessingStatus() { return processingStatus; }
    public List<IndicatorScore> getIndicators() { return indicators; }
    public Double getOverallScore() { return overallScore; }
    public Recommendation getRecommendation() { return recommendation; }
    public ScoringWeights getWeights() { return weights; }
}
