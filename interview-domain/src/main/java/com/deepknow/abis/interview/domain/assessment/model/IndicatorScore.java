package com.deepknow.abis.interview.domain.assessment.model;

import java.util.List;

/**
 * 汇总视图中的单个指标行。NOT_ASSESSED 时各分数为 null，而不是填充一个"中性"默认分。
 */
public final class IndicatorScore {
    public enum Status { ASSESSED, NOT_ASSESSED }

    private final Indicator indicator;
    private final Status status;
    private final Double aiScore;
    private final Double manualScore;
    private final Double combinedScore;
    private final List<String> evidence;
    private final String reasoning;
    private final String interviewerNotes;

    public IndicatorScore(Indicator indicator, Status status, Double aiScore, Double manualScore, Double combinedScore,
                          List<String> evidence, String reasoning, String interviewerNotes) {
        this.indicator = indicator;
        this.status = status;
        this.aiScore = aiScore;
        this.manualScore = manualScore;
        this.combinedScore = combinedScore;
        this.evidence = evidence == null ? List.of() : List.copyOf(evidence);
        this.reasoning = reasoning;
        this.interviewerNotes = interviewerNotes;
    }

    public static IndicatorScore notAssessed(Indicator indicator) {
        return new IndicatorScore(indicator, Status.NOT_ASSESSED, null, null, null, null, null, null);
    }

    public Indicator getIndicator() { return indicator; }
    public Status getStatus() { return status; }
    public Double getAiScore() { return aiScore; }
    public Double getManualScore() { return manualScore; }
    public Double getCombinedScore() { return combinedScore; }
    public List<String> getEvidence() { return evidence; }
    public String getReasoning() { return reasoning; }
    public String getInterviewerNotes() { return interviewerNotes; }
}
