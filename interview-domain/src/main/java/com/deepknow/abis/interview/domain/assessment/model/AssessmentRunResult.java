package com.deepknow.abis.interview.domain.assessment.model;

import com.deepknow.abis.interview.domain.session.model.ProcessingStatus;

import java.util.List;

/**
 * 一次批量评估运行的结果。FAILED 时 outcomes 为空、error 给出原因。
 */
public final class AssessmentRunResult {
    private final String sessionId;
    private final ProcessingStatus status;
    private final List<IndicatorOutcome> outcomes;
    private final Double overallAiScore;
    private final int transcriptSegments;
    private final String error;

    public AssessmentRunResult(String sessionId, ProcessingStatus status, List<IndicatorOutcome> outcomes,
                               Double overallAiScore, int transcriptSegments, String error) {
        this.sessionId = sessionId;
        this.status = status;
        this.outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        this.overallAiScore = overallAiScore;
        this.transcriptSegments = transcriptSegments;
        this.error = error;
    }

    public static AssessmentRunResult failed(String sessionId, String error) {
        return new AssessmentRunResult(sessionId, ProcessingStatus.FAILED, null, null, 0, error);
    }

    public String getSessionId() { return sessionId; }
    public ProcessingStatus getStatus() { return status; }
    public List<IndicatorOutcome> getOutcomes() { return outcomes; }
    public Double getOverallAiScore() { return overallAiScore; }
    public int getTranscriptSegments() { return transcriptSegments; }
    public String getError() { return error; }

    /**
     * 单个指标在本次运行中的结果；assessed=false 时 reason 说明原因（抽取失败、并发占用等）。
     */
    public static final class IndicatorOutcome {
        private final Long indicatorId;
        private final boolean assessed;
        private final Double aiScore;
        private final String reason;

        public IndicatorOutcome(Long indicatorId, boolean assessed, Double aiScore, String reason) {
            this.indicatorId = indicatorId;
            this.assessed = assessed;
            this.aiScore = aiScore;
            this.reason = reason;
        }

        public static IndicatorOutcome assessed(Long indicatorId, double aiScore) {
            return new IndicatorOutcome(indicatorId, true, aiScore, null);
        }

        public static IndicatorOutcome notAssessed(Long indicatorId, String reason) {
            return new IndicatorOutcome(indicatorId, false, null, reason);
        }

        public Long getIndicatorId() { return indicatorId; }
        public boolean isAssessed() { return assessed; }
        public Double getAiScore() { return aiScore; }
        public String getReason() { return reason; }
    }
}
