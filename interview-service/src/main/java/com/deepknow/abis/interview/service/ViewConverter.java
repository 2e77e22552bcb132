package com.deepknow.abis.interview.service;

import com.deepknow.abis.interview.api.InterviewApiException;
import com.deepknow.abis.interview.api.model.AssessmentRunView;
import com.deepknow.abis.interview.api.model.AssessmentSummaryView;
import com.deepknow.abis.interview.api.model.AssessmentView;
import com.deepknow.abis.interview.api.model.EmotionSnapshotView;
import com.deepknow.abis.interview.api.model.IndicatorDto;
import com.deepknow.abis.interview.api.model.IndicatorOutcomeView;
import com.deepknow.abis.interview.api.model.IndicatorScoreView;
import com.deepknow.abis.interview.api.model.ModalityView;
import com.deepknow.abis.interview.api.model.ScoringWeightsView;
import com.deepknow.abis.interview.api.model.SessionClosedView;
import com.deepknow.abis.interview.domain.assessment.model.Assessment;
import com.deepknow.abis.interview.domain.assessment.model.AssessmentRunResult;
import com.deepknow.abis.interview.domain.assessment.model.AssessmentSummary;
import com.deepknow.abis.interview.domain.assessment.model.Indicator;
import com.deepknow.abis.interview.domain.assessment.model.IndicatorScore;
import com.deepknow.abis.interview.domain.emotion.EmotionSnapshot;
import com.deepknow.abis.interview.domain.emotion.ModalitySnapshot;
import com.deepknow.abis.interview.domain.error.ConfigurationException;
import com.deepknow.abis.interview.domain.error.InterviewException;
import com.deepknow.abis.interview.domain.scoring.ScoringWeights;
import com.deepknow.abis.interview.domain.session.model.FinalizedSession;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 域对象与 RPC 视图之间的转换，以及域异常到 {@link InterviewApiException} 的映射。
 */
final class ViewConverter {

    private ViewConverter() {
    }

    static InterviewApiException toApi(InterviewException e) {
        return new InterviewApiException(e.getCode(), e.getMessage());
    }

    static List<Indicator> toIndicators(List<IndicatorDto> dtos) {
        if (dtos == null) {
            throw new ConfigurationException("Indicator list is required");
        }
        return dtos.stream().map(ViewConverter::toIndicator).collect(Collectors.toList());
    }

    static Indicator toIndicator(IndicatorDto dto) {
        if (dto == null) {
            throw new ConfigurationException("Indicator is required");
        }
        return new Indicator(dto.getId(), dto.getName(), dto.getDescription(), dto.getWeight(), dto.getKeywords());
    }

    static EmotionSnapshotView toView(EmotionSnapshot snapshot) {
        EmotionSnapshotView v = new EmotionSnapshotView();
        v.setSessionId(snapshot.getSessionId());
        v.setFacial(toView(snapshot.getFacial()));
        v.setVoice(toView(snapshot.getVoice()));
        v.setTotalSamples(snapshot.getTotalSamples());
        return v;
    }

    static ModalityView toView(ModalitySnapshot m) {
        ModalityView v = new ModalityView();
        v.setLabel(m.getLabel());
        v.setDominantLabel(m.getDominantLabel());
        v.setConfidence(m.getConfidence());
        v.setStability(m.getStability());
        v.setWindowSamples(m.getWindowSamples());
        return v;
    }

    static SessionClosedView toView(FinalizedSession f) {
        SessionClosedView v = new SessionClosedView();
        v.setSessionId(f.getSessionId());
        v.setAudioArtifactRef(f.getAudioArtifactRef());
        v.setEmotionSampleCount(f.getEmotionSampleCount());
        v.setPersistedSampleCount(f.getPersistedSampleCount());
        v.setAbrupt(f.isAbrupt());
        return v;
    }

    static AssessmentView toView(Assessment a) {
        AssessmentView v = new AssessmentView();
        v.setSessionId(a.getSessionId());
        v.setIndicatorId(a.getIndicatorId());
        v.setAiScore(a.getAiScore());
        v.setManualScore(a.getManualScore());
        v.setEvidence(a.evidenceSpans());
        v.setReasoning(a.getReasoning());
        v.setInterviewerNotes(a.getInterviewerNotes());
        return v;
    }

    static AssessmentRunView toView(AssessmentRunResult r) {
        AssessmentRunView v = new AssessmentRunView();
        v.setSessionId(r.getSessionId());
        v.setStatus(r.getStatus().name());
        v.setOverallAiScore(r.getOverallAiScore());
        v.setTranscriptSegments(r.getTranscriptSegments());
        v.setError(r.getError());
        v.setOutcomes(r.getOutcomes().stream().map(o -> {
            IndicatorOutcomeView ov = new IndicatorOutcomeView();
            ov.setIndicatorId(o.getIndicatorId());
            ov.setAssessed(o.isAssessed());
            ov.setAiScore(o.getAiScore());
            ov.setReason(o.getReason());
            return ov;
        }).collect(Collectors.toList()));
        return v;
    }

    static AssessmentSummaryView toView(AssessmentSummary s) {
        AssessmentSummaryView v = new AssessmentSummaryView();
        v.setSessionId(s.getSessionId());
        v.setProcessingStatus(s.getProcessingStatus());
        v.setOverallScore(s.getOverallScore());
        v.setRecommendation(s.getRecommendation() == null ? null : s.getRecommendation().name());
        v.setAiWeight(s.getWeights().getAiWeight());
        v.setManualWeight(s.getWeights().getManualWeight());
        v.setIndicators(s.getIndicators().stream().map(ViewConverter::toView).collect(Collectors.toList()));
        return v;
    }

    static IndicatorScoreView toView(IndicatorScore s) {
        IndicatorScoreView v = new IndicatorScoreView();
        v.setIndicatorId(s.getIndicator().getId());
        v.setName(s.getIndicator().getName());
        v.setWeight(s.getIndicator().getWeight());
        v.setStatus(s.getStatus().name());
        v.setAiScore(s.getAiScore());
        v.setManualScore(s.getManualScore());
        v.setCombinedScore(s.getCombinedScore());
        v.setEvidence(s.getEvidence() == null ? Collections.emptyList() : s.getEvidence());
        v.setReasoning(s.getReasoning());
        v.setInterviewerNotes(s.getInterviewerNotes());
        return v;
    }

    static ScoringWeightsView toView(ScoringWeights w) {
        ScoringWeightsView v = new ScoringWeightsView();
        v.setAiWeight(w.getAiWeight());
        v.setManualWeight(w.getManualWeight());
        return v;
    }
}
