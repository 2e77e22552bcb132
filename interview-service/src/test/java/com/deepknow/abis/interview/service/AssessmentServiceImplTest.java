package com.deepknow.abis.interview.service;

import com.deepknow.abis.interview.api.InterviewApiException;
import com.deepknow.abis.interview.api.model.AssessmentRunView;
import com.deepknow.abis.interview.api.model.AssessmentSummaryView;
import com.deepknow.abis.interview.api.model.AssessmentView;
import com.deepknow.abis.interview.api.model.IndicatorDto;
import com.deepknow.abis.interview.api.request.ManualScoreRequest;
import com.deepknow.abis.interview.api.request.RunAssessmentRequest;
import com.deepknow.abis.interview.api.request.SummaryRequest;
import com.deepknow.abis.interview.domain.assessment.model.Assessment;
import com.deepknow.abis.interview.domain.assessment.model.AssessmentRunResult;
import com.deepknow.abis.interview.domain.assessment.model.AssessmentSummary;
import com.deepknow.abis.interview.domain.assessment.model.Indicator;
import com.deepknow.abis.interview.domain.assessment.model.IndicatorScore;
import com.deepknow.abis.interview.domain.assessment.service.AssessmentProcessingService;
import com.deepknow.abis.interview.domain.error.InvalidArgumentException;
import com.deepknow.abis.interview.domain.error.SessionStateException;
import com.deepknow.abis.interview.domain.scoring.Recommendation;
import com.deepknow.abis.interview.domain.scoring.ScoringWeights;
import com.deepknow.abis.interview.domain.session.model.ProcessingStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AssessmentServiceImplTest {

    private AssessmentProcessingService processing;
    private AssessmentServiceImpl service;

    @BeforeEach
    void setUp() {
        processing = mock(AssessmentProcessingService.class);
        service = new AssessmentServiceImpl(processing);
    }

    private static IndicatorDto indicator(long id, String name) {
        IndicatorDto dto = new IndicatorDto();
        dto.setId(id);
        dto.setName(name);
        dto.setDescription("");
        dto.setWeight(1.0);
        return dto;
    }

    @Test
    void syncRunReturnsConvertedResult() {
        AssessmentRunResult result = new AssessmentRunResult("s-1", ProcessingStatus.COMPLETED,
                List.of(AssessmentRunResult.IndicatorOutcome.assessed(1L, 72.5)), 72.5, 4, null);
        when(processing.runAssessment(eq("s-1"), isNull(), anyList())).thenReturn(result);
        RunAssessmentRequest req = new RunAssessmentRequest();
        req.setSessionId("s-1");
        req.setIndicators(List.of(indicator(1L, "Leadership")));

        AssessmentRunView view = service.runAssessment(req);

        assertThat(view.getStatus()).isEqualTo("COMPLETED");
        assertThat(view.getOverallAiScore()).isEqualTo(72.5);
        assertThat(view.getOutcomes()).hasSize(1);
        verify(processing, never()).submitAssessment(any(), any(), anyList());
    }

    @Test
    void asyncRunReturnsProcessingImmediately() {
        when(processing.submitAssessment(eq("s-1"), isNull(), anyList())).thenReturn(new CompletableFuture<>());
        RunAssessmentRequest req = new RunAssessmentRequest();
        req.setSessionId("s-1");
        req.setAsync(true);
        req.setIndicators(List.of(indicator(1L, "Leadership")));

        AssessmentRunView view = service.runAssessment(req);

        assertThat(view.getStatus()).isEqualTo("PROCESSING");
        assertThat(view.getOutcomes()).isEmpty();
    }

    @Test
    void missingIndicatorListMapsToConfigurationCode() {
        RunAssessmentRequest req = new RunAssessmentRequest();
        req.setSessionId("s-1");

        assertThatThrownBy(() -> service.runAssessment(req))
                .isInstanceOfSatisfying(InterviewApiException.class,
                        e -> assertThat(e.getCode()).isEqualTo("CONFIGURATION"));
        verifyNoInteractions(processing);
    }

    @Test
    void invalidIndicatorWeightMapsToConfigurationCode() {
        IndicatorDto bad = indicator(1L, "Leadership");
        bad.setWeight(0);
        SummaryRequest req = new SummaryRequest();
        req.setSessionId("s-1");
        req.setIndicators(List.of(bad));

        assertThatThrownBy(() -> service.getSummary(req))
                .isInstanceOfSatisfying(InterviewApiException.class,
                        e -> assertThat(e.getCode()).isEqualTo("CONFIGURATION"));
    }

    @Test
    void domainErrorsKeepTheirCode() {
        when(processing.submitManualScore("s-1", 1L, 120.0, null))
                .thenThrow(new InvalidArgumentException("Manual score must be within [0,100]: 120.0"));
        when(processing.submitManualScore("s-1", 2L, 50.0, null))
                .thenThrow(new SessionStateException("Indicator has no AI assessment yet"));

        assertThatThrownBy(() -> service.submitManualScore(manual(1L, 120.0)))
                .isInstanceOfSatisfying(InterviewApiException.class, e -> {
                    assertThat(e.getCode()).isEqualTo("INVALID_ARGUMENT");
                    assertThat(e.getMessage()).contains("[0,100]");
                });
        assertThatThrownBy(() -> service.submitManualScore(manual(2L, 50.0)))
                .isInstanceOfSatisfying(InterviewApiException.class,
                        e -> assertThat(e.getCode()).isEqualTo("SESSION_STATE"));
    }

    @Test
    void manualScoreViewCarriesSplitEvidence() {
        Assessment a = new Assessment();
        a.setSessionId("s-1");
        a.setIndicatorId(1L);
        a.setAiScore(70.0);
        a.setManualScore(80.0);
        a.setEvidence("I led the team | We shipped on time");
        when(processing.submitManualScore("s-1", 1L, 80.0, null)).thenReturn(a);

        AssessmentView view = service.submitManualScore(manual(1L, 80.0));

        assertThat(view.getManualScore()).isEqualTo(80.0);
        assertThat(view.getEvidence()).containsExactly("I led the team", "We shipped on time");
    }

    @Test
    void summaryViewCarriesWeightsAndRecommendation() {
        Indicator leadership = Indicator.of(1L, "Leadership", "", 1.0);
        IndicatorScore score = new IndicatorScore(leadership, IndicatorScore.Status.ASSESSED, 70.0, 80.0, 74.0,
                List.of("I led the team"), "reason", null);
        AssessmentSummary summary = new AssessmentSummary("s-1", "COMPLETED", List.of(score), 74.0,
                Recommendation.CONSIDER, ScoringWeights.DEFAULT);
        when(processing.summarize(eq("s-1"), anyList())).thenReturn(summary);
        SummaryRequest req = new SummaryRequest();
        req.setSessionId("s-1");
        req.setIndicators(List.of(indicator(1L, "Leadership")));

        AssessmentSummaryView view = service.getSummary(req);

        assertThat(view.getOverallScore()).isEqualTo(74.0);
        assertThat(view.getRecommendation()).isEqualTo("CONSIDER");
        assertThat(view.getAiWeight()).isEqualTo(60);
        assertThat(view.getManualWeight()).isEqualTo(40);
        assertThat(view.getIndicators()).hasSize(1);
    }

    private static ManualScoreRequest manual(long indicatorId, double score) {
        ManualScoreRequest req = new ManualScoreRequest();
        req.setSessionId("s-1");
        req.setIndicatorId(indicatorId);
        req.setManualScore(score);
        return req;
    }
}
