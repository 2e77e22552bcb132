package com.deepknow.abis.interview.service;

import com.deepknow.abis.interview.api.AssessmentService;
import com.deepknow.abis.interview.api.model.AssessmentRunView;
import com.deepknow.abis.interview.api.model.AssessmentSummaryView;
import com.deepknow.abis.interview.api.model.AssessmentView;
import com.deepknow.abis.interview.api.request.ManualScoreRequest;
import com.deepknow.abis.interview.api.request.ReassessRequest;
import com.deepknow.abis.interview.api.request.RunAssessmentRequest;
import com.deepknow.abis.interview.api.request.SummaryRequest;
import com.deepknow.abis.interview.domain.assessment.model.Indicator;
import com.deepknow.abis.interview.domain.assessment.service.AssessmentProcessingService;
import com.deepknow.abis.interview.domain.error.InterviewException;
import com.deepknow.abis.interview.domain.session.model.ProcessingStatus;
import org.apache.dubbo.config.annotation.DubboService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;

@DubboService
@Service
public class AssessmentServiceImpl implements AssessmentService {
    private static final Logger logger = LoggerFactory.getLogger(AssessmentServiceImpl.class);

    private final AssessmentProcessingService processingService;

    public AssessmentServiceImpl(AssessmentProcessingService processingService) {
        this.processingService = processingService;
    }

    @Override
    public AssessmentRunView runAssessment(RunAssessmentRequest req) {
        try {
            List<Indicator> indicators = ViewConverter.toIndicators(req.getIndicators());
            if (!req.isAsync()) {
                return ViewConverter.toView(processingService.runAssessment(
                        req.getSessionId(), req.getAudioArtifactRef(), indicators));
            }
            processingService.submitAssessment(req.getSessionId(), req.getAudioArtifactRef(), indicators)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            logger.warn("Async assessment failed: sessionId={}", req.getSessionId(), ex);
                        }
                    });
            AssessmentRunView accepted = new AssessmentRunView();
            accepted.setSessionId(req.getSessionId());
            accepted.setStatus(ProcessingStatus.PROCESSING.name());
            accepted.setOutcomes(Collections.emptyList());
            return accepted;
        } catch (InterviewException e) {
            throw ViewConverter.toApi(e);
        }
    }

    @Override
    public AssessmentView reassessIndicator(ReassessRequest req) {
        try {
            return ViewConverter.toView(processingService.reassessIndicator(
                    req.getSessionId(), ViewConverter.toIndicator(req.getIndicator())));
        } catch (InterviewException e) {
            throw ViewConverter.toApi(e);
        }
    }

    @Override
    public AssessmentView submitManualScore(ManualScoreRequest req) {
        try {
            return ViewConverter.toView(processingService.submitManualScore(
                    req.getSessionId(), req.getIndicatorId(), req.getManualScore(), req.getNotes()));
        } catch (InterviewException e) {
            throw ViewConverter.toApi(e);
        }
    }

    @Override
    public AssessmentSummaryView getSummary(SummaryRequest req) {
        try {
            return ViewConverter.toView(processingService.summarize(
                    req.getSessionId(), ViewConverter.toIndicators(req.getIndicators())));
        } catch (InterviewException e) {
            throw ViewConverter.toApi(e);
        }
    }
}
