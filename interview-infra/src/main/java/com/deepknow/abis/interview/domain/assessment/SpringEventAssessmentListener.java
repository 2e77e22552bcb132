package com.deepknow.abis.interview.domain.assessment;

import com.deepknow.abis.interview.domain.assessment.model.Assessment;
import com.deepknow.abis.interview.domain.assessment.service.AssessmentListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 把 assessmentReady 转成 Spring 应用事件，并记录日志。
 */
@Component
public class SpringEventAssessmentListener implements AssessmentListener {
    private static final Logger logger = LoggerFactory.getLogger(SpringEventAssessmentListener.class);

    private final ApplicationEventPublisher publisher;

    public SpringEventAssessmentListener(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void onAssessmentReady(String sessionId, Long indicatorId, Assessment assessment) {
        publisher.publishEvent(new AssessmentReadyEvent(this, sessionId, indicatorId, assessment));
    }

    @EventListener
    public void log(AssessmentReadyEvent event) {
        Assessment a = event.getAssessment();
        logger.info("Assessment ready: sessionId={}, indicatorId={}, aiScore={}",
                event.getSessionId(), event.getIndicatorId(), a == null ? null : a.getAiScore());
    }
}
