package com.deepknow.abis.interview.service;

import com.deepknow.abis.interview.api.LiveSessionService;
import com.deepknow.abis.interview.api.model.EmotionSnapshotView;
import com.deepknow.abis.interview.api.model.SessionClosedView;
import com.deepknow.abis.interview.domain.error.InterviewException;
import com.deepknow.abis.interview.domain.session.service.SessionStreamService;
import org.apache.dubbo.config.annotation.DubboService;
import org.springframework.stereotype.Service;

@DubboService
@Service
public class LiveSessionServiceImpl implements LiveSessionService {
    private final SessionStreamService sessionStreamService;

    public LiveSessionServiceImpl(SessionStreamService sessionStreamService) {
        this.sessionStreamService = sessionStreamService;
    }

    @Override
    public EmotionSnapshotView getSnapshot(String sessionId) {
        try {
            return ViewConverter.toView(sessionStreamService.requestSnapshot(sessionId));
        } catch (InterviewException e) {
            throw ViewConverter.toApi(e);
        }
    }

    @Override
    public SessionClosedView closeSession(String sessionId) {
        try {
            return ViewConverter.toView(sessionStreamService.close(sessionId));
        } catch (InterviewException e) {
            throw ViewConverter.toApi(e);
        }
    }

    @Override
    public String getState(String sessionId) {
        return sessionStreamService.stateOf(sessionId).name();
    }
}
