package com.deepknow.abis.interview.service;

import com.deepknow.abis.interview.api.SessionCreateService;
import com.deepknow.abis.interview.api.request.CreateSessionRequest;
import com.deepknow.abis.interview.api.request.EndSessionRequest;
import com.deepknow.abis.interview.domain.error.InterviewException;
import com.deepknow.abis.interview.domain.session.service.SessionService;
import org.apache.dubbo.config.annotation.DubboService;
import org.springframework.stereotype.Service;

@DubboService
@Service
public class SessionCreateServiceImpl implements SessionCreateService {
    private final SessionService sessionService;

    public SessionCreateServiceImpl(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Override
    public void createSession(CreateSessionRequest req) {
        try {
            sessionService.createSession(req.getSessionId(), req.getUserId(), req.getConfig());
        } catch (InterviewException e) {
            throw ViewConverter.toApi(e);
        }
    }

    @Override
    public String endSession(EndSessionRequest req) {
        try {
            return sessionService.endSession(req.getSessionId());
        } catch (InterviewException e) {
            throw ViewConverter.toApi(e);
        }
    }
}
