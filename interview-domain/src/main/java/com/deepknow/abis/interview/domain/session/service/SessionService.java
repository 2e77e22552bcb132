package com.deepknow.abis.interview.domain.session.service;

import com.deepknow.abis.interview.domain.session.model.InterviewSession;

import java.util.Map;

public interface SessionService {
    void createSession(String sessionId, String userId, Map<String, Object> config);

    /**
     * 结束会话：若仍在直播则关闭并返回音频产物引用，否则返回已记录的引用。
     */
    String endSession(String sessionId);

    InterviewSession getSession(String sessionId);
}
