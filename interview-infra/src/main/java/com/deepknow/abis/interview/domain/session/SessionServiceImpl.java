package com.deepknow.abis.interview.domain.session;

import com.deepknow.abis.interview.domain.error.SessionNotFoundException;
import com.deepknow.abis.interview.domain.error.SessionStateException;
import com.deepknow.abis.interview.domain.session.model.InterviewSession;
import com.deepknow.abis.interview.domain.session.model.ProcessingStatus;
import com.deepknow.abis.interview.domain.session.model.SessionState;
import com.deepknow.abis.interview.domain.session.service.SessionService;
import com.deepknow.abis.interview.domain.session.service.SessionStreamService;
import com.deepknow.abis.interview.repo.mapper.InterviewSessionMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Map;

@Service
public class SessionServiceImpl implements SessionService {
    private static final Logger logger = LoggerFactory.getLogger(SessionServiceImpl.class);

    private final InterviewSessionMapper sessionMapper;
    private final SessionStreamService streamService;
    private final ObjectMapper objectMapper;

    public SessionServiceImpl(InterviewSessionMapper sessionMapper, SessionStreamService streamService, ObjectMapper objectMapper) {
        this.sessionMapper = sessionMapper;
        this.streamService = streamService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void createSession(String sessionId, String userId, Map<String, Object> config) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new SessionStateException("sessionId is required");
        }
        if (sessionMapper.findById(sessionId) != null) {
            throw new SessionStateException("Session already exists: " + sessionId);
        }
        InterviewSession s = new InterviewSession();
        s.setId(sessionId);
        s.setUserId(userId);
        s.setStatus(SessionState.IDLE.name());
        s.setStartTime(LocalDateTime.now());
        s.setEndTime(null);
        s.setProcessingStatus(ProcessingStatus.RECORDING.name());
        try {
            s.setConfigJson(config == null ? "{}" : objectMapper.writeValueAsString(config));
        } catch (Exception e) {
            logger.warn("Serialize session config failed, use empty: sessionId={}", sessionId, e);
            s.setConfigJson("{}");
        }
        sessionMapper.insert(s);
        logger.info("Session created: sessionId={}, userId={}", sessionId, userId);
    }

    @Override
    public String endSession(String sessionId) {
        if (streamService.stateOf(sessionId).acceptsFrames()) {
            return streamService.close(sessionId).getAudioArtifactRef();
        }
        InterviewSession s = getSession(sessionId);
        if (!SessionState.CLOSED.name().equals(s.getStatus())) {
            sessionMapper.updateStatus(sessionId, SessionState.CLOSED.name(), LocalDateTime.now());
        }
        return s.getAudioArtifactRef();
    }

    @Override
    public InterviewSession getSession(String sessionId) {
        InterviewSession s = sessionMapper.findById(sessionId);
        if (s == null) {
            throw new SessionNotFoundException("Session not found: " + sessionId);
        }
        return s;
    }
}
