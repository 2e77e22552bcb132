package com.deepknow.abis.interview.domain.session;

import com.deepknow.abis.interview.config.LiveSessionProperties;
import com.deepknow.abis.interview.domain.emotion.DetectorFactory;
import com.deepknow.abis.interview.domain.emotion.EmotionLogRepository;
import com.deepknow.abis.interview.domain.emotion.EmotionSnapshot;
import com.deepknow.abis.interview.domain.emotion.FacialEmotionDetector;
import com.deepknow.abis.interview.domain.emotion.Modality;
import com.deepknow.abis.interview.domain.emotion.VoiceEmotionDetector;
import com.deepknow.abis.interview.domain.error.AlreadyOpenException;
import com.deepknow.abis.interview.domain.error.SessionNotFoundException;
import com.deepknow.abis.interview.domain.error.SessionStateException;
import com.deepknow.abis.interview.domain.session.model.FinalizedSession;
import com.deepknow.abis.interview.domain.session.model.InterviewSession;
import com.deepknow.abis.interview.domain.session.model.SessionCallbacks;
import com.deepknow.abis.interview.domain.session.model.SessionState;
import com.deepknow.abis.interview.domain.session.service.SessionStreamService;
import com.deepknow.abis.interview.domain.session.util.WavAudioRecorder;
import com.deepknow.abis.interview.repo.mapper.InterviewSessionMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class SessionStreamServiceImpl implements SessionStreamService {
    private static final Logger logger = LoggerFactory.getLogger(SessionStreamServiceImpl.class);

    private final ConcurrentHashMap<String, LiveSessionController> activeSessions = new ConcurrentHashMap<>();
    private final Map<String, FinalizedSession> finalizedSessions;

    private final LiveSessionProperties props;
    private final FacialEmotionDetector facialDetector;
    private final VoiceEmotionDetector voiceDetector;
    private final EmotionLogRepository emotionLogRepository;
    private final InterviewSessionMapper sessionMapper;
    private final ThreadPoolExecutor detectorExecutor;
    // 每个会话独占一条出站投递线程，慢消费方只阻塞自己
    private final ConcurrentHashMap<String, ExecutorService> eventLanes = new ConcurrentHashMap<>();

    @Autowired
    public SessionStreamServiceImpl(LiveSessionProperties props,
                                    DetectorFactory detectorFactory,
                                    EmotionLogRepository emotionLogRepository,
                                    InterviewSessionMapper sessionMapper) {
        this(props, detectorFactory.createFacial(), detectorFactory.createVoice(), emotionLogRepository, sessionMapper);
    }

    SessionStreamServiceImpl(LiveSessionProperties props,
                             FacialEmotionDetector facialDetector,
                             VoiceEmotionDetector voiceDetector,
                             EmotionLogRepository emotionLogRepository,
                             InterviewSessionMapper sessionMapper) {
        this.props = props;
        this.facialDetector = facialDetector;
        this.voiceDetector = voiceDetector;
        this.emotionLogRepository = emotionLogRepository;
        this.sessionMapper = sessionMapper;
        int cacheSize = Math.max(16, props.getFinalizedCacheSize());
        this.finalizedSessions = Collections.synchronizedMap(new LinkedHashMap<String, FinalizedSession>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, FinalizedSession> eldest) {
                return size() > cacheSize;
            }
        });
        int pool = Math.max(2, props.getDetectorPoolSize());
        this.detectorExecutor = new ThreadPoolExecutor(
                pool,
                pool,
                1,
                TimeUnit.MINUTES,
                new LinkedBlockingQueue<>(Math.max(1, props.getDetectorQueueCapacity())),
                namedThreads("emotion-detector-"),
                (r, e) -> {
                    logger.warn("Detector executor overloaded, frame dropped");
                    throw new RejectedExecutionException("detector executor overloaded");
                }
        );
    }

    private ExecutorService newEventLane(String sessionId) {
        // 发布端已合并为最新快照，队列中至多一个投递任务
        return new ThreadPoolExecutor(
                1,
                1,
                0,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(4),
                namedThreads("emotion-event-" + sessionId + "-"),
                (r, e) -> {
                    logger.warn("Emotion event lane overloaded, update dropped: sessionId={}", sessionId);
                    throw new RejectedExecutionException("event lane overloaded: " + sessionId);
                }
        );
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void open(String sessionId, SessionCallbacks callbacks) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new SessionStateException("sessionId is required");
        }
        if (finalizedSessions.containsKey(sessionId)) {
            throw new SessionStateException("Session already closed: " + sessionId);
        }
        InterviewSession record = sessionMapper.findById(sessionId);
        if (record == null) {
            throw new SessionNotFoundException("Session not found: " + sessionId);
        }
        if (SessionState.CLOSED.name().equals(record.getStatus())) {
            throw new SessionStateException("Session already closed: " + sessionId);
        }
        boolean[] created = {false};
        LiveSessionController controller = activeSessions.computeIfAbsent(sessionId, id -> {
            created[0] = true;
            return newController(id, callbacks);
        });
        if (!created[0]) {
            throw new AlreadyOpenException("Session already open: " + sessionId);
        }
        controller.open();
        try {
            sessionMapper.updateStatus(sessionId, SessionState.OPEN.name(), null);
        } catch (Exception e) {
            logger.warn("Update session status failed: sessionId={}", sessionId, e);
        }
        logger.info("Open session: sessionId={}, activeSessions={}", sessionId, activeSessions.size());
    }

    private LiveSessionController newController(String sessionId, SessionCallbacks callbacks) {
        WavAudioRecorder recorder = null;
        try {
            recorder = WavAudioRecorder.start(props.getRecordingsDir(), sessionId, props.getAudioSampleRate());
        } catch (Exception e) {
            logger.error("Start audio recording failed, session continues without artifact: sessionId={}", sessionId, e);
        }
        ExecutorService eventLane = newEventLane(sessionId);
        eventLanes.put(sessionId, eventLane);
        return new LiveSessionController(sessionId, props, facialDetector, voiceDetector,
                detectorExecutor, eventLane, emotionLogRepository, callbacks, recorder);
    }

    @Override
    public boolean ingestFrame(String sessionId, Modality modality, byte[] payload, double clientTimestamp) {
        LiveSessionController controller = activeSessions.get(sessionId);
        if (controller == null) {
            if (finalizedSessions.containsKey(sessionId)) {
                logger.trace("Drop frame for closed session: sessionId={}", sessionId);
                return false;
            }
            throw new SessionNotFoundException("Session not open: " + sessionId);
        }
        return controller.ingest(modality, payload, clientTimestamp);
    }

    @Override
    public EmotionSnapshot requestSnapshot(String sessionId) {
        LiveSessionController controller = activeSessions.get(sessionId);
        if (controller != null) {
            return controller.snapshot();
        }
        if (finalizedSessions.containsKey(sessionId)) {
            throw new SessionStateException("Snapshot unavailable for closed session: " + sessionId);
        }
        throw new SessionNotFoundException("Session not open: " + sessionId);
    }

    @Override
    public FinalizedSession close(String sessionId) {
        LiveSessionController controller = activeSessions.get(sessionId);
        if (controller == null) {
            FinalizedSession done = finalizedSessions.get(sessionId);
            if (done != null) return done;
            done = restoreClosed(sessionId);
            if (done != null) return done;
            throw new SessionNotFoundException("Session not open: " + sessionId);
        }
        return retire(controller, controller.close());
    }

    @Override
    public FinalizedSession disconnect(String sessionId) {
        LiveSessionController controller = activeSessions.get(sessionId);
        if (controller == null) {
            FinalizedSession done = finalizedSessions.get(sessionId);
            return done != null ? done : restoreClosed(sessionId);
        }
        return retire(controller, controller.disconnect());
    }

    /**
     * 结果缓存已淘汰时按库中记录重建关闭结果；记录不存在或未关闭返回 null。
     * 计数不落库，重建结果中为 0。
     */
    private FinalizedSession restoreClosed(String sessionId) {
        InterviewSession record = sessionMapper.findById(sessionId);
        if (record == null || !SessionState.CLOSED.name().equals(record.getStatus())) {
            return null;
        }
        FinalizedSession restored = new FinalizedSession(sessionId, record.getAudioArtifactRef(), 0, 0,
                record.getStartTime(), record.getEndTime(), false);
        finalizedSessions.put(sessionId, restored);
        logger.debug("Restored closed session from record: sessionId={}", sessionId);
        return restored;
    }

    private FinalizedSession retire(LiveSessionController controller, FinalizedSession result) {
        String sessionId = controller.getSessionId();
        finalizedSessions.put(sessionId, result);
        if (activeSessions.remove(sessionId, controller)) {
            ExecutorService eventLane = eventLanes.remove(sessionId);
            if (eventLane != null) {
                eventLane.shutdown();
            }
            try {
                sessionMapper.updateStatus(sessionId, SessionState.CLOSED.name(), result.getEndedAt());
                if (result.getAudioArtifactRef() != null) {
                    sessionMapper.updateAudioArtifact(sessionId, result.getAudioArtifactRef());
                }
            } catch (Exception e) {
                logger.warn("Update closed session record failed: sessionId={}", sessionId, e);
            }
        }
        return result;
    }

    @Override
    public SessionState stateOf(String sessionId) {
        LiveSessionController controller = activeSessions.get(sessionId);
        if (controller != null) return controller.getState();
        if (finalizedSessions.containsKey(sessionId)) return SessionState.CLOSED;
        InterviewSession record = sessionMapper.findById(sessionId);
        if (record != null && SessionState.CLOSED.name().equals(record.getStatus())) return SessionState.CLOSED;
        return SessionState.IDLE;
    }

    @PreDestroy
    public void shutdown() {
        List<LiveSessionController> remaining = new ArrayList<>(activeSessions.values());
        if (!remaining.isEmpty()) {
            logger.info("Shutting down with {} live sessions, closing them", remaining.size());
        }
        for (LiveSessionController c : remaining) {
            try {
                retire(c, c.close());
            } catch (RuntimeException e) {
                logger.warn("Close on shutdown failed: sessionId={}", c.getSessionId(), e);
            }
        }
        detectorExecutor.shutdownNow();
        for (ExecutorService lane : eventLanes.values()) {
            lane.shutdownNow();
        }
        eventLanes.clear();
    }
}
