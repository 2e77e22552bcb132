package com.deepknow.abis.interview.domain.session;

import com.deepknow.abis.interview.config.LiveSessionProperties;
import com.deepknow.abis.interview.domain.emotion.EmotionAggregator;
import com.deepknow.abis.interview.domain.emotion.EmotionDetection;
import com.deepknow.abis.interview.domain.emotion.EmotionLogRepository;
import com.deepknow.abis.interview.domain.emotion.EmotionSample;
import com.deepknow.abis.interview.domain.emotion.EmotionSnapshot;
import com.deepknow.abis.interview.domain.emotion.FacialEmotionDetector;
import com.deepknow.abis.interview.domain.emotion.Modality;
import com.deepknow.abis.interview.domain.emotion.VoiceEmotionDetector;
import com.deepknow.abis.interview.domain.error.DetectorUnavailableException;
import com.deepknow.abis.interview.domain.error.SessionStateException;
import com.deepknow.abis.interview.domain.session.model.FinalizedSession;
import com.deepknow.abis.interview.domain.session.model.SessionCallbacks;
import com.deepknow.abis.interview.domain.session.model.SessionState;
import com.deepknow.abis.interview.domain.session.util.AudioWindowBuffer;
import com.deepknow.abis.interview.domain.session.util.WavAudioRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 单个直播会话的控制器：状态机 OPEN → CLOSING → CLOSED（异常断开时 OPEN → CLOSED）。
 * <p>
 * 每个通道同一时刻至多一个在途检测，忙时新帧直接丢弃；面部与语音两个通道相互独立并发。
 * 关闭时按通道有界等待在途检测，超时即取消并丢弃其结果，随后封存聚合器、持久化日志、落盘音频。
 */
public class LiveSessionController {
    private static final Logger logger = LoggerFactory.getLogger(LiveSessionController.class);

    private final String sessionId;
    private final LiveSessionProperties props;
    private final FacialEmotionDetector facialDetector;
    private final VoiceEmotionDetector voiceDetector;
    private final ExecutorService detectorExecutor;
    private final EmotionLogRepository emotionLogRepository;
    private final SessionCallbacks callbacks;
    private final WavAudioRecorder recorder;

    private final EmotionAggregator aggregator;
    private final SnapshotPublisher publisher;
    private final AudioWindowBuffer voiceWindow;
    private final Map<Modality, Lane> lanes = new EnumMap<>(Modality.class);
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.IDLE);
    private final AtomicLong facialFrames = new AtomicLong();
    private final AtomicLong droppedFrames = new AtomicLong();
    private final Object recorderLock = new Object();
    private final long openedNanos = System.nanoTime();
    private final LocalDateTime startedAt = LocalDateTime.now();

    private volatile FinalizedSession finalized;

    public LiveSessionController(String sessionId,
                                 LiveSessionProperties props,
                                 FacialEmotionDetector facialDetector,
                                 VoiceEmotionDetector voiceDetector,
                                 ExecutorService detectorExecutor,
                                 Executor eventExecutor,
                                 EmotionLogRepository emotionLogRepository,
                                 SessionCallbacks callbacks,
                                 WavAudioRecorder recorder) {
        this.sessionId = sessionId;
        this.props = props;
        this.facialDetector = facialDetector;
        this.voiceDetector = voiceDetector;
        this.detectorExecutor = detectorExecutor;
        this.emotionLogRepository = emotionLogRepository;
        this.callbacks = callbacks == null ? SessionCallbacks.none() : callbacks;
        this.recorder = recorder;
        this.aggregator = new EmotionAggregator(sessionId, props.getStabilityWindowSeconds(),
                props.getMaxWindowSamples(), props.getEmptyWindowPolicy());
        this.publisher = new SnapshotPublisher(sessionId, eventExecutor, this.callbacks.getOnEmotionUpdate());
        this.voiceWindow = new AudioWindowBuffer(props.getVoiceWindowBytes());
        for (Modality m : Modality.values()) {
            lanes.put(m, new Lane(m));
        }
    }

    public void open() {
        if (!state.compareAndSet(SessionState.IDLE, SessionState.OPEN)) {
            throw new SessionStateException("Session cannot be opened from state " + state.get() + ": " + sessionId);
        }
        logger.info("Live session opened: sessionId={}, recording={}", sessionId, recorder != null);
    }

    /**
     * 非阻塞接入一帧。仅 OPEN 时接受；其他状态静默丢弃。
     */
    public boolean ingest(Modality modality, byte[] payload, double clientTimestamp) {
        if (!state.get().acceptsFrames()) {
            logger.trace("Drop frame in state {}: sessionId={}, modality={}", state.get(), sessionId, modality);
            return false;
        }
        double ts = clientTimestamp > 0 ? clientTimestamp : elapsedSeconds();
        if (modality == Modality.VOICE) {
            record(payload);
            byte[] window = voiceWindow.append(payload);
            if (window != null) {
                dispatch(Modality.VOICE, () -> voiceDetector.detect(window, props.getAudioSampleRate()), ts);
            }
        } else {
            long n = facialFrames.incrementAndGet();
            int interval = Math.max(1, props.getFacialFrameInterval());
            if (n % interval == 0) {
                dispatch(Modality.FACIAL, () -> facialDetector.detect(payload), ts);
            }
        }
        return true;
    }

    public EmotionSnapshot snapshot() {
        SessionState s = state.get();
        if (!s.servesSnapshots()) {
            throw new SessionStateException("Snapshot unavailable in state " + s + ": " + sessionId);
        }
        return aggregator.snapshot();
    }

    /**
     * 正常关闭。幂等：重复调用返回同一结果，不会重复排空。
     */
    public synchronized FinalizedSession close() {
        if (finalized != null) return finalized;
        if (!state.compareAndSet(SessionState.OPEN, SessionState.CLOSING)) {
            throw new SessionStateException("Session cannot be closed from state " + state.get() + ": " + sessionId);
        }
        logger.info("Closing session: sessionId={}", sessionId);
        for (Lane lane : lanes.values()) {
            lane.drain(props.getDrainTimeoutMs());
        }
        return finish(false);
    }

    /**
     * 通道异常断开：直接进入 CLOSED，取消所有在途检测，不做等待。
     */
    public synchronized FinalizedSession disconnect() {
        if (finalized != null) return finalized;
        SessionState prev = state.getAndSet(SessionState.CLOSED);
        logger.warn("Session disconnected abruptly: sessionId={}, previousState={}", sessionId, prev);
        for (Lane lane : lanes.values()) {
            lane.cancel();
        }
        return finish(true);
    }

    private FinalizedSession finish(boolean abrupt) {
        List<EmotionSample> log = aggregator.seal();
        int persisted = persist(log);
        String audioRef = finishRecording();
        state.set(SessionState.CLOSED);
        finalized = new FinalizedSession(sessionId, audioRef, log.size(), persisted, startedAt, LocalDateTime.now(), abrupt);
        logger.info("Session closed: sessionId={}, samples={}, persisted={}, droppedFrames={}, audio={}, abrupt={}",
                sessionId, log.size(), persisted, droppedFrames.get(), audioRef, abrupt);
        notify(callbacks.getOnClosed(), finalized);
        return finalized;
    }

    private int persist(List<EmotionSample> log) {
        double min = props.getMinPersistConfidence();
        List<EmotionSample> kept = min > 0
                ? log.stream().filter(s -> s.getConfidence() >= min).collect(Collectors.toList())
                : log;
        if (kept.isEmpty()) return 0;
        try {
            return emotionLogRepository.persist(sessionId, kept);
        } catch (RuntimeException e) {
            logger.error("Persist emotion log failed: sessionId={}, samples={}", sessionId, kept.size(), e);
            return 0;
        }
    }

    private void record(byte[] pcm) {
        if (recorder == null) return;
        synchronized (recorderLock) {
            try {
                recorder.write(pcm);
            } catch (IOException e) {
                logger.warn("Write audio chunk failed: sessionId={}", sessionId, e);
                notify(callbacks.getOnError(), e);
            }
        }
    }

    private String finishRecording() {
        if (recorder == null) return null;
        synchronized (recorderLock) {
            try {
                return recorder.finish();
            } catch (IOException e) {
                logger.error("Finalize audio recording failed: sessionId={}", sessionId, e);
                return null;
            }
        }
    }

    private void dispatch(Modality modality, Supplier<Optional<EmotionDetection>> call, double ts) {
        Lane lane = lanes.get(modality);
        synchronized (lane) {
            if (!lane.busy.compareAndSet(false, true)) {
                droppedFrames.incrementAndGet();
                logger.debug("Detector busy, drop frame: sessionId={}, modality={}", sessionId, modality);
                return;
            }
            InFlight task = new InFlight();
            try {
                task.future = detectorExecutor.submit(() -> runDetection(lane, task, call, ts));
                lane.current = task;
            } catch (RejectedExecutionException e) {
                lane.busy.set(false);
                droppedFrames.incrementAndGet();
                logger.warn("Detector executor saturated, drop frame: sessionId={}, modality={}", sessionId, modality);
            }
        }
    }

    private void runDetection(Lane lane, InFlight task, Supplier<Optional<EmotionDetection>> call, double ts) {
        try {
            if (task.isDiscarded() || state.get() == SessionState.CLOSED) return;
            Optional<EmotionDetection> detection = call.get();
            if (detection.isEmpty()) return;
            boolean recorded;
            // 与取消互斥：被取消的检测结果整体丢弃
            synchronized (task) {
                if (task.discarded) return;
                recorded = aggregator.record(lane.modality, detection.get(), ts).isPresent();
            }
            if (recorded) {
                publisher.publish(aggregator.snapshot());
            }
        } catch (DetectorUnavailableException e) {
            logger.warn("Detector unavailable, drop frame: sessionId={}, modality={}, reason={}",
                    sessionId, lane.modality, e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Detection failed, drop frame: sessionId={}, modality={}", sessionId, lane.modality, e);
        } finally {
            lane.busy.set(false);
        }
    }

    private double elapsedSeconds() {
        return (System.nanoTime() - openedNanos) / 1_000_000_000.0;
    }

    private <T> void notify(Consumer<T> consumer, T value) {
        if (consumer == null) return;
        try {
            consumer.accept(value);
        } catch (RuntimeException e) {
            logger.warn("Session callback failed: sessionId={}", sessionId, e);
        }
    }

    public String getSessionId() { return sessionId; }
    public SessionState getState() { return state.get(); }
    public long getDroppedFrames() { return droppedFrames.get(); }
    EmotionAggregator aggregator() { return aggregator; }

    private static final class InFlight {
        private volatile Future<?> future;
        private boolean discarded;

        synchronized boolean isDiscarded() { return discarded; }

        synchronized void discard() { discarded = true; }
    }

    private final class Lane {
        private final Modality modality;
        private final AtomicBoolean busy = new AtomicBoolean(false);
        private volatile InFlight current;

        Lane(Modality modality) {
            this.modality = modality;
        }

        void drain(long timeoutMs) {
            InFlight task = current;
            if (task == null || task.future == null || task.future.isDone()) return;
            try {
                task.future.get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                logger.warn("Detector call exceeded drain timeout, discard: sessionId={}, modality={}, timeoutMs={}",
                        sessionId, modality, timeoutMs);
                cancel();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancel();
            } catch (ExecutionException | CancellationException e) {
                logger.debug("In-flight detection ended abnormally: sessionId={}, modality={}", sessionId, modality);
            }
        }

        void cancel() {
            InFlight task = current;
            if (task == null) return;
            task.discard();
            Future<?> f = task.future;
            if (f != null && !f.isDone()) {
                f.cancel(true);
            }
        }
    }
}
