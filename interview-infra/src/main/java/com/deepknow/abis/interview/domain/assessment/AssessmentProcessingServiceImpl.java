package com.deepknow.abis.interview.domain.assessment;

import com.deepknow.abis.interview.config.AssessmentProperties;
import com.deepknow.abis.interview.domain.assessment.model.Assessment;
import com.deepknow.abis.interview.domain.assessment.model.AssessmentRunResult;
import com.deepknow.abis.interview.domain.assessment.model.AssessmentRunResult.IndicatorOutcome;
import com.deepknow.abis.interview.domain.assessment.model.AssessmentSummary;
import com.deepknow.abis.interview.domain.assessment.model.ExtractionResult;
import com.deepknow.abis.interview.domain.assessment.model.Indicator;
import com.deepknow.abis.interview.domain.assessment.model.IndicatorScore;
import com.deepknow.abis.interview.domain.assessment.model.Transcript;
import com.deepknow.abis.interview.domain.assessment.service.AssessmentListener;
import com.deepknow.abis.interview.domain.assessment.service.AssessmentProcessingService;
import com.deepknow.abis.interview.domain.assessment.service.AssessmentRepository;
import com.deepknow.abis.interview.domain.assessment.service.SemanticEvidenceExtractor;
import com.deepknow.abis.interview.domain.assessment.service.SimilarityScorer;
import com.deepknow.abis.interview.domain.assessment.service.TranscriptRepository;
import com.deepknow.abis.interview.domain.assessment.service.TranscriptionClient;
import com.deepknow.abis.interview.domain.error.AssessmentInProgressException;
import com.deepknow.abis.interview.domain.error.ConfigurationException;
import com.deepknow.abis.interview.domain.error.InvalidArgumentException;
import com.deepknow.abis.interview.domain.error.SessionNotFoundException;
import com.deepknow.abis.interview.domain.error.SessionStateException;
import com.deepknow.abis.interview.domain.scoring.Recommendation;
import com.deepknow.abis.interview.domain.scoring.ScoreCombiner;
import com.deepknow.abis.interview.domain.scoring.ScoringWeights;
import com.deepknow.abis.interview.domain.scoring.ScoringWeightsStore;
import com.deepknow.abis.interview.domain.session.model.InterviewSession;
import com.deepknow.abis.interview.domain.session.model.ProcessingStatus;
import com.deepknow.abis.interview.domain.session.model.SessionState;
import com.deepknow.abis.interview.repo.mapper.InterviewSessionMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 会后批量评估流水线：转写 → 保存转写 → 逐指标抽取证据 → 只覆盖 AI 字段。
 * <p>
 * 同一 (session, indicator) 同时至多一个抽取在执行，第二个请求被拒绝；
 * 转写失败时整个运行以 FAILED 结束，已有评估原样保留。
 */
@Service
public class AssessmentProcessingServiceImpl implements AssessmentProcessingService {
    private static final Logger logger = LoggerFactory.getLogger(AssessmentProcessingServiceImpl.class);

    private final TranscriptionClient transcriptionClient;
    private final SemanticEvidenceExtractor extractor;
    private final AssessmentRepository assessmentRepository;
    private final TranscriptRepository transcriptRepository;
    private final InterviewSessionMapper sessionMapper;
    private final ScoringWeightsStore weightsStore;
    private final AssessmentListener listener;
    private final AssessmentProperties props;
    private final ExecutorService workerExecutor;

    private final Set<String> runningSessions = ConcurrentHashMap.newKeySet();
    private final Set<String> busyPairs = ConcurrentHashMap.newKeySet();

    @Autowired
    public AssessmentProcessingServiceImpl(AssessmentClientFactory clientFactory,
                                           AssessmentProperties props,
                                           AssessmentRepository assessmentRepository,
                                           TranscriptRepository transcriptRepository,
                                           InterviewSessionMapper sessionMapper,
                                           ScoringWeightsStore weightsStore,
                                           AssessmentListener listener) {
        this(clientFactory.createTranscription(), clientFactory.createSimilarity(), props,
                assessmentRepository, transcriptRepository, sessionMapper, weightsStore, listener);
    }

    AssessmentProcessingServiceImpl(TranscriptionClient transcriptionClient,
                                    SimilarityScorer similarityScorer,
                                    AssessmentProperties props,
                                    AssessmentRepository assessmentRepository,
                                    TranscriptRepository transcriptRepository,
                                    InterviewSessionMapper sessionMapper,
                                    ScoringWeightsStore weightsStore,
                                    AssessmentListener listener) {
        this.transcriptionClient = transcriptionClient;
        this.extractor = new SemanticEvidenceExtractor(similarityScorer, props.toExtractorSettings());
        this.props = props;
        this.assessmentRepository = assessmentRepository;
        this.transcriptRepository = transcriptRepository;
        this.sessionMapper = sessionMapper;
        this.weightsStore = weightsStore;
        this.listener = listener;
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "assessment-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        int pool = Math.max(1, props.getWorkerPoolSize());
        this.workerExecutor = new ThreadPoolExecutor(
                pool,
                pool,
                1,
                TimeUnit.MINUTES,
                new LinkedBlockingQueue<>(100),
                threadFactory,
                (r, e) -> {
                    logger.warn("Assessment executor overloaded, run rejected");
                    throw new RejectedExecutionException("assessment executor overloaded");
                }
        );
    }

    @Override
    public AssessmentRunResult runAssessment(String sessionId, String audioArtifactRef, List<Indicator> indicators) {
        validateIndicators(indicators);
        InterviewSession record = requireSession(sessionId);
        if (SessionState.OPEN.name().equals(record.getStatus()) || SessionState.CLOSING.name().equals(record.getStatus())) {
            throw new SessionStateException("Session is still live: " + sessionId);
        }
        if (!runningSessions.add(sessionId)) {
            throw new AssessmentInProgressException("Assessment already running: sessionId=" + sessionId);
        }
        try {
            return doRun(record, audioArtifactRef != null ? audioArtifactRef : record.getAudioArtifactRef(), indicators);
        } finally {
            runningSessions.remove(sessionId);
        }
    }

    private AssessmentRunResult doRun(InterviewSession record, String audioRef, List<Indicator> indicators) {
        String sessionId = record.getId();
        long started = System.currentTimeMillis();
        logger.info("Assessment run start: sessionId={}, indicators={}, audio={}", sessionId, indicators.size(), audioRef);
        updateStatus(sessionId, ProcessingStatus.PROCESSING, null);

        Transcript transcript;
        try {
            transcript = transcriptionClient.transcribe(audioRef);
            transcriptRepository.replace(sessionId, transcript);
        } catch (RuntimeException e) {
            // 不能从残缺证据里给出分数：整体失败，已有评估保持不变
            logger.error("Assessment run failed at transcription: sessionId={}, reason={}", sessionId, e.getMessage(), e);
            updateStatus(sessionId, ProcessingStatus.FAILED, e.getMessage());
            return AssessmentRunResult.failed(sessionId, e.getMessage());
        }

        List<String> spans = extractor.candidateSpans(transcript);
        List<IndicatorOutcome> outcomes = new ArrayList<>(indicators.size());
        Map<Long, Double> aiScores = new HashMap<>();
        for (Indicator indicator : indicators) {
            String pair = pairKey(sessionId, indicator.getId());
            if (!busyPairs.add(pair)) {
                logger.warn("Skip indicator, re-assessment in progress: sessionId={}, indicatorId={}", sessionId, indicator.getId());
                outcomes.add(IndicatorOutcome.notAssessed(indicator.getId(), "assessment in progress"));
                continue;
            }
            try {
                Assessment saved = extractAndSave(sessionId, indicator, spans);
                aiScores.put(indicator.getId(), saved.getAiScore());
                outcomes.add(IndicatorOutcome.assessed(indicator.getId(), saved.getAiScore()));
            } catch (RuntimeException e) {
                logger.warn("Indicator not assessed: sessionId={}, indicatorId={}, reason={}",
                        sessionId, indicator.getId(), e.getMessage());
                outcomes.add(IndicatorOutcome.notAssessed(indicator.getId(), e.getMessage()));
            } finally {
                busyPairs.remove(pair);
            }
        }

        OptionalDouble overall = ScoreCombiner.overall(aiScores, indicators);
        updateStatus(sessionId, ProcessingStatus.COMPLETED, null);
        if (props.isDeleteAudioAfterSuccess()) {
            deleteAudio(sessionId, audioRef);
        }
        logger.info("Assessment run completed: sessionId={}, assessed={}/{}, overallAi={}, segments={}, costMs={}",
                sessionId, aiScores.size(), indicators.size(), overall.isPresent() ? overall.getAsDouble() : null,
                transcript.getSegments().size(), System.currentTimeMillis() - started);
        return new AssessmentRunResult(sessionId, ProcessingStatus.COMPLETED, outcomes,
                overall.isPresent() ? overall.getAsDouble() : null, transcript.getSegments().size(), null);
    }

    @Override
    public CompletableFuture<AssessmentRunResult> submitAssessment(String sessionId, String audioArtifactRef, List<Indicator> indicators) {
        validateIndicators(indicators);
        if (runningSessions.contains(sessionId)) {
            throw new AssessmentInProgressException("Assessment already running: sessionId=" + sessionId);
        }
        logger.info("Assessment submitted: sessionId={}", sessionId);
        return CompletableFuture.supplyAsync(() -> runAssessment(sessionId, audioArtifactRef, indicators), workerExecutor);
    }

    @Override
    public Assessment reassessIndicator(String sessionId, Indicator indicator) {
        if (indicator == null) {
            throw new InvalidArgumentException("indicator is required");
        }
        requireSession(sessionId);
        Transcript transcript = transcriptRepository.find(sessionId);
        if (transcript == null) {
            throw new SessionStateException("No transcript for session, run a full assessment first: " + sessionId);
        }
        String pair = pairKey(sessionId, indicator.getId());
        if (!busyPairs.add(pair)) {
            throw new AssessmentInProgressException("Assessment in progress: sessionId=" + sessionId
                    + ", indicatorId=" + indicator.getId());
        }
        try {
            logger.info("Re-assess indicator: sessionId={}, indicatorId={}", sessionId, indicator.getId());
            return extractAndSave(sessionId, indicator, extractor.candidateSpans(transcript));
        } finally {
            busyPairs.remove(pair);
        }
    }

    private Assessment extractAndSave(String sessionId, Indicator indicator, List<String> spans) {
        ExtractionResult result = extractor.extract(indicator, spans);
        Assessment saved = assessmentRepository.upsertAiResult(sessionId, indicator.getId(),
                result.getAiScore(), result.evidenceText(), result.getReasoning());
        logger.debug("Indicator assessed: sessionId={}, indicatorId={}, aiScore={}, qualifying={}, exact={}",
                sessionId, indicator.getId(), result.getAiScore(), result.getQualifyingSpans(), result.getExactMatches());
        try {
            listener.onAssessmentReady(sessionId, indicator.getId(), saved);
        } catch (RuntimeException e) {
            logger.warn("Assessment listener failed: sessionId={}, indicatorId={}", sessionId, indicator.getId(), e);
        }
        return saved;
    }

    @Override
    public Assessment submitManualScore(String sessionId, Long indicatorId, Double manualScore, String notes) {
        if (manualScore != null && (manualScore.isNaN() || manualScore < 0 || manualScore > 100)) {
            throw new InvalidArgumentException("Manual score must be within [0,100]: " + manualScore);
        }
        Assessment existing = assessmentRepository.find(sessionId, indicatorId);
        if (existing == null || existing.getAiScore() == null) {
            throw new SessionStateException("Indicator has no AI assessment yet: sessionId=" + sessionId
                    + ", indicatorId=" + indicatorId);
        }
        Assessment updated = assessmentRepository.updateManualScore(sessionId, indicatorId, manualScore, notes);
        logger.info("Manual score saved: sessionId={}, indicatorId={}, manualScore={}", sessionId, indicatorId, manualScore);
        return updated;
    }

    @Override
    public AssessmentSummary summarize(String sessionId, List<Indicator> indicators) {
        validateIndicators(indicators);
        InterviewSession record = requireSession(sessionId);
        // 一次读取整对权重，整个汇总使用同一组
        ScoringWeights weights = weightsStore.current();
        Map<Long, Assessment> byIndicator = new HashMap<>();
        for (Assessment a : assessmentRepository.listBySession(sessionId)) {
            byIndicator.put(a.getIndicatorId(), a);
        }
        List<IndicatorScore> scores = new ArrayList<>(indicators.size());
        Map<Long, Double> combined = new LinkedHashMap<>();
        for (Indicator indicator : indicators) {
            Assessment a = byIndicator.get(indicator.getId());
            if (a == null || a.getAiScore() == null) {
                scores.add(IndicatorScore.notAssessed(indicator));
                continue;
            }
            double c = ScoreCombiner.combine(a.getAiScore(), a.getManualScore(), weights);
            combined.put(indicator.getId(), c);
            scores.add(new IndicatorScore(indicator, IndicatorScore.Status.ASSESSED, a.getAiScore(), a.getManualScore(), c,
                    a.evidenceSpans(), a.getReasoning(), a.getInterviewerNotes()));
        }
        OptionalDouble overall = ScoreCombiner.overall(combined, indicators);
        Double overallScore = overall.isPresent() ? overall.getAsDouble() : null;
        return new AssessmentSummary(sessionId, record.getProcessingStatus(), scores, overallScore,
                overallScore == null ? null : Recommendation.forOverall(overallScore), weights);
    }

    private InterviewSession requireSession(String sessionId) {
        InterviewSession record = sessionMapper.findById(sessionId);
        if (record == null) {
            throw new SessionNotFoundException("Session not found: " + sessionId);
        }
        return record;
    }

    private static void validateIndicators(List<Indicator> indicators) {
        if (indicators == null) {
            throw new ConfigurationException("Indicator list is required");
        }
        Set<Long> seen = new HashSet<>();
        for (Indicator i : indicators) {
            if (i == null) throw new ConfigurationException("Indicator list contains null");
            if (!seen.add(i.getId())) throw new ConfigurationException("Duplicate indicator id: " + i.getId());
        }
    }

    private void updateStatus(String sessionId, ProcessingStatus status, String error) {
        try {
            sessionMapper.updateProcessingStatus(sessionId, status.name(), error);
        } catch (RuntimeException e) {
            logger.warn("Update processing status failed: sessionId={}, status={}", sessionId, status, e);
        }
    }

    private void deleteAudio(String sessionId, String audioRef) {
        if (audioRef == null) return;
        try {
            if (Files.deleteIfExists(Path.of(audioRef))) {
                sessionMapper.updateAudioArtifact(sessionId, null);
                logger.info("Audio artifact deleted: sessionId={}, file={}", sessionId, audioRef);
            }
        } catch (Exception e) {
            logger.warn("Delete audio artifact failed: sessionId={}, file={}", sessionId, audioRef, e);
        }
    }

    private static String pairKey(String sessionId, Long indicatorId) {
        return sessionId + "#" + indicatorId;
    }

    @PreDestroy
    public void shutdown() {
        workerExecutor.shutdown();
    }
}
