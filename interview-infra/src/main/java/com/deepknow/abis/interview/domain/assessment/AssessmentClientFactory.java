package com.deepknow.abis.interview.domain.assessment;

import com.deepknow.abis.interview.config.SimilarityProperties;
import com.deepknow.abis.interview.config.TranscriptionProperties;
import com.deepknow.abis.interview.domain.assessment.service.SimilarityScorer;
import com.deepknow.abis.interview.domain.assessment.service.TranscriptionClient;
import com.deepknow.abis.interview.domain.assessment.similarity.DashScopeEmbeddingSimilarityScorer;
import com.deepknow.abis.interview.domain.assessment.similarity.TokenOverlapSimilarityScorer;
import com.deepknow.abis.interview.domain.assessment.transcription.DashScopeTranscriptionClient;
import com.deepknow.abis.interview.domain.assessment.transcription.MockTranscriptionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 会后评估协作者工厂：按 transcription.* / similarity.* 选择阿里云或本地实现。
 * 选了阿里云但拿不到密钥时退回本地实现并告警。
 */
@Component
public class AssessmentClientFactory {
    private static final Logger log = LoggerFactory.getLogger(AssessmentClientFactory.class);

    private final TranscriptionProperties transcriptionProps;
    private final SimilarityProperties similarityProps;

    public AssessmentClientFactory(TranscriptionProperties transcriptionProps, SimilarityProperties similarityProps) {
        this.transcriptionProps = transcriptionProps;
        this.similarityProps = similarityProps;
    }

    public TranscriptionClient createTranscription() {
        if ("aliyun".equalsIgnoreCase(transcriptionProps.getProvider())) {
            String key = transcriptionProps.resolveApiKey();
            if (key == null || key.isEmpty()) {
                log.warn("Transcription provider aliyun selected but no API key ({}); fallback to mock",
                        transcriptionProps.getApiKeyEnv());
                return new MockTranscriptionClient();
            }
            log.info("Transcription: aliyun model={}", transcriptionProps.getModel());
            return new DashScopeTranscriptionClient(key, transcriptionProps.getModel(), transcriptionProps.getSampleRate(),
                    transcriptionProps.getLanguageHints(), transcriptionProps.getInterviewerSpeakerId());
        }
        log.info("Transcription: mock");
        return new MockTranscriptionClient();
    }

    public SimilarityScorer createSimilarity() {
        if ("aliyun".equalsIgnoreCase(similarityProps.getProvider())) {
            String key = similarityProps.resolveApiKey();
            if (key == null || key.isEmpty()) {
                log.warn("Similarity provider aliyun selected but no API key ({}); fallback to lexical",
                        similarityProps.getApiKeyEnv());
                return new TokenOverlapSimilarityScorer();
            }
            return new DashScopeEmbeddingSimilarityScorer(key, similarityProps.getModel(),
                    similarityProps.getTimeoutMs(), similarityProps.getBatchSize());
        }
        log.info("Similarity: lexical");
        return new TokenOverlapSimilarityScorer();
    }
}
