package com.deepknow.abis.interview.domain.assessment;

import com.deepknow.abis.interview.config.SimilarityProperties;
import com.deepknow.abis.interview.config.TranscriptionProperties;
import com.deepknow.abis.interview.domain.assessment.similarity.DashScopeEmbeddingSimilarityScorer;
import com.deepknow.abis.interview.domain.assessment.similarity.TokenOverlapSimilarityScorer;
import com.deepknow.abis.interview.domain.assessment.transcription.DashScopeTranscriptionClient;
import com.deepknow.abis.interview.domain.assessment.transcription.MockTranscriptionClient;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AssessmentClientFactoryTest {

    private static final String MISSING_ENV = "ABIS_TEST_KEY_THAT_IS_NEVER_SET";

    @Test
    void defaultsToLocalImplementations() {
        AssessmentClientFactory factory = new AssessmentClientFactory(new TranscriptionProperties(), new SimilarityProperties());

        assertThat(factory.createTranscription()).isInstanceOf(MockTranscriptionClient.class);
        assertThat(factory.createSimilarity()).isInstanceOf(TokenOverlapSimilarityScorer.class);
    }

    @Test
    void aliyunWithoutKeyFallsBack() {
        TranscriptionProperties t = new TranscriptionProperties();
        t.setProvider("aliyun");
        t.setApiKeyEnv(MISSING_ENV);
        SimilarityProperties s = new SimilarityProperties();
        s.setProvider("aliyun");
        s.setApiKeyEnv(MISSING_ENV);
        AssessmentClientFactory factory = new AssessmentClientFactory(t, s);

        assertThat(factory.createTranscription()).isInstanceOf(MockTranscriptionClient.class);
        assertThat(factory.createSimilarity()).isInstanceOf(TokenOverlapSimilarityScorer.class);
    }

    @Test
    void aliyunWithKeyUsesDashScope() {
        TranscriptionProperties t = new TranscriptionProperties();
        t.setProvider("aliyun");
        t.setApiKey("sk-test");
        SimilarityProperties s = new SimilarityProperties();
        s.setProvider("ALIYUN");
        s.setApiKey("sk-test");
        AssessmentClientFactory factory = new AssessmentClientFactory(t, s);

        assertThat(factory.createTranscription()).isInstanceOf(DashScopeTranscriptionClient.class);
        assertThat(factory.createSimilarity()).isInstanceOf(DashScopeEmbeddingSimilarityScorer.class);
    }
}
