package com.deepknow.abis.interview.config;

import com.deepknow.abis.interview.domain.assessment.service.ExtractorSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "assessment")
public class AssessmentProperties {
    private int topK = 3;
    private double relevanceThreshold = 0.50;
    private double exactMatchRelevance = 0.95;
    private double baselineScore = 10.0;
    private int minSpanChars = 15;
    private int maxSpanChars = 150;
    private int workerPoolSize = 2;
    private boolean deleteAudioAfterSuccess = false;

    public ExtractorSettings toExtractorSettings() {
        return new ExtractorSettings(topK, relevanceThreshold, exactMatchRelevance, baselineScore, minSpanChars, maxSpanChars);
    }

    public int getTopK() { return topK; }
    public void setTopK(int topK) { this.topK = topK; }
    public double getRelevanceThreshold() { return relevanceThreshold; }
    public void setRelevanceThreshold(double relevanceThreshold) { this.relevanceThreshold = relevanceThreshold; }
    public double getExactMatchRelevance() { return exactMatchRelevance; }
    public void setExactMatchRelevance(double exactMatchRelevance) { this.exactMatchRelevance = exactMatchRelevance; }
    public double getBaselineScore() { return baselineScore; }
    public void setBaselineScore(double baselineScore) { this.baselineScore = baselineScore; }
    public int getMinSpanChars() { return minSpanChars; }
    public void setMinSpanChars(int minSpanChars) { this.minSpanChars = minSpanChars; }
    public int getMaxSpanChars() { return maxSpanChars; }
    public void setMaxSpanChars(int maxSpanChars) { this.maxSpanChars = maxSpanChars; }
    public int getWorkerPoolSize() { return workerPoolSize; }
    public void setWorkerPoolSize(int workerPoolSize) { this.workerPoolSize = workerPoolSize; }
    public boolean isDeleteAudioAfterSuccess() { return deleteAudioAfterSuccess; }
    public void setDeleteAudioAfterSuccess(boolean deleteAudioAfterSuccess) { this.deleteAudioAfterSuccess = deleteAudioAfterSuccess; }
}
