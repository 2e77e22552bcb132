package com.deepknow.abis.interview.domain.assessment.service;

import com.deepknow.abis.interview.domain.error.ConfigurationException;

/**
 * 证据抽取参数。
 */
public final class ExtractorSettings {
    public static final ExtractorSettings DEFAULT = new ExtractorSettings(3, 0.50, 0.95, 10.0, 15, 150);

    private final int topK;
    private final double relevanceThreshold;
    private final double exactMatchRelevance;
    private final double baselineScore;
    private final int minSpanChars;
    private final int maxSpanChars;

    public ExtractorSettings(int topK, double relevanceThreshold, double exactMatchRelevance,
                             double baselineScore, int minSpanChars, int maxSpanChars) {
        if (topK < 1) {
            throw new ConfigurationException("topK must be >= 1: " + topK);
        }
        if (relevanceThreshold < 0 || relevanceThreshold > 1) {
            throw new ConfigurationException("relevanceThreshold must be within [0,1]: " + relevanceThreshold);
        }
        if (baselineScore <= 0 || baselineScore > 100) {
            throw new ConfigurationException("baselineScore must be within (0,100]: " + baselineScore);
        }
        if (minSpanChars < 1 || maxSpanChars < minSpanChars) {
            throw new ConfigurationException("Invalid span bounds: min=" + minSpanChars + ", max=" + maxSpanChars);
        }
        this.topK = topK;
        this.relevanceThreshold = relevanceThreshold;
        this.exactMatchRelevance = exactMatchRelevance;
        this.baselineScore = baselineScore;
        this.minSpanChars = minSpanChars;
        this.maxSpanChars = maxSpanChars;
    }

    public int getTopK() { return topK; }
    public double getRelevanceThreshold() { return relevanceThreshold; }
    public double getExactMatchRelevance() { return exactMatchRelevance; }
    public double getBaselineScore() { return baselineScore; }
    public int getMinSpanChars() { return minSpanChars; }
    public int getMaxSpanChars() { return maxSpanChars; }
}
