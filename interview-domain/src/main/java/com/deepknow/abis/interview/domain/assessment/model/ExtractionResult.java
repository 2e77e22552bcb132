package com.deepknow.abis.interview.domain.assessment.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个指标的语义证据抽取结果。
 */
public final class ExtractionResult {
    public static final String NO_EVIDENCE = "no specific evidence found in the transcript";
    public static final String EVIDENCE_SEPARATOR = " | ";

    private final double aiScore;
    private final List<String> evidence;
    private final String reasoning;
    private final int qualifyingSpans;
    private final int exactMatches;
    private final double topRelevance;

    public ExtractionResult(double aiScore, List<String> evidence, String reasoning,
                            int qualifyingSpans, int exactMatches, double topRelevance) {
        this.aiScore = aiScore;
        this.evidence = evidence == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(evidence));
        this.reasoning = reasoning;
        this.qualifyingSpans = qualifyingSpans;
        this.exactMatches = exactMatches;
        this.topRelevance = topRelevance;
    }

    public double getAiScore() { return aiScore; }
    public List<String> getEvidence() { return evidence; }
    public String getReasoning() { return reasoning; }
    public int getQualifyingSpans() { return qualifyingSpans; }
    public int getExactMatches() { return exactMatches; }
    public double getTopRelevance() { return topRelevance; }

    public boolean isInsufficientEvidence() { return evidence.isEmpty(); }

    /**
     * 证据的存储形态：以分隔符拼接的引文；无证据时为固定哨兵串。
     */
    public String evidenceText() {
        if (evidence.isEmpty()) return NO_EVIDENCE;
        return String.join(EVIDENCE_SEPARATOR, evidence);
    }

    public static List<String> splitEvidence(String evidenceText) {
        if (evidenceText == null || evidenceText.isBlank() || NO_EVIDENCE.equals(evidenceText)) {
            return Collections.emptyList();
        }
        List<String> out = new ArrayList<>();
        for (String part : evidenceText.split(" \\| ")) {
            String p = part.trim();
            if (!p.isEmpty()) out.add(p);
        }
        return out;
    }

    @Override
    public String toString() {
        return "ExtractionResult{" +
                "aiScore=" + aiScore +
                ", qualifyingSpans=" + qualifyingSpans +
                ", exactMatches=" + exactMatches +
                ", topRelevance=" + topRelevance +
                '}';
    }
}
