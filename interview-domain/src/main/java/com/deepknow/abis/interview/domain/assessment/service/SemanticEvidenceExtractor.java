package com.deepknow.abis.interview.domain.assessment.service;

import com.deepknow.abis.interview.domain.assessment.model.ExtractionResult;
import com.deepknow.abis.interview.domain.assessment.model.Indicator;
import com.deepknow.abis.interview.domain.assessment.model.Transcript;
import com.deepknow.abis.interview.domain.assessment.model.TranscriptSegment;
import com.deepknow.abis.interview.domain.error.SimilarityUnavailableException;
import com.deepknow.abis.interview.domain.scoring.ScoreCombiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 语义证据抽取：对单个指标，从候选人发言中挑出最相关的句子，给出 AI 分、证据与可解释的理由。
 * <p>
 * 相关度 = 句向量相似度；命中关键词（或指标名本身）时相关度至少为 exactMatchRelevance。
 * 相关度超过阈值或精确命中的句子视为"合格证据"。
 * <pre>
 * 数量分 = min(50, 20 + 15·ln(n+1))
 * 相关分 = clamp(30 + (top - 0.5)·100, 30, 60)
 * 关键词加分 = min(15, 8·exact)
 * aiScore = clamp(数量分 + 相关分 + 关键词加分, 0, 100)，保留一位小数
 * </pre>
 * 无合格证据时返回哨兵证据与基线分。对同一转写与指标，输出完全确定。
 */
public class SemanticEvidenceExtractor {
    private static final Logger logger = LoggerFactory.getLogger(SemanticEvidenceExtractor.class);

    private static final String QUERY_SUFFIX = "Behaviour, actions or experiences that demonstrate this trait.";
    private static final int MIN_KEYWORD_LENGTH = 3;

    private final SimilarityScorer similarityScorer;
    private final ExtractorSettings settings;
    private final SentenceSplitter splitter;

    public SemanticEvidenceExtractor(SimilarityScorer similarityScorer, ExtractorSettings settings) {
        this.similarityScorer = similarityScorer;
        this.settings = settings == null ? ExtractorSettings.DEFAULT : settings;
        this.splitter = new SentenceSplitter(this.settings.getMinSpanChars(), this.settings.getMaxSpanChars());
    }

    /**
     * 切出候选句子：仅候选人片段，按出现顺序去重。
     */
    public List<String> candidateSpans(Transcript transcript) {
        Set<String> spans = new LinkedHashSet<>();
        if (transcript == null) return new ArrayList<>();
        for (TranscriptSegment segment : transcript.candidateSegments()) {
            spans.addAll(splitter.split(segment.getText()));
        }
        return new ArrayList<>(spans);
    }

    /**
     * @throws SimilarityUnavailableException 相似度服务不可用；调用方应将该指标标记为未评估
     */
    public ExtractionResult extract(Indicator indicator, Transcript transcript) {
        return extract(indicator, candidateSpans(transcript));
    }

    public ExtractionResult extract(Indicator indicator, List<String> spans) {
        if (spans == null || spans.isEmpty()) {
            logger.debug("No candidate spans: indicatorId={}", indicator.getId());
            return insufficient(indicator);
        }
        List<Double> similarities = similarityScorer.similarities(buildQuery(indicator), spans);
        if (similarities == null || similarities.size() != spans.size()) {
            throw new SimilarityUnavailableException("Similarity scorer returned "
                    + (similarities == null ? "null" : similarities.size()) + " scores for " + spans.size() + " spans", null);
        }
        List<String> keywords = keywords(indicator);

        List<RankedSpan> qualifying = new ArrayList<>();
        int exactMatches = 0;
        for (int i = 0; i < spans.size(); i++) {
            String span = spans.get(i);
            double sim = sanitize(similarities.get(i));
            boolean exact = containsKeyword(span, keywords);
            double relevance = exact ? Math.max(sim, settings.getExactMatchRelevance()) : sim;
            if (exact || sim > settings.getRelevanceThreshold()) {
                qualifying.add(new RankedSpan(i, span, relevance, exact));
                if (exact) exactMatches++;
            }
        }
        if (qualifying.isEmpty()) {
            return insufficient(indicator);
        }
        qualifying.sort(Comparator.comparingDouble(RankedSpan::relevance).reversed()
                .thenComparingInt(RankedSpan::order));

        int n = qualifying.size();
        double top = qualifying.get(0).relevance();
        double countPart = Math.min(50.0, 20.0 + 15.0 * Math.log(n + 1));
        double relevancePart = clamp(30.0 + (top - 0.5) * 100.0, 30.0, 60.0);
        double keywordPart = Math.min(15.0, 8.0 * exactMatches);
        double score = ScoreCombiner.roundOneDecimal(clamp(countPart + relevancePart + keywordPart, 0.0, 100.0));

        List<String> evidence = new ArrayList<>();
        for (int i = 0; i < Math.min(settings.getTopK(), n); i++) {
            evidence.add(qualifying.get(i).text().replace("|", "/"));
        }
        String reasoning = reasoning(indicator, qualifying.get(0), n, exactMatches,
                countPart, relevancePart, keywordPart, score);
        return new ExtractionResult(score, evidence, reasoning, n, exactMatches, top);
    }

    String buildQuery(Indicator indicator) {
        StringBuilder q = new StringBuilder(indicator.getName());
        if (!indicator.getDescription().isEmpty()) {
            q.append(". ").append(indicator.getDescription());
        }
        return q.append(". ").append(QUERY_SUFFIX).toString();
    }

    private List<String> keywords(Indicator indicator) {
        List<String> out = new ArrayList<>();
        for (String k : indicator.getKeywords()) {
            if (k.length() >= MIN_KEYWORD_LENGTH) out.add(k.toLowerCase(Locale.ROOT));
        }
        String name = indicator.getName().toLowerCase(Locale.ROOT);
        if (name.length() >= MIN_KEYWORD_LENGTH && !out.contains(name)) out.add(name);
        return out;
    }

    private static boolean containsKeyword(String span, List<String> keywords) {
        String lower = span.toLowerCase(Locale.ROOT);
        for (String k : keywords) {
            if (lower.contains(k)) return true;
        }
        return false;
    }

    private ExtractionResult insufficient(Indicator indicator) {
        double baseline = ScoreCombiner.roundOneDecimal(settings.getBaselineScore());
        String reasoning = String.format(Locale.ROOT,
                "No candidate statement cleared the relevance threshold of %.2f for '%s'; "
                        + "a baseline score of %.1f reflects insufficient evidence rather than absence of the trait.",
                settings.getRelevanceThreshold(), indicator.getName(), baseline);
        return new ExtractionResult(baseline, null, reasoning, 0, 0, 0.0);
    }

    private String reasoning(Indicator indicator, RankedSpan strongest, int qualifying, int exact,
                             double countPart, double relevancePart, double keywordPart, double score) {
        String quote = strongest.text().length() > 80 ? strongest.text().substring(0, 77) + "..." : strongest.text();
        return String.format(Locale.ROOT,
                "%d candidate statement(s) matched '%s' (%d by keyword). Strongest: \"%s\" (relevance %.2f). "
                        + "Score %.1f = evidence count %.1f + top relevance %.1f + keyword bonus %.1f; %s.",
                qualifying, indicator.getName(), exact, quote.replace("|", "/"), strongest.relevance(),
                score, countPart, relevancePart, keywordPart, band(score));
    }

    private static String band(double score) {
        if (score >= 80) return "strong demonstration";
        if (score >= 60) return "clear demonstration";
        if (score >= 40) return "partial demonstration";
        return "weak demonstration";
    }

    private static double sanitize(Double value) {
        if (value == null || value.isNaN()) return 0.0;
        return clamp(value, 0.0, 1.0);
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    private static final class RankedSpan {
        private final int order;
        private final String text;
        private final double relevance;
        private final boolean exact;

        RankedSpan(int order, String text, double relevance, boolean exact) {
            this.order = order;
            this.text = text;
            this.relevance = relevance;
            this.exact = exact;
        }

        int order() { return order; }
        String text() { return text; }
        double relevance() { return relevance; }
    }
}
