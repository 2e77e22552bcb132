package com.deepknow.abis.interview.domain.assessment.similarity;

import com.deepknow.abis.interview.domain.assessment.service.SimilarityScorer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 词面相似度（无向量服务时的兜底）：候选集内统计 IDF，按 TF-IDF 余弦打分。
 * 英文按长度 ≥ 3 的词切分；中文按相邻两字切分。结果确定，范围 [0,1]。
 */
public final class TokenOverlapSimilarityScorer implements SimilarityScorer {
    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "that", "this", "with", "for", "was", "were", "are", "you", "but", "not",
            "have", "has", "had", "our", "their", "they", "them", "from", "into", "then", "than",
            "what", "when", "which", "who", "how", "its", "can", "could", "would", "will", "just");

    @Override
    public List<Double> similarities(String query, List<String> candidates) {
        List<Double> out = new ArrayList<>();
        if (candidates == null || candidates.isEmpty()) return out;

        List<Map<String, Integer>> docs = new ArrayList<>(candidates.size());
        Map<String, Integer> df = new HashMap<>();
        for (String c : candidates) {
            Map<String, Integer> tf = termFrequencies(c);
            docs.add(tf);
            for (String t : tf.keySet()) df.merge(t, 1, Integer::sum);
        }
        Map<String, Integer> queryTf = termFrequencies(query);
        for (String t : queryTf.keySet()) df.merge(t, 1, Integer::sum);

        double n = candidates.size() + 1.0;
        Map<String, Double> idf = new HashMap<>(df.size() * 2);
        for (Map.Entry<String, Integer> e : df.entrySet()) {
            idf.put(e.getKey(), Math.log((n + 1.0) / (e.getValue() + 1.0)) + 1.0);
        }
        Map<String, Double> q = weigh(queryTf, idf);
        for (Map<String, Integer> d : docs) {
            out.add(cosine(q, weigh(d, idf)));
        }
        return out;
    }

    static Map<String, Integer> termFrequencies(String text) {
        Map<String, Integer> tf = new HashMap<>();
        if (text == null) return tf;
        for (String token : tokenize(text)) tf.merge(token, 1, Integer::sum);
        return tf;
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        String lower = text.toLowerCase(Locale.ROOT);
        StringBuilder word = new StringBuilder();
        char prevCjk = 0;
        for (int i = 0; i < lower.length(); i++) {
            char ch = lower.charAt(i);
            if (isCjk(ch)) {
                flush(word, tokens);
                if (prevCjk != 0) tokens.add(new String(new char[]{prevCjk, ch}));
                prevCjk = ch;
            } else if (Character.isLetterOrDigit(ch)) {
                prevCjk = 0;
                word.append(ch);
            } else {
                prevCjk = 0;
                flush(word, tokens);
            }
        }
        flush(word, tokens);
        return tokens;
    }

    private static void flush(StringBuilder word, List<String> tokens) {
        if (word.length() >= 3) {
            String w = word.toString();
            if (!STOPWORDS.contains(w)) tokens.add(w);
        }
        word.setLength(0);
    }

    private static boolean isCjk(char ch) {
        return Character.UnicodeScript.of(ch) == Character.UnicodeScript.HAN;
    }

    private static Map<String, Double> weigh(Map<String, Integer> tf, Map<String, Double> idf) {
        Map<String, Double> v = new HashMap<>(tf.size() * 2);
        for (Map.Entry<String, Integer> e : tf.entrySet()) {
            v.put(e.getKey(), (1.0 + Math.log(e.getValue())) * idf.getOrDefault(e.getKey(), 1.0));
        }
        return v;
    }

    private static double cosine(Map<String, Double> a, Map<String, Double> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        Set<String> shared = new HashSet<>(a.keySet());
        shared.retainAll(b.keySet());
        double dot = 0;
        for (String t : shared) dot += a.get(t) * b.get(t);
        double na = 0, nb = 0;
        for (double x : a.values()) na += x * x;
        for (double x : b.values()) nb += x * x;
        double c = dot / (Math.sqrt(na) * Math.sqrt(nb));
        return Math.max(0.0, Math.min(1.0, c));
    }
}
