package com.deepknow.abis.interview.domain.assessment.similarity;

import com.deepknow.abis.interview.domain.assessment.service.SimilarityScorer;
import com.deepknow.abis.interview.domain.error.SimilarityUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 阿里云百炼文本向量（REST）+ 余弦相似度。
 * 余弦值 [-1,1] 截断到 [0,1]。
 */
public class DashScopeEmbeddingSimilarityScorer implements SimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(DashScopeEmbeddingSimilarityScorer.class);
    private static final String EMBEDDING_URL =
            "https://dashscope.aliyuncs.com/api/v1/services/embeddings/text-embedding/text-embedding";

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String apiKey;
    private final String model;
    private final Duration timeout;
    private final int batchSize;

    public DashScopeEmbeddingSimilarityScorer(String apiKey, String model, int timeoutMs, int batchSize) {
        this.apiKey = apiKey;
        this.model = model == null ? "text-embedding-v2" : model;
        this.timeout = Duration.ofMillis(timeoutMs <= 0 ? 15000 : timeoutMs);
        this.batchSize = Math.max(1, batchSize);
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
        log.info("Embedding scorer init: model={} batchSize={}", this.model, this.batchSize);
    }

    @Override
    public List<Double> similarities(String query, List<String> candidates) {
        if (candidates == null || candidates.isEmpty()) return new ArrayList<>();
        double[] q = embed(List.of(query)).get(0);
        List<Double> out = new ArrayList<>(candidates.size());
        for (int from = 0; from < candidates.size(); from += batchSize) {
            List<String> batch = candidates.subList(from, Math.min(candidates.size(), from + batchSize));
            for (double[] v : embed(batch)) {
                out.add(Math.max(0.0, Math.min(1.0, cosine(q, v))));
            }
        }
        return out;
    }

    private List<double[]> embed(List<String> texts) {
        try {
            Map<String, Object> payload = new HashMap<>();
            payload.put("model", model);
            payload.put("input", Map.of("texts", texts));
            String body = mapper.writeValueAsString(payload);
            HttpRequest req = HttpRequest.newBuilder(URI.create(EMBEDDING_URL))
                    .timeout(timeout)
                    .header("Authorization", "Bearer " + apiKey)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();
            HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            log.debug("Embedding call status: {} model={} texts={}", resp.statusCode(), model, texts.size());
            if (resp.statusCode() / 100 != 2) {
                throw new SimilarityUnavailableException("Embedding service status " + resp.statusCode(), null);
            }
            return parseEmbeddings(mapper.readTree(resp.body()), texts.size());
        } catch (SimilarityUnavailableException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SimilarityUnavailableException("Embedding call interrupted", e);
        } catch (Exception e) {
            throw new SimilarityUnavailableException("Embedding call failed: " + e.getMessage(), e);
        }
    }

    static List<double[]> parseEmbeddings(JsonNode root, int expected) {
        JsonNode arr = root.path("output").path("embeddings");
        if (!arr.isArray() || arr.size() != expected) {
            throw new SimilarityUnavailableException("Embedding response has "
                    + (arr.isArray() ? arr.size() : 0) + " vectors, expected " + expected, null);
        }
        double[][] ordered = new double[expected][];
        for (int i = 0; i < arr.size(); i++) {
            JsonNode item = arr.get(i);
            int idx = item.path("text_index").asInt(i);
            JsonNode vec = item.path("embedding");
            double[] v = new double[vec.size()];
            for (int j = 0; j < v.length; j++) v[j] = vec.get(j).asDouble();
            if (idx < 0 || idx >= expected) {
                throw new SimilarityUnavailableException("Embedding text_index out of range: " + idx, null);
            }
            ordered[idx] = v;
        }
        List<double[]> out = new ArrayList<>(expected);
        for (double[] v : ordered) {
            if (v == null) throw new SimilarityUnavailableException("Embedding response missing vectors", null);
            out.add(v);
        }
        return out;
    }

    static double cosine(double[] a, double[] b) {
        int n = Math.min(a.length, b.length);
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < n; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 0.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}
