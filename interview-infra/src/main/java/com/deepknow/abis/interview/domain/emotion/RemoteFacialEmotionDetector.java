package com.deepknow.abis.interview.domain.emotion;

import com.deepknow.abis.interview.domain.error.DetectorUnavailableException;
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
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 面部情绪模型服务客户端（REST）。
 * 请求：{"image":"&lt;base64&gt;"}；响应：{"dominant_emotion":..,"confidence":..,"face_detected":..,"emotions":{..}}。
 * confidence 若以百分比给出（&gt;1）会被归一到 [0,1]。
 */
public class RemoteFacialEmotionDetector implements FacialEmotionDetector {
    private static final Logger log = LoggerFactory.getLogger(RemoteFacialEmotionDetector.class);

    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final URI endpoint;
    private final Duration timeout;

    public RemoteFacialEmotionDetector(String endpoint, int timeoutMs, ObjectMapper mapper) {
        this(endpoint, timeoutMs, mapper, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(3)).build());
    }

    RemoteFacialEmotionDetector(String endpoint, int timeoutMs, ObjectMapper mapper, HttpClient httpClient) {
        this.endpoint = URI.create(endpoint);
        this.timeout = Duration.ofMillis(timeoutMs <= 0 ? 2000 : timeoutMs);
        this.mapper = mapper == null ? new ObjectMapper() : mapper;
        this.httpClient = httpClient;
    }

    @Override
    public Optional<EmotionDetection> detect(byte[] image) {
        String body;
        try {
            body = mapper.writeValueAsString(Map.of("image", Base64.getEncoder().encodeToString(image)));
        } catch (Exception e) {
            throw new DetectorUnavailableException("Encode facial request failed", e);
        }
        HttpRequest req = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> resp;
        try {
            resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DetectorUnavailableException("Facial detector call interrupted", e);
        } catch (Exception e) {
            throw new DetectorUnavailableException("Facial detector call failed: " + e.getMessage(), e);
        }
        if (resp.statusCode() / 100 != 2) {
            throw new DetectorUnavailableException("Facial detector status " + resp.statusCode());
        }
        return parse(resp.body());
    }

    Optional<EmotionDetection> parse(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (Exception e) {
            throw new DetectorUnavailableException("Malformed facial detector response", e);
        }
        if (!root.path("face_detected").asBoolean(true)) {
            log.trace("No face detected in frame");
            return Optional.empty();
        }
        String label = root.path("dominant_emotion").asText("");
        if (label.isEmpty()) return Optional.empty();
        double confidence = normalize(root.path("confidence").asDouble(0.0));
        Map<String, Double> scores = new LinkedHashMap<>();
        JsonNode emotions = root.path("emotions");
        if (emotions.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = emotions.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                scores.put(e.getKey(), normalize(e.getValue().asDouble(0.0)));
            }
        }
        return Optional.of(new EmotionDetection(label, confidence, scores));
    }

    private static double normalize(double v) {
        return v > 1.0 ? v / 100.0 : v;
    }
}
