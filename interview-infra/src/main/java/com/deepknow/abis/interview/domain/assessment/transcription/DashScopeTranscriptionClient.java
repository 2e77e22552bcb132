package com.deepknow.abis.interview.domain.assessment.transcription;

import com.alibaba.dashscope.audio.asr.recognition.Recognition;
import com.alibaba.dashscope.audio.asr.recognition.RecognitionParam;
import com.deepknow.abis.interview.domain.assessment.model.Speaker;
import com.deepknow.abis.interview.domain.assessment.model.Transcript;
import com.deepknow.abis.interview.domain.assessment.model.TranscriptSegment;
import com.deepknow.abis.interview.domain.assessment.service.TranscriptionClient;
import com.deepknow.abis.interview.domain.error.TranscriptionException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * 阿里云百炼录音文件识别（官方 Java SDK）。
 * 以整段 WAV 调用 Recognition，解析 sentences[]（begin_time/end_time 毫秒）为转写片段。
 */
public class DashScopeTranscriptionClient implements TranscriptionClient {
    private static final Logger log = LoggerFactory.getLogger(DashScopeTranscriptionClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String apiKey;
    private final String model;
    private final int sampleRate;
    private final String[] languageHints;
    private final String interviewerSpeakerId;

    public DashScopeTranscriptionClient(String apiKey, String model, int sampleRate,
                                        List<String> languageHints, String interviewerSpeakerId) {
        this.apiKey = apiKey;
        this.model = model == null ? "paraformer-realtime-v2" : model;
        this.sampleRate = sampleRate <= 0 ? 16000 : sampleRate;
        this.languageHints = languageHints == null ? new String[0] : languageHints.toArray(new String[0]);
        this.interviewerSpeakerId = interviewerSpeakerId;
    }

    @Override
    public Transcript transcribe(String audioArtifactRef) {
        if (audioArtifactRef == null || audioArtifactRef.isBlank()) {
            throw new TranscriptionException("No audio artifact to transcribe");
        }
        File audio = new File(audioArtifactRef);
        if (!audio.isFile() || audio.length() <= 44) {
            throw new TranscriptionException("Audio artifact missing or empty: " + audioArtifactRef);
        }
        var builder = RecognitionParam.builder()
                .model(model)
                .format("wav")
                .sampleRate(sampleRate);
        if (languageHints.length > 0) {
            builder.parameter("language_hints", languageHints);
        }
        // 如果未通过环境变量配置 API Key，可在此显式设置
        if (apiKey != null && !apiKey.isEmpty()) {
            builder.apiKey(apiKey);
        }
        String json;
        try {
            Recognition recognizer = new Recognition();
            log.info("Transcription start: file={}, bytes={}, model={}", audio.getName(), audio.length(), model);
            json = recognizer.call(builder.build(), audio);
        } catch (Exception e) {
            throw new TranscriptionException("DashScope transcription failed: " + e.getMessage(), e);
        }
        Transcript transcript = parse(json, interviewerSpeakerId);
        if (transcript.isEmpty()) {
            throw new TranscriptionException("Transcription produced no text: " + audioArtifactRef);
        }
        log.info("Transcription done: file={}, segments={}", audio.getName(), transcript.getSegments().size());
        return transcript;
    }

    static Transcript parse(String json, String interviewerSpeakerId) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json == null ? "" : json);
        } catch (Exception e) {
            throw new TranscriptionException("Malformed transcription result", e);
        }
        if (root == null || root.isMissingNode()) {
            throw new TranscriptionException("Empty transcription result");
        }
        JsonNode sentences = root.path("sentences");
        if (!sentences.isArray()) {
            sentences = root.path("output").path("sentences");
        }
        List<TranscriptSegment> segments = new ArrayList<>();
        if (sentences.isArray()) {
            for (JsonNode s : sentences) {
                String text = s.path("text").asText("").trim();
                if (text.isEmpty()) continue;
                String speakerId = s.path("speaker_id").asText(null);
                Speaker speaker = interviewerSpeakerId != null && interviewerSpeakerId.equals(speakerId)
                        ? Speaker.INTERVIEWER : Speaker.CANDIDATE;
                double conf = s.has("confidence") ? s.path("confidence").asDouble(1.0) : 1.0;
                segments.add(new TranscriptSegment(speaker, text,
                        s.path("begin_time").asLong(0) / 1000.0,
                        s.path("end_time").asLong(0) / 1000.0,
                        conf));
            }
        } else {
            String text = root.path("text").asText("").trim();
            if (!text.isEmpty()) {
                segments.add(TranscriptSegment.candidate(text, 0.0, 0.0));
            }
        }
        return new Transcript(segments);
    }
}
