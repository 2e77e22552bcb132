package com.deepknow.abis.interview.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "transcription")
public class TranscriptionProperties {
    private String provider = "mock"; // aliyun | mock
    private String apiKeyEnv = "DASHSCOPE_API_KEY";
    private String apiKey; // 直接配置的密钥（优先级高于 apiKeyEnv）
    private String model = "paraformer-realtime-v2";
    private int sampleRate = 16000;
    private List<String> languageHints = new ArrayList<>(List.of("zh", "en"));
    private String interviewerSpeakerId; // 配置后该说话人的片段归为面试官

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getApiKeyEnv() { return apiKeyEnv; }
    public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public int getSampleRate() { return sampleRate; }
    public void setSampleRate(int sampleRate) { this.sampleRate = sampleRate; }
    public List<String> getLanguageHints() { return languageHints; }
    public void setLanguageHints(List<String> languageHints) { this.languageHints = languageHints; }
    public String getInterviewerSpeakerId() { return interviewerSpeakerId; }
    public void setInterviewerSpeakerId(String interviewerSpeakerId) { this.interviewerSpeakerId = interviewerSpeakerId; }

    public String resolveApiKey() {
        if (apiKey != null && !apiKey.isEmpty()) return apiKey;
        return apiKeyEnv == null ? null : System.getenv(apiKeyEnv);
    }
}
