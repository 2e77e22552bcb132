package com.deepknow.abis.interview.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "similarity")
public class SimilarityProperties {
    private String provider = "lexical"; // aliyun | lexical
    private String apiKeyEnv = "DASHSCOPE_API_KEY";
    private String apiKey;
    private String model = "text-embedding-v2";
    private int timeoutMs = 15000;
    private int batchSize = 20;

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getApiKeyEnv() { return apiKeyEnv; }
    public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public int getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(int timeoutMs) { this.timeoutMs = timeoutMs; }
    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public String resolveApiKey() {
        if (apiKey != null && !apiKey.isEmpty()) return apiKey;
        return apiKeyEnv == null ? null : System.getenv(apiKeyEnv);
    }
}
