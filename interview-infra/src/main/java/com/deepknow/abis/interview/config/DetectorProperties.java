package com.deepknow.abis.interview.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "detector")
public class DetectorProperties {
    private String facialProvider = "mock"; // remote | mock
    private String facialEndpoint = "http://localhost:8001/analyze";
    private int facialTimeoutMs = 2000;
    private String voiceProvider = "acoustic"; // acoustic | mock

    public String getFacialProvider() { return facialProvider; }
    public void setFacialProvider(String facialProvider) { this.facialProvider = facialProvider; }
    public String getFacialEndpoint() { return facialEndpoint; }
    public void setFacialEndpoint(String facialEndpoint) { this.facialEndpoint = facialEndpoint; }
    public int getFacialTimeoutMs() { return facialTimeoutMs; }
    public void setFacialTimeoutMs(int facialTimeoutMs) { this.facialTimeoutMs = facialTimeoutMs; }
    public String getVoiceProvider() { return voiceProvider; }
    public void setVoiceProvider(String voiceProvider) { this.voiceProvider = voiceProvider; }
}
