package com.deepknow.abis.interview.config;

import com.deepknow.abis.interview.domain.emotion.EmptyWindowPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "live")
public class LiveSessionProperties {
    private double stabilityWindowSeconds = 30.0;
    private int maxWindowSamples = 100;
    private EmptyWindowPolicy emptyWindowPolicy = EmptyWindowPolicy.STABLE; // STABLE -> 1.0 | UNDEFINED -> 缺省
    private long drainTimeoutMs = 300;
    private int detectorPoolSize = 8;
    private int detectorQueueCapacity = 256;
    private int facialFrameInterval = 1; // 每 N 帧抽检一帧
    private int voiceWindowBytes = 32000; // 1s 16kHz 单声道 PCM16
    private int maxFrameBytes = 2 * 1024 * 1024;
    private String recordingsDir = "recordings";
    private int audioSampleRate = 16000;
    private double minPersistConfidence = 0.0;
    private int finalizedCacheSize = 1024;

    public double getStabilityWindowSeconds() { return stabilityWindowSeconds; }
    public void setStabilityWindowSeconds(double stabilityWindowSeconds) { this.stabilityWindowSeconds = stabilityWindowSeconds; }
    public int getMaxWindowSamples() { return maxWindowSamples; }
    public void setMaxWindowSamples(int maxWindowSamples) { this.maxWindowSamples = maxWindowSamples; }
    public EmptyWindowPolicy getEmptyWindowPolicy() { return emptyWindowPolicy; }
    public void setEmptyWindowPolicy(EmptyWindowPolicy emptyWindowPolicy) { this.emptyWindowPolicy = emptyWindowPolicy; }
    public long getDrainTimeoutMs() { return drainTimeoutMs; }
    public void setDrainTimeoutMs(long drainTimeoutMs) { this.drainTimeoutMs = drainTimeoutMs; }
    public int getDetectorPoolSize() { return detectorPoolSize; }
    public void setDetectorPoolSize(int detectorPoolSize) { this.detectorPoolSize = detectorPoolSize; }
    public int getDetectorQueueCapacity() { return detectorQueueCapacity; }
    public void setDetectorQueueCapacity(int detectorQueueCapacity) { this.detectorQueueCapacity = detectorQueueCapacity; }
    public int getFacialFrameInterval() { return facialFrameInterval; }
    public void setFacialFrameInterval(int facialFrameInterval) { this.facialFrameInterval = facialFrameInterval; }
    public int getVoiceWindowBytes() { return voiceWindowBytes; }
    public void setVoiceWindowBytes(int voiceWindowBytes) { this.voiceWindowBytes = voiceWindowBytes; }
    public int getMaxFrameBytes() { return maxFrameBytes; }
    public void setMaxFrameBytes(int maxFrameBytes) { this.maxFrameBytes = maxFrameBytes; }
    public String getRecordingsDir() { return recordingsDir; }
    public void setRecordingsDir(String recordingsDir) { this.recordingsDir = recordingsDir; }
    public int getAudioSampleRate() { return audioSampleRate; }
    public void setAudioSampleRate(int audioSampleRate) { this.audioSampleRate = audioSampleRate; }
    public double getMinPersistConfidence() { return minPersistConfidence; }
    public void setMinPersistConfidence(double minPersistConfidence) { this.minPersistConfidence = minPersistConfidence; }
    public int getFinalizedCacheSize() { return finalizedCacheSize; }
    public void setFinalizedCacheSize(int finalizedCacheSize) { this.finalizedCacheSize = finalizedCacheSize; }
}
