package com.deepknow.abis.interview.domain.session.model;

import java.time.LocalDateTime;

/**
 * 关闭结果：交给批量评估的音频产物引用以及日志概况。重复 close 返回同一实例。
 */
public final class FinalizedSession {
    private final String sessionId;
    private final String audioArtifactRef;
    private final int emotionSampleCount;
    private final int persistedSampleCount;
    private final LocalDateTime startedAt;
    private final LocalDateTime endedAt;
    private final boolean abrupt;

    public FinalizedSession(String sessionId, String audioArtifactRef, int emotionSampleCount, int persistedSampleCount,
                            LocalDateTime startedAt, LocalDateTime endedAt, boolean abrupt) {
        this.sessionId = sessionId;
        this.audioArtifactRef = audioArtifactRef;
        this.emotionSampleCount = emotionSampleCount;
        this.persistedSampleCount = persistedSampleCount;
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.abrupt = abrupt;
    }

    public String getSessionId() { return sessionId; }
    public String getAudioArtifactRef() { return audioArtifactRef; }
    public int getEmotionSampleCount() { return emotionSampleCount; }
    public int getPersistedSampleCount() { return persistedSampleCount; }
    public LocalDateTime getStartedAt() { return startedAt; }
    public LocalDateTime getEndedAt() { return endedAt; }
    public boolean isAbrupt() { return abrupt; }

    @Override
    public String toString() {
        return "FinalizedSession{" +
                "sessionId='" + sessionId + '\'' +
                ", audioArtifactRef='" + audioArtifactRef + '\'' +
                ", emotionSampleCount=" + emotionSampleCount +
                ", persistedSampleCount=" + persistedSampleCount +
                ", abrupt=" + abrupt +
                '}';
    }
}
