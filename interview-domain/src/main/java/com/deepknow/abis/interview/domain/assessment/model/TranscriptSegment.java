package com.deepknow.abis.interview.domain.assessment.model;

/**
 * 带时间戳的转写片段（秒）。
 */
public final class TranscriptSegment {
    private final Speaker speaker;
    private final String text;
    private final double startSeconds;
    private final double endSeconds;
    private final double confidence;

    public TranscriptSegment(Speaker speaker, String text, double startSeconds, double endSeconds, double confidence) {
        this.speaker = speaker == null ? Speaker.CANDIDATE : speaker;
        this.text = text == null ? "" : text.trim();
        this.startSeconds = startSeconds;
        this.endSeconds = endSeconds;
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static TranscriptSegment candidate(String text, double startSeconds, double endSeconds) {
        return new TranscriptSegment(Speaker.CANDIDATE, text, startSeconds, endSeconds, 1.0);
    }

    public static TranscriptSegment interviewer(String text, double startSeconds, double endSeconds) {
        return new TranscriptSegment(Speaker.INTERVIEWER, text, startSeconds, endSeconds, 1.0);
    }

    public Speaker getSpeaker() { return speaker; }
    public String getText() { return text; }
    public double getStartSeconds() { return startSeconds; }
    public double getEndSeconds() { return endSeconds; }
    public double getConfidence() { return confidence; }

    @Override
    public String toString() {
        return "TranscriptSegment{" + speaker + " @" + startSeconds + "s: '" + text + "'}";
    }
}
