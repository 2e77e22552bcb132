package com.deepknow.abis.interview.domain.assessment.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 已定稿的转写结果：按时间排列的片段列表。
 */
public final class Transcript {
    private final List<TranscriptSegment> segments;

    public Transcript(List<TranscriptSegment> segments) {
        this.segments = segments == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(segments));
    }

    public List<TranscriptSegment> getSegments() { return segments; }

    public List<TranscriptSegment> candidateSegments() {
        return segments.stream()
                .filter(s -> s.getSpeaker() == Speaker.CANDIDATE)
                .collect(Collectors.toList());
    }

    public String fullText() {
        return segments.stream()
                .map(TranscriptSegment::getText)
                .filter(t -> !t.isEmpty())
                .collect(Collectors.joining(" "));
    }

    public boolean isEmpty() {
        return segments.stream().allMatch(s -> s.getText().isEmpty());
    }

    public double averageConfidence() {
        return segments.stream().mapToDouble(TranscriptSegment::getConfidence).average().orElse(0.0);
    }
}
