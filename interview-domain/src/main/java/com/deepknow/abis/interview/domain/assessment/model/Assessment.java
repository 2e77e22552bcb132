package com.deepknow.abis.interview.domain.assessment.model;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 每个 (session, indicator) 至多一行。AI 字段（aiScore/evidence/reasoning）与人工字段（manualScore/notes）独立写入；
 * 合成分从不落库，读取时按当前权重重新计算。
 */
@Data
public class Assessment {
    private Long id;
    private String sessionId;
    private Long indicatorId;
    private Double aiScore;
    private Double manualScore;
    private String evidence;
    private String reasoning;
    private String interviewerNotes;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public List<String> evidenceSpans() {
        return ExtractionResult.splitEvidence(evidence);
    }
}
