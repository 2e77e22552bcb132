package com.deepknow.abis.interview.api.model;

import lombok.Data;

import java.io.Serializable;
import java.util.List;

@Data
public class AssessmentView implements Serializable {
    private static final long serialVersionUID = 3302186615572939104L;

    private String sessionId;
    private Long indicatorId;
    private Double aiScore;
    private Double manualScore;
    private List<String> evidence;
    private String reasoning;
    private String interviewerNotes;
}
