package com.deepknow.abis.interview.api.model;

import lombok.Data;

import java.io.Serializable;
import java.util.List;

@Data
public class IndicatorScoreView implements Serializable {
    private static final long serialVersionUID = -3361570049116437725L;

    private Long indicatorId;
    private String name;
    private double weight;
    /** ASSESSED | NOT_ASSESSED */
    private String status;
    private Double aiScore;
    private Double manualScore;
    private Double combinedScore;
    private List<String> evidence;
    private String reasoning;
    private String interviewerNotes;
}
