package com.deepknow.abis.interview.domain.session.model;

import lombok.Data;

import java.time.LocalDateTime;


@Data
public class InterviewSession {
    private String id;
    private String userId;
    private String status; // IDLE, OPEN, CLOSING, CLOSED
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private String configJson;
    private String audioArtifactRef;
    private String processingStatus; // RECORDING, PROCESSING, COMPLETED, FAILED
    private String processingError;
}
