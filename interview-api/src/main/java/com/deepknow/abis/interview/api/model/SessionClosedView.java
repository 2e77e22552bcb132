package com.deepknow.abis.interview.api.model;

import lombok.Data;

import java.io.Serializable;

@Data
public class SessionClosedView implements Serializable {
    private static final long serialVersionUID = -7724419055311690163L;

    private String sessionId;
    private String audioArtifactRef;
    private int emotionSampleCount;
    private int persistedSampleCount;
    private boolean abrupt;
}
