package com.deepknow.abis.interview.api.model;

import lombok.Data;

import java.io.Serializable;

@Data
public class EmotionSnapshotView implements Serializable {
    private static final long serialVersionUID = 5392019925046338772L;

    private String sessionId;
    private ModalityView facial;
    private ModalityView voice;
    private long totalSamples;
}
