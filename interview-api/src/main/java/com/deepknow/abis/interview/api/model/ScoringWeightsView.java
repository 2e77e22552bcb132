package com.deepknow.abis.interview.api.model;

import lombok.Data;

import java.io.Serializable;

@Data
public class ScoringWeightsView implements Serializable {
    private static final long serialVersionUID = -902376141198450215L;

    private int aiWeight;
    private int manualWeight;
}
