package com.deepknow.abis.interview.api.model;

import lombok.Data;

import java.io.Serializable;

@Data
public class IndicatorOutcomeView implements Serializable {
    private static final long serialVersionUID = -5640913457782301876L;

    private Long indicatorId;
    private boolean assessed;
    private Double aiScore;
    private String reason;
}
