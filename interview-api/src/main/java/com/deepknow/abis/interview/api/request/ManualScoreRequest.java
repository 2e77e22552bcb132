package com.deepknow.abis.interview.api.request;

import lombok.Data;

import java.io.Serializable;

@Data
public class ManualScoreRequest implements Serializable {
    private static final long serialVersionUID = 7290466839152238811L;

    private String sessionId;
    private Long indicatorId;
    /** [0,100]；为空表示清除人工分 */
    private Double manualScore;
    private String notes;
}
