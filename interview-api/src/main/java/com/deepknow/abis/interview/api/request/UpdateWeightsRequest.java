package com.deepknow.abis.interview.api.request;

import lombok.Data;

import java.io.Serializable;

@Data
public class UpdateWeightsRequest implements Serializable {
    private static final long serialVersionUID = 2093876601835579151L;

    private int aiWeight;
    private int manualWeight;
}
