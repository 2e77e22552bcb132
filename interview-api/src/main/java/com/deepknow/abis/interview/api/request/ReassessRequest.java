package com.deepknow.abis.interview.api.request;

import com.deepknow.abis.interview.api.model.IndicatorDto;
import lombok.Data;

import java.io.Serializable;

@Data
public class ReassessRequest implements Serializable {
    private static final long serialVersionUID = -2871395005731247744L;

    private String sessionId;
    private IndicatorDto indicator;
}
