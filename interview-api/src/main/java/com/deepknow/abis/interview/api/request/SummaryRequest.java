package com.deepknow.abis.interview.api.request;

import com.deepknow.abis.interview.api.model.IndicatorDto;
import lombok.Data;

import java.io.Serializable;
import java.util.List;

@Data
public class SummaryRequest implements Serializable {
    private static final long serialVersionUID = -4113927164209577102L;

    private String sessionId;
    private List<IndicatorDto> indicators;
}
