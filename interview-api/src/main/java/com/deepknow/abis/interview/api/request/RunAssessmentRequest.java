package com.deepknow.abis.interview.api.request;

import com.deepknow.abis.interview.api.model.IndicatorDto;
import lombok.Data;

import java.io.Serializable;
import java.util.List;

@Data
public class RunAssessmentRequest implements Serializable {
    private static final long serialVersionUID = 4410298316519387405L;

    private String sessionId;
    /** 为空时使用会话记录中的音频产物 */
    private String audioArtifactRef;
    private List<IndicatorDto> indicators;
    /** true 时异步提交，立即返回 */
    private boolean async;
}
