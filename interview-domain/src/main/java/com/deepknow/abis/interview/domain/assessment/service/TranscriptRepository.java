package com.deepknow.abis.interview.domain.assessment.service;

import com.deepknow.abis.interview.domain.assessment.model.Transcript;

public interface TranscriptRepository {
    /**
     * 以新转写整体替换该会话的旧转写。
     */
    void replace(String sessionId, Transcript transcript);

    /**
     * @return 未转写过时返回 null
     */
    Transcript find(String sessionId);
}
