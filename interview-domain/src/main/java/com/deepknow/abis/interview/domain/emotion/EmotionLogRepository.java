package com.deepknow.abis.interview.domain.emotion;

import java.util.List;

/**
 * 情绪样本日志的持久化协作者。会话关闭时一次性写入。
 */
public interface EmotionLogRepository {
    /**
     * @return 实际写入的条数
     */
    int persist(String sessionId, List<EmotionSample> samples);

    List<EmotionSample> listBySession(String sessionId);
}
