package com.deepknow.abis.interview.domain.session.service;

import com.deepknow.abis.interview.domain.emotion.EmotionSnapshot;
import com.deepknow.abis.interview.domain.emotion.Modality;
import com.deepknow.abis.interview.domain.session.model.FinalizedSession;
import com.deepknow.abis.interview.domain.session.model.SessionCallbacks;
import com.deepknow.abis.interview.domain.session.model.SessionState;

/**
 * 会话级直播编排接口：管理每个会话的帧接入、检测调度、情绪聚合与关闭收尾。
 * 端点层应仅依赖此接口，具体实现放在 infra 层。
 */
public interface SessionStreamService {

    /**
     * 打开直播会话。sessionId 已在直播时抛出 AlreadyOpenException；已关闭的会话抛出 SessionStateException。
     */
    void open(String sessionId, SessionCallbacks callbacks);

    /**
     * 非阻塞接入一帧。仅 OPEN 状态接受；CLOSING/CLOSED 时静默丢弃。
     *
     * @return 帧是否被接受（不代表检测一定执行）
     */
    boolean ingestFrame(String sessionId, Modality modality, byte[] payload, double clientTimestamp);

    /**
     * 当前情绪快照；仅 OPEN 或 CLOSING 有效。
     */
    EmotionSnapshot requestSnapshot(String sessionId);

    /**
     * 有界排空在途检测、持久化日志、落盘音频并返回最终结果。幂等。
     */
    FinalizedSession close(String sessionId);

    /**
     * 通道异常中断：OPEN → CLOSED，不经过 CLOSING，也不等待在途检测。
     */
    FinalizedSession disconnect(String sessionId);

    SessionState stateOf(String sessionId);
}
