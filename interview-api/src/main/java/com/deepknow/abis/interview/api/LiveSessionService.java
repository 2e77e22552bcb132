package com.deepknow.abis.interview.api;

import com.deepknow.abis.interview.api.model.EmotionSnapshotView;
import com.deepknow.abis.interview.api.model.SessionClosedView;

/**
 * 直播会话的控制面：帧数据走 WebSocket，快照查询与关闭也可通过 RPC 完成。
 */
public interface LiveSessionService {
    EmotionSnapshotView getSnapshot(String sessionId);

    SessionClosedView closeSession(String sessionId);

    /**
     * @return IDLE | OPEN | CLOSING | CLOSED
     */
    String getState(String sessionId);
}
