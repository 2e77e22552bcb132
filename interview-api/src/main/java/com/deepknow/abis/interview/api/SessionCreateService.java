package com.deepknow.abis.interview.api;

import com.deepknow.abis.interview.api.request.CreateSessionRequest;
import com.deepknow.abis.interview.api.request.EndSessionRequest;

public interface SessionCreateService {
    void createSession(CreateSessionRequest req);

    /**
     * @return 会话音频产物引用；未录到音频时为空
     */
    String endSession(EndSessionRequest req);
}
