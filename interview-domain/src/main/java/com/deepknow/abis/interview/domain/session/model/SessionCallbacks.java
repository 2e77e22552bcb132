package com.deepknow.abis.interview.domain.session.model;

import com.deepknow.abis.interview.domain.emotion.EmotionSnapshot;

import java.util.function.Consumer;

/**
 * 聚合直播会话的出站回调，避免参数爆炸。任一回调可为 null。
 */
public class SessionCallbacks {
    private final Consumer<EmotionSnapshot> onEmotionUpdate;
    private final Consumer<FinalizedSession> onClosed;
    private final Consumer<Throwable> onError;

    public SessionCallbacks(Consumer<EmotionSnapshot> onEmotionUpdate,
                            Consumer<FinalizedSession> onClosed,
                            Consumer<Throwable> onError) {
        this.onEmotionUpdate = onEmotionUpdate;
        this.onClosed = onClosed;
        this.onError = onError;
    }

    public static SessionCallbacks of(Consumer<EmotionSnapshot> onEmotionUpdate,
                                      Consumer<FinalizedSession> onClosed,
                                      Consumer<Throwable> onError) {
        return new SessionCallbacks(onEmotionUpdate, onClosed, onError);
    }

    public static SessionCallbacks none() {
        return new SessionCallbacks(null, null, null);
    }

    public Consumer<EmotionSnapshot> getOnEmotionUpdate() { return onEmotionUpdate; }
    public Consumer<FinalizedSession> getOnClosed() { return onClosed; }
    public Consumer<Throwable> getOnError() { return onError; }
}
