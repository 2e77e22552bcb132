package com.deepknow.abis.interview.domain.session;

import com.deepknow.abis.interview.domain.emotion.EmotionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * 出站快照合并投递：只保留最新一份待发快照，同一时刻至多一个投递循环。
 * 消费方慢时看到的是最新快照而不是积压队列。
 */
public class SnapshotPublisher {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotPublisher.class);

    private final String sessionId;
    private final Executor executor;
    private final Consumer<EmotionSnapshot> consumer;
    private final AtomicReference<EmotionSnapshot> latest = new AtomicReference<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    public SnapshotPublisher(String sessionId, Executor executor, Consumer<EmotionSnapshot> consumer) {
        this.sessionId = sessionId;
        this.executor = executor;
        this.consumer = consumer;
    }

    public void publish(EmotionSnapshot snapshot) {
        if (consumer == null || snapshot == null) return;
        if (latest.getAndSet(snapshot) != null) {
            logger.trace("Snapshot coalesced: sessionId={}", sessionId);
        }
        scheduleDrain();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) return;
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            logger.warn("Snapshot delivery rejected: sessionId={}", sessionId);
        }
    }

    private void drain() {
        try {
            EmotionSnapshot next;
            while ((next = latest.getAndSet(null)) != null) {
                try {
                    consumer.accept(next);
                } catch (RuntimeException e) {
                    logger.warn("Snapshot consumer failed: sessionId={}", sessionId, e);
                }
            }
        } finally {
            draining.set(false);
        }
        // 退出循环与清除标志之间可能有新快照进入
        if (latest.get() != null) {
            scheduleDrain();
        }
    }
}
