package com.deepknow.abis.interview.domain.emotion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 会话级情绪聚合器：维护追加写入的样本日志、按通道的滚动窗口，以及稳定度计算。
 * <p>
 * 稳定度 = 窗口内众数标签的样本数 / 窗口内样本总数。窗口以该通道最近一条样本的时间为锚点，
 * 因此长时间没有新样本时不会让稳定度回退（宁可沿用旧数据，也不输出突兀的空值）。
 * 空窗口的取值由 {@link EmptyWindowPolicy} 决定，默认 1.0。
 * <p>
 * 线程安全：所有读写方法同步在实例上；封存（seal）之后的写入被拒绝，保证持久化的日志不会被部分写入。
 */
public class EmotionAggregator {
    private static final Logger log = LoggerFactory.getLogger(EmotionAggregator.class);

    public static final double DEFAULT_WINDOW_SECONDS = 30.0;
    public static final int DEFAULT_MAX_WINDOW_SAMPLES = 100;

    private final String sessionId;
    private final double windowSeconds;
    private final int maxWindowSamples;
    private final EmptyWindowPolicy emptyWindowPolicy;

    private final List<EmotionSample> samples = new ArrayList<>(256);
    private final Map<Modality, ArrayDeque<EmotionSample>> windows = new EnumMap<>(Modality.class);
    private boolean sealed = false;

    public EmotionAggregator(String sessionId) {
        this(sessionId, DEFAULT_WINDOW_SECONDS, DEFAULT_MAX_WINDOW_SAMPLES, EmptyWindowPolicy.STABLE);
    }

    public EmotionAggregator(String sessionId, double windowSeconds, int maxWindowSamples, EmptyWindowPolicy emptyWindowPolicy) {
        if (!(windowSeconds > 0)) throw new IllegalArgumentException("windowSeconds must be > 0");
        if (maxWindowSamples < 1) throw new IllegalArgumentException("maxWindowSamples must be >= 1");
        this.sessionId = sessionId;
        this.windowSeconds = windowSeconds;
        this.maxWindowSamples = maxWindowSamples;
        this.emptyWindowPolicy = emptyWindowPolicy == null ? EmptyWindowPolicy.STABLE : emptyWindowPolicy;
        for (Modality m : Modality.values()) {
            windows.put(m, new ArrayDeque<>(Math.min(maxWindowSamples, 128)));
        }
    }

    /**
     * 追加一条样本。同一通道内时间戳不允许倒退：早于上一条的时间戳会被钳到上一条。
     *
     * @return 写入的样本；聚合器已封存时返回 empty
     */
    public synchronized Optional<EmotionSample> record(Modality modality, String label, double confidence, double timestampSeconds) {
        if (sealed) {
            log.debug("Aggregator sealed, drop late sample: sessionId={}, modality={}", sessionId, modality);
            return Optional.empty();
        }
        ArrayDeque<EmotionSample> window = windows.get(modality);
        EmotionSample last = window.peekLast();
        double ts = timestampSeconds;
        if (last != null && ts < last.getTimestampSeconds()) {
            ts = last.getTimestampSeconds();
        }
        EmotionSample sample = new EmotionSample(sessionId, ts, modality, label, confidence);
        samples.add(sample);
        window.addLast(sample);
        while (window.size() > maxWindowSamples) {
            window.pollFirst();
        }
        return Optional.of(sample);
    }

    public synchronized Optional<EmotionSample> record(Modality modality, EmotionDetection detection, double timestampSeconds) {
        return record(modality, detection.getLabel(), detection.getConfidence(), timestampSeconds);
    }

    /**
     * 使用默认窗口计算稳定度。
     */
    public synchronized double stability(Modality modality) {
        return stability(modality, windowSeconds);
    }

    /**
     * 计算最近 windowSeconds 内（且不超过 maxWindowSamples 条）的稳定度。
     * 单条样本为 1.0；空窗口按策略返回 1.0 或 NaN（UNDEFINED）。
     */
    public synchronized double stability(Modality modality, double windowSeconds) {
        WindowStats stats = windowStats(modality, windowSeconds);
        if (stats.total == 0) {
            return emptyWindowPolicy == EmptyWindowPolicy.STABLE ? 1.0 : Double.NaN;
        }
        return (double) stats.modalCount / (double) stats.total;
    }

    /**
     * 窗口内出现次数最多的标签；并列时取最近出现的那个。空窗口返回 null。
     */
    public synchronized String dominantLabel(Modality modality) {
        return windowStats(modality, windowSeconds).modalLabel;
    }

    public synchronized EmotionSnapshot snapshot() {
        return new EmotionSnapshot(sessionId,
                modalitySnapshot(Modality.FACIAL),
                modalitySnapshot(Modality.VOICE),
                samples.size());
    }

    /**
     * 全量样本日志的只读副本。
     */
    public synchronized List<EmotionSample> samples() {
        return Collections.unmodifiableList(new ArrayList<>(samples));
    }

    public synchronized int size() {
        return samples.size();
    }

    /**
     * 封存并返回最终日志；此后的写入全部被拒绝。重复调用返回同一份内容。
     */
    public synchronized List<EmotionSample> seal() {
        sealed = true;
        return Collections.unmodifiableList(new ArrayList<>(samples));
    }

    public synchronized boolean isSealed() {
        return sealed;
    }

    public String getSessionId() { return sessionId; }
    public double getWindowSeconds() { return windowSeconds; }
    public EmptyWindowPolicy getEmptyWindowPolicy() { return emptyWindowPolicy; }

    private ModalitySnapshot modalitySnapshot(Modality modality) {
        EmotionSample latest = windows.get(modality).peekLast();
        WindowStats stats = windowStats(modality, windowSeconds);
        Double stability;
        if (stats.total == 0) {
            stability = emptyWindowPolicy == EmptyWindowPolicy.STABLE ? 1.0 : null;
        } else {
            stability = (double) stats.modalCount / (double) stats.total;
        }
        if (latest == null) {
            return new ModalitySnapshot(null, null, null, stability, 0);
        }
        return new ModalitySnapshot(latest.getLabel(), stats.modalLabel, latest.getConfidence(), stability, stats.total);
    }

    private WindowStats windowStats(Modality modality, double windowSeconds) {
        ArrayDeque<EmotionSample> window = windows.get(modality);
        EmotionSample latest = window.peekLast();
        if (latest == null) return new WindowStats(null, 0, 0);
        double cutoff = latest.getTimestampSeconds() - windowSeconds;

        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, Integer> lastSeen = new LinkedHashMap<>();
        int total = 0;
        int position = 0;
        Iterator<EmotionSample> it = window.descendingIterator();
        while (it.hasNext()) {
            EmotionSample s = it.next();
            if (s.getTimestampSeconds() < cutoff) break;
            counts.merge(s.getLabel(), 1, Integer::sum);
            lastSeen.putIfAbsent(s.getLabel(), position);
            total++;
            position++;
        }

        String modal = null;
        int modalCount = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            int c = e.getValue();
            if (c > modalCount || (c == modalCount && lastSeen.get(e.getKey()) < lastSeen.get(modal))) {
                modal = e.getKey();
                modalCount = c;
            }
        }
        return new WindowStats(modal, modalCount, total);
    }

    private static final class WindowStats {
        final String modalLabel;
        final int modalCount;
        final int total;

        WindowStats(String modalLabel, int modalCount, int total) {
            this.modalLabel = modalLabel;
            this.modalCount = modalCount;
            this.total = total;
        }
    }
}
