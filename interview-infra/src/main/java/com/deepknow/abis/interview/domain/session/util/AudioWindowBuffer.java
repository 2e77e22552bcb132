package com.deepknow.abis.interview.domain.session.util;

/**
 * 语音分析窗口：累积 PCM 直到满一个窗口，然后整体取出。
 * 同步方法保护内部缓冲，检测线程与接入线程可并发调用。
 */
public class AudioWindowBuffer {
    private final byte[] buffer;
    private int size = 0;

    public AudioWindowBuffer(int windowBytes) {
        // PCM16 需要偶数长度
        this.buffer = new byte[Math.max(2, windowBytes & ~1)];
    }

    /**
     * 追加一块音频；若窗口已满，返回完整窗口并清空缓冲，超出部分留到下一窗口。
     *
     * @return 满窗口时返回窗口数据，否则 null
     */
    public synchronized byte[] append(byte[] chunk) {
        if (chunk == null || chunk.length == 0) return null;
        byte[] full = null;
        int offset = 0;
        while (offset < chunk.length) {
            int n = Math.min(buffer.length - size, chunk.length - offset);
            System.arraycopy(chunk, offset, buffer, size, n);
            size += n;
            offset += n;
            if (size == buffer.length) {
                // 同一块跨越多个窗口时只保留最新的完整窗口
                full = buffer.clone();
                size = 0;
            }
        }
        return full;
    }

    public synchronized int size() {
        return size;
    }

    public synchronized void clear() {
        size = 0;
    }

    public int capacity() {
        return buffer.length;
    }
}
