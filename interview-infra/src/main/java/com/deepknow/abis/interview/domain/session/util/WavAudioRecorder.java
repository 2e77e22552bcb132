package com.deepknow.abis.interview.domain.session.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * 以 WAV（PCM16 小端、单声道）持续落盘会话音频。先写占位头，finish 时回填长度字段。
 * 非线程安全，调用方负责串行化。
 */
public class WavAudioRecorder implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(WavAudioRecorder.class);
    private static final int HEADER_BYTES = 44;
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path path;
    private final int sampleRate;
    private RandomAccessFile file;
    private long dataBytes = 0;
    private boolean finished = false;

    public WavAudioRecorder(Path path, int sampleRate) throws IOException {
        this.path = path;
        this.sampleRate = sampleRate;
        if (path.getParent() != null) Files.createDirectories(path.getParent());
        this.file = new RandomAccessFile(path.toFile(), "rw");
        this.file.setLength(0);
        this.file.write(header(0));
    }

    public static WavAudioRecorder start(String recordingsDir, String sessionId, int sampleRate) throws IOException {
        String name = "interview_" + sessionId.replaceAll("[^A-Za-z0-9_-]", "_") + "_" + LocalDateTime.now().format(TS) + ".wav";
        WavAudioRecorder recorder = new WavAudioRecorder(Path.of(recordingsDir, name), sampleRate);
        logger.info("Recording started: sessionId={}, file={}", sessionId, recorder.path);
        return recorder;
    }

    public void write(byte[] pcm) throws IOException {
        if (finished || pcm == null || pcm.length == 0) return;
        file.write(pcm);
        dataBytes += pcm.length;
    }

    /**
     * 回填头部并关闭文件。可重复调用。
     *
     * @return 音频文件路径
     */
    public String finish() throws IOException {
        if (!finished) {
            finished = true;
            try {
                file.seek(0);
                file.write(header(dataBytes));
            } finally {
                file.close();
                file = null;
            }
            logger.info("Recording finished: file={}, dataBytes={}, seconds={}",
                    path, dataBytes, String.format("%.1f", durationSeconds()));
        }
        return path.toString();
    }

    public double durationSeconds() {
        return dataBytes / 2.0 / sampleRate;
    }

    public long getDataBytes() { return dataBytes; }
    public Path getPath() { return path; }

    @Override
    public void close() throws IOException {
        finish();
    }

    private byte[] header(long dataLen) {
        ByteBuffer b = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        b.put(new byte[]{'R', 'I', 'F', 'F'});
        b.putInt((int) (36 + dataLen));
        b.put(new byte[]{'W', 'A', 'V', 'E'});
        b.put(new byte[]{'f', 'm', 't', ' '});
        b.putInt(16);
        b.putShort((short) 1);            // PCM
        b.putShort((short) 1);            // mono
        b.putInt(sampleRate);
        b.putInt(sampleRate * 2);         // byte rate
        b.putShort((short) 2);            // block align
        b.putShort((short) 16);           // bits per sample
        b.put(new byte[]{'d', 'a', 't', 'a'});
        b.putInt((int) dataLen);
        return b.array();
    }
}
