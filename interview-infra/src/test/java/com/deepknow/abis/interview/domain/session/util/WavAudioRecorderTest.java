package com.deepknow.abis.interview.domain.session.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class WavAudioRecorderTest {

    @TempDir
    Path dir;

    @Test
    void finishPatchesHeaderWithDataLength() throws Exception {
        WavAudioRecorder recorder = WavAudioRecorder.start(dir.toString(), "sess/01", 16000);
        recorder.write(new byte[3200]);
        recorder.write(new byte[3200]);

        String ref = recorder.finish();

        Path file = Path.of(ref);
        assertThat(file.getFileName().toString()).startsWith("interview_sess_01_").endsWith(".wav");
        byte[] bytes = Files.readAllBytes(file);
        assertThat(bytes).hasSize(44 + 6400);
        ByteBuffer header = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        assertThat(new String(bytes, 0, 4)).isEqualTo("RIFF");
        assertThat(header.getInt(4)).isEqualTo(36 + 6400);
        assertThat(header.getInt(24)).isEqualTo(16000);
        assertThat(header.getInt(40)).isEqualTo(6400);
        assertThat(recorder.durationSeconds()).isEqualTo(0.2);
    }

    @Test
    void finishIsRepeatableAndIgnoresLateWrites() throws Exception {
        WavAudioRecorder recorder = new WavAudioRecorder(dir.resolve("a.wav"), 16000);
        recorder.write(new byte[100]);

        String first = recorder.finish();
        recorder.write(new byte[100]);
        String second = recorder.finish();

        assertThat(second).isEqualTo(first);
        assertThat(recorder.getDataBytes()).isEqualTo(100);
        assertThat(Files.size(dir.resolve("a.wav"))).isEqualTo(144);
    }
}
