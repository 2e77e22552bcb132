package com.deepknow.abis.interview.domain.assessment.transcription;

import com.deepknow.abis.interview.domain.assessment.model.Speaker;
import com.deepknow.abis.interview.domain.assessment.model.Transcript;
import com.deepknow.abis.interview.domain.error.TranscriptionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DashScopeTranscriptionClientTest {

    @TempDir
    Path dir;

    @Test
    void parsesSentencesWithSpeakerRoles() {
        String json = "{\"sentences\":["
                + "{\"begin_time\":0,\"end_time\":2500,\"text\":\"Tell me about yourself.\",\"speaker_id\":0},"
                + "{\"begin_time\":2600,\"end_time\":9000,\"text\":\" I lead the payments team. \",\"speaker_id\":1},"
                + "{\"begin_time\":9000,\"end_time\":9100,\"text\":\"\"}]}";

        Transcript t = DashScopeTranscriptionClient.parse(json, "0");

        assertThat(t.getSegments()).hasSize(2);
        assertThat(t.getSegments().get(0).getSpeaker()).isEqualTo(Speaker.INTERVIEWER);
        assertThat(t.candidateSegments()).singleElement()
                .satisfies(s -> {
                    assertThat(s.getText()).isEqualTo("I lead the payments team.");
                    assertThat(s.getStartSeconds()).isEqualTo(2.6);
                    assertThat(s.getEndSeconds()).isEqualTo(9.0);
                });
    }

    @Test
    void readsNestedOutputAndPlainText() {
        Transcript nested = DashScopeTranscriptionClient.parse(
                "{\"output\":{\"sentences\":[{\"begin_time\":0,\"end_time\":1000,\"text\":\"hello there\"}]}}", null);
        Transcript plain = DashScopeTranscriptionClient.parse("{\"text\":\"just text\"}", null);

        assertThat(nested.candidateSegments()).hasSize(1);
        assertThat(plain.fullText()).isEqualTo("just text");
    }

    @Test
    void malformedResultFails() {
        assertThatThrownBy(() -> DashScopeTranscriptionClient.parse("not json", null))
                .isInstanceOf(TranscriptionException.class);
    }

    @Test
    void missingAudioFailsBeforeCallingService() throws Exception {
        DashScopeTranscriptionClient client = new DashScopeTranscriptionClient("key", "paraformer-realtime-v2", 16000,
                List.of("zh"), null);
        Path empty = Files.write(dir.resolve("empty.wav"), new byte[44]);

        assertThatThrownBy(() -> client.transcribe(null)).isInstanceOf(TranscriptionException.class);
        assertThatThrownBy(() -> client.transcribe(dir.resolve("none.wav").toString()))
                .isInstanceOf(TranscriptionException.class);
        assertThatThrownBy(() -> client.transcribe(empty.toString())).isInstanceOf(TranscriptionException.class);
    }
}
