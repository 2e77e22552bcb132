package com.deepknow.abis.interview.websocket;

import com.deepknow.abis.interview.domain.emotion.EmotionSnapshot;
import com.deepknow.abis.interview.domain.emotion.ModalitySnapshot;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

class InterviewStreamWebSocketHandlerTest {

    @Test
    void snapshotMessageUsesSnakeCaseKeys() {
        EmotionSnapshot snapshot = new EmotionSnapshot("s-1",
                new ModalitySnapshot("happy", "happy", 0.9, 0.8, 5),
                new ModalitySnapshot(null, null, null, 1.0, 0),
                5);

        Map<String, Object> msg = InterviewStreamWebSocketHandler.snapshotMessage("emotion_update", snapshot);

        assertThat(msg).containsEntry("type", "emotion_update");
        assertThat(msg).extractingByKey("data").asInstanceOf(MAP)
                .containsEntry("session_id", "s-1")
                .containsEntry("total_samples", 5L);
        assertThat(msg).extractingByKey("data").asInstanceOf(MAP)
                .extractingByKey("facial").asInstanceOf(MAP)
                .containsEntry("dominant_label", "happy")
                .containsEntry("stability", 0.8)
                .containsEntry("window_samples", 5);
        assertThat(msg).extractingByKey("data").asInstanceOf(MAP)
                .extractingByKey("voice").asInstanceOf(MAP)
                .containsEntry("label", null)
                .containsEntry("stability", 1.0);
    }
}
