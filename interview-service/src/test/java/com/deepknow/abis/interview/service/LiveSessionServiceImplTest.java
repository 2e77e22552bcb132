package com.deepknow.abis.interview.service;

import com.deepknow.abis.interview.api.InterviewApiException;
import com.deepknow.abis.interview.api.model.EmotionSnapshotView;
import com.deepknow.abis.interview.api.model.SessionClosedView;
import com.deepknow.abis.interview.domain.emotion.EmotionSnapshot;
import com.deepknow.abis.interview.domain.emotion.ModalitySnapshot;
import com.deepknow.abis.interview.domain.error.SessionNotFoundException;
import com.deepknow.abis.interview.domain.session.model.FinalizedSession;
import com.deepknow.abis.interview.domain.session.model.SessionState;
import com.deepknow.abis.interview.domain.session.service.SessionStreamService;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LiveSessionServiceImplTest {

    private final SessionStreamService stream = mock(SessionStreamService.class);
    private final LiveSessionServiceImpl service = new LiveSessionServiceImpl(stream);

    @Test
    void snapshotKeepsAbsentModalityEmpty() {
        EmotionSnapshot snapshot = new EmotionSnapshot("s-1",
                new ModalitySnapshot("happy", "happy", 0.8, 1.0, 5),
                new ModalitySnapshot(null, null, null, null, 0), 5);
        when(stream.requestSnapshot("s-1")).thenReturn(snapshot);

        EmotionSnapshotView view = service.getSnapshot("s-1");

        assertThat(view.getFacial().getLabel()).isEqualTo("happy");
        assertThat(view.getFacial().getStability()).isEqualTo(1.0);
        assertThat(view.getVoice().getLabel()).isNull();
        assertThat(view.getVoice().getConfidence()).isNull();
        assertThat(view.getTotalSamples()).isEqualTo(5);
    }

    @Test
    void closeReturnsArtifact() {
        when(stream.close("s-1")).thenReturn(new FinalizedSession("s-1", "recordings/s-1.wav", 7, 6,
                LocalDateTime.now().minusMinutes(1), LocalDateTime.now(), false));

        SessionClosedView view = service.closeSession("s-1");

        assertThat(view.getAudioArtifactRef()).isEqualTo("recordings/s-1.wav");
        assertThat(view.getPersistedSampleCount()).isEqualTo(6);
        assertThat(view.isAbrupt()).isFalse();
    }

    @Test
    void unknownSessionMapsToNotFound() {
        when(stream.requestSnapshot("missing")).thenThrow(new SessionNotFoundException("Session not found: missing"));

        assertThatThrownBy(() -> service.getSnapshot("missing"))
                .isInstanceOfSatisfying(InterviewApiException.class,
                        e -> assertThat(e.getCode()).isEqualTo("NOT_FOUND"));
    }

    @Test
    void stateIsReportedByName() {
        when(stream.stateOf("s-1")).thenReturn(SessionState.CLOSING);

        assertThat(service.getState("s-1")).isEqualTo("CLOSING");
    }
}
