package com.deepknow.abis.interview.domain.session;

import com.deepknow.abis.interview.domain.error.SessionNotFoundException;
import com.deepknow.abis.interview.domain.error.SessionStateException;
import com.deepknow.abis.interview.domain.session.model.FinalizedSession;
import com.deepknow.abis.interview.domain.session.model.InterviewSession;
import com.deepknow.abis.interview.domain.session.model.SessionState;
import com.deepknow.abis.interview.domain.session.service.SessionStreamService;
import com.deepknow.abis.interview.repo.mapper.InterviewSessionMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.LocalDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionServiceImplTest {

    private InterviewSessionMapper mapper;
    private SessionStreamService stream;
    private SessionServiceImpl service;

    @BeforeEach
    void setUp() {
        mapper = mock(InterviewSessionMapper.class);
        stream = mock(SessionStreamService.class);
        when(stream.stateOf(anyString())).thenReturn(SessionState.IDLE);
        service = new SessionServiceImpl(mapper, stream, new ObjectMapper());
    }

    @Test
    void createInsertsIdleRecordWithConfigJson() {
        service.createSession("s-1", "u-1", Map.of("position", "backend"));

        ArgumentCaptor<InterviewSession> captor = ArgumentCaptor.forClass(InterviewSession.class);
        verify(mapper).insert(captor.capture());
        InterviewSession saved = captor.getValue();
        assertThat(saved.getStatus()).isEqualTo("IDLE");
        assertThat(saved.getProcessingStatus()).isEqualTo("RECORDING");
        assertThat(saved.getConfigJson()).isEqualTo("{\"position\":\"backend\"}");
    }

    @Test
    void duplicateOrBlankIdIsRejected() {
        when(mapper.findById("s-1")).thenReturn(new InterviewSession());

        assertThatThrownBy(() -> service.createSession("s-1", "u-1", null)).isInstanceOf(SessionStateException.class);
        assertThatThrownBy(() -> service.createSession(" ", "u-1", null)).isInstanceOf(SessionStateException.class);
        verify(mapper, never()).insert(any());
    }

    @Test
    void endClosesLiveSessionThroughStream() {
        when(stream.stateOf("s-1")).thenReturn(SessionState.OPEN);
        when(stream.close("s-1")).thenReturn(new FinalizedSession("s-1", "recordings/s-1.wav", 3, 3,
                LocalDateTime.now().minusMinutes(5), LocalDateTime.now(), false));

        assertThat(service.endSession("s-1")).isEqualTo("recordings/s-1.wav");
        verify(mapper, never()).updateStatus(anyString(), anyString(), any());
    }

    @Test
    void endMarksIdleRecordClosed() {
        InterviewSession record = new InterviewSession();
        record.setId("s-1");
        record.setStatus("IDLE");
        when(mapper.findById("s-1")).thenReturn(record);

        assertThat(service.endSession("s-1")).isNull();
        verify(mapper).updateStatus(eq("s-1"), eq("CLOSED"), any());
    }

    @Test
    void endUnknownSessionFails() {
        assertThatThrownBy(() -> service.endSession("missing")).isInstanceOf(SessionNotFoundException.class);
    }
}
