package com.deepknow.abis.interview.service;

import com.deepknow.abis.interview.api.InterviewApiException;
import com.deepknow.abis.interview.api.request.CreateSessionRequest;
import com.deepknow.abis.interview.api.request.EndSessionRequest;
import com.deepknow.abis.interview.domain.error.SessionStateException;
import com.deepknow.abis.interview.domain.session.service.SessionService;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionCreateServiceImplTest {

    private final SessionService sessionService = mock(SessionService.class);
    private final SessionCreateServiceImpl service = new SessionCreateServiceImpl(sessionService);

    @Test
    void duplicateCreateMapsToSessionState() {
        doThrow(new SessionStateException("Session already exists: s-1"))
                .when(sessionService).createSession("s-1", "u-1", null);
        CreateSessionRequest req = new CreateSessionRequest();
        req.setSessionId("s-1");
        req.setUserId("u-1");

        assertThatThrownBy(() -> service.createSession(req))
                .isInstanceOfSatisfying(InterviewApiException.class,
                        e -> assertThat(e.getCode()).isEqualTo("SESSION_STATE"));
    }

    @Test
    void endReturnsArtifactRef() {
        when(sessionService.endSession("s-1")).thenReturn("recordings/s-1.wav");
        EndSessionRequest req = new EndSessionRequest();
        req.setSessionId("s-1");

        assertThat(service.endSession(req)).isEqualTo("recordings/s-1.wav");
    }
}
