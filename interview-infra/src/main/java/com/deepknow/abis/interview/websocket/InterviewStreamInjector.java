package com.deepknow.abis.interview.websocket;

import com.deepknow.abis.interview.config.LiveSessionProperties;
import com.deepknow.abis.interview.domain.session.service.SessionStreamService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;

@Component
public class InterviewStreamInjector {

    private final SessionStreamService sessionStreamService;
    private final LiveSessionProperties liveProps;
    private final ObjectMapper objectMapper;

    public InterviewStreamInjector(SessionStreamService sessionStreamService,
                                   LiveSessionProperties liveProps,
                                   ObjectMapper objectMapper) {
        this.sessionStreamService = sessionStreamService;
        this.liveProps = liveProps;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void inject() {
        InterviewStreamWebSocketHandler.setSessionStreamService(sessionStreamService);
        InterviewStreamWebSocketHandler.setDecoder(new InboundMessageDecoder(objectMapper, liveProps.getMaxFrameBytes()));
    }
}
