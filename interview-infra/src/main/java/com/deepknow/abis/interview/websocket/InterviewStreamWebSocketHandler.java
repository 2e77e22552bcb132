package com.deepknow.abis.interview.websocket;

import com.deepknow.abis.interview.domain.emotion.EmotionSnapshot;
import com.deepknow.abis.interview.domain.emotion.ModalitySnapshot;
import com.deepknow.abis.interview.domain.error.InterviewException;
import com.deepknow.abis.interview.domain.session.model.FinalizedSession;
import com.deepknow.abis.interview.domain.session.model.SessionCallbacks;
import com.deepknow.abis.interview.domain.session.service.SessionStreamService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.websocket.CloseReason;
import javax.websocket.OnClose;
import javax.websocket.OnError;
import javax.websocket.OnMessage;
import javax.websocket.OnOpen;
import javax.websocket.Session;
import javax.websocket.server.ServerEndpoint;
import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 直播会话通道：/interview/stream?sessionId=xxx
 * <p>
 * 入站：video_frame / audio_chunk / get_snapshot / end / ping（文本 JSON），二进制帧视为 PCM16LE 音频块。
 * 出站：emotion_update / snapshot / pong / session_closed / error。
 * 单帧错误只回一条 error 消息，不关闭通道。
 */
@Component
@ServerEndpoint(value = "/interview/stream")
public class InterviewStreamWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(InterviewStreamWebSocketHandler.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    // 容器创建端点实例，不经 Spring 注入，由 Injector 写入静态字段
    private static SessionStreamService sessionStreamService;
    private static InboundMessageDecoder decoder;

    public static void setSessionStreamService(SessionStreamService service) { sessionStreamService = service; }
    public static void setDecoder(InboundMessageDecoder d) { decoder = d; }

    private static SessionStreamService ensureService() {
        if (sessionStreamService == null) {
            try {
                sessionStreamService = InterviewStreamEndpointConfig.lookup(SessionStreamService.class);
            } catch (Exception e) {
                log.warn("Lookup SessionStreamService failed: {}", e.getMessage());
            }
        }
        return sessionStreamService;
    }

    private static InboundMessageDecoder ensureDecoder() {
        if (decoder == null) {
            decoder = new InboundMessageDecoder(objectMapper, 2 * 1024 * 1024);
        }
        return decoder;
    }

    private String sessionId;

    @OnOpen
    public void onOpen(Session session) {
        log.info("WS connected: {}", session.getId());
        if (ensureService() == null) {
            log.warn("SessionStreamService not injected; refuse open for ws {}", session.getId());
            closeQuietly(session, new CloseReason(CloseReason.CloseCodes.UNEXPECTED_CONDITION, "SERVICE_NOT_READY"));
            return;
        }
        String sid = parseQueryParam(session, "sessionId");
        if (sid == null || sid.isBlank()) {
            sendError(session, "SESSION_STATE", "sessionId query parameter is required");
            closeQuietly(session, new CloseReason(CloseReason.CloseCodes.VIOLATED_POLICY, "MISSING_SESSION_ID"));
            return;
        }
        SessionCallbacks callbacks = SessionCallbacks.of(
                snapshot -> sendJson(session, snapshotMessage("emotion_update", snapshot)),
                finalized -> sendJson(session, closedMessage(finalized)),
                ex -> sendError(session, "RECORDING_FAILED", ex.getMessage())
        );
        try {
            sessionStreamService.open(sid, callbacks);
            this.sessionId = sid;
            log.info("Open session: wsSessionId={}, sessionId={}", session.getId(), sid);
        } catch (InterviewException e) {
            log.warn("Open session rejected: wsSessionId={}, sessionId={}, code={}", session.getId(), sid, e.getCode());
            sendError(session, e.getCode(), e.getMessage());
            closeQuietly(session, new CloseReason(CloseReason.CloseCodes.VIOLATED_POLICY, e.getCode()));
        }
    }

    @OnMessage
    public void onBinaryMessage(ByteBuffer message, Session session) {
        log.trace("Received audio chunk, bytes={}", message.remaining());
        if (sessionId == null || ensureService() == null) return;
        byte[] bytes = new byte[message.remaining()];
        message.get(bytes);
        try {
            InboundMessage msg = ensureDecoder().decodeBinary(bytes);
            sessionStreamService.ingestFrame(sessionId, msg.modality(), msg.getPayload(), msg.getTimestamp());
        } catch (InterviewException e) {
            log.debug("Reject binary frame: sessionId={}, code={}, reason={}", sessionId, e.getCode(), e.getMessage());
            sendError(session, e.getCode(), e.getMessage());
        }
    }

    @OnMessage
    public void onTextMessage(String text, Session session) {
        if (sessionId == null || ensureService() == null) return;
        try {
            InboundMessage msg = ensureDecoder().decodeText(text);
            switch (msg.getType()) {
                case VIDEO_FRAME:
                case AUDIO_CHUNK:
                    sessionStreamService.ingestFrame(sessionId, msg.modality(), msg.getPayload(), msg.getTimestamp());
                    break;
                case GET_SNAPSHOT:
                    sendJson(session, snapshotMessage("snapshot", sessionStreamService.requestSnapshot(sessionId)));
                    break;
                case PING:
                    sendJson(session, Map.of("type", "pong"));
                    break;
                case END:
                    log.info("Client requested end: sessionId={}", sessionId);
                    // session_closed 由 onClosed 回调推送
                    sessionStreamService.close(sessionId);
                    closeQuietly(session, new CloseReason(CloseReason.CloseCodes.NORMAL_CLOSURE, "SESSION_ENDED"));
                    break;
                default:
                    break;
            }
        } catch (InterviewException e) {
            log.debug("Reject message: sessionId={}, code={}, reason={}", sessionId, e.getCode(), e.getMessage());
            sendError(session, e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Handle message failed: sessionId={}", sessionId, e);
            sendError(session, "INTERNAL", "internal error");
        }
    }

    @OnClose
    public void onClose(Session session, CloseReason reason) {
        log.info("WS closed: {} sessionId={} status={}", session.getId(), sessionId, reason);
        disconnect();
    }

    @OnError
    public void onError(Session session, Throwable throwable) {
        String msg = throwable != null ? throwable.getMessage() : "unknown";
        log.warn("WS error: sessionId={} {}", sessionId, msg, throwable);
        disconnect();
    }

    private void disconnect() {
        if (sessionId == null || ensureService() == null) return;
        try {
            // 已正常关闭时返回缓存结果，不会重复收尾
            sessionStreamService.disconnect(sessionId);
        } catch (RuntimeException e) {
            log.warn("Disconnect failed: sessionId={}", sessionId, e);
        }
    }

    static Map<String, Object> snapshotMessage(String type, EmotionSnapshot snapshot) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("session_id", snapshot.getSessionId());
        data.put("facial", modalityView(snapshot.getFacial()));
        data.put("voice", modalityView(snapshot.getVoice()));
        data.put("total_samples", snapshot.getTotalSamples());
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", type);
        msg.put("data", data);
        return msg;
    }

    private static Map<String, Object> modalityView(ModalitySnapshot m) {
        Map<String, Object> v = new LinkedHashMap<>();
        v.put("label", m.getLabel());
        v.put("dominant_label", m.getDominantLabel());
        v.put("confidence", m.getConfidence());
        v.put("stability", m.getStability());
        v.put("window_samples", m.getWindowSamples());
        return v;
    }

    private static Map<String, Object> closedMessage(FinalizedSession f) {
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", "session_closed");
        msg.put("session_id", f.getSessionId());
        msg.put("audio_artifact", f.getAudioArtifactRef());
        msg.put("samples", f.getEmotionSampleCount());
        msg.put("abrupt", f.isAbrupt());
        return msg;
    }

    private void sendError(Session session, String code, String message) {
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", "error");
        msg.put("code", code);
        msg.put("message", message == null ? "" : message);
        sendJson(session, msg);
    }

    private void sendJson(Session session, Map<String, Object> obj) {
        if (session == null || !session.isOpen()) return;
        try {
            String json = objectMapper.writeValueAsString(obj);
            // 检测线程与容器线程都会推送，basicRemote 不允许并发写
            synchronized (session) {
                session.getBasicRemote().sendText(json);
            }
        } catch (IOException | IllegalStateException e) {
            log.warn("Send {} failed: sessionId={}", obj.get("type"), sessionId, e);
        }
    }

    private void closeQuietly(Session session, CloseReason reason) {
        try {
            if (session != null && session.isOpen()) session.close(reason);
        } catch (IOException e) {
            log.debug("Close ws failed: {}", e.getMessage());
        }
    }

    private String parseQueryParam(Session session, String key) {
        try {
            URI uri = session.getRequestURI();
            String query = uri.getQuery();
            if (query == null || query.isEmpty()) return null;
            for (String p : query.split("&")) {
                int i = p.indexOf('=');
                if (i > 0 && key.equals(p.substring(0, i))) {
                    return URLDecoder.decode(p.substring(i + 1), StandardCharsets.UTF_8);
                }
            }
        } catch (Exception e) {
            log.warn("Failed to parse query param {}", key);
        }
        return null;
    }
}
