package com.deepknow.abis.interview.websocket;

import com.deepknow.abis.interview.domain.emotion.Modality;

/**
 * 解码后的入站消息。仅 VIDEO_FRAME / AUDIO_CHUNK 携带负载。
 */
public final class InboundMessage {
    public enum Type {
        VIDEO_FRAME("video_frame"),
        AUDIO_CHUNK("audio_chunk"),
        GET_SNAPSHOT("get_snapshot"),
        END("end"),
        PING("ping");

        private final String wireName;

        Type(String wireName) { this.wireName = wireName; }

        public String wireName() { return wireName; }

        public static Type fromWireName(String name) {
            for (Type t : values()) {
                if (t.wireName.equals(name)) return t;
            }
            return null;
        }
    }

    private final Type type;
    private final byte[] payload;
    private final double timestamp;

    InboundMessage(Type type, byte[] payload, double timestamp) {
        this.type = type;
        this.payload = payload;
        this.timestamp = timestamp;
    }

    public Type getType() { return type; }
    public byte[] getPayload() { return payload; }
    public double getTimestamp() { return timestamp; }

    public Modality modality() {
        if (type == Type.VIDEO_FRAME) return Modality.FACIAL;
        if (type == Type.AUDIO_CHUNK) return Modality.VOICE;
        return null;
    }
}
