package com.deepknow.abis.interview.websocket;

import com.deepknow.abis.interview.domain.error.InvalidFrameException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Base64;

/**
 * 帧接入校验与解码。
 * <ul>
 *   <li>文本帧：{"type":..,"data":"&lt;base64 或 data URL&gt;","timestamp":秒}</li>
 *   <li>二进制帧：原始 PCM16LE 音频块</li>
 * </ul>
 * 视频负载必须是 JPEG/PNG；音频负载必须为偶数字节。
 */
public class InboundMessageDecoder {
    private static final byte[] JPEG_MAGIC = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final byte[] PNG_MAGIC = {(byte) 0x89, 'P', 'N', 'G'};

    private final ObjectMapper objectMapper;
    private final int maxFrameBytes;

    public InboundMessageDecoder(ObjectMapper objectMapper, int maxFrameBytes) {
        this.objectMapper = objectMapper;
        this.maxFrameBytes = maxFrameBytes;
    }

    public InboundMessage decodeText(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidFrameException("Empty message");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (Exception e) {
            throw new InvalidFrameException("Malformed JSON message");
        }
        if (root == null || !root.isObject()) {
            throw new InvalidFrameException("Message must be a JSON object");
        }
        String typeName = root.path("type").asText("");
        InboundMessage.Type type = InboundMessage.Type.fromWireName(typeName);
        if (type == null) {
            throw new InvalidFrameException("Unknown message type: " + typeName);
        }
        double ts = root.path("timestamp").asDouble(0.0);
        if (Double.isNaN(ts) || ts < 0) ts = 0.0;
        switch (type) {
            case VIDEO_FRAME: {
                byte[] image = decodeBase64(root.path("data").asText(""));
                if (!startsWith(image, JPEG_MAGIC) && !startsWith(image, PNG_MAGIC)) {
                    throw new InvalidFrameException("Video frame must be JPEG or PNG");
                }
                return new InboundMessage(type, image, ts);
            }
            case AUDIO_CHUNK: {
                byte[] pcm = decodeBase64(root.path("data").asText(""));
                checkPcm(pcm);
                return new InboundMessage(type, pcm, ts);
            }
            default:
                return new InboundMessage(type, null, ts);
        }
    }

    public InboundMessage decodeBinary(byte[] pcm) {
        if (pcm == null || pcm.length == 0) {
            throw new InvalidFrameException("Empty audio chunk");
        }
        if (pcm.length > maxFrameBytes) {
            throw new InvalidFrameException("Audio chunk exceeds " + maxFrameBytes + " bytes");
        }
        checkPcm(pcm);
        return new InboundMessage(InboundMessage.Type.AUDIO_CHUNK, pcm, 0.0);
    }

    private byte[] decodeBase64(String data) {
        if (data.isEmpty()) {
            throw new InvalidFrameException("Missing payload");
        }
        int comma = data.startsWith("data:") ? data.indexOf(',') : -1;
        String b64 = comma >= 0 ? data.substring(comma + 1) : data;
        // base64 展开约 3/4
        if ((long) b64.length() * 3 / 4 > maxFrameBytes) {
            throw new InvalidFrameException("Payload exceeds " + maxFrameBytes + " bytes");
        }
        byte[] bytes;
        try {
            bytes = Base64.getMimeDecoder().decode(b64);
        } catch (IllegalArgumentException e) {
            throw new InvalidFrameException("Payload is not valid base64");
        }
        if (bytes.length == 0) {
            throw new InvalidFrameException("Missing payload");
        }
        return bytes;
    }

    private static void checkPcm(byte[] pcm) {
        if (pcm.length % 2 != 0) {
            throw new InvalidFrameException("PCM16 audio must have an even byte length");
        }
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) return false;
        }
        return true;
    }
}
