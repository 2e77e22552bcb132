package com.deepknow.abis.interview.websocket;

import com.deepknow.abis.interview.domain.emotion.Modality;
import com.deepknow.abis.interview.domain.error.InvalidFrameException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InboundMessageDecoderTest {

    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0, 16};

    private final InboundMessageDecoder decoder = new InboundMessageDecoder(new ObjectMapper(), 1024);

    private static String b64(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }

    @Test
    void decodesVideoFrameFromDataUrl() {
        String json = "{\"type\":\"video_frame\",\"data\":\"data:image/jpeg;base64," + b64(JPEG) + "\",\"timestamp\":3.5}";

        InboundMessage msg = decoder.decodeText(json);

        assertThat(msg.getType()).isEqualTo(InboundMessage.Type.VIDEO_FRAME);
        assertThat(msg.modality()).isEqualTo(Modality.FACIAL);
        assertThat(msg.getPayload()).isEqualTo(JPEG);
        assertThat(msg.getTimestamp()).isEqualTo(3.5);
    }

    @Test
    void rejectsVideoThatIsNotAnImage() {
        String json = "{\"type\":\"video_frame\",\"data\":\"" + b64(new byte[]{1, 2, 3, 4}) + "\"}";

        assertThatThrownBy(() -> decoder.decodeText(json))
                .isInstanceOf(InvalidFrameException.class)
                .hasMessageContaining("JPEG or PNG");
    }

    @Test
    void decodesAudioChunkAndDefaultsTimestamp() {
        String json = "{\"type\":\"audio_chunk\",\"data\":\"" + b64(new byte[]{1, 0, 2, 0}) + "\",\"timestamp\":-1}";

        InboundMessage msg = decoder.decodeText(json);

        assertThat(msg.modality()).isEqualTo(Modality.VOICE);
        assertThat(msg.getPayload()).hasSize(4);
        assertThat(msg.getTimestamp()).isZero();
    }

    @Test
    void rejectsOddLengthPcm() {
        assertThatThrownBy(() -> decoder.decodeBinary(new byte[]{1, 2, 3}))
                .isInstanceOf(InvalidFrameException.class);
        String json = "{\"type\":\"audio_chunk\",\"data\":\"" + b64(new byte[]{1, 2, 3}) + "\"}";
        assertThatThrownBy(() -> decoder.decodeText(json)).isInstanceOf(InvalidFrameException.class);
    }

    @Test
    void rejectsOversizedPayloads() {
        assertThatThrownBy(() -> decoder.decodeBinary(new byte[2048]))
                .isInstanceOf(InvalidFrameException.class)
                .hasMessageContaining("1024");
        String json = "{\"type\":\"audio_chunk\",\"data\":\"" + b64(new byte[2048]) + "\"}";
        assertThatThrownBy(() -> decoder.decodeText(json)).isInstanceOf(InvalidFrameException.class);
    }

    @Test
    void rejectsMalformedOrUnknownMessages() {
        assertThatThrownBy(() -> decoder.decodeText("{not json")).isInstanceOf(InvalidFrameException.class);
        assertThatThrownBy(() -> decoder.decodeText("[1,2]")).isInstanceOf(InvalidFrameException.class);
        assertThatThrownBy(() -> decoder.decodeText("{\"type\":\"dance\"}"))
                .isInstanceOf(InvalidFrameException.class)
                .hasMessageContaining("dance");
        assertThatThrownBy(() -> decoder.decodeText("{\"type\":\"video_frame\"}"))
                .isInstanceOf(InvalidFrameException.class)
                .hasMessageContaining("Missing payload");
        assertThatThrownBy(() -> decoder.decodeText(" ")).isInstanceOf(InvalidFrameException.class);
    }

    @Test
    void controlMessagesCarryNoPayload() {
        assertThat(decoder.decodeText("{\"type\":\"ping\"}").getType()).isEqualTo(InboundMessage.Type.PING);
        assertThat(decoder.decodeText("{\"type\":\"get_snapshot\"}").getPayload()).isNull();
        assertThat(decoder.decodeText("{\"type\":\"end\"}").getType()).isEqualTo(InboundMessage.Type.END);
    }
}
