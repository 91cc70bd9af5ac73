package com.blissfly.proxy.core.session;

import com.blissfly.proxy.core.exceptions.ProtocolException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebSocketFrameCodecTest {

    @Test
    void acceptKey_matchesRfcExample() {
        assertThat(WebSocketFrameCodec.acceptKey("dGhlIHNhbXBsZSBub25jZQ=="))
                .isEqualTo("s3pPLMBiTxaQ9kYGzvzhZRHnpk4=");
    }

    @Test
    void readFrame_unmasksClientPayload() throws IOException {
        byte[] frame = Frames.masked(true, WebSocketFrameCodec.OPCODE_TEXT, "Hello".getBytes(StandardCharsets.UTF_8));

        WebSocketFrame decoded = WebSocketFrameCodec.readFrame(new ByteArrayInputStream(frame), 1024);

        assertThat(decoded.fin()).isTrue();
        assertThat(decoded.opcode()).isEqualTo(WebSocketFrameCodec.OPCODE_TEXT);
        assertThat(decoded.text()).isEqualTo("Hello");
        assertThat(decoded.isControl()).isFalse();
    }

    @Test
    void readFrame_handlesExtendedLengths() throws IOException {
        byte[] payload = new byte[300];
        payload[299] = 7;

        WebSocketFrame decoded = WebSocketFrameCodec.readFrame(
                new ByteArrayInputStream(Frames.masked(true, WebSocketFrameCodec.OPCODE_BINARY, payload)), 1024);

        assertThat(decoded.payload()).hasSize(300);
        assertThat(decoded.payload()[299]).isEqualTo((byte) 7);
    }

    @Test
    void readFrame_returnsNullAtEndOfStream() throws IOException {
        assertThat(WebSocketFrameCodec.readFrame(new ByteArrayInputStream(new byte[0]), 10)).isNull();
    }

    @Test
    void readFrame_rejectsUnmaskedFrames() {
        byte[] unmasked = { (byte) 0x81, 0x01, 'a' };

        assertThatThrownBy(() -> WebSocketFrameCodec.readFrame(new ByteArrayInputStream(unmasked), 10))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("not masked");
    }

    @Test
    void readFrame_rejectsOversizedPayload() {
        byte[] frame = Frames.masked(true, WebSocketFrameCodec.OPCODE_TEXT, new byte[64]);

        assertThatThrownBy(() -> WebSocketFrameCodec.readFrame(new ByteArrayInputStream(frame), 16))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("too large");
    }

    @Test
    void readFrame_rejectsFragmentedControlFrames() {
        byte[] frame = Frames.masked(false, WebSocketFrameCodec.OPCODE_PING, new byte[1]);

        assertThatThrownBy(() -> WebSocketFrameCodec.readFrame(new ByteArrayInputStream(frame), 16))
                .isInstanceOf(ProtocolException.class);
    }

    @Test
    void readFrame_failsOnTruncatedInput() {
        byte[] frame = Frames.masked(true, WebSocketFrameCodec.OPCODE_TEXT, new byte[10]);
        byte[] truncated = new byte[frame.length - 3];
        System.arraycopy(frame, 0, truncated, 0, truncated.length);

        assertThatThrownBy(() -> WebSocketFrameCodec.readFrame(new ByteArrayInputStream(truncated), 16))
                .isInstanceOf(EOFException.class);
    }

    @Test
    void writeFrame_producesUnmaskedServerFrames() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        WebSocketFrameCodec.writeText(out, "hi");
        WebSocketFrameCodec.writeFrame(out, WebSocketFrameCodec.OPCODE_BINARY, new byte[200]);

        byte[] bytes = out.toByteArray();
        assertThat(bytes[0]).isEqualTo((byte) 0x81);
        assertThat(bytes[1]).isEqualTo((byte) 2);
        assertThat(new String(bytes, 2, 2, StandardCharsets.UTF_8)).isEqualTo("hi");
        assertThat(bytes[4]).isEqualTo((byte) 0x82);
        assertThat(bytes[5]).isEqualTo((byte) 126);
        assertThat(((bytes[6] & 0xFF) << 8) | (bytes[7] & 0xFF)).isEqualTo(200);
        assertThat(bytes).hasSize(4 + 4 + 200);
    }
}
