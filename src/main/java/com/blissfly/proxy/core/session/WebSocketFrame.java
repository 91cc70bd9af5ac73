package com.blissfly.proxy.core.session;

import java.nio.charset.StandardCharsets;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * One decoded RFC 6455 frame, payload already unmasked.
 *
 * @param fin     Whether this is the final fragment of a message.
 * @param opcode  Frame opcode, see the constants in {@link WebSocketFrameCodec}.
 * @param payload Unmasked payload bytes.
 */
@SuppressFBWarnings({ "EI_EXPOSE_REP", "EI_EXPOSE_REP2" })
public record WebSocketFrame(boolean fin, int opcode, byte[] payload) {

    /**
     * @return The payload interpreted as UTF-8 text.
     */
    public String text() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    public boolean isControl() {
        return (opcode & 0x08) != 0;
    }
}
