package com.blissfly.proxy.core.rewrite;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Output of {@link ContentRewriter#transform}.
 *
 * @param body        Bytes to send to the client.
 * @param contentType Content type to announce; updated to UTF-8 when the body was rewritten.
 * @param rewritten   Whether the body differs from the upstream body.
 */
@SuppressFBWarnings({ "EI_EXPOSE_REP", "EI_EXPOSE_REP2" })
public record RewrittenContent(byte[] body, String contentType, boolean rewritten) {
}
