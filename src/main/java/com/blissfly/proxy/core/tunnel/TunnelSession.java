package com.blissfly.proxy.core.tunnel;

import java.net.Socket;

import com.blissfly.proxy.core.utils.IoUtils;

/**
 * One inbound socket paired with one outbound socket. Closing the session closes both
 * legs.
 */
public final class TunnelSession implements AutoCloseable {
    private final String target;
    private final Socket inbound;
    private final Socket outbound;

    TunnelSession(String target, Socket inbound, Socket outbound) {
        this.target = target;
        this.inbound = inbound;
        this.outbound = outbound;
    }

    public String getTarget() {
        return target;
    }

    @Override
    public void close() {
        IoUtils.closeQuietly(outbound, "tunnel outbound socket");
        IoUtils.closeQuietly(inbound, "tunnel inbound socket");
    }
}
