package com.blissfly.proxy.config;

/**
 * Shared session sub-protocol served over WebSocket.
 */
public class SessionConfig {
    private boolean enabled = true;

    /** Request path of the session endpoint. */
    private String path = "/session";

    /** Largest accepted message payload in bytes. */
    private int maxMessageSize = 64 * 1024;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getMaxMessageSize() {
        return maxMessageSize;
    }

    public void setMaxMessageSize(int maxMessageSize) {
        this.maxMessageSize = maxMessageSize;
    }
}
