package com.blissfly.proxy.config;

/**
 * Settings of the inbound HTTP listener.
 */
public class ServerConfig {
    /** Name used in metric tags and log lines. */
    private String name = "blissfly";

    /** Listening port. */
    private int port = 10000;

    /** Bind address; null binds every interface. */
    private String bindAddress;

    /** Maximum number of concurrently served client connections. */
    private int maxConnections = 1000;

    /** Socket read timeout in milliseconds. */
    private int timeout = 60000;

    /** Whether a client connection may carry several requests. */
    private boolean keepAlive = true;

    /** Maximum accepted request body size in bytes (POST /watch, POST /search). */
    private int maxRequestBody = 64 * 1024;

    /**
     * Public origin of the proxy as browsers see it, e.g. {@code https://proxy.example}.
     * When unset it is derived from the inbound Host header.
     */
    private String publicOrigin;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public void setBindAddress(String bindAddress) {
        this.bindAddress = bindAddress;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }

    public int getTimeout() {
        return timeout;
    }

    public void setTimeout(int timeout) {
        this.timeout = timeout;
    }

    public boolean isKeepAlive() {
        return keepAlive;
    }

    public void setKeepAlive(boolean keepAlive) {
        this.keepAlive = keepAlive;
    }

    public int getMaxRequestBody() {
        return maxRequestBody;
    }

    public void setMaxRequestBody(int maxRequestBody) {
        this.maxRequestBody = maxRequestBody;
    }

    public String getPublicOrigin() {
        return publicOrigin;
    }

    public void setPublicOrigin(String publicOrigin) {
        this.publicOrigin = publicOrigin;
    }
}
