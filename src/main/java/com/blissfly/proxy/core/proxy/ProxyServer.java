package com.blissfly.proxy.core.proxy;

import com.blissfly.proxy.config.ServerConfig;

/**
 * Interface representing an inbound server instance.
 */
public interface ProxyServer {
    /**
     * Binds the listening socket and runs the accept loop until stopped.
     */
    void start();

    /**
     * Stops the server and releases all associated resources.
     */
    void stop();

    /**
     * Retrieves the server configuration.
     * @return The configuration used by this server.
     */
    ServerConfig getConfig();
}
