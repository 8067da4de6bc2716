package com.passage.proxy.core.proxy;

import com.passage.proxy.config.ServerConfig;

/**
 * Interface representing a listening proxy server instance.
 */
public interface ProxyServer {
    /**
     * Binds and runs the accept loop. Blocks until {@link #stop()} is called.
     */
    void start();

    /**
     * Stops the server and releases all associated resources.
     */
    void stop();

    /**
     * @return The configuration used by this server.
     */
    ServerConfig getConfig();
}
