package com.passage.proxy.config;

/**
 * Configuration for the inbound listener.
 */
public class ServerConfig {
    /** Port to listen on. */
    private int port = 8080;

    /** Local IP address to bind to. Null means all interfaces. */
    private String bindAddress;

    /** Maximum concurrent client connections. */
    private int maxConnections = 1000;

    /** Client socket read timeout in milliseconds. */
    private int timeout = 60000;

    /** Whether to serve several requests per client connection. */
    private boolean keepAlive = true;

    /** Wall-clock ceiling for one fetch-rewrite-respond cycle, in milliseconds. */
    private int requestTimeout = 60000;

    /** Size of the pool running the rewrite pipeline. */
    private int workerThreads = 32;

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

    public int getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(int requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }
}
