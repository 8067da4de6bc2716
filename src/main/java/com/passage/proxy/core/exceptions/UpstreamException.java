package com.passage.proxy.core.exceptions;

/**
 * Thrown when the upstream site cannot be fetched (DNS, connect, TLS, timeout
 * or an oversized body). The message is shown to the client in the 502 body.
 */
public class UpstreamException extends ProxyException {
    /**
     * Constructs a new UpstreamException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public UpstreamException(String message) {
        super(message);
    }

    /**
     * Constructs a new UpstreamException with the specified detail message and
     * cause.
     * 
     * @param message the detail message.
     * @param cause   the underlying transport failure.
     */
    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
