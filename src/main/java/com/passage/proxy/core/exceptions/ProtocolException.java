package com.passage.proxy.core.exceptions;

/**
 * Thrown when an inbound HTTP request cannot be parsed, such as a bad request
 * line or an oversized header section.
 */
public class ProtocolException extends ProxyException {
    /**
     * Constructs a new ProtocolException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public ProtocolException(String message) {
        super(message);
    }

    /**
     * Constructs a new ProtocolException with the specified detail message and
     * cause.
     * 
     * @param message the detail message.
     * @param cause   the cause of the exception.
     */
    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
