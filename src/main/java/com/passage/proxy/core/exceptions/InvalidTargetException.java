package com.passage.proxy.core.exceptions;

/**
 * Thrown when the requested target URL is missing a usable scheme or host.
 * Always reported to the client as 400 before anything is fetched.
 */
public class InvalidTargetException extends ProxyException {
    public InvalidTargetException(String message) {
        super(message);
    }
}
