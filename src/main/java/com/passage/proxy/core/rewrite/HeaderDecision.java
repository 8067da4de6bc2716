package com.passage.proxy.core.rewrite;

/**
 * What the header pipeline does with one upstream response header.
 */
public enum HeaderDecision {
    /** Pass through with the original name and value. */
    FORWARD,
    /** Never sent to the client. */
    DROP,
    /** Value replaced with a proxied link. */
    REWRITE
}
