package com.passage.proxy.core.constants;

/**
 * HTTP header names the proxy reads, writes or filters.
 */
public enum HeaderConstants {
    /** Redirect target; rewritten into a proxied link. */
    LOCATION("Location"),
    /** Media type of the body; re-emitted last from the declared value. */
    CONTENT_TYPE("Content-Type"),
    /** Length of the entity body in bytes. */
    CONTENT_LENGTH("Content-Length"),
    /** Compression applied to the body. */
    CONTENT_ENCODING("Content-Encoding"),
    /** Type of encoding used to transfer the entity. */
    TRANSFER_ENCODING("Transfer-Encoding"),
    /** Compression schemes the client accepts. */
    ACCEPT_ENCODING("Accept-Encoding"),
    /** Hop-by-hop Connection header. */
    CONNECTION("Connection"),
    /** Specifies the persistent connection parameters. */
    KEEP_ALIVE("Keep-Alive"),
    /** Client software identification, forwarded upstream. */
    USER_AGENT("User-Agent"),
    /** Previous page, set on each followed redirect hop. */
    REFERER("Referer"),
    /** Methods accepted by the proxy endpoint. */
    ALLOW("Allow"),
    /** Upstream policy headers that would pin the page to its original origin. */
    CONTENT_SECURITY_POLICY("Content-Security-Policy"),
    X_FRAME_OPTIONS("X-Frame-Options"),
    STRICT_TRANSPORT_SECURITY("Strict-Transport-Security");

    private final String value;

    HeaderConstants(String value) {
        this.value = value;
    }

    /**
     * Retrieves the standard string value of the header.
     * 
     * @return The standard string value of the header.
     */
    public String getValue() {
        return value;
    }
}
