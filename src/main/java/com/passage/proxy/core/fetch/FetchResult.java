package com.passage.proxy.core.fetch;

import java.util.Collections;
import java.util.List;

import com.passage.proxy.core.http.HttpHeader;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * The final upstream response after redirects. The body is already
 * decompressed.
 */
public final class FetchResult {
    private final int status;
    private final List<HttpHeader> headers;
    private final byte[] body;
    private final String effectiveUrl;
    private final String contentType;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public FetchResult(int status, List<HttpHeader> headers, byte[] body, String effectiveUrl, String contentType) {
        this.status = status;
        this.headers = headers == null ? List.of() : List.copyOf(headers);
        this.body = body == null ? new byte[0] : body;
        this.effectiveUrl = effectiveUrl;
        this.contentType = contentType;
    }

    public int getStatus() {
        return status;
    }

    /**
     * Headers as the fetcher produced them. {@link HttpClientUpstreamFetcher}
     * reads them from the JDK client's header map, which is sorted by name
     * case-insensitively, so names come out alphabetically rather than in
     * wire order. Repeated headers such as {@code Set-Cookie} keep their
     * relative order.
     *
     * @return The response headers, duplicates included.
     */
    public List<HttpHeader> getHeaders() {
        return Collections.unmodifiableList(headers);
    }

    /**
     * Not copied; the orchestrator owns the result for one request only.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP")
    public byte[] getBody() {
        return body;
    }

    /**
     * @return The URL of the last request made, after redirects.
     */
    public String getEffectiveUrl() {
        return effectiveUrl;
    }

    /**
     * @return The declared Content-Type of the final response, or null.
     */
    public String getContentType() {
        return contentType;
    }
}
