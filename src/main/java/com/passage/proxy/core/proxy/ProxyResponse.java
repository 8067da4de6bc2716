package com.passage.proxy.core.proxy;

import java.nio.charset.StandardCharsets;
import java.util.List;

import com.passage.proxy.core.constants.HeaderConstants;
import com.passage.proxy.core.http.ContentTypes;
import com.passage.proxy.core.http.HttpHeader;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * A complete response ready to be framed and written to the client.
 */
public final class ProxyResponse {
    private final int status;
    private final List<HttpHeader> headers;
    private final byte[] body;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ProxyResponse(int status, List<HttpHeader> headers, byte[] body) {
        this.status = status;
        this.headers = List.copyOf(headers);
        this.body = body != null ? body : new byte[0];
    }

    /**
     * Builds a plain-text diagnostic response.
     *
     * @param status  HTTP status.
     * @param message Body text.
     * @return The response.
     */
    public static ProxyResponse text(int status, String message) {
        return new ProxyResponse(status,
                List.of(new HttpHeader(HeaderConstants.CONTENT_TYPE.getValue(),
                        ContentTypes.TEXT_PLAIN + "; charset=UTF-8")),
                message.getBytes(StandardCharsets.UTF_8));
    }

    public int getStatus() {
        return status;
    }

    public List<HttpHeader> getHeaders() {
        return headers;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public byte[] getBody() {
        return body;
    }

    /**
     * @param name Header name, any case.
     * @return The first value, or null.
     */
    public String header(String name) {
        for (HttpHeader h : headers) {
            if (h.hasName(name)) {
                return h.getValue();
            }
        }
        return null;
    }
}
