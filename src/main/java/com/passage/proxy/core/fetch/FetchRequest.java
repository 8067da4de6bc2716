package com.passage.proxy.core.fetch;

import java.util.List;
import java.util.Objects;

import com.passage.proxy.core.http.HttpHeader;
import com.passage.proxy.core.url.AbsoluteUrl;

/**
 * An outbound request: the validated target plus the client headers that may
 * be forwarded.
 */
public final class FetchRequest {
    private final AbsoluteUrl target;
    private final List<HttpHeader> clientHeaders;

    public FetchRequest(AbsoluteUrl target, List<HttpHeader> clientHeaders) {
        this.target = Objects.requireNonNull(target, "target");
        this.clientHeaders = clientHeaders == null ? List.of() : List.copyOf(clientHeaders);
    }

    public AbsoluteUrl getTarget() {
        return target;
    }

    /**
     * @param name Header name, case-insensitive.
     * @return The first client value, or null.
     */
    public String clientHeader(String name) {
        for (HttpHeader header : clientHeaders) {
            if (header.hasName(name)) {
                return header.getValue();
            }
        }
        return null;
    }
}
