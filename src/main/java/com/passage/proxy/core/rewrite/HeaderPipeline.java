package com.passage.proxy.core.rewrite;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import com.passage.proxy.core.constants.HeaderConstants;
import com.passage.proxy.core.http.HttpHeader;
import com.passage.proxy.core.url.ProxyLinkEncoder;
import com.passage.proxy.core.url.UrlResolver;

/**
 * Filters upstream response headers for the client.
 * <p>
 * Framing headers and page security policies are dropped because the proxy
 * re-frames and may rewrite the body. {@code Location} is turned into a
 * proxied link. The declared content type is re-emitted last.
 * </p>
 */
public class HeaderPipeline {

    private static final Set<String> DROPPED = EnumSet.of(
            HeaderConstants.CONTENT_SECURITY_POLICY,
            HeaderConstants.X_FRAME_OPTIONS,
            HeaderConstants.STRICT_TRANSPORT_SECURITY,
            HeaderConstants.CONTENT_LENGTH,
            HeaderConstants.TRANSFER_ENCODING,
            HeaderConstants.CONTENT_ENCODING,
            HeaderConstants.CONTENT_TYPE,
            HeaderConstants.CONNECTION,
            HeaderConstants.KEEP_ALIVE).stream()
            .map(h -> h.getValue().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    private static final String LOCATION = HeaderConstants.LOCATION.getValue().toLowerCase(Locale.ROOT);

    private final UrlResolver resolver;

    public HeaderPipeline(UrlResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @param raw                 Upstream headers in arrival order.
     * @param effectiveUrl        Final URL after redirects.
     * @param declaredContentType Content type to re-emit, may be null.
     * @param encoder             Link encoder for this request.
     * @return Headers to send to the client.
     */
    public List<HttpHeader> process(List<HttpHeader> raw, String effectiveUrl, String declaredContentType,
            ProxyLinkEncoder encoder) {
        List<HttpHeader> out = new ArrayList<>();
        boolean locationSeen = false;

        for (HttpHeader header : raw) {
            switch (decide(header.getName())) {
                case DROP:
                    break;
                case REWRITE:
                    if (!locationSeen) {
                        String target = resolver.resolve(header.getValue(), effectiveUrl);
                        out.add(new HttpHeader(HeaderConstants.LOCATION.getValue(), encoder.encode(target)));
                        locationSeen = true;
                    }
                    break;
                default:
                    out.add(header);
                    break;
            }
        }

        if (declaredContentType != null) {
            out.add(new HttpHeader(HeaderConstants.CONTENT_TYPE.getValue(), declaredContentType));
        }
        return out;
    }

    /**
     * @param name Header name as received.
     * @return The decision for that name.
     */
    public HeaderDecision decide(String name) {
        if (name == null || name.isEmpty() || name.startsWith(":")
                || name.regionMatches(true, 0, "HTTP/", 0, 5)) {
            return HeaderDecision.DROP;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (DROPPED.contains(lower)) {
            return HeaderDecision.DROP;
        }
        if (lower.equals(LOCATION)) {
            return HeaderDecision.REWRITE;
        }
        return HeaderDecision.FORWARD;
    }

    /**
     * Parses a raw header block as captured off the wire.
     * <p>
     * Lines starting with {@code HTTP/} and lines without a colon are skipped.
     * Names and values are trimmed.
     * </p>
     *
     * @param block Header lines separated by CRLF, LF or CR.
     * @return The headers in order.
     */
    public static List<HttpHeader> parseHeaderBlock(String block) {
        List<HttpHeader> headers = new ArrayList<>();
        if (block == null) {
            return headers;
        }
        for (String line : block.split("\\r\\n|\\n|\\r")) {
            if (line.regionMatches(true, 0, "HTTP/", 0, 5)) {
                continue;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String name = line.substring(0, colon).trim();
            if (!name.isEmpty()) {
                headers.add(new HttpHeader(name, line.substring(colon + 1).trim()));
            }
        }
        return headers;
    }
}
