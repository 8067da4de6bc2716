package com.passage.proxy.core.url;

import java.nio.charset.StandardCharsets;

import com.passage.proxy.core.http.QueryStrings;

/**
 * Turns an absolute target into a same-origin link that re-enters the proxy:
 * {@code <script-path>?url=<percent-encoded target>}.
 * <p>
 * Every client-facing link is built here. The script path comes from the
 * inbound request, so one encoder exists per request.
 * </p>
 */
public final class ProxyLinkEncoder {

    /** Query parameter carrying the target URL. */
    public static final String URL_PARAM = "url";

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final String scriptPath;

    /**
     * @param scriptPath Path of the proxy endpoint as requested by the client,
     *                   without query. Blank means {@code /}.
     */
    public ProxyLinkEncoder(String scriptPath) {
        this.scriptPath = scriptPath == null || scriptPath.isBlank() ? "/" : scriptPath;
    }

    /**
     * @param target The URL to route through the proxy.
     * @return The proxied link.
     */
    public String encode(String target) {
        return scriptPath + "?" + URL_PARAM + "=" + percentEncode(target == null ? "" : target);
    }

    /**
     * Reads the target back out of a proxied link.
     *
     * @param link A link produced by {@link #encode(String)}.
     * @return The decoded target, or null if the link carries no {@code url}
     *         parameter.
     */
    public static String decode(String link) {
        if (link == null) {
            return null;
        }
        int q = link.indexOf('?');
        if (q == -1) {
            return null;
        }
        return QueryStrings.parse(link.substring(q + 1)).get(URL_PARAM);
    }

    /**
     * Percent-encodes every UTF-8 byte outside the RFC 3986 unreserved set, so a
     * space becomes {@code %20} rather than {@code +}.
     */
    static String percentEncode(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length * 3);
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (isUnreserved(c)) {
                sb.append((char) c);
            } else {
                sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return sb.toString();
    }

    private static boolean isUnreserved(int c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                || c == '-' || c == '_' || c == '.' || c == '~';
    }
}
