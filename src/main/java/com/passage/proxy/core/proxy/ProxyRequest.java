package com.passage.proxy.core.proxy;

import java.util.List;
import java.util.Map;

import com.passage.proxy.core.http.HttpHeader;
import com.passage.proxy.core.http.QueryStrings;
import com.passage.proxy.core.url.ProxyLinkEncoder;

/**
 * A parsed inbound request.
 */
public final class ProxyRequest {
    private final String method;
    private final String target;
    private final String path;
    private final Map<String, String> parameters;
    private final List<HttpHeader> headers;
    private final String remoteAddress;

    /**
     * @param method        Request method, upper-case.
     * @param target        Request target exactly as sent on the request line.
     * @param headers       Request headers in arrival order.
     * @param remoteAddress Client IP.
     */
    public ProxyRequest(String method, String target, List<HttpHeader> headers, String remoteAddress) {
        this.method = method;
        this.target = target;
        this.headers = List.copyOf(headers);
        this.remoteAddress = remoteAddress;

        String withoutFragment = target;
        int hash = withoutFragment.indexOf('#');
        if (hash != -1) {
            withoutFragment = withoutFragment.substring(0, hash);
        }
        int q = withoutFragment.indexOf('?');
        this.path = stripOrigin(q == -1 ? withoutFragment : withoutFragment.substring(0, q));
        this.parameters = q == -1 ? Map.of() : QueryStrings.parse(withoutFragment.substring(q + 1));
    }

    /**
     * Absolute-form targets ({@code http://proxy/path?...}) keep only their path.
     */
    private static String stripOrigin(String rawPath) {
        int scheme = rawPath.indexOf("://");
        if (scheme == -1 || rawPath.startsWith("/")) {
            return rawPath;
        }
        int slash = rawPath.indexOf('/', scheme + 3);
        return slash == -1 ? "/" : rawPath.substring(slash);
    }

    public String getMethod() {
        return method;
    }

    public String getTarget() {
        return target;
    }

    /**
     * @return The script path: the request path without query, used as the
     *         prefix of every proxied link.
     */
    public String getPath() {
        return path;
    }

    public List<HttpHeader> getHeaders() {
        return headers;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    /**
     * @param name Query parameter name.
     * @return The decoded value of its first occurrence, or null.
     */
    public String getParameter(String name) {
        return parameters.get(name);
    }

    /**
     * @return The {@code url} parameter, or null when absent or blank.
     */
    public String getTargetUrl() {
        String url = getParameter(ProxyLinkEncoder.URL_PARAM);
        return url == null || url.isBlank() ? null : url;
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

    public boolean isHead() {
        return "HEAD".equals(method);
    }
}
