package com.passage.proxy.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Configuration for fetching upstream sites.
 */
public class UpstreamConfig {
    /** Connect timeout in milliseconds. */
    private int connectTimeout = 15000;

    /** Total request timeout in milliseconds, per hop. */
    private int timeout = 30000;

    /** Maximum number of redirects followed before the 3xx is returned as-is. */
    private int maxRedirects = 10;

    /**
     * Skips certificate and hostname verification towards upstream sites.
     * Only meant for self-signed or misconfigured targets.
     */
    private boolean insecureSkipVerify = false;

    /** User-Agent sent when the client did not provide one. */
    private String userAgent = "Mozilla/5.0 (compatible; PassageProxy/1.0)";

    /** Client request headers copied onto the upstream request. */
    private List<String> forwardedHeaders = new ArrayList<>(
            List.of("User-Agent", "Accept", "Accept-Language", "DNT"));

    /** Largest decoded body accepted from upstream, in bytes. */
    private long maxBodyBytes = 16L * 1024 * 1024;

    public int getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(int connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public int getTimeout() {
        return timeout;
    }

    public void setTimeout(int timeout) {
        this.timeout = timeout;
    }

    public int getMaxRedirects() {
        return maxRedirects;
    }

    public void setMaxRedirects(int maxRedirects) {
        this.maxRedirects = maxRedirects;
    }

    public boolean isInsecureSkipVerify() {
        return insecureSkipVerify;
    }

    public void setInsecureSkipVerify(boolean insecureSkipVerify) {
        this.insecureSkipVerify = insecureSkipVerify;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public List<String> getForwardedHeaders() {
        return forwardedHeaders == null ? null : Collections.unmodifiableList(forwardedHeaders);
    }

    public void setForwardedHeaders(List<String> forwardedHeaders) {
        this.forwardedHeaders = forwardedHeaders == null ? null : new ArrayList<>(forwardedHeaders);
    }

    public long getMaxBodyBytes() {
        return maxBodyBytes;
    }

    public void setMaxBodyBytes(long maxBodyBytes) {
        this.maxBodyBytes = maxBodyBytes;
    }
}
