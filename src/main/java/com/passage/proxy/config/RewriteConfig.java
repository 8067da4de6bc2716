package com.passage.proxy.config;

/**
 * Options for rewriting references in proxied content.
 */
public class RewriteConfig {
    /** Keep the query string of relative references when resolving them. */
    private boolean preserveQuery = true;

    /**
     * Wrap {@code data:}, {@code mailto:}, {@code javascript:}, {@code blob:}
     * and fragment-only references in proxied links like every other
     * reference. When false they are left in place as written.
     */
    private boolean encodeNonRoutable = true;

    public boolean isPreserveQuery() {
        return preserveQuery;
    }

    public void setPreserveQuery(boolean preserveQuery) {
        this.preserveQuery = preserveQuery;
    }

    public boolean isEncodeNonRoutable() {
        return encodeNonRoutable;
    }

    public void setEncodeNonRoutable(boolean encodeNonRoutable) {
        this.encodeNonRoutable = encodeNonRoutable;
    }
}
