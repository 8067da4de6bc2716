package com.passage.proxy.core.rewrite;

import java.util.Objects;

import com.passage.proxy.core.url.ProxyLinkEncoder;
import com.passage.proxy.core.url.UrlResolver;

/**
 * Everything a rewriter needs for one response: the base URL references are
 * resolved against and the encoder that turns them into proxied links.
 * <p>
 * Immutable. A {@code <base href>} produces a new context through
 * {@link #withBase(String)} that only the current document sees.
 * </p>
 */
public final class RewriteContext {
    private final String baseUrl;
    private final ProxyLinkEncoder encoder;
    private final UrlResolver resolver;
    private final boolean encodeNonRoutable;

    public RewriteContext(String baseUrl, ProxyLinkEncoder encoder, UrlResolver resolver, boolean encodeNonRoutable) {
        this.baseUrl = baseUrl;
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.encodeNonRoutable = encodeNonRoutable;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public ProxyLinkEncoder getEncoder() {
        return encoder;
    }

    public UrlResolver getResolver() {
        return resolver;
    }

    /**
     * @param newBase The resolved {@code <base href>} value.
     * @return A context resolving against {@code newBase}.
     */
    public RewriteContext withBase(String newBase) {
        return new RewriteContext(newBase, encoder, resolver, encodeNonRoutable);
    }

    /**
     * Resolves a reference and wraps it in a proxied link.
     * <p>
     * Every reference goes to the encoder, including ones the resolver hands
     * back unchanged. With {@code encodeNonRoutable} off, {@code data:},
     * {@code mailto:}, {@code javascript:}, {@code blob:} and fragment-only
     * references are returned as given instead.
     * </p>
     *
     * @param reference Raw attribute, header or CSS value.
     * @return The value to write back.
     */
    public String rewriteReference(String reference) {
        if (!shouldRewrite(reference)) {
            return reference;
        }
        return encoder.encode(resolver.resolve(reference, baseUrl));
    }

    /**
     * @param reference Raw reference.
     * @return False for non-routable references the configuration leaves alone.
     */
    public boolean shouldRewrite(String reference) {
        if (encodeNonRoutable || reference == null) {
            return true;
        }
        String trimmed = reference.trim();
        return UrlResolver.isProxyRoutable(trimmed) || !UrlResolver.isUnchangedReference(trimmed);
    }
}
