package com.passage.proxy.core.url;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves references found in pages and headers against a base URL.
 * <p>
 * This is a restricted subset of RFC 3986 resolution: dot segments are
 * collapsed, empty segments are dropped and the result always has a single
 * leading slash. References that are already absolute, or that use a scheme
 * the proxy cannot route ({@code data:}, {@code mailto:}, {@code javascript:},
 * {@code blob:}, fragment-only), come back unchanged. So does every reference
 * when the base itself cannot be parsed.
 * </p>
 * Instances hold no per-request state and are safe to share.
 */
public class UrlResolver {

    private static final Pattern UNCHANGED_REFERENCE = Pattern.compile(
            "^(https?://|data:|blob:|mailto:|javascript:|#)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ROUTABLE = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);
    private static final String SEP = "/";

    private final boolean preserveQuery;

    /**
     * Creates a resolver that carries query strings over from references.
     */
    public UrlResolver() {
        this(true);
    }

    /**
     * @param preserveQuery Whether the query string of a relative reference is
     *                      kept on the resolved URL. When false, both query and
     *                      fragment are dropped.
     */
    public UrlResolver(boolean preserveQuery) {
        this.preserveQuery = preserveQuery;
    }

    /**
     * Resolves a reference against a base URL.
     *
     * @param reference The raw reference; null is treated as empty.
     * @param base      The base URL.
     * @return The absolute URL, or the trimmed reference when it is already
     *         absolute, not routable, or the base is unusable.
     */
    public String resolve(String reference, String base) {
        String ref = reference == null ? "" : reference.trim();
        if (isUnchangedReference(ref)) {
            return ref;
        }

        Optional<AbsoluteUrl> parsedBase = AbsoluteUrl.tryParse(base);
        if (parsedBase.isEmpty()) {
            return ref;
        }
        AbsoluteUrl baseUrl = parsedBase.get();

        if (ref.startsWith("//")) {
            return baseUrl.getScheme() + ":" + ref;
        }

        String refPath = ref;
        String query = null;
        int hash = refPath.indexOf('#');
        if (hash != -1) {
            refPath = refPath.substring(0, hash);
        }
        int q = refPath.indexOf('?');
        if (q != -1) {
            query = refPath.substring(q + 1);
            refPath = refPath.substring(0, q);
        }

        String workingPath;
        if (refPath.startsWith(SEP)) {
            workingPath = refPath;
        } else {
            workingPath = directoryOf(baseUrl.getPath()) + refPath;
        }

        String resolved = baseUrl.origin() + normalizePath(workingPath);
        if (preserveQuery && query != null) {
            resolved += "?" + query;
        }
        return resolved;
    }

    /**
     * @param reference A trimmed reference.
     * @return True if {@link #resolve} would hand it back untouched regardless of
     *         the base.
     */
    public static boolean isUnchangedReference(String reference) {
        return reference != null && UNCHANGED_REFERENCE.matcher(reference).find();
    }

    /**
     * @param url A resolved reference.
     * @return True if the proxy can fetch it, i.e. it is an absolute http(s) URL.
     */
    public static boolean isProxyRoutable(String url) {
        return url != null && ROUTABLE.matcher(url).find();
    }

    /**
     * Returns the base path with its final segment removed, keeping the trailing
     * slash. A missing path counts as {@code /}.
     */
    static String directoryOf(String path) {
        if (path == null || path.isEmpty()) {
            return SEP;
        }
        int slash = path.lastIndexOf('/');
        return slash == -1 ? SEP : path.substring(0, slash + 1);
    }

    /**
     * Collapses {@code .}, {@code ..} and empty segments. Popping past the root
     * is a no-op. A path naming a directory keeps its trailing slash.
     */
    static String normalizePath(String path) {
        boolean directory = path.endsWith(SEP) || path.endsWith("/.") || path.endsWith("/..");
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split(SEP, -1)) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                segments.pollLast();
            } else {
                segments.addLast(segment);
            }
        }
        if (segments.isEmpty()) {
            return SEP;
        }
        return SEP + String.join(SEP, segments) + (directory ? SEP : "");
    }
}
