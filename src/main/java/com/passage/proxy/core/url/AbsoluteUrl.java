package com.passage.proxy.core.url;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.passage.proxy.core.exceptions.InvalidTargetException;

/**
 * An absolute http(s) URL split into the parts the resolver needs.
 * <p>
 * Parsing is deliberately lenient: characters that {@link java.net.URI}
 * rejects in the path or query (spaces, {@code |}, raw non-ASCII) are kept
 * as-is, the way a browser address bar would. Only the scheme and host are
 * validated.
 * </p>
 */
public final class AbsoluteUrl {

    private static final Pattern URL_PATTERN = Pattern.compile(
            "^([a-zA-Z][a-zA-Z0-9+.-]*)://([^/?#]*)([^?#]*)(?:\\?([^#]*))?(?:#(.*))?$", Pattern.DOTALL);
    private static final Pattern HTTP_PREFIX = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);
    private static final Pattern VALID_HOST = Pattern.compile("[^\\s<>\"{}|\\\\^`\\[\\]]+|\\[[0-9a-fA-F:.]+\\]");

    private final String scheme;
    private final String host;
    private final int port;
    private final String path;
    private final String query;
    private final String fragment;

    private AbsoluteUrl(String scheme, String host, int port, String path, String query, String fragment) {
        this.scheme = scheme;
        this.host = host;
        this.port = port;
        this.path = path;
        this.query = query;
        this.fragment = fragment;
    }

    /**
     * Parses an absolute http(s) URL.
     *
     * @param raw The URL text.
     * @return The parsed URL, or empty if the scheme is not http(s) or the host
     *         is missing or malformed.
     */
    public static Optional<AbsoluteUrl> tryParse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher m = URL_PATTERN.matcher(raw.trim());
        if (!m.matches()) {
            return Optional.empty();
        }
        String scheme = m.group(1).toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return Optional.empty();
        }

        String authority = m.group(2);
        int at = authority.lastIndexOf('@');
        if (at != -1) {
            authority = authority.substring(at + 1);
        }

        String host;
        String portStr = null;
        if (authority.startsWith("[")) {
            int close = authority.indexOf(']');
            if (close == -1) {
                return Optional.empty();
            }
            host = authority.substring(0, close + 1);
            String rest = authority.substring(close + 1);
            if (rest.startsWith(":")) {
                portStr = rest.substring(1);
            } else if (!rest.isEmpty()) {
                return Optional.empty();
            }
        } else {
            int colon = authority.lastIndexOf(':');
            host = colon == -1 ? authority : authority.substring(0, colon);
            portStr = colon == -1 ? null : authority.substring(colon + 1);
        }

        if (host.isEmpty() || !VALID_HOST.matcher(host).matches()) {
            return Optional.empty();
        }

        int port = -1;
        if (portStr != null && !portStr.isEmpty()) {
            if (!portStr.chars().allMatch(Character::isDigit) || portStr.length() > 5) {
                return Optional.empty();
            }
            port = Integer.parseInt(portStr);
            if (port > 65535) {
                return Optional.empty();
            }
        }

        return Optional.of(new AbsoluteUrl(scheme, host.toLowerCase(Locale.ROOT), port,
                m.group(3), m.group(4), m.group(5)));
    }

    /**
     * Parses an absolute http(s) URL.
     *
     * @param raw The URL text.
     * @return The parsed URL.
     * @throws InvalidTargetException If the text is not an absolute http(s) URL
     *                                with a host.
     */
    public static AbsoluteUrl parse(String raw) {
        return tryParse(raw).orElseThrow(() -> new InvalidTargetException("Invalid URL provided."));
    }

    /**
     * Validates a target typed by a user. Host-only input such as
     * {@code example.com/page} gets {@code http://} prepended.
     *
     * @param raw The user-supplied target.
     * @return The parsed URL.
     * @throws InvalidTargetException If no host can be parsed.
     */
    public static AbsoluteUrl fromUserInput(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidTargetException("Invalid URL provided.");
        }
        String candidate = raw.trim();
        if (!HTTP_PREFIX.matcher(candidate).find()) {
            candidate = "http://" + candidate;
        }
        return parse(candidate);
    }

    public String getScheme() {
        return scheme;
    }

    public String getHost() {
        return host;
    }

    /**
     * @return The explicit port, or -1 when the URL has none.
     */
    public int getPort() {
        return port;
    }

    /**
     * @return The path exactly as written; may be empty.
     */
    public String getPath() {
        return path;
    }

    /**
     * @return {@code scheme://host[:port]}.
     */
    public String origin() {
        return scheme + "://" + host + (port != -1 ? ":" + port : "");
    }

    /**
     * @return The URL without its fragment, as sent upstream.
     */
    public String withoutFragment() {
        return origin() + path + (query != null ? "?" + query : "");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return toString().equals(o.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public String toString() {
        return withoutFragment() + (fragment != null ? "#" + fragment : "");
    }
}
