package com.passage.proxy.core.http;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;

/**
 * Helpers for reading {@code Content-Type} values.
 */
public final class ContentTypes {

    public static final String TEXT_HTML = "text/html";
    public static final String TEXT_CSS = "text/css";
    public static final String TEXT_PLAIN = "text/plain";

    private ContentTypes() {
        // Utility class
    }

    /**
     * Returns the primary content type: the MIME token before any {@code ;}
     * parameters, trimmed and lower-cased.
     *
     * @param contentType Raw header value, may be null.
     * @return The primary type, or an empty string when none was declared.
     */
    public static String primaryType(String contentType) {
        if (contentType == null) {
            return "";
        }
        int semi = contentType.indexOf(';');
        String type = semi == -1 ? contentType : contentType.substring(0, semi);
        return type.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Extracts the {@code charset} parameter.
     *
     * @param contentType Raw header value, may be null.
     * @return The charset, or null if absent or not supported by this JVM.
     */
    public static Charset charset(String contentType) {
        if (contentType == null) {
            return null;
        }
        for (String param : contentType.split(";")) {
            int eq = param.indexOf('=');
            if (eq == -1 || !param.substring(0, eq).trim().equalsIgnoreCase("charset")) {
                continue;
            }
            String name = param.substring(eq + 1).trim();
            if (name.length() >= 2 && name.startsWith("\"") && name.endsWith("\"")) {
                name = name.substring(1, name.length() - 1);
            }
            try {
                return Charset.forName(name);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                return null;
            }
        }
        return null;
    }
}
