package com.passage.proxy.core.http;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes {@code application/x-www-form-urlencoded} query strings.
 */
public final class QueryStrings {

    private QueryStrings() {
        // Utility class
    }

    /**
     * Parses a raw query string (without the leading {@code ?}). When a name
     * repeats, the first occurrence wins.
     *
     * @param rawQuery The raw query, may be null.
     * @return Decoded parameters in order of appearance.
     */
    public static Map<String, String> parse(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> params = new LinkedHashMap<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = decode(eq == -1 ? pair : pair.substring(0, eq));
            String value = eq == -1 ? "" : decode(pair.substring(eq + 1));
            params.putIfAbsent(name, value);
        }
        return Collections.unmodifiableMap(params);
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // Malformed escape: keep the raw text
            return s;
        }
    }
}
