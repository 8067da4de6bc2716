package com.passage.proxy.core.rewrite;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites {@code url(...)} tokens in CSS text.
 * <p>
 * The argument is stripped of surrounding whitespace and quotes, resolved,
 * encoded and written back as {@code url("...")}. The rest of the text is left
 * byte-for-byte alone.
 * </p>
 */
public final class CssUrlRewriter {

    private static final Pattern CSS_URL = Pattern.compile("url\\(([^)]+)\\)", Pattern.CASE_INSENSITIVE);
    private static final String TRIM_CHARS = " \t\n'\"";

    private CssUrlRewriter() {
        // Utility class
    }

    /**
     * @param css     Stylesheet, {@code <style>} content or a style attribute.
     * @param context Base URL and encoder.
     * @return The text with every {@code url()} argument rewritten.
     */
    public static String rewrite(String css, RewriteContext context) {
        if (css == null || css.isEmpty()) {
            return css;
        }
        Matcher m = CSS_URL.matcher(css);
        return m.replaceAll(match -> Matcher.quoteReplacement(rewriteToken(match.group(), match.group(1), context)));
    }

    private static String rewriteToken(String token, String argument, RewriteContext context) {
        String url = trim(argument);
        if (!context.shouldRewrite(url)) {
            return token;
        }
        return "url(\"" + context.rewriteReference(url) + "\")";
    }

    static String trim(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && TRIM_CHARS.indexOf(value.charAt(start)) != -1) {
            start++;
        }
        while (end > start && TRIM_CHARS.indexOf(value.charAt(end - 1)) != -1) {
            end--;
        }
        return value.substring(start, end);
    }
}
