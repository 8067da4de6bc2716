package com.passage.proxy.core.rewrite;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites the candidate URLs of a {@code srcset} attribute, keeping each
 * width or density descriptor.
 */
public final class SrcsetRewriter {

    private SrcsetRewriter() {
        // Utility class
    }

    /**
     * @param srcset  The attribute value, e.g. {@code a.png 1x, b.png 2x}.
     * @param context Base URL and encoder.
     * @return Rewritten candidates joined with {@code ", "}.
     */
    public static String rewrite(String srcset, RewriteContext context) {
        List<String> candidates = new ArrayList<>();
        for (String candidate : srcset.split(",")) {
            String trimmed = candidate.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] parts = trimmed.split("\\s+", 2);
            String url = context.rewriteReference(parts[0]);
            candidates.add(parts.length > 1 ? url + " " + parts[1] : url);
        }
        return String.join(", ", candidates);
    }
}
