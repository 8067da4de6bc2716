package com.passage.proxy.core.rewrite;

import java.util.List;

import com.passage.proxy.core.http.ContentTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches a response body to the rewriter for its content type.
 * <p>
 * Bodies no rewriter claims pass through untouched. A rewriter that blows up
 * costs the client its rewritten links, never the response.
 * </p>
 */
public class ContentRewritePipeline {

    private static final Logger log = LoggerFactory.getLogger(ContentRewritePipeline.class);

    private final List<ContentRewriter> rewriters;

    /**
     * Creates a pipeline with the HTML and CSS rewriters.
     */
    public ContentRewritePipeline() {
        this(List.of(new HtmlContentRewriter(), new CssContentRewriter()));
    }

    /**
     * @param rewriters Candidates, first match wins.
     */
    public ContentRewritePipeline(List<ContentRewriter> rewriters) {
        this.rewriters = List.copyOf(rewriters);
    }

    /**
     * @param body                Identity-encoded body.
     * @param declaredContentType Upstream Content-Type, may be null.
     * @param context             Base URL and encoder.
     * @return Rewritten bytes, or {@code body} itself when nothing applies.
     */
    public byte[] rewrite(byte[] body, String declaredContentType, RewriteContext context) {
        ContentRewriter rewriter = rewriterFor(declaredContentType);
        if (rewriter == null) {
            return body;
        }
        try {
            return rewriter.rewrite(body, declaredContentType, context);
        } catch (RuntimeException e) {
            log.warn("Failed to rewrite {} from {}, sending original body: {}", declaredContentType,
                    context.getBaseUrl(), e.getMessage(), e);
            return body;
        }
    }

    /**
     * @param declaredContentType Upstream Content-Type, may be null.
     * @return Whether a rewriter would handle the type.
     */
    public boolean isRewritable(String declaredContentType) {
        return rewriterFor(declaredContentType) != null;
    }

    private ContentRewriter rewriterFor(String declaredContentType) {
        String primary = ContentTypes.primaryType(declaredContentType);
        if (primary.isEmpty()) {
            return null;
        }
        for (ContentRewriter rewriter : rewriters) {
            if (rewriter.supports(primary)) {
                return rewriter;
            }
        }
        return null;
    }
}
