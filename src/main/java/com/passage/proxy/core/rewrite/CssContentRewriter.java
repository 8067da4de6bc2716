package com.passage.proxy.core.rewrite;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import com.passage.proxy.core.http.ContentTypes;

/**
 * Rewrites {@code url()} references in standalone stylesheets. Resolution
 * always uses the effective URL of the stylesheet itself.
 */
public class CssContentRewriter implements ContentRewriter {

    @Override
    public boolean supports(String primaryType) {
        return ContentTypes.TEXT_CSS.equals(primaryType);
    }

    @Override
    public byte[] rewrite(byte[] body, String contentType, RewriteContext context) {
        Charset declared = ContentTypes.charset(contentType);
        Charset charset = declared != null ? declared : StandardCharsets.UTF_8;
        String css = new String(body, charset);
        return CssUrlRewriter.rewrite(css, context).getBytes(charset);
    }
}
