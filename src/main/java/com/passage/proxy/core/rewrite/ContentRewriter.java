package com.passage.proxy.core.rewrite;

/**
 * Rewrites references inside one kind of response body.
 */
public interface ContentRewriter {
    /**
     * @param primaryType Lower-cased MIME type without parameters.
     * @return Whether this rewriter handles the type.
     */
    boolean supports(String primaryType);

    /**
     * @param body        Identity-encoded body bytes.
     * @param contentType Full declared Content-Type, may carry a charset.
     * @param context     Base URL and encoder for this response.
     * @return The bytes to send to the client.
     */
    byte[] rewrite(byte[] body, String contentType, RewriteContext context);
}
