package com.passage.proxy.core.fetch;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipException;

import com.passage.proxy.core.exceptions.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Undoes the {@code Content-Encoding} the upstream applied, so the rewriter
 * always sees identity-encoded bytes.
 */
public final class BodyDecoder {

    private static final Logger log = LoggerFactory.getLogger(BodyDecoder.class);

    /** Largest array the JVM reliably allocates. */
    private static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

    private BodyDecoder() {
        // Utility class
    }

    /**
     * @param body            Raw body bytes as received.
     * @param contentEncoding The Content-Encoding header value, may be null.
     * @param maxBytes        Limit on the decoded size.
     * @return The decoded body. Unknown encodings are returned untouched.
     * @throws UpstreamException If the body is corrupt or decodes past
     *                           {@code maxBytes}.
     */
    public static byte[] decode(byte[] body, String contentEncoding, long maxBytes) {
        if (contentEncoding == null || body.length == 0) {
            return body;
        }
        String encoding = contentEncoding.trim().toLowerCase(Locale.ROOT);
        try {
            switch (encoding) {
                case "", "identity" -> {
                    return body;
                }
                case "gzip", "x-gzip" -> {
                    return readLimited(new GZIPInputStream(new ByteArrayInputStream(body)), maxBytes);
                }
                case "deflate" -> {
                    return inflate(body, maxBytes);
                }
                default -> {
                    log.debug("Leaving body with unsupported Content-Encoding '{}' as received", contentEncoding);
                    return body;
                }
            }
        } catch (IOException e) {
            throw new UpstreamException("Could not decode " + encoding + " response body: " + e.getMessage(), e);
        }
    }

    /**
     * Servers disagree on whether "deflate" carries a zlib header; try the
     * wrapped form first and fall back to raw deflate.
     */
    private static byte[] inflate(byte[] body, long maxBytes) throws IOException {
        try {
            return readLimited(new InflaterInputStream(new ByteArrayInputStream(body)), maxBytes);
        } catch (ZipException e) {
            Inflater raw = new Inflater(true);
            try {
                return readLimited(new InflaterInputStream(new ByteArrayInputStream(body), raw), maxBytes);
            } finally {
                raw.end();
            }
        }
    }

    static byte[] readLimited(InputStream in, long maxBytes) throws IOException {
        try (in) {
            int cap = maxBytes >= MAX_ARRAY_SIZE ? MAX_ARRAY_SIZE : (int) Math.max(0, maxBytes) + 1;
            byte[] data = in.readNBytes(cap);
            if (data.length > maxBytes) {
                throw new UpstreamException("Upstream response body exceeds " + maxBytes + " bytes");
            }
            return data;
        }
    }
}
