package com.passage.proxy.core.utils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import com.passage.proxy.core.exceptions.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stream helpers for the inbound HTTP listener.
 */
public class IoUtils {

    private IoUtils() {
        // Utility class
    }

    private static final Logger log = LoggerFactory.getLogger(IoUtils.class);

    /** Longest request or header line accepted from a client. */
    public static final int MAX_LINE_LENGTH = 8192;

    /**
     * Reads a single line of text from an input stream.
     * The line is considered terminated by CRLF (\r\n) or LF (\n).
     *
     * @param in The input stream to read from.
     * @return The line read, or null if the end of the stream is reached.
     * @throws IOException If an I/O error occurs.
     */
    public static String readLine(InputStream in) throws IOException {
        return readLine(in, MAX_LINE_LENGTH);
    }

    /**
     * Reads a single line of text with a length limit. Bytes are decoded as
     * ISO-8859-1, the HTTP/1.1 wire encoding.
     *
     * @param in        The input stream to read from.
     * @param maxLength The maximum allowed length of the line.
     * @return The line read, or null if the end of the stream is reached.
     * @throws IOException       If an I/O error occurs.
     * @throws ProtocolException If the line exceeds {@code maxLength}.
     */
    public static String readLine(InputStream in, int maxLength) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int len = 0;
        int c;
        while ((c = in.read()) != -1) {
            if (c == '\n') {
                break;
            }
            if (c != '\r') {
                if (++len > maxLength) {
                    throw new ProtocolException("Line length exceeds maximum allowed length of " + maxLength);
                }
                buf.write(c);
            }
        }
        if (c == -1 && len == 0) {
            return null;
        }
        return buf.toString(StandardCharsets.ISO_8859_1);
    }

    /**
     * Skips exactly {@code length} bytes of a request body so the next request on
     * a kept-alive connection starts at the right offset.
     *
     * @param in     The client stream.
     * @param length Declared Content-Length; zero or less is a no-op.
     * @throws IOException If the stream ends early.
     */
    public static void skipBody(InputStream in, long length) throws IOException {
        if (length > 0) {
            in.skipNBytes(length);
        }
    }

    /**
     * Safely closes a resource without throwing exceptions.
     *
     * @param closeable The resource to close.
     */
    public static void closeQuietly(AutoCloseable closeable) {
        closeQuietly(closeable, "resource");
    }

    /**
     * Safely closes a resource, logging any exceptions.
     *
     * @param closeable The resource to close.
     * @param name      Name of the resource for logging.
     */
    public static void closeQuietly(AutoCloseable closeable, String name) {
        if (closeable != null) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.debug("Error closing {}: {}", name, e.getMessage());
            }
        }
    }
}
