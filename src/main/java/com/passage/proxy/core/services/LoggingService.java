package com.passage.proxy.core.services;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

import com.passage.proxy.config.LoggingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one Apache-style access log line per response to the {@code access}
 * logger. Where the lines end up is decided by the Logback configuration.
 */
public class LoggingService {

    /** Name of the SLF4J logger receiving access log lines. */
    public static final String ACCESS_LOGGER = "access";

    private static final Logger access = LoggerFactory.getLogger(ACCESS_LOGGER);
    private static final DateTimeFormatter DATE_FORMATTER =
            DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss Z", Locale.ENGLISH);

    private final LoggingConfig config;

    /**
     * Cached formatted timestamp, refreshed at most once per second to avoid
     * repeated clock + TZ lookups.
     */
    private volatile String cachedTimestamp = "";
    /** The epoch second at which {@link #cachedTimestamp} was last produced. */
    private volatile long cachedTimestampSec = 0;

    public LoggingService(LoggingConfig config) {
        this.config = config;
    }

    /**
     * Internal record to group logging context for formatting.
     */
    record LogRecord(String remoteHost, String time, String requestLine, String status, String bytes,
            String method, String query) {
    }

    /**
     * Logs a served request using the configured format.
     *
     * @param remoteHost Client's IP.
     * @param method     HTTP method.
     * @param uri        Request target as sent by the client.
     * @param status     Response status code.
     * @param bytes      Number of body bytes sent.
     */
    public void logRequest(String remoteHost, String method, String uri, int status, long bytes) {
        if (!access.isInfoEnabled()) {
            return;
        }
        String line = format(remoteHost, method, uri, status, bytes);
        access.info(line);

        if (config.isLogResponse()) {
            access.info("[RESPONSE] {} {} -> STATUS: {}, BYTES: {}", method, uri, status, bytes > 0 ? bytes : "-");
        }
    }

    /**
     * Renders one access log line.
     *
     * @param remoteHost Client's IP.
     * @param method     HTTP method.
     * @param uri        Request target.
     * @param status     Response status code.
     * @param bytes      Number of body bytes sent.
     * @return The formatted line.
     */
    String format(String remoteHost, String method, String uri, int status, long bytes) {
        String time = "[" + getCachedTimestamp() + "]";
        String byteStr = bytes > 0 ? String.valueOf(bytes) : "-";
        String requestLine = method + " " + uri + " HTTP/1.1";
        int queryIndex = uri.indexOf('?');
        String query = queryIndex != -1 ? uri.substring(queryIndex) : "";

        LogRecord logRecord = new LogRecord(remoteHost, time, requestLine, String.valueOf(status), byteStr, method,
                query);
        return formatLogLine(config.getFormat(), logRecord);
    }

    /**
     * Formats a log line based on the Apache-style format string.
     * Supported tokens: %h, %l, %u, %t, %r, %>s, %b, %m, %q.
     */
    private String formatLogLine(String format, LogRecord logRecord) {
        StringBuilder sb = new StringBuilder(format.length() + 100);
        int i = 0;
        while (i < format.length()) {
            char c = format.charAt(i);
            if (c == '%' && i + 1 < format.length()) {
                i = appendToken(sb, format, i, logRecord);
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    /**
     * Appends a specific token value to the formatted log line.
     *
     * @return The new index position in the format string after the token.
     */
    private int appendToken(StringBuilder sb, String format, int currentIdx, LogRecord logRecord) {
        char next = format.charAt(currentIdx + 1);
        int skip = 1;
        switch (next) {
            case 'h' -> sb.append(logRecord.remoteHost());
            case 'l', 'u' -> sb.append('-');
            case 't' -> sb.append(logRecord.time());
            case 'r' -> sb.append(logRecord.requestLine());
            case 'm' -> sb.append(logRecord.method());
            case 'q' -> sb.append(logRecord.query());
            case '>' -> {
                if (currentIdx + 2 < format.length() && format.charAt(currentIdx + 2) == 's') {
                    sb.append(logRecord.status());
                    skip = 2;
                } else {
                    sb.append('%');
                    skip = 0;
                }
            }
            case 'b' -> sb.append(logRecord.bytes());
            default -> {
                sb.append('%');
                skip = 0;
            }
        }
        return currentIdx + skip + 1;
    }

    /**
     * Returns a formatted timestamp string for the current second, e.g.
     * {@code 22/Feb/2026:23:30:00 +0900}.
     */
    private String getCachedTimestamp() {
        long nowSec = Instant.now().getEpochSecond();
        if (nowSec != cachedTimestampSec) {
            cachedTimestampSec = nowSec;
            cachedTimestamp = ZonedDateTime.now().format(DATE_FORMATTER);
        }
        return cachedTimestamp;
    }
}
