package com.passage.proxy.config;

/**
 * Configuration for the access log.
 */
public class LoggingConfig {
    /** Logging format (Apache-style placeholders like %h, %r, %s). */
    private String format = "%h %l %u %t \"%r\" %>s %b";

    /** Whether to log an extra line with response details (useful for debugging). */
    private boolean logResponse = false;

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public boolean isLogResponse() {
        return logResponse;
    }

    public void setLogResponse(boolean logResponse) {
        this.logResponse = logResponse;
    }
}
