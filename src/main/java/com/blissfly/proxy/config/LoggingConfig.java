package com.blissfly.proxy.config;

/**
 * Configuration for the access log.
 */
public class LoggingConfig {
    /** Access log format (Apache-style placeholders like %h, %r, %s, plus %c for cache status). */
    private String format = "%h %l %u %t \"%r\" %>s %b %c";

    /** Whether every served request is written to the access log. */
    private boolean accessLog = true;

    /** Whether an extra response summary line is logged (useful for debugging). */
    private boolean logResponse = false;

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public boolean isAccessLog() {
        return accessLog;
    }

    public void setAccessLog(boolean accessLog) {
        this.accessLog = accessLog;
    }

    public boolean isLogResponse() {
        return logResponse;
    }

    public void setLogResponse(boolean logResponse) {
        this.logResponse = logResponse;
    }
}
