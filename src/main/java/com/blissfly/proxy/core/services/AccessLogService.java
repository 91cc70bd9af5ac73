package com.blissfly.proxy.core.services;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

import com.blissfly.proxy.config.LoggingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes access log lines in a configurable Apache-style format.
 * <p>
 * Supported tokens: {@code %h} remote host, {@code %l} always {@code -}, {@code %u}
 * user, {@code %t} timestamp, {@code %r} request line, {@code %>s} status, {@code %b}
 * body bytes, {@code %m} method, {@code %q} query string, {@code %c} cache status.
 * Unknown tokens are written literally.
 */
public class AccessLogService {

    private static final Logger log = LoggerFactory.getLogger(AccessLogService.class);
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter
            .ofPattern("dd/MMM/yyyy:HH:mm:ss Z", Locale.ENGLISH);

    private final LoggingConfig config;
    private final Clock clock;

    /** Formatted timestamp, refreshed at most once per second. */
    private volatile String cachedTimestamp = "";
    private volatile long cachedTimestampSec = -1;

    public AccessLogService(LoggingConfig config) {
        this(config, Clock.systemDefaultZone());
    }

    public AccessLogService(LoggingConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    record LogRecord(String remoteHost, String user, String time, String requestLine,
            String status, String bytes, String method, String query, String cacheStatus) {
    }

    /**
     * Logs one handled request.
     *
     * @param remoteHost  Client address.
     * @param user        Authenticated user, may be null.
     * @param method      Request method.
     * @param uri         Request target.
     * @param status      Status sent to the client.
     * @param bytes       Body bytes sent.
     * @param cacheStatus {@code HIT}, {@code MISS} or {@code -}.
     */
    public void logRequest(String remoteHost, String user, String method, String uri, int status, long bytes,
            String cacheStatus) {
        if (!config.isAccessLog()) {
            return;
        }
        String logLine = format(remoteHost, user, method, uri, status, bytes, cacheStatus);
        log.info(logLine);

        if (config.isLogResponse()) {
            log.info("[RESPONSE] {} {} -> STATUS: {}, BYTES: {}, CACHE: {}", method, uri, status,
                    bytes > 0 ? bytes : "-", cacheStatus != null ? cacheStatus : "-");
        }
    }

    /**
     * Renders a log line with the configured format.
     *
     * @return The formatted line.
     */
    String format(String remoteHost, String user, String method, String uri, int status, long bytes,
            String cacheStatus) {
        int queryIndex = uri.indexOf('?');
        LogRecord logRecord = new LogRecord(
                remoteHost,
                user != null ? user : "-",
                "[" + getCachedTimestamp() + "]",
                method + " " + uri + " HTTP/1.1",
                String.valueOf(status),
                bytes > 0 ? String.valueOf(bytes) : "-",
                method,
                queryIndex != -1 ? uri.substring(queryIndex) : "",
                cacheStatus != null ? cacheStatus : "-");
        return formatLogLine(config.getFormat(), logRecord);
    }

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
     * @return Index in the format string just past the token.
     */
    private int appendToken(StringBuilder sb, String format, int currentIdx, LogRecord logRecord) {
        char next = format.charAt(currentIdx + 1);
        int skip = 1;
        switch (next) {
            case 'h' -> sb.append(logRecord.remoteHost());
            case 'l' -> sb.append('-');
            case 'u' -> sb.append(logRecord.user());
            case 't' -> sb.append(logRecord.time());
            case 'r' -> sb.append(logRecord.requestLine());
            case 'm' -> sb.append(logRecord.method());
            case 'q' -> sb.append(logRecord.query());
            case 'c' -> sb.append(logRecord.cacheStatus());
            case 'b' -> sb.append(logRecord.bytes());
            case '>' -> {
                if (currentIdx + 2 < format.length() && format.charAt(currentIdx + 2) == 's') {
                    sb.append(logRecord.status());
                    skip = 2;
                } else {
                    sb.append('%');
                    skip = 0;
                }
            }
            default -> {
                sb.append('%');
                skip = 0;
            }
        }
        return currentIdx + skip + 1;
    }

    private String getCachedTimestamp() {
        long nowSec = clock.instant().getEpochSecond();
        if (nowSec != cachedTimestampSec) {
            cachedTimestamp = ZonedDateTime.now(clock).format(DATE_FORMATTER);
            cachedTimestampSec = nowSec;
        }
        return cachedTimestamp;
    }
}
