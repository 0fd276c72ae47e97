package com.gateway.model;

import java.time.Instant;

/**
 * What the audit side-channel learns about one dispatch attempt.
 *
 * @param toolName   The invoked tool.
 * @param service    Owning backend of the tool.
 * @param url        Target URL of the attempt.
 * @param method     Upper-case HTTP method.
 * @param userAgent  The caller's user agent, {@code unknown} when not reported.
 * @param response   Response payload on success, or an error description.
 * @param statusCode HTTP status, {@code 0} when no response was received.
 * @param timestamp  When the attempt completed.
 */
public record AuditEntry(String toolName,
                         String service,
                         String url,
                         String method,
                         String userAgent,
                         Object response,
                         int statusCode,
                         Instant timestamp) {

    public boolean successful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
