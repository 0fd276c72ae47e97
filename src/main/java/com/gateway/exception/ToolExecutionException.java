package com.gateway.exception;

import lombok.Getter;

/**
 * Raised when a dispatched tool call went out but did not succeed: either the backend answered
 * with a non-success status, or the request failed on the network (status {@code 0}).
 */
@Getter
public class ToolExecutionException extends GatewayException {

    /**
     * HTTP status returned by the backend, or {@code 0} when no response was received.
     */
    private final int statusCode;

    /**
     * Response body as text, or the error description when no response was received.
     */
    private final String responseBody;

    public ToolExecutionException(int statusCode, String responseBody) {
        super("HTTP " + statusCode + ": " + responseBody);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.responseBody = message;
    }
}
