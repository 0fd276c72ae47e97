package com.gateway.exception;

import lombok.Getter;

/**
 * Raised when a caller invokes a tool name that is not part of the current catalog.
 * No request is sent to any backend in this case.
 */
@Getter
public class UnknownToolException extends GatewayException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
        this.toolName = toolName;
    }
}
