package com.gateway.dto.response;

/**
 * The result of a tool-call request as returned to the caller.
 *
 * @param isError Whether the call failed on the backend or on the network.
 * @param text    The serialized backend response, or the failure description.
 */
public record ToolCallResponse(boolean isError, String text) {

    public static ToolCallResponse success(String text) {
        return new ToolCallResponse(false, text);
    }

    public static ToolCallResponse failure(String text) {
        return new ToolCallResponse(true, text);
    }
}
