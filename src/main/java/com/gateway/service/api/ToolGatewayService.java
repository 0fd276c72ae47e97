package com.gateway.service.api;

import com.gateway.dto.response.ToolCallResponse;
import com.gateway.dto.response.ToolDescriptor;
import java.util.List;
import java.util.Map;

/**
 * The operations the transport layer binds to: session bootstrap and termination, tool listing
 * and tool invocation, all keyed by session id.
 */
public interface ToolGatewayService {

    /**
     * Opens a session for a caller.
     *
     * @param authorizationHeader Raw {@code Authorization} header value, may be {@code null}.
     * @param tierOverride        Tier requested through the endpoint, may be {@code null}.
     * @param userAgent           The caller's user agent, may be {@code null}.
     * @return The new session id.
     */
    String initializeSession(String authorizationHeader, String tierOverride, String userAgent);

    /**
     * @return The tools visible to the session's access tier, in catalog order.
     */
    List<ToolDescriptor> listTools(String sessionId);

    /**
     * Invokes a tool on behalf of a session.
     *
     * @return A text payload, flagged as an error when the backend call failed.
     * @throws com.gateway.exception.UnknownToolException if no tool has this name.
     * @throws com.gateway.exception.SessionException if neither the session nor the configuration
     *                                                provides a bearer token.
     */
    ToolCallResponse callTool(String sessionId, String toolName, Map<String, Object> arguments);

    void terminateSession(String sessionId);
}
