package com.gateway.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gateway.config.GatewayProperties;
import com.gateway.dto.response.ToolCallResponse;
import com.gateway.dto.response.ToolDescriptor;
import com.gateway.exception.GatewayException;
import com.gateway.exception.SessionException;
import com.gateway.exception.ToolExecutionException;
import com.gateway.exception.UnknownToolException;
import com.gateway.model.AccessTier;
import com.gateway.model.CallerSession;
import com.gateway.model.InvocationResult;
import com.gateway.model.ToolDefinition;
import com.gateway.service.api.AccessTierResolver;
import com.gateway.service.api.CatalogService;
import com.gateway.service.api.Dispatcher;
import com.gateway.service.api.SessionRegistry;
import com.gateway.service.api.ToolGatewayService;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Wires sessions, access tiers, the catalog and the dispatcher into the operations served to
 * callers.
 * <p>
 * A session id the registry does not know is treated like no session at all: the caller sees the
 * lowest tier and tool calls use the fallback bearer token, if one is configured.
 */
@Service
@Slf4j
public class ToolGatewayServiceImpl implements ToolGatewayService {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SessionRegistry sessionRegistry;
    private final AccessTierResolver accessTierResolver;
    private final CatalogService catalogService;
    private final Dispatcher dispatcher;
    private final GatewayProperties properties;
    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public ToolGatewayServiceImpl(SessionRegistry sessionRegistry,
                                  AccessTierResolver accessTierResolver,
                                  CatalogService catalogService,
                                  Dispatcher dispatcher,
                                  GatewayProperties properties) {
        this.sessionRegistry = sessionRegistry;
        this.accessTierResolver = accessTierResolver;
        this.catalogService = catalogService;
        this.dispatcher = dispatcher;
        this.properties = properties;
    }

    @Override
    public String initializeSession(String authorizationHeader, String tierOverride, String userAgent) {
        String token = extractBearerToken(authorizationHeader);
        return sessionRegistry.initialize(token, tierOverride, userAgent).getSessionId();
    }

    @Override
    public List<ToolDescriptor> listTools(String sessionId) {
        Optional<CallerSession> session = sessionRegistry.get(sessionId);
        String override = session.map(CallerSession::getTierOverride).orElse(null);
        AccessTier tier = accessTierResolver.resolveTier(session.orElse(null), override);

        List<ToolDefinition> visible = CatalogView.filter(catalogService.current(), tier);
        log.info("Returning {} tools for {} tier{} (session: {})", visible.size(), tier.name(),
                override != null ? " (override: " + override + ")" : "", sessionId != null ? sessionId : "none");
        return visible.stream()
                .map(tool -> new ToolDescriptor(tool.getName(), tool.getDescription(), tool.getInputSchema()))
                .toList();
    }

    @Override
    public ToolCallResponse callTool(String sessionId, String toolName, Map<String, Object> arguments) {
        ToolDefinition tool = catalogService.current().find(toolName)
                .orElseThrow(() -> new UnknownToolException(toolName));
        String userAgent = sessionRegistry.get(sessionId).map(CallerSession::getUserAgent).orElse("unknown");
        String credential = credentialFor(sessionId);

        try {
            InvocationResult result = dispatcher.dispatch(tool, arguments, credential, userAgent);
            return ToolCallResponse.success(render(result));
        } catch (ToolExecutionException e) {
            return ToolCallResponse.failure("Tool execution failed: " + e.getMessage());
        }
    }

    @Override
    public void terminateSession(String sessionId) {
        if (sessionRegistry.close(sessionId).isEmpty()) {
            log.debug("Session {} was already closed", sessionId);
        }
    }

    static String extractBearerToken(String authorizationHeader) {
        return authorizationHeader != null && authorizationHeader.startsWith(BEARER_PREFIX)
                ? authorizationHeader.substring(BEARER_PREFIX.length())
                : null;
    }

    private String credentialFor(String sessionId) {
        Optional<String> sessionCredential = sessionRegistry.credentialFor(sessionId);
        if (sessionCredential.isPresent()) {
            log.debug("Using session-specific Bearer token for session: {}", sessionId);
            return sessionCredential.get();
        }
        String fallback = properties.getFallbackBearerToken();
        if (fallback == null || fallback.isBlank()) {
            throw new SessionException("No Bearer token available. Please provide an Authorization header or set BEARER_TOKEN_OAUTH2_AUTHENTICATION environment variable.");
        }
        log.debug("Using fallback Bearer token from configuration");
        return fallback;
    }

    private String render(InvocationResult result) {
        try {
            return jsonMapper.writeValueAsString(result.payload());
        } catch (JsonProcessingException e) {
            throw new GatewayException("Could not serialize the response of " + result.toolName(), e);
        }
    }
}
