package com.gateway.service.impl;

import com.gateway.config.GatewayProperties;
import com.gateway.exception.IdentityValidationException;
import com.gateway.model.RoleFlags;
import com.gateway.service.api.IdentityResolver;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Validates bearer credentials against the platform gateway's {@code me} endpoint.
 */
@Service
@Slf4j
public class IdentityResolverImpl implements IdentityResolver {

    static final String ME_PATH = "/api/gateway/v1/me/";

    private static final Configuration LENIENT = Configuration.defaultConfiguration()
            .addOptions(Option.SUPPRESS_EXCEPTIONS);

    private final WebClient webClient;
    private final GatewayProperties properties;

    public IdentityResolverImpl(WebClient webClient, GatewayProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public RoleFlags resolve(String credential) {
        String body;
        try {
            body = webClient.get()
                    .uri(properties.getBaseUrl() + ME_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + credential)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(properties.getTimeouts().getIdentity())
                    .block();
        } catch (WebClientResponseException e) {
            log.error("Token validation failed: {} {}", e.getStatusCode().value(), e.getStatusText());
            throw new IdentityValidationException("Authentication failed: " + e.getStatusCode().value() + " " + e.getStatusText(), e);
        } catch (Exception e) {
            log.error("Token validation failed: {}", e.getMessage());
            throw new IdentityValidationException("Token validation failed: " + e.getMessage(), e);
        }
        return parseRoleFlags(body);
    }

    /**
     * Reads the flags of {@code results[0]}. Missing flags count as {@code false}; a missing or
     * empty {@code results} array is a validation failure.
     */
    RoleFlags parseRoleFlags(String body) {
        DocumentContext document;
        try {
            document = JsonPath.using(LENIENT).parse(body);
        } catch (Exception e) {
            throw new IdentityValidationException("Invalid response format from " + ME_PATH, e);
        }
        Object results = document.read("$.results");
        if (!(results instanceof List<?> records) || records.isEmpty()) {
            throw new IdentityValidationException("Invalid response format from " + ME_PATH);
        }
        boolean superuser = Boolean.TRUE.equals(document.read("$.results[0].is_superuser"));
        boolean auditor = Boolean.TRUE.equals(document.read("$.results[0].is_platform_auditor"));
        return new RoleFlags(superuser, auditor);
    }
}
