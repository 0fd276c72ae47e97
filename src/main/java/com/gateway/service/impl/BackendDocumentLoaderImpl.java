package com.gateway.service.impl;

import com.gateway.config.GatewayProperties;
import com.gateway.config.ServiceConfig;
import com.gateway.model.BackendDocument;
import com.gateway.service.api.BackendDocumentLoader;
import io.swagger.parser.OpenAPIParser;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Reads backend API descriptions from disk or over HTTP and parses them with swagger-parser.
 * <p>
 * Parsing resolves local references fully, so a {@code $ref} that points back to an enclosing
 * schema becomes a shared object reference. Swagger 2.0 documents are converted to the
 * OpenAPI 3 model on the way.
 */
@Service
@Slf4j
public class BackendDocumentLoaderImpl implements BackendDocumentLoader {

    static final String CONTROLLER_SCHEMA_URL = "https://s3.amazonaws.com/awx-public-ci-files/release_4.6/schema.json";

    private final WebClient webClient;
    private final GatewayProperties properties;

    public BackendDocumentLoaderImpl(WebClient webClient, GatewayProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public String defaultUrl(String serviceName) {
        String baseUrl = properties.getBaseUrl();
        Map<String, String> defaults = Map.of(
                "eda", baseUrl + "/api/eda/v1/openapi.json",
                "gateway", baseUrl + "/api/gateway/v1/docs/schema/",
                "galaxy", baseUrl + "/api/galaxy/v3/openapi.json",
                "controller", CONTROLLER_SCHEMA_URL);
        return serviceName == null ? null : defaults.get(serviceName);
    }

    @Override
    public Optional<BackendDocument> load(ServiceConfig service) {
        boolean local = StringUtils.hasText(service.getLocalPath());
        String source = local ? service.getLocalPath()
                : StringUtils.hasText(service.getUrl()) ? service.getUrl()
                : defaultUrl(service.getName());
        if (source == null) {
            log.error("No OpenAPI source configured for service '{}'", service.getName());
            return Optional.empty();
        }

        try {
            String content = local ? readLocal(source) : fetch(source);
            return parse(content, source).map(openAPI -> new BackendDocument(service.getName(), source, openAPI));
        } catch (Exception e) {
            log.error("Error loading OpenAPI spec from {}: {}", source, e.getMessage(), e);
            return Optional.empty();
        }
    }

    private String readLocal(String path) throws IOException {
        log.info("Loading OpenAPI spec from local file: {}", path);
        return Files.readString(Path.of(path), StandardCharsets.UTF_8);
    }

    private String fetch(String url) {
        log.info("Fetching OpenAPI spec from: {}", url);
        return webClient.get()
                .uri(url)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(properties.getTimeouts().getDocumentFetch())
                .block();
    }

    private Optional<OpenAPI> parse(String content, String source) {
        if (content == null || content.isBlank()) {
            log.error("Empty OpenAPI document received from {}", source);
            return Optional.empty();
        }
        ParseOptions options = new ParseOptions();
        options.setResolve(true);
        options.setResolveFully(true);
        SwaggerParseResult result = new OpenAPIParser().readContents(content, null, options);
        if (result.getMessages() != null && !result.getMessages().isEmpty()) {
            log.debug("Parser messages for {}: {}", source, result.getMessages());
        }
        if (result.getOpenAPI() == null) {
            log.error("Failed to parse the OpenAPI document from {}: {}", source, result.getMessages());
            return Optional.empty();
        }
        log.info("Successfully loaded OpenAPI spec from: {}", source);
        return Optional.of(result.getOpenAPI());
    }
}
