package com.gateway.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gateway.config.GatewayProperties;
import com.gateway.exception.GatewayException;
import com.gateway.exception.ToolExecutionException;
import com.gateway.model.AuditEntry;
import com.gateway.model.InvocationResult;
import com.gateway.model.ToolDefinition;
import com.gateway.model.ToolParameter;
import com.gateway.service.api.AuditSink;
import com.gateway.service.api.Dispatcher;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Turns a tool invocation into an HTTP request against the platform and classifies the answer.
 * <p>
 * Arguments are not validated against the tool's input schema. A path parameter missing from
 * the arguments stays in the URL as its {@code {name}} placeholder and the backend rejects the
 * call. Failed calls are never retried.
 */
@Service
@Slf4j
public class DispatcherImpl implements Dispatcher {

    static final String REQUEST_BODY = "requestBody";
    private static final Pattern PATH_PLACEHOLDER = Pattern.compile("\\{([^}/]+)}");
    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    private final WebClient webClient;
    private final GatewayProperties properties;
    private final AuditSink auditSink;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public DispatcherImpl(WebClient webClient, GatewayProperties properties, AuditSink auditSink) {
        this.webClient = webClient;
        this.properties = properties;
        this.auditSink = auditSink;
    }

    @Override
    public InvocationResult dispatch(ToolDefinition tool, Map<String, Object> args, String credential, String userAgent) {
        Map<String, Object> arguments = args != null ? args : Map.of();
        String method = tool.httpMethod();
        URI uri = buildUri(tool, arguments);
        log.info("Calling: {} {}", method, uri);

        WebClient.RequestHeadersSpec<?> request = buildRequest(method, uri, arguments, credential);

        long started = System.nanoTime();
        RawResponse raw;
        try {
            raw = request
                    .exchangeToMono(response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new RawResponse(response.statusCode().value(),
                                    response.headers().contentType().orElse(null), body)))
                    .timeout(properties.getTimeouts().getDispatch())
                    .block();
        } catch (Exception e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Call to {} {} failed: {}", method, uri, error);
            publishAudit(new AuditEntry(tool.getName(), tool.getService(), uri.toString(), method, userAgent,
                    Map.of("error", error), 0, Instant.now()));
            throw new ToolExecutionException(error, e);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        Classified classified = classify(raw);
        publishAudit(new AuditEntry(tool.getName(), tool.getService(), uri.toString(), method, userAgent,
                classified.payload(), raw.status(), Instant.now()));

        if (raw.status() < 200 || raw.status() >= 300) {
            log.warn("{} {} answered {} after {} ms", method, uri, raw.status(), elapsed.toMillis());
            String body = classified.structured() ? classified.payload().toString() : classified.payload().asText();
            throw new ToolExecutionException(raw.status(), body);
        }
        log.debug("{} {} answered {} after {} ms", method, uri, raw.status(), elapsed.toMillis());
        return new InvocationResult(tool.getName(), method, uri.toString(), raw.status(),
                classified.payload(), classified.structured(), elapsed);
    }

    /**
     * Expands the path template and query parameters with strict encoding: every character
     * outside the unreserved set is percent-encoded, so {@code +}, {@code &} or {@code /} in an
     * argument reach the backend as data. A path placeholder without a value is kept literally.
     */
    URI buildUri(ToolDefinition tool, Map<String, Object> args) {
        Set<String> pathParameters = tool.getParameters().stream()
                .filter(ToolParameter::isPath)
                .map(ToolParameter::name)
                .collect(Collectors.toSet());
        Map<String, Object> variables = new HashMap<>();

        // placeholders are renamed so argument names never clash with query variables
        Matcher matcher = PATH_PLACEHOLDER.matcher(tool.getPathTemplate());
        StringBuilder path = new StringBuilder();
        while (matcher.find()) {
            Object value = pathParameters.contains(matcher.group(1)) ? args.get(matcher.group(1)) : null;
            String variable = "p" + variables.size();
            variables.put(variable, value != null ? String.valueOf(value) : matcher.group());
            matcher.appendReplacement(path, Matcher.quoteReplacement("{" + variable + "}"));
        }
        matcher.appendTail(path);

        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(properties.getBaseUrl() + path);
        for (ToolParameter parameter : tool.getParameters()) {
            Object value = args.get(parameter.name());
            if (parameter.isQuery() && value != null) {
                String variable = "q" + variables.size();
                variables.put(variable, queryValue(value));
                builder.queryParam(parameter.name(), "{" + variable + "}");
            }
        }
        return builder.encode().buildAndExpand(variables).toUri();
    }

    private WebClient.RequestHeadersSpec<?> buildRequest(String method, URI uri, Map<String, Object> args, String credential) {
        WebClient.RequestBodySpec request = webClient.method(HttpMethod.valueOf(method))
                .uri(uri)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + credential)
                .accept(MediaType.APPLICATION_JSON);

        Object body = args.get(REQUEST_BODY);
        if (BODY_METHODS.contains(method) && body != null) {
            return request.contentType(MediaType.APPLICATION_JSON).bodyValue(serialize(body));
        }
        return request;
    }

    private String serialize(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new GatewayException("Could not serialize the request body: " + e.getOriginalMessage(), e);
        }
    }

    private static String queryValue(Object value) {
        if (value instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).collect(Collectors.joining(","));
        }
        return String.valueOf(value);
    }

    /**
     * Parses JSON responses; everything else, including JSON that does not parse, stays text.
     */
    private Classified classify(RawResponse raw) {
        if (raw.contentType() != null && isJson(raw.contentType()) && !raw.body().isBlank()) {
            try {
                return new Classified(objectMapper.readTree(raw.body()), true);
            } catch (JsonProcessingException e) {
                log.debug("Response declared as {} is not valid JSON, keeping it as text", raw.contentType());
            }
        }
        return new Classified(TextNode.valueOf(raw.body()), false);
    }

    private static boolean isJson(MediaType contentType) {
        return MediaType.APPLICATION_JSON.isCompatibleWith(contentType)
                || contentType.getSubtype().endsWith("+json");
    }

    private void publishAudit(AuditEntry entry) {
        if (!properties.isRecordApiQueries()) {
            return;
        }
        try {
            Mono.fromRunnable(() -> auditSink.record(entry))
                    .subscribeOn(Schedulers.boundedElastic())
                    .subscribe(null, error -> log.warn("Failed to record audit entry for tool {}: {}",
                            entry.toolName(), error.getMessage()));
        } catch (RuntimeException e) {
            log.warn("Could not schedule audit entry for tool {}: {}", entry.toolName(), e.getMessage());
        }
    }

    private record RawResponse(int status, MediaType contentType, String body) {
    }

    private record Classified(JsonNode payload, boolean structured) {
    }
}
