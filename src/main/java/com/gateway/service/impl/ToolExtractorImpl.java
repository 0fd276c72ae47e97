package com.gateway.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gateway.model.ToolDefinition;
import com.gateway.model.ToolDiagnostic;
import com.gateway.model.ToolParameter;
import com.gateway.service.api.SchemaTranslator;
import com.gateway.service.api.ToolExtractor;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Walks the operations of one API description and turns each included one into a raw
 * {@link ToolDefinition}.
 * <p>
 * Nothing found in a description is fatal here: gaps such as a missing operation id or
 * description are recorded as diagnostics on the tool, and an operation whose inclusion flag
 * cannot be evaluated falls back to the default inclusion.
 */
@Service
@Slf4j
public class ToolExtractorImpl implements ToolExtractor {

    static final String REQUEST_BODY = "requestBody";
    private static final String JSON_CONTENT_TYPE = "application/json";

    private final SchemaTranslator schemaTranslator;

    public ToolExtractorImpl(SchemaTranslator schemaTranslator) {
        this.schemaTranslator = schemaTranslator;
    }

    @Override
    public List<ToolDefinition> extract(OpenAPI document, boolean defaultInclude) {
        List<ToolDefinition> tools = new ArrayList<>();
        if (document == null || document.getPaths() == null) {
            return tools;
        }

        ToolNamer namer = new ToolNamer();
        for (Map.Entry<String, PathItem> pathEntry : document.getPaths().entrySet()) {
            String path = pathEntry.getKey();
            PathItem pathItem = pathEntry.getValue();
            if (pathItem == null) {
                continue;
            }
            for (Map.Entry<PathItem.HttpMethod, Operation> opEntry : pathItem.readOperationsMap().entrySet()) {
                String method = opEntry.getKey().name().toLowerCase();
                Operation operation = opEntry.getValue();
                if (!isIncluded(document, pathItem, operation, method, path, defaultInclude)) {
                    log.debug("Skipping {} {} (excluded by {})", method.toUpperCase(), path, InclusionPolicy.EXTENSION);
                    continue;
                }
                tools.add(createTool(method, path, pathItem, operation, namer));
            }
        }
        log.info("Extracted {} tools from '{}'", tools.size(),
                document.getInfo() != null ? document.getInfo().getTitle() : "untitled document");
        return tools;
    }

    private boolean isIncluded(OpenAPI document, PathItem pathItem, Operation operation,
                               String method, String path, boolean defaultInclude) {
        String label = operation.getOperationId() != null ? operation.getOperationId() : method + " " + path;
        try {
            return InclusionPolicy.resolve(operation.getExtensions(), pathItem.getExtensions(),
                    document.getExtensions(), label, path, defaultInclude);
        } catch (RuntimeException e) {
            log.warn("Error evaluating {} extension for operation {}: {}", InclusionPolicy.EXTENSION, label, e.getMessage());
            return defaultInclude;
        }
    }

    private ToolDefinition createTool(String method, String path, PathItem pathItem, Operation operation, ToolNamer namer) {
        List<ToolDiagnostic> diagnostics = new ArrayList<>();

        if (operation.getOperationId() == null) {
            diagnostics.add(ToolDiagnostic.warn("no operationId key available"));
        }
        String baseName = operation.getOperationId() != null
                ? operation.getOperationId()
                : ToolNamer.synthesize(method, path);
        String name = namer.claim(baseName);
        if (!name.equals(baseName)) {
            diagnostics.add(ToolDiagnostic.warn("name was transformed from " + baseName));
        }
        if (operation.getDescription() == null) {
            diagnostics.add(ToolDiagnostic.warn("no description in OpenAPI schema"));
        }
        if (operation.getSummary() == null) {
            diagnostics.add(ToolDiagnostic.info("no summary in OpenAPI schema"));
        }

        String description = operation.getDescription() != null ? operation.getDescription()
                : operation.getSummary() != null ? operation.getSummary()
                : "Executes " + method.toUpperCase() + " " + path;

        List<Parameter> parameters = mergeParameters(pathItem.getParameters(), operation.getParameters());
        ObjectNode properties = JsonNodeFactory.instance.objectNode();
        List<String> required = new ArrayList<>();
        addParameterProperties(parameters, properties, required);
        String bodyContentType = addRequestBodyProperty(operation.getRequestBody(), properties, required);

        ObjectNode inputSchema = JsonNodeFactory.instance.objectNode();
        inputSchema.put("type", "object");
        inputSchema.set("properties", properties);
        if (!required.isEmpty()) {
            ArrayNode requiredNode = inputSchema.putArray("required");
            required.forEach(requiredNode::add);
        }

        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(inputSchema)
                .method(method)
                .pathTemplate(path)
                .parameters(parameters.stream()
                        .filter(p -> p.getName() != null)
                        .map(p -> new ToolParameter(p.getName(), p.getIn()))
                        .toList())
                .operationId(baseName)
                .requestBodyContentType(bodyContentType)
                .deprecated(Boolean.TRUE.equals(operation.getDeprecated()))
                .diagnostics(diagnostics)
                .build();
    }

    /**
     * Merges path-item parameters with operation parameters by (name, location). An operation
     * parameter replaces a path-item parameter with the same identity at its position.
     */
    static List<Parameter> mergeParameters(List<Parameter> pathItemParameters, List<Parameter> operationParameters) {
        List<Parameter> merged = new ArrayList<>();
        for (List<Parameter> source : List.of(nullSafe(pathItemParameters), nullSafe(operationParameters))) {
            for (Parameter candidate : source) {
                if (candidate == null) {
                    continue;
                }
                int existing = indexOf(merged, candidate);
                if (existing >= 0) {
                    merged.set(existing, candidate);
                } else {
                    merged.add(candidate);
                }
            }
        }
        return merged;
    }

    private static int indexOf(List<Parameter> parameters, Parameter candidate) {
        for (int i = 0; i < parameters.size(); i++) {
            Parameter p = parameters.get(i);
            if (Objects.equals(p.getName(), candidate.getName()) && Objects.equals(p.getIn(), candidate.getIn())) {
                return i;
            }
        }
        return -1;
    }

    private static List<Parameter> nullSafe(List<Parameter> parameters) {
        return parameters != null ? parameters : Collections.emptyList();
    }

    private void addParameterProperties(List<Parameter> parameters, ObjectNode properties, List<String> required) {
        for (Parameter parameter : parameters) {
            if (parameter.getName() == null || parameter.getSchema() == null) {
                continue;
            }
            JsonNode schema = schemaTranslator.translate(parameter.getSchema());
            if (schema instanceof ObjectNode objectSchema && parameter.getDescription() != null) {
                objectSchema.put("description", parameter.getDescription());
            }
            properties.set(parameter.getName(), schema);
            if (Boolean.TRUE.equals(parameter.getRequired())) {
                required.add(parameter.getName());
            }
        }
    }

    /**
     * Adds the synthetic {@code requestBody} property.
     *
     * @return The content type the body is described with, or {@code null} without a body.
     */
    private String addRequestBodyProperty(RequestBody requestBody, ObjectNode properties, List<String> required) {
        if (requestBody == null || requestBody.getContent() == null || requestBody.getContent().isEmpty()) {
            return null;
        }
        Content content = requestBody.getContent();
        MediaType json = content.get(JSON_CONTENT_TYPE);
        String contentType;

        if (json != null && json.getSchema() != null) {
            contentType = JSON_CONTENT_TYPE;
            JsonNode bodySchema = schemaTranslator.translate(json.getSchema());
            if (bodySchema instanceof ObjectNode objectSchema) {
                String description = requestBody.getDescription() != null ? requestBody.getDescription()
                        : objectSchema.hasNonNull("description") ? objectSchema.get("description").asText()
                        : "The JSON request body.";
                objectSchema.put("description", description);
            }
            properties.set(REQUEST_BODY, bodySchema);
        } else {
            contentType = content.keySet().iterator().next();
            ObjectNode opaque = properties.putObject(REQUEST_BODY);
            opaque.put("type", "string");
            opaque.put("description", requestBody.getDescription() != null
                    ? requestBody.getDescription()
                    : "Request body (content type: " + contentType + ")");
        }

        if (Boolean.TRUE.equals(requestBody.getRequired())) {
            required.add(REQUEST_BODY);
        }
        return contentType;
    }
}
