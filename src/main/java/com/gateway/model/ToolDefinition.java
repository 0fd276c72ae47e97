package com.gateway.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One invocable operation of a backend, as exposed to callers of the gateway.
 * <p>
 * Instances are immutable. Reformatting and catalog assembly derive new instances through
 * {@link #toBuilder()} instead of mutating existing ones.
 */
@Value
@Builder(toBuilder = true)
public class ToolDefinition {

    /**
     * The unique tool name within the catalog, e.g. {@code eda.activations_list}.
     */
    String name;

    String description;

    /**
     * JSON-Schema object describing the accepted arguments. Advisory only: the gateway does not
     * validate arguments against it.
     */
    ObjectNode inputSchema;

    /**
     * Lower-case HTTP method, e.g. {@code get}.
     */
    String method;

    /**
     * Path relative to the platform base URL, with {@code {name}} placeholders.
     */
    String pathTemplate;

    @Singular
    List<ToolParameter> parameters;

    /**
     * Identifier of the backend the tool was extracted from.
     */
    String service;

    /**
     * Base name before sanitizing: the declared operation id, or the synthesized one.
     */
    String operationId;

    String requestBodyContentType;

    boolean deprecated;

    @Singular
    List<ToolDiagnostic> diagnostics;

    /**
     * Serialized byte length of name, description and input schema. Zero until the catalog
     * is assembled.
     */
    long size;

    public String httpMethod() {
        return method.toUpperCase();
    }
}
