package com.gateway.dto.response;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The caller-facing view of a tool in a tool-list response.
 *
 * @param name        The tool name to invoke.
 * @param description What the tool does.
 * @param inputSchema JSON-Schema of the accepted arguments.
 */
public record ToolDescriptor(String name, String description, ObjectNode inputSchema) {
}
