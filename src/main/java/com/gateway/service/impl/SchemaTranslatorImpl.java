package com.gateway.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gateway.service.api.SchemaTranslator;
import io.swagger.v3.oas.models.media.Schema;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Translates swagger-parser schema models into plain JSON-Schema trees.
 * <p>
 * Only JSON-Schema keywords are carried over; OpenAPI-only keywords ({@code nullable},
 * {@code example}, {@code xml}, {@code externalDocs}, {@code deprecated}, {@code readOnly},
 * {@code writeOnly}, {@code discriminator}) are dropped, with {@code nullable} folded into the
 * type as a union with {@code null}.
 */
@Service
@Slf4j
public class SchemaTranslatorImpl implements SchemaTranslator {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public JsonNode translate(Schema<?> node) {
        return translate(node, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    @Override
    public JsonNode translate(Schema<?> node, Set<Schema<?>> visited) {
        if (node == null) {
            return genericObject();
        }
        if (node.getBooleanSchemaValue() != null) {
            return BooleanNode.valueOf(node.getBooleanSchemaValue());
        }
        if (node.get$ref() != null) {
            log.warn("Unresolved $ref '{}'.", node.get$ref());
            return genericObject();
        }
        if (visited.contains(node)) {
            log.warn("Cycle detected in schema{}, returning generic object to break recursion.",
                    node.getTitle() != null ? " \"" + node.getTitle() + "\"" : "");
            return genericObject();
        }

        visited.add(node);
        try {
            return translateObject(node, visited);
        } catch (RuntimeException e) {
            log.warn("Could not translate schema{}: {}", node.getTitle() != null ? " \"" + node.getTitle() + "\"" : "", e.getMessage());
            return genericObject();
        } finally {
            visited.remove(node);
        }
    }

    private ObjectNode translateObject(Schema<?> node, Set<Schema<?>> visited) {
        ObjectNode json = NODES.objectNode();

        writeType(json, node);
        putText(json, "format", node.getFormat());
        putText(json, "title", node.getTitle());
        putText(json, "description", node.getDescription());
        if (node.getEnum() != null) {
            json.set("enum", objectMapper.valueToTree(node.getEnum()));
        }
        if (node.getDefault() != null) {
            json.set("default", objectMapper.valueToTree(node.getDefault()));
        }
        if (node.getMinimum() != null) {
            json.put("minimum", node.getMinimum());
        }
        if (node.getMaximum() != null) {
            json.put("maximum", node.getMaximum());
        }
        if (Boolean.TRUE.equals(node.getExclusiveMinimum())) {
            json.put("exclusiveMinimum", true);
        }
        if (Boolean.TRUE.equals(node.getExclusiveMaximum())) {
            json.put("exclusiveMaximum", true);
        }
        putInt(json, "minLength", node.getMinLength());
        putInt(json, "maxLength", node.getMaxLength());
        putText(json, "pattern", node.getPattern());
        putInt(json, "minItems", node.getMinItems());
        putInt(json, "maxItems", node.getMaxItems());
        if (node.getUniqueItems() != null) {
            json.put("uniqueItems", node.getUniqueItems());
        }
        putInt(json, "minProperties", node.getMinProperties());
        putInt(json, "maxProperties", node.getMaxProperties());
        if (node.getRequired() != null && !node.getRequired().isEmpty()) {
            ArrayNode required = json.putArray("required");
            node.getRequired().forEach(required::add);
        }

        if (node.getProperties() != null) {
            ObjectNode properties = json.putObject("properties");
            for (Map.Entry<String, Schema> entry : node.getProperties().entrySet()) {
                properties.set(entry.getKey(), translate(entry.getValue(), visited));
            }
        }
        if (node.getItems() != null) {
            json.set("items", translate(node.getItems(), visited));
        }
        Object additional = node.getAdditionalProperties();
        if (additional instanceof Boolean flag) {
            json.put("additionalProperties", flag);
        } else if (additional instanceof Schema<?> additionalSchema) {
            json.set("additionalProperties", translate(additionalSchema, visited));
        }
        writeComposition(json, "allOf", node.getAllOf(), visited);
        writeComposition(json, "anyOf", node.getAnyOf(), visited);
        writeComposition(json, "oneOf", node.getOneOf(), visited);
        return json;
    }

    /**
     * Writes {@code type} with {@code integer} normalized to {@code number} and
     * {@code nullable} folded in.
     */
    private void writeType(ObjectNode json, Schema<?> node) {
        List<String> types = new ArrayList<>();
        if (node.getType() != null) {
            types.add(node.getType());
        } else if (node.getTypes() != null) {
            types.addAll(node.getTypes());
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String type : types) {
            normalized.add("integer".equals(type) ? "number" : type);
        }
        if (Boolean.TRUE.equals(node.getNullable())) {
            normalized.add("null");
        }

        if (normalized.size() == 1) {
            json.put("type", normalized.iterator().next());
        } else if (normalized.size() > 1) {
            ArrayNode union = json.putArray("type");
            normalized.forEach(union::add);
        }
    }

    private void writeComposition(ObjectNode json, String keyword, List<Schema> members, Set<Schema<?>> visited) {
        if (members == null || members.isEmpty()) {
            return;
        }
        ArrayNode array = json.putArray(keyword);
        for (Schema<?> member : members) {
            array.add(translate(member, visited));
        }
    }

    private static void putText(ObjectNode json, String field, String value) {
        if (value != null) {
            json.put(field, value);
        }
    }

    private static void putInt(ObjectNode json, String field, Integer value) {
        if (value != null) {
            json.put(field, value);
        }
    }

    static ObjectNode genericObject() {
        ObjectNode placeholder = NODES.objectNode();
        placeholder.put("type", "object");
        return placeholder;
    }
}
