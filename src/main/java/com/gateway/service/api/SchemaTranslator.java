package com.gateway.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.models.media.Schema;
import java.util.Set;

public interface SchemaTranslator {

    /**
     * Converts one OpenAPI schema node into a portable JSON-Schema node.
     * <p>
     * {@code visited} holds the nodes on the current descent path, compared by reference. A node
     * already on the path is replaced by a generic object schema, which is what keeps recursive
     * schemas finite. Never throws; anomalies degrade to a generic object schema.
     *
     * @param node    The schema node, may be {@code null}.
     * @param visited Identity set of the ancestors of {@code node}; restored before returning.
     * @return An object node, or a boolean node for boolean schemas.
     */
    JsonNode translate(Schema<?> node, Set<Schema<?>> visited);

    /**
     * Translates a root node with a fresh visited set.
     */
    JsonNode translate(Schema<?> node);
}
