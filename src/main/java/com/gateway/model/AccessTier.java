package com.gateway.model;

import java.util.List;

/**
 * A named visibility class and the tool names it may see.
 * <p>
 * The allow-list is not checked against the catalog: names without a matching tool simply
 * never match when the catalog is filtered.
 *
 * @param name      The tier name, e.g. {@code anonymous}.
 * @param toolNames The ordered allow-list of tool names.
 */
public record AccessTier(String name, List<String> toolNames) {

    public AccessTier {
        toolNames = toolNames == null ? List.of() : List.copyOf(toolNames);
    }

    public boolean allows(String toolName) {
        return toolNames.contains(toolName);
    }
}
