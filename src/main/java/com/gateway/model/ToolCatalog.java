package com.gateway.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The ordered, read-only set of tools served by the gateway.
 * <p>
 * A catalog is built once and never patched; a reload produces a new instance. Because nothing
 * mutates it after construction it can be read from any number of sessions without locking.
 */
public final class ToolCatalog {

    private static final ToolCatalog EMPTY = new ToolCatalog(List.of());

    private final List<ToolDefinition> tools;
    private final Map<String, ToolDefinition> index;

    public ToolCatalog(List<ToolDefinition> tools) {
        this.tools = List.copyOf(tools);
        Map<String, ToolDefinition> byName = new LinkedHashMap<>();
        for (ToolDefinition tool : this.tools) {
            // first definition wins, mirroring extraction order
            byName.putIfAbsent(tool.getName(), tool);
        }
        this.index = Collections.unmodifiableMap(byName);
    }

    public static ToolCatalog empty() {
        return EMPTY;
    }

    public List<ToolDefinition> tools() {
        return tools;
    }

    public Optional<ToolDefinition> find(String name) {
        return Optional.ofNullable(index.get(name));
    }

    public boolean contains(String name) {
        return index.containsKey(name);
    }

    public int size() {
        return tools.size();
    }

    /**
     * @return The distinct backend identifiers that contributed tools, in catalog order.
     */
    public Set<String> services() {
        Set<String> services = new LinkedHashSet<>();
        tools.forEach(tool -> services.add(tool.getService()));
        return services;
    }
}
