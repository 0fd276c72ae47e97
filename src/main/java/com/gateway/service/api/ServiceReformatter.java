package com.gateway.service.api;

import com.gateway.model.ToolDefinition;
import java.util.Optional;

/**
 * A backend-specific transformation applied to every tool extracted from that backend's
 * description, before the tools are aggregated into the catalog.
 */
public interface ServiceReformatter {

    /**
     * @return The backend identifier this reformatter is registered for.
     */
    String serviceName();

    /**
     * Namespaces, rewrites or vetoes one tool. Implementations must be free of side effects.
     *
     * @param tool The extracted tool.
     * @return The reformatted tool, or empty to drop it from the catalog.
     */
    Optional<ToolDefinition> reformat(ToolDefinition tool);
}
