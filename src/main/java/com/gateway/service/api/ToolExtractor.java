package com.gateway.service.api;

import com.gateway.model.ToolDefinition;
import io.swagger.v3.oas.models.OpenAPI;
import java.util.List;

public interface ToolExtractor {

    /**
     * Produces one raw tool per included (path, method) operation of an API description.
     *
     * @param document       The parsed API description.
     * @param defaultInclude Inclusion when no {@code x-mcp} flag applies at any level.
     * @return Tools in document order with unique names; never {@code null}.
     */
    List<ToolDefinition> extract(OpenAPI document, boolean defaultInclude);
}
