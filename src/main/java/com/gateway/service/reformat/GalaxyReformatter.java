package com.gateway.service.reformat;

import com.gateway.model.ToolDefinition;
import com.gateway.service.api.ServiceReformatter;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Automation hub: only the canonical v3 namespace is exposed; UI-only endpoints and the other
 * namespaces are vetoed.
 */
@Component
public class GalaxyReformatter implements ServiceReformatter {

    private static final String UI_PATH_PREFIX = "/api/galaxy/_ui";
    private static final String CANONICAL_PREFIX = "api_galaxy_v3";
    private static final Pattern NAMESPACE = Pattern.compile("(api_galaxy_v3_|api_galaxy_|)(.+)");

    @Override
    public String serviceName() {
        return "galaxy";
    }

    @Override
    public Optional<ToolDefinition> reformat(ToolDefinition tool) {
        if (tool.getPathTemplate() != null && tool.getPathTemplate().startsWith(UI_PATH_PREFIX)) {
            return Optional.empty();
        }
        if (!tool.getName().startsWith(CANONICAL_PREFIX)) {
            return Optional.empty();
        }
        String name = NAMESPACE.matcher(tool.getName()).replaceFirst("galaxy.$2");
        return Optional.of(tool.toBuilder().name(name).build());
    }
}
