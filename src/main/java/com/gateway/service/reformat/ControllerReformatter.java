package com.gateway.service.reformat;

import com.gateway.model.ToolDefinition;
import com.gateway.service.api.ServiceReformatter;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Automation controller: the published schema describes the standalone {@code /api/v2} layout,
 * which the platform serves under {@code /api/controller/v2}.
 */
@Component
public class ControllerReformatter implements ServiceReformatter {

    private static final Pattern API_NAME = Pattern.compile("api_(.+)");

    @Override
    public String serviceName() {
        return "controller";
    }

    @Override
    public Optional<ToolDefinition> reformat(ToolDefinition tool) {
        String path = tool.getPathTemplate() != null
                ? tool.getPathTemplate().replaceFirst(Pattern.quote("/api/v2"), "/api/controller/v2")
                : null;
        return Optional.of(tool.toBuilder()
                .pathTemplate(path)
                .name(API_NAME.matcher(tool.getName()).replaceFirst("controller.$1"))
                .description(Descriptions.firstParagraph(tool.getDescription()))
                .build());
    }
}
