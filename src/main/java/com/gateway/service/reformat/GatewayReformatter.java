package com.gateway.service.reformat;

import com.gateway.model.ToolDefinition;
import com.gateway.service.api.ServiceReformatter;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Platform gateway: hides legacy endpoints and keeps only the first description paragraph.
 */
@Component
public class GatewayReformatter implements ServiceReformatter {

    @Override
    public String serviceName() {
        return "gateway";
    }

    @Override
    public Optional<ToolDefinition> reformat(ToolDefinition tool) {
        String description = Descriptions.firstParagraph(tool.getDescription());
        if (description != null && description.contains("Legacy")) {
            return Optional.empty();
        }
        return Optional.of(tool.toBuilder()
                .name("gateway." + tool.getName())
                .description(description)
                .build());
    }
}
