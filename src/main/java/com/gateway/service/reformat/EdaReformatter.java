package com.gateway.service.reformat;

import com.gateway.model.ToolDefinition;
import com.gateway.service.api.ServiceReformatter;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Event-Driven Ansible: the description omits the API prefix from its paths.
 */
@Component
public class EdaReformatter implements ServiceReformatter {

    static final String PATH_PREFIX = "/api/eda/v1";

    @Override
    public String serviceName() {
        return "eda";
    }

    @Override
    public Optional<ToolDefinition> reformat(ToolDefinition tool) {
        return Optional.of(tool.toBuilder()
                .name("eda." + tool.getName())
                .pathTemplate(PATH_PREFIX + tool.getPathTemplate())
                .build());
    }
}
