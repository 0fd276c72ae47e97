package com.gateway.service.reformat;

import com.gateway.model.ToolDefinition;
import com.gateway.service.api.ServiceReformatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Strategy table of the registered {@link ServiceReformatter}s, keyed by backend identifier.
 */
@Component
@Slf4j
public class ServiceReformatters {

    private static final ServiceReformatter IDENTITY = new ServiceReformatter() {
        @Override
        public String serviceName() {
            return "identity";
        }

        @Override
        public Optional<ToolDefinition> reformat(ToolDefinition tool) {
            return Optional.of(tool);
        }
    };

    private final Map<String, ServiceReformatter> byService = new LinkedHashMap<>();

    public ServiceReformatters(List<ServiceReformatter> reformatters) {
        reformatters.forEach(r -> byService.put(r.serviceName(), r));
    }

    /**
     * @return The reformatter of a backend, or one that returns every tool unchanged.
     */
    public ServiceReformatter forService(String serviceName) {
        ServiceReformatter reformatter = byService.get(serviceName);
        if (reformatter == null) {
            log.warn("No reformatter registered for service '{}', tools are kept unchanged", serviceName);
            return IDENTITY;
        }
        return reformatter;
    }
}
