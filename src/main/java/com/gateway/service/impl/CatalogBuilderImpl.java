package com.gateway.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateway.config.ServiceConfig;
import com.gateway.exception.GatewayException;
import com.gateway.model.BackendDocument;
import com.gateway.model.ToolCatalog;
import com.gateway.model.ToolDefinition;
import com.gateway.service.api.BackendDocumentLoader;
import com.gateway.service.api.CatalogBuilder;
import com.gateway.service.api.ServiceReformatter;
import com.gateway.service.api.ToolExtractor;
import com.gateway.service.reformat.ServiceReformatters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Assembles the tool catalog from every enabled backend.
 * <p>
 * Deprecated tools are dropped after reformatting for every backend alike. Some backends do not
 * publish deprecation at all, so the absence of the flag is not read as "current"; the policy
 * only ever removes tools that are explicitly marked.
 */
@Service
@Slf4j
public class CatalogBuilderImpl implements CatalogBuilder {

    private final BackendDocumentLoader documentLoader;
    private final ToolExtractor toolExtractor;
    private final ServiceReformatters reformatters;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public CatalogBuilderImpl(BackendDocumentLoader documentLoader,
                              ToolExtractor toolExtractor,
                              ServiceReformatters reformatters) {
        this.documentLoader = documentLoader;
        this.toolExtractor = toolExtractor;
        this.reformatters = reformatters;
    }

    @Override
    public ToolCatalog build(List<ServiceConfig> services) {
        List<ServiceConfig> enabled = enabledServices(services);
        log.info("Loading OpenAPI specs for services: {} ({} specs)",
                enabled.stream().map(ServiceConfig::getName).toList(), enabled.size());

        List<ToolDefinition> aggregate = new ArrayList<>();
        for (ServiceConfig service : enabled) {
            Optional<BackendDocument> document = documentLoader.load(service);
            if (document.isEmpty()) {
                log.error("Service '{}' contributes no tools: its OpenAPI document could not be loaded", service.getName());
                continue;
            }
            aggregate.addAll(toolsOf(document.get()));
        }

        List<ToolDefinition> sized = aggregate.stream()
                .map(tool -> tool.toBuilder().size(sizeOf(tool)).build())
                .sorted(Comparator.comparingLong(ToolDefinition::getSize).reversed())
                .toList();
        log.info("Built tool catalog with {} tools", sized.size());
        return new ToolCatalog(sized);
    }

    List<ServiceConfig> enabledServices(List<ServiceConfig> services) {
        List<ServiceConfig> enabled = new ArrayList<>();
        for (ServiceConfig service : services) {
            if (!service.isEnabled()) {
                log.info("Service '{}' is disabled", service.getName());
            } else if (documentLoader.defaultUrl(service.getName()) == null) {
                log.warn("Ignoring unknown service '{}'", service.getName());
            } else {
                enabled.add(service);
            }
        }
        return enabled;
    }

    private List<ToolDefinition> toolsOf(BackendDocument document) {
        log.info("Loading {}", document.service());
        ServiceReformatter reformatter = reformatters.forService(document.service());
        List<ToolDefinition> tools = new ArrayList<>();
        int vetoed = 0;
        int deprecated = 0;

        for (ToolDefinition raw : toolExtractor.extract(document.document(), true)) {
            ToolDefinition tagged = raw.toBuilder().service(document.service()).build();
            Optional<ToolDefinition> reformatted = reformatter.reformat(tagged);
            if (reformatted.isEmpty()) {
                vetoed++;
            } else if (reformatted.get().isDeprecated()) {
                deprecated++;
            } else {
                tools.add(reformatted.get());
            }
        }
        log.info("Service '{}': {} tools kept, {} vetoed, {} deprecated", document.service(), tools.size(), vetoed, deprecated);
        return tools;
    }

    /**
     * @return UTF-8 byte length of the serialized name, description and input schema.
     */
    long sizeOf(ToolDefinition tool) {
        Map<String, Object> exposed = new LinkedHashMap<>();
        exposed.put("name", tool.getName());
        exposed.put("description", tool.getDescription());
        exposed.put("inputSchema", tool.getInputSchema());
        try {
            return objectMapper.writeValueAsBytes(exposed).length;
        } catch (JsonProcessingException e) {
            throw new GatewayException("Could not serialize tool '" + tool.getName() + "'", e);
        }
    }
}
