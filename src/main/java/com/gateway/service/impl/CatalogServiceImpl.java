package com.gateway.service.impl;

import com.gateway.config.GatewayProperties;
import com.gateway.model.AccessTier;
import com.gateway.model.ToolCatalog;
import com.gateway.service.api.AccessTierResolver;
import com.gateway.service.api.CatalogBuilder;
import com.gateway.service.api.CatalogService;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class CatalogServiceImpl implements CatalogService {

    private final CatalogBuilder catalogBuilder;
    private final AccessTierResolver accessTierResolver;
    private final GatewayProperties properties;
    private final AtomicReference<ToolCatalog> current = new AtomicReference<>(ToolCatalog.empty());

    public CatalogServiceImpl(CatalogBuilder catalogBuilder,
                              AccessTierResolver accessTierResolver,
                              GatewayProperties properties) {
        this.catalogBuilder = catalogBuilder;
        this.accessTierResolver = accessTierResolver;
        this.properties = properties;
    }

    @Override
    public ToolCatalog current() {
        return current.get();
    }

    @Override
    public synchronized ToolCatalog reload() {
        ToolCatalog catalog = catalogBuilder.build(properties.getServices());
        reportUnknownAllowListEntries(catalog);
        current.set(catalog);
        return catalog;
    }

    /**
     * Allow-list names without a tool are not an error; they are reported once per build so a
     * stale tier configuration shows up in the logs.
     */
    private void reportUnknownAllowListEntries(ToolCatalog catalog) {
        for (AccessTier tier : accessTierResolver.tiers()) {
            List<String> unknown = tier.toolNames().stream()
                    .distinct()
                    .filter(name -> !catalog.contains(name))
                    .toList();
            if (!unknown.isEmpty()) {
                log.warn("Tier '{}' names {} tools missing from the catalog: {}", tier.name(), unknown.size(), unknown);
            }
        }
    }
}
