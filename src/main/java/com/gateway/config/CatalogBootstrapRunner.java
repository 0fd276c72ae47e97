package com.gateway.config;

import com.gateway.model.ToolCatalog;
import com.gateway.service.api.CatalogService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Builds the tool catalog once at startup, before the gateway serves any caller.
 */
@Component
@Profile("!test") // Ensures this does not run during tests
@Slf4j
public class CatalogBootstrapRunner implements CommandLineRunner {

    private final CatalogService catalogService;
    private final GatewayProperties properties;

    public CatalogBootstrapRunner(CatalogService catalogService, GatewayProperties properties) {
        this.catalogService = catalogService;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        log.info("BASE_URL: {}", properties.getBaseUrl());
        log.info("API query recording: {}", properties.isRecordApiQueries() ? "ENABLED" : "DISABLED");
        ToolCatalog catalog = catalogService.reload();
        log.info("Tool catalog ready: {} tools from services {}", catalog.size(), catalog.services());
    }
}
