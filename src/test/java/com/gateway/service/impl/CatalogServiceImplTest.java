package com.gateway.service.impl;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.gateway.config.GatewayProperties;
import com.gateway.config.ServiceConfig;
import com.gateway.model.AccessTier;
import com.gateway.model.ToolCatalog;
import com.gateway.model.ToolDefinition;
import com.gateway.service.api.AccessTierResolver;
import com.gateway.service.api.CatalogBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CatalogServiceImplTest {

    @Mock
    private CatalogBuilder catalogBuilder;

    @Mock
    private AccessTierResolver accessTierResolver;

    private GatewayProperties properties;
    private CatalogServiceImpl catalogService;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.setServices(List.of(new ServiceConfig("eda")));
        catalogService = new CatalogServiceImpl(catalogBuilder, accessTierResolver, properties);
    }

    @Test
    void current_shouldBeEmptyBeforeFirstReload() {
        assertThat(catalogService.current().size()).isZero();
    }

    @Test
    void reload_shouldPublishNewCatalog() {
        ToolDefinition tool = ToolDefinition.builder().name("eda.ping").description("Ping.")
                .inputSchema(JsonNodeFactory.instance.objectNode()).method("get").pathTemplate("/ping").build();
        ToolCatalog built = new ToolCatalog(List.of(tool));
        when(catalogBuilder.build(properties.getServices())).thenReturn(built);
        when(accessTierResolver.tiers()).thenReturn(List.of(new AccessTier("user", List.of("eda.ping", "eda.gone"))));

        ToolCatalog result = catalogService.reload();

        assertThat(result).isSameAs(built);
        assertThat(catalogService.current()).isSameAs(built);
        assertThat(catalogService.current().contains("eda.ping")).isTrue();
    }
}
