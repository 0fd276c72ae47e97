package com.gateway.service.impl;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.gateway.model.AccessTier;
import com.gateway.model.ToolCatalog;
import com.gateway.model.ToolDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogViewTest {

    private static ToolDefinition tool(String name) {
        return ToolDefinition.builder().name(name).description(name)
                .inputSchema(JsonNodeFactory.instance.objectNode()).method("get").pathTemplate("/" + name).build();
    }

    private final ToolCatalog catalog = new ToolCatalog(List.of(tool("eda.a"), tool("eda.b"), tool("gateway.c")));

    @Test
    void filter_shouldKeepCatalogOrder() {
        AccessTier tier = new AccessTier("user", List.of("gateway.c", "eda.a"));

        assertThat(CatalogView.filter(catalog, tier)).extracting(ToolDefinition::getName)
                .containsExactly("eda.a", "gateway.c");
    }

    @Test
    void filter_shouldIgnoreNamesMissingFromCatalog() {
        // e.g. a tool the galaxy reformatter vetoed is still named by the tier
        AccessTier tier = new AccessTier("admin", List.of("eda.b", "galaxy.pulp_tasks_list"));

        assertThat(CatalogView.filter(catalog, tier)).extracting(ToolDefinition::getName).containsExactly("eda.b");
    }

    @Test
    void filter_emptyTierShouldSeeNothing() {
        assertThat(CatalogView.filter(catalog, new AccessTier("anonymous", null))).isEmpty();
    }
}
