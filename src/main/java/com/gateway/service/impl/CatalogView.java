package com.gateway.service.impl;

import com.gateway.model.AccessTier;
import com.gateway.model.ToolCatalog;
import com.gateway.model.ToolDefinition;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Restricts a catalog to the tools named by an access tier. Membership in the allow-list is the
 * only criterion; catalog order is preserved.
 */
public final class CatalogView {

    private CatalogView() {
    }

    public static List<ToolDefinition> filter(ToolCatalog catalog, AccessTier tier) {
        Set<String> allowed = new HashSet<>(tier.toolNames());
        return catalog.tools().stream()
                .filter(tool -> allowed.contains(tool.getName()))
                .toList();
    }
}
