package com.gateway.service.api;

import com.gateway.model.ToolCatalog;

/**
 * Owns the catalog currently served to callers.
 */
public interface CatalogService {

    /**
     * @return The current catalog; empty before the first build.
     */
    ToolCatalog current();

    /**
     * Rebuilds the catalog from scratch and publishes it. Not re-entrant.
     *
     * @return The newly published catalog.
     */
    ToolCatalog reload();
}
