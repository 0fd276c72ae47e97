package com.gateway.service.api;

import com.gateway.config.ServiceConfig;
import com.gateway.model.ToolCatalog;
import java.util.List;

public interface CatalogBuilder {

    /**
     * Runs load, extraction and reformatting for every enabled backend and assembles the
     * result into a new catalog. A backend that fails to load contributes no tools.
     *
     * @param services The configured backends.
     * @return A new immutable catalog.
     */
    ToolCatalog build(List<ServiceConfig> services);
}
