package com.gateway.service.api;

import com.gateway.config.ServiceConfig;
import com.gateway.model.BackendDocument;
import java.util.Optional;

public interface BackendDocumentLoader {

    /**
     * Loads and parses the API description of one backend, from its local file when configured
     * or else from its URL.
     *
     * @param service The backend configuration.
     * @return The parsed document, or empty when it could not be read or parsed. Failures are
     *         logged, never thrown.
     */
    Optional<BackendDocument> load(ServiceConfig service);

    /**
     * @return The document URL used for a backend when none is configured, or {@code null}
     *         for an unknown backend.
     */
    String defaultUrl(String serviceName);
}
