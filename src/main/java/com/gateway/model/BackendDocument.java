package com.gateway.model;

import io.swagger.v3.oas.models.OpenAPI;

/**
 * A parsed API description together with the backend it belongs to.
 *
 * @param service  The backend identifier, e.g. {@code eda}.
 * @param source   The file path or URL the document was read from.
 * @param document The parsed OpenAPI model, with local references resolved.
 */
public record BackendDocument(String service, String source, OpenAPI document) {
}
