package com.gateway.service.api;

import com.gateway.model.RoleFlags;

public interface IdentityResolver {

    /**
     * Exchanges a bearer credential for the caller's role flags.
     *
     * @param credential The bearer token, without the {@code Bearer } prefix.
     * @return The flags of the first identity record.
     * @throws com.gateway.exception.IdentityValidationException if the endpoint is unreachable,
     *         answers with a non-success status, or returns no usable identity record.
     */
    RoleFlags resolve(String credential);
}
