package com.gateway.exception;

/**
 * Raised when a caller credential cannot be validated against the identity endpoint.
 * Session initialization fails closed on this exception.
 */
public class IdentityValidationException extends GatewayException {

    public IdentityValidationException(String message) {
        super(message);
    }

    public IdentityValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
