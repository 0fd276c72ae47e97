package com.gateway.exception;

/**
 * Raised for malformed session traffic, e.g. a request that carries neither a known session id
 * nor a usable credential.
 */
public class SessionException extends GatewayException {

    public SessionException(String message) {
        super(message);
    }
}
