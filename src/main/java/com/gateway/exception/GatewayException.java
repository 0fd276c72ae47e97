package com.gateway.exception;

/**
 * Base runtime exception for failures raised by the tool gateway.
 * <p>
 * Subclasses separate caller errors (an unknown tool, a bad session request) from failures of
 * the upstream platform (identity validation, tool dispatch), so the transport can report each
 * through the same response channel without leaking internal state.
 */
public class GatewayException extends RuntimeException {

    /**
     * Constructs a new GatewayException with the specified detail message.
     *
     * @param message The detail message.
     */
    public GatewayException(String message) {
        super(message);
    }

    /**
     * Constructs a new GatewayException with the specified detail message and cause.
     *
     * @param message The detail message.
     * @param cause   The underlying cause, may be {@code null}.
     */
    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
