package com.gateway.model;

/**
 * Lifecycle of a {@link CallerSession}.
 * <p>
 * The registry stores only {@link #ACTIVE} sessions. An id it has never issued, or whose
 * session has been closed and removed, reads as {@link #UNINITIALIZED}; an id whose identity
 * check is still running reads as {@link #INITIALIZING}. {@link #CLOSED} marks the session
 * handed back by a close.
 */
public enum SessionState {
    UNINITIALIZED,
    INITIALIZING,
    ACTIVE,
    CLOSED
}
