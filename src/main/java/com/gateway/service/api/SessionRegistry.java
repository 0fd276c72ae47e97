package com.gateway.service.api;

import com.gateway.model.CallerSession;
import com.gateway.model.SessionState;
import java.util.Optional;

/**
 * Process-wide registry of caller sessions, keyed by session id.
 * <p>
 * The registry is the only owner of per-session state: credential, role flags, tier override
 * and user agent. Entries are removed explicitly on close, never left to garbage collection.
 */
public interface SessionRegistry {

    /**
     * Creates a session. When a credential is given it is validated synchronously; on failure
     * no session is stored and the exception propagates.
     *
     * @param credential   Bearer token, or {@code null} for an anonymous session.
     * @param tierOverride Tier requested by the operator, or {@code null}.
     * @param userAgent    The caller's user agent, or {@code null}.
     * @return The active session.
     */
    CallerSession initialize(String credential, String tierOverride, String userAgent);

    Optional<CallerSession> get(String sessionId);

    /**
     * @return The decrypted credential of a session, if it has one.
     */
    Optional<String> credentialFor(String sessionId);

    /**
     * Closes a session and releases everything stored for it. Idempotent.
     *
     * @return The removed session in state {@link SessionState#CLOSED}, or empty if no session
     *         was removed by this call.
     */
    Optional<CallerSession> close(String sessionId);

    /**
     * @return Where the given session id stands in its lifecycle. Ids that are unknown, blank or
     *         already closed read as {@link SessionState#UNINITIALIZED}.
     */
    SessionState state(String sessionId);

    /**
     * Closes every open session, e.g. at shutdown.
     */
    void closeAll();

    int activeCount();
}
