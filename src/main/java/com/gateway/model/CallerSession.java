package com.gateway.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One caller's authenticated interaction sequence.
 * <p>
 * The credential is held in encrypted form; the role flags are resolved once when the session
 * is initialized and never refreshed afterwards.
 */
@Value
@Builder(toBuilder = true)
public class CallerSession {

    String sessionId;

    /**
     * Encrypted bearer credential, or {@code null} for an anonymous session.
     */
    String encryptedCredential;

    /**
     * Flags from the identity endpoint, or {@code null} when no credential was validated.
     */
    RoleFlags roleFlags;

    /**
     * Tier name requested by the operator at initialization, or {@code null}.
     */
    String tierOverride;

    String userAgent;

    SessionState state;

    Instant createdAt;

    public boolean hasRoleFlags() {
        return roleFlags != null;
    }
}
