package com.gateway.service.impl;

import com.gateway.model.CallerSession;
import com.gateway.model.RoleFlags;
import com.gateway.model.SessionState;
import com.gateway.service.api.IdentityResolver;
import com.gateway.service.api.SessionRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.jasypt.encryption.StringEncryptor;
import org.springframework.stereotype.Service;

/**
 * In-memory {@link SessionRegistry} backed by a concurrent map.
 * <p>
 * Credentials are encrypted with the Jasypt {@link StringEncryptor} before they are stored and
 * decrypted only when a tool call needs them. A session is visible to {@link #get(String)} only
 * once its identity has been resolved; a failed resolution leaves no trace in the map.
 */
@Service
@Slf4j
public class SessionRegistryImpl implements SessionRegistry {

    private final Map<String, CallerSession> sessions = new ConcurrentHashMap<>();
    private final Set<String> initializing = ConcurrentHashMap.newKeySet();
    private final IdentityResolver identityResolver;
    private final StringEncryptor encryptor;

    public SessionRegistryImpl(IdentityResolver identityResolver, StringEncryptor encryptor) {
        this.identityResolver = identityResolver;
        this.encryptor = encryptor;
    }

    @Override
    public CallerSession initialize(String credential, String tierOverride, String userAgent) {
        String sessionId = UUID.randomUUID().toString();
        log.debug("Session {} is {}", sessionId, SessionState.INITIALIZING);

        RoleFlags roleFlags = null;
        if (credential != null && !credential.isBlank()) {
            initializing.add(sessionId);
            try {
                roleFlags = identityResolver.resolve(credential);
            } finally {
                initializing.remove(sessionId);
            }
        } else {
            log.warn("No bearer token provided for session {}", sessionId);
        }

        CallerSession session = CallerSession.builder()
                .sessionId(sessionId)
                .encryptedCredential(roleFlags != null ? encryptor.encrypt(credential) : null)
                .roleFlags(roleFlags)
                .tierOverride(tierOverride)
                .userAgent(userAgent != null ? userAgent : "unknown")
                .state(SessionState.ACTIVE)
                .createdAt(Instant.now())
                .build();
        sessions.put(sessionId, session);

        if (roleFlags != null) {
            log.info("Session initialized with ID: {}{} (superuser={}, auditor={})", sessionId,
                    tierOverride != null ? " with tier override: " + tierOverride : "",
                    roleFlags.superuser(), roleFlags.platformAuditor());
        } else {
            log.info("Anonymous session initialized with ID: {}{}", sessionId,
                    tierOverride != null ? " with tier override: " + tierOverride : "");
        }
        return session;
    }

    @Override
    public Optional<CallerSession> get(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Optional<String> credentialFor(String sessionId) {
        return get(sessionId)
                .map(CallerSession::getEncryptedCredential)
                .map(encryptor::decrypt);
    }

    @Override
    public Optional<CallerSession> close(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        CallerSession removed = sessions.remove(sessionId);
        if (removed == null) {
            return Optional.empty();
        }
        log.info("Removed session data for session: {} ({})", sessionId, SessionState.CLOSED);
        return Optional.of(removed.toBuilder().state(SessionState.CLOSED).build());
    }

    @Override
    public SessionState state(String sessionId) {
        if (sessionId == null) {
            return SessionState.UNINITIALIZED;
        }
        if (sessions.containsKey(sessionId)) {
            return SessionState.ACTIVE;
        }
        return initializing.contains(sessionId) ? SessionState.INITIALIZING : SessionState.UNINITIALIZED;
    }

    int initializingCount() {
        return initializing.size();
    }

    @Override
    @PreDestroy
    public void closeAll() {
        if (!sessions.isEmpty()) {
            log.info("Closing {} open sessions", sessions.size());
        }
        sessions.keySet().forEach(this::close);
    }

    @Override
    public int activeCount() {
        return sessions.size();
    }
}
