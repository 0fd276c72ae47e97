package com.gateway.service.impl;

import com.gateway.config.GatewayProperties;
import com.gateway.model.AccessTier;
import com.gateway.model.CallerSession;
import com.gateway.service.api.AccessTierResolver;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves the access tier of a caller from the configured tiers.
 * <p>
 * An explicit override naming a configured tier always wins, whatever the caller's role flags.
 * The override is an operator convenience for exposing a reduced tool set on a dedicated
 * endpoint; it is not an authorization mechanism, and backends still enforce their own
 * permissions on every dispatched call.
 */
@Service
@Slf4j
public class AccessTierResolverImpl implements AccessTierResolver {

    private final Map<String, AccessTier> tiers;
    private final GatewayProperties.Tiers config;

    public AccessTierResolverImpl(GatewayProperties properties) {
        this.config = properties.getTiers();
        Map<String, AccessTier> byName = new LinkedHashMap<>();
        config.getAllowLists().forEach((name, toolNames) ->
                byName.put(normalize(name), new AccessTier(normalize(name), toolNames)));
        this.tiers = Collections.unmodifiableMap(byName);
        log.info("Configured access tiers: {}", tiers.keySet());
    }

    @Override
    public AccessTier resolveTier(CallerSession session, String override) {
        if (override != null) {
            return fromOverride(override).orElseGet(() -> {
                log.warn("Unknown tier override: {}, defaulting to {}", override, config.getLowest());
                return lowest();
            });
        }
        return forUnresolved(session)
                .or(() -> forElevated(session))
                .or(this::forAuthenticated)
                .orElseGet(this::lowest);
    }

    @Override
    public Collection<AccessTier> tiers() {
        return tiers.values();
    }

    /**
     * An override matching a configured tier, case-insensitively.
     */
    Optional<AccessTier> fromOverride(String override) {
        return tier(override);
    }

    /**
     * Callers without a session or without resolved role flags get the lowest tier.
     */
    Optional<AccessTier> forUnresolved(CallerSession session) {
        if (session == null || !session.hasRoleFlags()) {
            return Optional.of(lowest());
        }
        return Optional.empty();
    }

    /**
     * Superusers get the highest tier, when one is configured.
     */
    Optional<AccessTier> forElevated(CallerSession session) {
        if (session != null && session.hasRoleFlags() && session.getRoleFlags().superuser()) {
            return tier(config.getHighest());
        }
        return Optional.empty();
    }

    /**
     * Every other authenticated caller gets the middle tier, when one is configured.
     */
    Optional<AccessTier> forAuthenticated() {
        return tier(config.getMiddle());
    }

    /**
     * The lowest tier, or an empty allow-list under its name when it is not configured.
     */
    AccessTier lowest() {
        return tier(config.getLowest()).orElseGet(() -> new AccessTier(normalize(config.getLowest()), List.of()));
    }

    private Optional<AccessTier> tier(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tiers.get(normalize(name)));
    }

    private static String normalize(String name) {
        return name == null ? null : name.toLowerCase(Locale.ROOT);
    }
}
