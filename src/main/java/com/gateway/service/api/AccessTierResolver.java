package com.gateway.service.api;

import com.gateway.model.AccessTier;
import com.gateway.model.CallerSession;
import java.util.Collection;

public interface AccessTierResolver {

    /**
     * Maps a session and an optional explicit override to a configured access tier.
     *
     * @param session  The caller session, or {@code null} when the caller has none.
     * @param override Tier name requested explicitly, or {@code null}.
     * @return The resolved tier; never {@code null}.
     */
    AccessTier resolveTier(CallerSession session, String override);

    /**
     * @return All configured tiers in configuration order.
     */
    Collection<AccessTier> tiers();
}
