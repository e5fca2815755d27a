package com.khaounen.authguard.security.ratelimit;

import com.khaounen.authguard.security.sweep.ExpirableStore;

import java.util.Optional;

/**
 * Fixed-window request counter. Implementations must run the whole
 * read-modify-write of {@link #check} atomically per key.
 */
public interface WindowCounterStore extends ExpirableStore {

    RateLimitDecision check(String key, PolicyPreset policy);

    void reset(String key);

    void resetAll();

    Optional<WindowEntry> entry(String key);
}
