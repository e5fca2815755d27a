package com.khaounen.authguard.security.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-process {@link WindowCounterStore}. Entries are immutable and replaced
 * inside {@code compute}, which Caffeine runs atomically per key.
 */
public class InMemoryWindowCounterStore implements WindowCounterStore {

    private final Clock clock;
    private final Cache<String, WindowEntry> counters;

    public InMemoryWindowCounterStore(Clock clock) {
        this(clock, 0);
    }

    /**
     * @param maxEntries upper bound on tracked keys; 0 or less means unbounded
     */
    public InMemoryWindowCounterStore(Clock clock, long maxEntries) {
        this.clock = clock;
        Caffeine<Object, Object> builder = Caffeine.newBuilder();
        if (maxEntries > 0) {
            builder.maximumSize(maxEntries);
        }
        this.counters = builder.build();
    }

    @Override
    public RateLimitDecision check(String key, PolicyPreset policy) {
        long now = clock.millis();
        long windowMillis = policy.windowMillis();
        WindowEntry entry = counters.asMap().compute(key, (k, existing) -> {
            if (existing == null || existing.isExpired(now)) {
                return WindowEntry.open(now, windowMillis);
            }
            return existing.increment();
        });
        if (entry.count() > policy.maxRequests()) {
            return RateLimitDecision.deny(policy, entry, now);
        }
        return RateLimitDecision.allow(policy, entry);
    }

    @Override
    public void reset(String key) {
        counters.invalidate(key);
    }

    @Override
    public void resetAll() {
        counters.invalidateAll();
    }

    @Override
    public Optional<WindowEntry> entry(String key) {
        return Optional.ofNullable(counters.getIfPresent(key));
    }

    @Override
    public int evictExpired() {
        long now = clock.millis();
        ConcurrentMap<String, WindowEntry> map = counters.asMap();
        int evicted = 0;
        for (String key : map.keySet()) {
            boolean[] removed = new boolean[1];
            map.computeIfPresent(key, (k, entry) -> {
                if (entry.isExpired(now)) {
                    removed[0] = true;
                    return null;
                }
                return entry;
            });
            if (removed[0]) {
                evicted++;
            }
        }
        return evicted;
    }

    @Override
    public long size() {
        counters.cleanUp();
        return counters.estimatedSize();
    }
}
