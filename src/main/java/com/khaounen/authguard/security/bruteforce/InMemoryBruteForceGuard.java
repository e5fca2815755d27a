package com.khaounen.authguard.security.bruteforce;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.khaounen.authguard.config.RequestContext;
import com.khaounen.authguard.security.events.GuardEvent;
import com.khaounen.authguard.security.events.GuardEventListener;

import java.time.Clock;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-process {@link BruteForceGuard}. Identities are trimmed and
 * lower-cased, so lookups are case-insensitive. Every transition runs inside a
 * per-key atomic {@code compute}. Streaks are never size-evicted, so flooding
 * the store with identities cannot push a lockout out.
 */
public class InMemoryBruteForceGuard implements BruteForceGuard {

    private final BruteForcePolicy policy;
    private final Clock clock;
    private final GuardEventListener eventListener;
    private final Cache<String, FailureStreak> streaks = Caffeine.newBuilder().build();

    public InMemoryBruteForceGuard(BruteForcePolicy policy, Clock clock, GuardEventListener eventListener) {
        this.policy = policy;
        this.clock = clock;
        this.eventListener = eventListener != null ? eventListener : GuardEventListener.NO_OP;
    }

    @Override
    public boolean recordFailure(String identity) {
        String key = BruteForceGuard.normalizeIdentity(identity);
        long now = clock.millis();
        long lockoutMillis = policy.lockoutDuration().toMillis();
        boolean[] newlyLocked = new boolean[1];
        FailureStreak streak = streaks.asMap().compute(key, (k, existing) -> {
            if (existing == null) {
                return lockIfThresholdReached(FailureStreak.first(now), now, lockoutMillis, newlyLocked);
            }
            StreakState state = existing.state(now, policy);
            if (state == StreakState.LOCKED) {
                FailureStreak next = existing.increment();
                return policy.extendLockoutOnFailure() ? next.lock(now + lockoutMillis) : next;
            }
            if (state == StreakState.CLEAR) {
                return lockIfThresholdReached(FailureStreak.first(now), now, lockoutMillis, newlyLocked);
            }
            return lockIfThresholdReached(existing.increment(), now, lockoutMillis, newlyLocked);
        });
        if (newlyLocked[0]) {
            eventListener.onEvent(GuardEvent.lockoutTriggered(
                    key,
                    RequestContext.getClientIp(),
                    ceilSeconds(streak.lockedUntil() - now),
                    clock.instant()
            ));
        }
        return streak.state(now, policy) == StreakState.LOCKED;
    }

    @Override
    public void recordSuccess(String identity) {
        streaks.invalidate(BruteForceGuard.normalizeIdentity(identity));
    }

    @Override
    public boolean isBlocked(String identity) {
        String key = BruteForceGuard.normalizeIdentity(identity);
        long now = clock.millis();
        FailureStreak streak = streaks.getIfPresent(key);
        if (streak == null || !streak.locked()) {
            return false;
        }
        if (now <= streak.lockedUntil()) {
            return true;
        }
        // lazy expiry; re-checked under the key lock so a fresh lockout is kept
        streaks.asMap().computeIfPresent(key, (k, current) ->
                current.locked() && now > current.lockedUntil() ? null : current);
        return false;
    }

    @Override
    public long remainingLockoutSeconds(String identity) {
        FailureStreak streak = streaks.getIfPresent(BruteForceGuard.normalizeIdentity(identity));
        if (streak == null || !streak.locked()) {
            return 0;
        }
        return ceilSeconds(streak.lockedUntil() - clock.millis());
    }

    @Override
    public void unblock(String identity) {
        String key = BruteForceGuard.normalizeIdentity(identity);
        FailureStreak removed = streaks.asMap().remove(key);
        if (removed != null) {
            eventListener.onEvent(GuardEvent.unblocked(key, clock.instant()));
        }
    }

    @Override
    public int failureCount(String identity) {
        FailureStreak streak = streaks.getIfPresent(BruteForceGuard.normalizeIdentity(identity));
        if (streak == null || streak.state(clock.millis(), policy) == StreakState.CLEAR) {
            return 0;
        }
        return streak.attemptCount();
    }

    @Override
    public LockoutStatus status(String identity) {
        String key = BruteForceGuard.normalizeIdentity(identity);
        long now = clock.millis();
        FailureStreak streak = streaks.getIfPresent(key);
        if (streak == null) {
            return LockoutStatus.clear(key);
        }
        StreakState state = streak.state(now, policy);
        return switch (state) {
            case CLEAR -> LockoutStatus.clear(key);
            case ACCUMULATING -> new LockoutStatus(key, state, streak.attemptCount(), 0);
            case LOCKED -> new LockoutStatus(key, state, streak.attemptCount(),
                    ceilSeconds(streak.lockedUntil() - now));
        };
    }

    @Override
    public BruteForcePolicy getPolicy() {
        return policy;
    }

    @Override
    public int evictExpired() {
        long now = clock.millis();
        ConcurrentMap<String, FailureStreak> map = streaks.asMap();
        int evicted = 0;
        for (String key : map.keySet()) {
            boolean[] removed = new boolean[1];
            map.computeIfPresent(key, (k, streak) -> {
                if (streak.state(now, policy) == StreakState.CLEAR) {
                    removed[0] = true;
                    return null;
                }
                return streak;
            });
            if (removed[0]) {
                evicted++;
            }
        }
        return evicted;
    }

    @Override
    public long size() {
        streaks.cleanUp();
        return streaks.estimatedSize();
    }

    private FailureStreak lockIfThresholdReached(
            FailureStreak streak,
            long now,
            long lockoutMillis,
            boolean[] newlyLocked
    ) {
        if (streak.attemptCount() >= policy.maxAttempts()) {
            newlyLocked[0] = true;
            return streak.lock(now + lockoutMillis);
        }
        return streak;
    }

    private static long ceilSeconds(long millis) {
        if (millis <= 0) {
            return 0;
        }
        return (millis + 999) / 1000;
    }
}
