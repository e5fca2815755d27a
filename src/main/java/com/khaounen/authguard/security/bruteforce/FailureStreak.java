package com.khaounen.authguard.security.bruteforce;

/**
 * Consecutive authentication failures for one identity. Timestamps are epoch
 * millis; {@code lockedUntil} is meaningful only when {@code locked}.
 */
public record FailureStreak(int attemptCount, long firstAttemptAt, boolean locked, long lockedUntil) {

    static FailureStreak first(long now) {
        return new FailureStreak(1, now, false, 0);
    }

    FailureStreak increment() {
        return new FailureStreak(attemptCount + 1, firstAttemptAt, locked, lockedUntil);
    }

    FailureStreak lock(long until) {
        return new FailureStreak(attemptCount, firstAttemptAt, true, until);
    }

    public StreakState state(long now, BruteForcePolicy policy) {
        if (locked) {
            return now <= lockedUntil ? StreakState.LOCKED : StreakState.CLEAR;
        }
        if (now - firstAttemptAt > policy.attemptWindow().toMillis()) {
            return StreakState.CLEAR;
        }
        return StreakState.ACCUMULATING;
    }
}
