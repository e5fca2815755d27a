package com.khaounen.authguard.security.bruteforce;

import com.khaounen.authguard.security.sweep.ExpirableStore;

import java.util.Locale;

/**
 * Turns repeated authentication failures for an identity into a timed lockout.
 * The identity may be an email, a username or an address; callers choose the
 * granularity. Identities compare case-insensitively and ignore surrounding
 * whitespace. No operation throws.
 */
public interface BruteForceGuard extends ExpirableStore {

    /**
     * Records a failed attempt.
     *
     * @return {@code true} when the identity is locked after this failure
     */
    boolean recordFailure(String identity);

    /** Forgets all history for the identity. */
    void recordSuccess(String identity);

    boolean isBlocked(String identity);

    long remainingLockoutSeconds(String identity);

    /** Administrative override; safe to repeat. */
    void unblock(String identity);

    int failureCount(String identity);

    LockoutStatus status(String identity);

    BruteForcePolicy getPolicy();

    /**
     * Canonical key for an identity; blank input becomes {@code "unknown"}.
     * Callers that build composite identities normalise each part with this.
     */
    static String normalizeIdentity(String identity) {
        return identity == null || identity.isBlank() ? "unknown" : identity.trim().toLowerCase(Locale.ROOT);
    }
}
