package com.khaounen.authguard.security.ratelimit;

public record RateLimitDecision(
        boolean allowed,
        int limit,
        long remaining,
        long resetAtMillis,
        long retryAfterSeconds,
        PolicyPreset policy
) {

    public static RateLimitDecision allow(PolicyPreset policy, WindowEntry entry) {
        long remaining = Math.max(0, policy.maxRequests() - entry.count());
        return new RateLimitDecision(true, policy.maxRequests(), remaining, entry.resetAt(), 0, policy);
    }

    public static RateLimitDecision deny(PolicyPreset policy, WindowEntry entry, long now) {
        return new RateLimitDecision(
                false,
                policy.maxRequests(),
                0,
                entry.resetAt(),
                ceilSeconds(entry.resetAt() - now),
                policy
        );
    }

    public String message() {
        return allowed ? null : policy.rejectionMessage();
    }

    public int statusCode() {
        return policy.statusCode();
    }

    static long ceilSeconds(long millis) {
        if (millis <= 0) {
            return 0;
        }
        return (millis + 999) / 1000;
    }
}
