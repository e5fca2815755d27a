package com.khaounen.authguard.security.events;

import java.time.Instant;

/**
 * Notification handed to the audit side when the guard rejects traffic or
 * changes a lockout. {@code retryAfterSeconds} is 0 for {@link GuardEventType#UNBLOCKED}.
 */
public record GuardEvent(
        GuardEventType type,
        String key,
        String clientIp,
        long retryAfterSeconds,
        Instant occurredAt
) {

    public static GuardEvent rateLimitDenied(String key, String clientIp, long retryAfterSeconds, Instant now) {
        return new GuardEvent(GuardEventType.RATE_LIMIT_DENIED, key, clientIp, retryAfterSeconds, now);
    }

    public static GuardEvent lockoutTriggered(String identity, String clientIp, long lockoutSeconds, Instant now) {
        return new GuardEvent(GuardEventType.LOCKOUT_TRIGGERED, identity, clientIp, lockoutSeconds, now);
    }

    public static GuardEvent unblocked(String identity, Instant now) {
        return new GuardEvent(GuardEventType.UNBLOCKED, identity, null, 0, now);
    }
}
