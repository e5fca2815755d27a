package com.khaounen.authguard.security.ratelimit;

/**
 * Count of requests seen for one key inside {@code [windowStart, resetAt)}, in epoch millis.
 */
public record WindowEntry(long count, long windowStart, long resetAt) {

    static WindowEntry open(long now, long windowMillis) {
        return new WindowEntry(1, now, now + windowMillis);
    }

    WindowEntry increment() {
        return new WindowEntry(count + 1, windowStart, resetAt);
    }

    public boolean isExpired(long now) {
        return now >= resetAt;
    }
}
