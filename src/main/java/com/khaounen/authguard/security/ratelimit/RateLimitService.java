package com.khaounen.authguard.security.ratelimit;

import com.khaounen.authguard.config.RequestContext;
import com.khaounen.authguard.security.events.GuardEvent;
import com.khaounen.authguard.security.events.GuardEventListener;

import java.time.Clock;
import java.util.Locale;

/**
 * Entry point for the request pipeline: derives the counter key, consults the
 * store and reports denials.
 */
public class RateLimitService {

    static final String UNKNOWN = "unknown";

    private final WindowCounterStore store;
    private final GuardEventListener eventListener;
    private final Clock clock;

    public RateLimitService(WindowCounterStore store, GuardEventListener eventListener, Clock clock) {
        this.store = store;
        this.eventListener = eventListener != null ? eventListener : GuardEventListener.NO_OP;
        this.clock = clock;
    }

    public RateLimitDecision check(String clientIdentity, String route, PolicyPreset policy) {
        String key = buildKey(clientIdentity, route);
        RateLimitDecision decision = store.check(key, policy);
        if (!decision.allowed()) {
            eventListener.onEvent(GuardEvent.rateLimitDenied(
                    key,
                    RequestContext.getClientIp(),
                    decision.retryAfterSeconds(),
                    clock.instant()
            ));
        }
        return decision;
    }

    public void reset(String clientIdentity, String route) {
        store.reset(buildKey(clientIdentity, route));
    }

    public void resetAll() {
        store.resetAll();
    }

    public WindowCounterStore getStore() {
        return store;
    }

    public static String buildKey(String clientIdentity, String route) {
        return safe(route) + "|" + safe(clientIdentity);
    }

    /**
     * Combines a client address with an optional account identifier.
     */
    public static String clientIdentity(String clientIp, String accountIdentifier) {
        if (accountIdentifier == null || accountIdentifier.isBlank()) {
            return safe(clientIp);
        }
        return safe(clientIp) + "#" + accountIdentifier.trim().toLowerCase(Locale.ROOT);
    }

    private static String safe(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value.trim();
    }
}
