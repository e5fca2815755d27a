package com.khaounen.authguard.security.events;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Default listener: one log line per event, then republished as a Spring
 * application event so audit components can subscribe with {@code @EventListener}.
 * Delivery failures are logged and dropped; they never reach the request path.
 */
@Slf4j
public class GuardEventDispatcher implements GuardEventListener {

    private final ObjectProvider<ApplicationEventPublisher> publisherProvider;

    public GuardEventDispatcher(ObjectProvider<ApplicationEventPublisher> publisherProvider) {
        this.publisherProvider = publisherProvider;
    }

    @Override
    public void onEvent(GuardEvent event) {
        if (event == null) {
            return;
        }
        logEvent(event);
        ApplicationEventPublisher publisher = publisherProvider.getIfAvailable();
        if (publisher == null) {
            return;
        }
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException ex) {
            log.warn("guard event delivery failed for {} {}: {}", event.type(), event.key(), ex.getMessage());
        }
    }

    private static void logEvent(GuardEvent event) {
        switch (event.type()) {
            case RATE_LIMIT_DENIED -> log.warn("rate limit exceeded key={} ip={} retryAfter={}s",
                    event.key(), event.clientIp(), event.retryAfterSeconds());
            case LOCKOUT_TRIGGERED -> log.warn("lockout triggered identity={} ip={} duration={}s",
                    event.key(), event.clientIp(), event.retryAfterSeconds());
            case UNBLOCKED -> log.info("lockout cleared identity={}", event.key());
            default -> log.debug("guard event {}", event);
        }
    }
}
