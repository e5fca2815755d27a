package com.khaounen.authguard.security.events;

public enum GuardEventType {
    RATE_LIMIT_DENIED,
    LOCKOUT_TRIGGERED,
    UNBLOCKED
}
