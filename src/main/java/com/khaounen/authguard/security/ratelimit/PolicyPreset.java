package com.khaounen.authguard.security.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * Named fixed-window limit applied to a class of endpoints.
 */
public record PolicyPreset(
        String name,
        Duration window,
        int maxRequests,
        String rejectionMessage,
        int statusCode
) {

    public static final int TOO_MANY_REQUESTS = 429;

    public static final PolicyPreset LOGIN = new PolicyPreset(
            "login",
            Duration.ofMinutes(15),
            5,
            "Too many login attempts. Please try again later.",
            TOO_MANY_REQUESTS
    );

    public static final PolicyPreset PASSWORD_RESET = new PolicyPreset(
            "password-reset",
            Duration.ofMinutes(60),
            3,
            "Too many password reset requests. Please try again later.",
            TOO_MANY_REQUESTS
    );

    public static final PolicyPreset TWO_FACTOR = new PolicyPreset(
            "two-factor",
            Duration.ofMinutes(10),
            10,
            "Too many verification attempts. Please try again later.",
            TOO_MANY_REQUESTS
    );

    public static final PolicyPreset GENERAL_API = new PolicyPreset(
            "general-api",
            Duration.ofMinutes(1),
            100,
            "Too many requests. Please slow down.",
            TOO_MANY_REQUESTS
    );

    public PolicyPreset {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(window, "window");
        if (name.isBlank()) {
            throw new IllegalArgumentException("preset name must not be blank");
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("preset '" + name + "' window must be positive");
        }
        if (maxRequests < 1) {
            throw new IllegalArgumentException("preset '" + name + "' maxRequests must be at least 1");
        }
        if (statusCode < 400 || statusCode > 599) {
            throw new IllegalArgumentException("preset '" + name + "' statusCode must be a 4xx or 5xx code");
        }
        if (rejectionMessage == null || rejectionMessage.isBlank()) {
            rejectionMessage = "Too many requests.";
        }
    }

    public long windowMillis() {
        return window.toMillis();
    }
}
