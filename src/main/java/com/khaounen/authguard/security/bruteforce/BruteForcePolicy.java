package com.khaounen.authguard.security.bruteforce;

import java.time.Duration;
import java.util.Objects;

public record BruteForcePolicy(
        int maxAttempts,
        Duration attemptWindow,
        Duration lockoutDuration,
        boolean extendLockoutOnFailure
) {

    public static final BruteForcePolicy DEFAULT = new BruteForcePolicy(
            5,
            Duration.ofMinutes(15),
            Duration.ofMinutes(30),
            false
    );

    public BruteForcePolicy {
        Objects.requireNonNull(attemptWindow, "attemptWindow");
        Objects.requireNonNull(lockoutDuration, "lockoutDuration");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (attemptWindow.isZero() || attemptWindow.isNegative()) {
            throw new IllegalArgumentException("attemptWindow must be positive");
        }
        if (lockoutDuration.isZero() || lockoutDuration.isNegative()) {
            throw new IllegalArgumentException("lockoutDuration must be positive");
        }
    }
}
