package com.khaounen.authguard.security.bruteforce;

public record LockoutStatus(String identity, StreakState state, int attempts, long remainingLockoutSeconds) {

    public static LockoutStatus clear(String identity) {
        return new LockoutStatus(identity, StreakState.CLEAR, 0, 0);
    }

    public boolean blocked() {
        return state == StreakState.LOCKED;
    }

    /** Text shown to the end user; identical whether or not the credentials were valid. */
    public String message() {
        if (!blocked()) {
            return null;
        }
        return "Too many failed attempts. Try again in " + remainingLockoutSeconds + " seconds.";
    }
}
