package com.khaounen.authguard.security.bruteforce;

public enum StreakState {
    /** No failures within the attempt window and no active lockout. */
    CLEAR,
    /** Failures counted, threshold not reached. */
    ACCUMULATING,
    /** Threshold reached; authentication is rejected until the lockout ends. */
    LOCKED
}
