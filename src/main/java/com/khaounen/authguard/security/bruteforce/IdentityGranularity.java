package com.khaounen.authguard.security.bruteforce;

/**
 * How a failed authentication is keyed in the guard.
 */
public enum IdentityGranularity {
    USERNAME,
    IP,
    USERNAME_AND_IP;

    public String identity(String username, String clientIp) {
        String user = BruteForceGuard.normalizeIdentity(username);
        String ip = BruteForceGuard.normalizeIdentity(clientIp);
        return switch (this) {
            case USERNAME -> user;
            case IP -> ip;
            case USERNAME_AND_IP -> user + "|" + ip;
        };
    }
}
