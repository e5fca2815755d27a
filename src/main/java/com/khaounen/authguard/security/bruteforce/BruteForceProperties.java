package com.khaounen.authguard.security.bruteforce;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "rate-limit.brute-force")
public class BruteForceProperties {

    private boolean enabled = true;
    private int maxAttempts = BruteForcePolicy.DEFAULT.maxAttempts();
    private Duration attemptWindow = BruteForcePolicy.DEFAULT.attemptWindow();
    private Duration lockoutDuration = BruteForcePolicy.DEFAULT.lockoutDuration();
    private boolean extendLockoutOnFailure = false;
    private IdentityGranularity identity = IdentityGranularity.USERNAME;
    private boolean listenToAuthenticationEvents = true;
    /** Status returned by the servlet filter on routes with {@code enforce-lockout}. */
    private int lockoutStatusCode = 403;

    public BruteForcePolicy toPolicy() {
        return new BruteForcePolicy(maxAttempts, attemptWindow, lockoutDuration, extendLockoutOnFailure);
    }
}
