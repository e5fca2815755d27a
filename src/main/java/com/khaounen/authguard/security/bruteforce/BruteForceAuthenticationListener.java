package com.khaounen.authguard.security.bruteforce;

import com.khaounen.authguard.config.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.security.authentication.event.AbstractAuthenticationEvent;
import org.springframework.security.authentication.event.AuthenticationFailureBadCredentialsEvent;
import org.springframework.security.authentication.event.AuthenticationSuccessEvent;

/**
 * Feeds Spring Security authentication outcomes into the {@link BruteForceGuard}.
 * Only bad-credential failures count; locked, disabled or expired accounts do not.
 * A success while the identity is locked out leaves the lockout in place.
 */
@Slf4j
public class BruteForceAuthenticationListener implements ApplicationListener<AbstractAuthenticationEvent> {

    private final BruteForceGuard guard;
    private final IdentityGranularity granularity;

    public BruteForceAuthenticationListener(BruteForceGuard guard, IdentityGranularity granularity) {
        this.guard = guard;
        this.granularity = granularity;
    }

    @Override
    public void onApplicationEvent(AbstractAuthenticationEvent event) {
        String identity = granularity.identity(event.getAuthentication().getName(), RequestContext.getClientIp());
        if (event instanceof AuthenticationFailureBadCredentialsEvent) {
            boolean locked = guard.recordFailure(identity);
            log.debug("authentication failure recorded identity={} locked={}", identity, locked);
        } else if (event instanceof AuthenticationSuccessEvent) {
            if (guard.isBlocked(identity)) {
                log.warn("authentication succeeded during an active lockout, lockout kept identity={}", identity);
                return;
            }
            guard.recordSuccess(identity);
        }
    }
}
