package com.khaounen.authguard.security.bruteforce;

import com.khaounen.authguard.config.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AuthenticationProvider;
import org.springframework.security.authentication.LockedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;

/**
 * Wraps an {@link AuthenticationProvider} and rejects locked-out identities
 * before the delegate sees the credentials, so the outcome is the same whether
 * or not they were valid.
 *
 * <pre>
 * http.authenticationProvider(new LockoutEnforcingAuthenticationProvider(daoProvider, guard, granularity));
 * </pre>
 *
 * {@link LockedException} is an account status failure: {@code ProviderManager}
 * rethrows it without trying other providers, and it is not counted as a bad
 * credential.
 */
@Slf4j
public class LockoutEnforcingAuthenticationProvider implements AuthenticationProvider {

    private final AuthenticationProvider delegate;
    private final BruteForceGuard guard;
    private final IdentityGranularity granularity;

    public LockoutEnforcingAuthenticationProvider(
            AuthenticationProvider delegate,
            BruteForceGuard guard,
            IdentityGranularity granularity
    ) {
        this.delegate = delegate;
        this.guard = guard;
        this.granularity = granularity;
    }

    @Override
    public Authentication authenticate(Authentication authentication) throws AuthenticationException {
        String identity = granularity.identity(authentication.getName(), RequestContext.getClientIp());
        LockoutStatus status = guard.status(identity);
        if (status.blocked()) {
            log.debug("authentication rejected, identity locked identity={} remaining={}s",
                    identity, status.remainingLockoutSeconds());
            throw new LockedException(status.message());
        }
        return delegate.authenticate(authentication);
    }

    @Override
    public boolean supports(Class<?> authentication) {
        return delegate.supports(authentication);
    }
}
