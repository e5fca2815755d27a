package com.khaounen.authguard.security.ratelimit;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Supplies the account part of a client identity when the route does not
 * name one explicitly. Returns {@code null} for anonymous requests.
 */
@FunctionalInterface
public interface AccountIdentifierResolver {

    AccountIdentifierResolver NONE = request -> null;

    String resolve(HttpServletRequest request);
}
