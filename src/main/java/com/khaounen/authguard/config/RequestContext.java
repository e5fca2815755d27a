package com.khaounen.authguard.config;

/**
 * Per-request client attributes resolved once by {@link RequestContextFilter}
 * and read by the rate limit filter and the brute-force listener.
 */
public final class RequestContext {

    private static final ThreadLocal<String> CLIENT_IP = new ThreadLocal<>();
    private static final ThreadLocal<String> USER_AGENT = new ThreadLocal<>();

    private RequestContext() {}

    public static void setClientIp(String clientIp) {
        CLIENT_IP.set(clientIp);
    }

    public static String getClientIp() {
        return CLIENT_IP.get();
    }

    public static void setUserAgent(String userAgent) {
        USER_AGENT.set(userAgent);
    }

    public static String getUserAgent() {
        return USER_AGENT.get();
    }

    public static void clear() {
        CLIENT_IP.remove();
        USER_AGENT.remove();
    }
}
