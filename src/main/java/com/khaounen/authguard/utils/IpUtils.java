package com.khaounen.authguard.utils;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

import java.util.List;

public class IpUtils {

    public static final List<String> DEFAULT_HEADERS = List.of("X-Forwarded-For", "X-Real-IP");

    private static final String UNKNOWN = "unknown";

    private IpUtils() {
    }

    /**
     * Resolves the client address, preferring proxy headers over the socket peer.
     * Only the first entry of a comma-separated header value is used; the chain
     * itself is not validated.
     */
    public static String resolveIp(HttpServletRequest request, List<String> headers) {
        if (headers != null) {
            for (String header : headers) {
                String value = request.getHeader(header);
                if (StringUtils.hasText(value)) {
                    String first = value.split(",")[0].trim();
                    if (!first.isEmpty()) {
                        return first;
                    }
                }
            }
        }
        String remote = request.getRemoteAddr();
        return StringUtils.hasText(remote) ? remote : UNKNOWN;
    }

    public static String resolveIp(HttpServletRequest request) {
        return resolveIp(request, DEFAULT_HEADERS);
    }
}
