package com.khaounen.authguard.security.ratelimit;

import com.khaounen.authguard.utils.IpUtils;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.AntPathMatcher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Data
@ConfigurationProperties(prefix = "rate-limit")
public class RateLimitProperties {

    private boolean enabled = true;
    private boolean applyDefaultToAll = false;
    private String defaultPreset = PolicyPreset.GENERAL_API.name();
    private boolean includeAccountInKey = true;
    private List<String> clientIpHeaders = new ArrayList<>(IpUtils.DEFAULT_HEADERS);
    private long maxEntries = 100_000;
    /** Servlet filter order; the default runs just after the Spring Security chain. */
    private int filterOrder = -90;
    private Map<String, Preset> presets = new LinkedHashMap<>();
    private List<Route> routes = new ArrayList<>();
    private Sweep sweep = new Sweep();

    private static final AntPathMatcher MATCHER = new AntPathMatcher();

    /**
     * First route whose pattern and method match wins.
     */
    public Optional<Route> match(String path, String method) {
        String normalizedMethod = method == null ? "" : method.toUpperCase(Locale.ROOT);
        for (Route route : routes) {
            if (MATCHER.match(route.getPath(), path) && route.allowsMethod(normalizedMethod)) {
                return Optional.of(route);
            }
        }
        if (applyDefaultToAll) {
            Route fallback = new Route();
            fallback.setPath(path);
            fallback.setPreset(defaultPreset);
            return Optional.of(fallback);
        }
        return Optional.empty();
    }

    @Data
    public static class Route {
        private String path = "";
        private List<String> methods = new ArrayList<>();
        private String preset = PolicyPreset.GENERAL_API.name();
        private String key;
        private List<String> identifierParams = new ArrayList<>();
        private String identifierHeader;
        /** Reject locked-out identities on this route before the request reaches the login handler. */
        private boolean enforceLockout = false;

        public boolean allowsMethod(String method) {
            if (methods == null || methods.isEmpty()) {
                return true;
            }
            return methods.stream().anyMatch(m -> m.equalsIgnoreCase(method));
        }

        /** Route component of the counter key; the pattern unless an explicit key is set. */
        public String routeKey() {
            if (key != null && !key.isBlank()) {
                return key;
            }
            return path;
        }
    }

    @Data
    public static class Preset {
        private Duration window;
        private Integer maxRequests;
        private String message;
        private Integer statusCode;

        PolicyPreset toPreset(String name, PolicyPreset base) {
            if (base == null && (window == null || maxRequests == null)) {
                throw new IllegalArgumentException("preset '" + name + "' needs both window and max-requests");
            }
            return new PolicyPreset(
                    name,
                    window != null ? window : base.window(),
                    maxRequests != null ? maxRequests : base.maxRequests(),
                    message != null ? message : base == null ? null : base.rejectionMessage(),
                    statusCode != null ? statusCode : base == null ? PolicyPreset.TOO_MANY_REQUESTS : base.statusCode()
            );
        }
    }

    @Data
    public static class Sweep {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(5);
    }
}
