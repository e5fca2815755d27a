package com.khaounen.authguard.security.filters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.authguard.config.RequestContext;
import com.khaounen.authguard.security.bruteforce.BruteForceGuard;
import com.khaounen.authguard.security.bruteforce.BruteForceProperties;
import com.khaounen.authguard.security.bruteforce.LockoutStatus;
import com.khaounen.authguard.security.ratelimit.AccountIdentifierResolver;
import com.khaounen.authguard.security.ratelimit.PolicyPreset;
import com.khaounen.authguard.security.ratelimit.PolicyPresetRegistry;
import com.khaounen.authguard.security.ratelimit.RateLimitDecision;
import com.khaounen.authguard.security.ratelimit.RateLimitProperties;
import com.khaounen.authguard.security.ratelimit.RateLimitService;
import com.khaounen.authguard.utils.IpUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies the configured preset to each matching request and rejects requests
 * over their window limit with the preset's status, message and a
 * {@code Retry-After} header. Routes flagged {@code enforce-lockout} also
 * reject identities the {@link BruteForceGuard} holds locked.
 */
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RESET_HEADER = "X-RateLimit-Reset";

    private final RateLimitProperties properties;
    private final PolicyPresetRegistry presets;
    private final RateLimitService service;
    private final ObjectMapper objectMapper;
    private final AccountIdentifierResolver accountIdentifierResolver;
    private final BruteForceGuard bruteForceGuard;
    private final BruteForceProperties bruteForceProperties;

    public RateLimitFilter(
            RateLimitProperties properties,
            PolicyPresetRegistry presets,
            RateLimitService service,
            ObjectMapper objectMapper,
            AccountIdentifierResolver accountIdentifierResolver
    ) {
        this(properties, presets, service, objectMapper, accountIdentifierResolver, null, null);
    }

    /**
     * @param bruteForceGuard null disables lockout enforcement
     */
    public RateLimitFilter(
            RateLimitProperties properties,
            PolicyPresetRegistry presets,
            RateLimitService service,
            ObjectMapper objectMapper,
            AccountIdentifierResolver accountIdentifierResolver,
            BruteForceGuard bruteForceGuard,
            BruteForceProperties bruteForceProperties
    ) {
        this.properties = properties;
        this.presets = presets;
        this.service = service;
        this.objectMapper = objectMapper;
        this.accountIdentifierResolver = accountIdentifierResolver != null
                ? accountIdentifierResolver
                : AccountIdentifierResolver.NONE;
        this.bruteForceGuard = bruteForceGuard;
        this.bruteForceProperties = bruteForceProperties != null ? bruteForceProperties : new BruteForceProperties();
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        if (!properties.isEnabled()) {
            filterChain.doFilter(request, response);
            return;
        }

        Optional<RateLimitProperties.Route> routeOpt = properties.match(request.getRequestURI(), request.getMethod());
        if (routeOpt.isEmpty()) {
            filterChain.doFilter(request, response);
            return;
        }

        RateLimitProperties.Route route = routeOpt.get();
        PolicyPreset preset = presets.require(route.getPreset());
        HttpServletRequest effectiveRequest = request;
        if (shouldReadBody(request, route)) {
            byte[] body = StreamUtils.copyToByteArray(request.getInputStream());
            effectiveRequest = new CachedBodyHttpServletRequest(request, body);
        }

        String clientIp = RequestContext.getClientIp();
        if (clientIp == null) {
            clientIp = IpUtils.resolveIp(request, properties.getClientIpHeaders());
        }
        boolean enforceLockout = route.isEnforceLockout() && bruteForceGuard != null;
        String account = properties.isIncludeAccountInKey() || enforceLockout
                ? resolveAccount(effectiveRequest, route)
                : null;
        String clientIdentity = RateLimitService.clientIdentity(
                clientIp, properties.isIncludeAccountInKey() ? account : null);

        RateLimitDecision decision = service.check(clientIdentity, route.routeKey(), preset);
        response.setHeader(LIMIT_HEADER, String.valueOf(decision.limit()));
        response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
        response.setHeader(RESET_HEADER, String.valueOf(Math.floorDiv(decision.resetAtMillis(), 1000L)));
        if (!decision.allowed()) {
            reject(response, decision);
            return;
        }

        if (enforceLockout) {
            String identity = bruteForceProperties.getIdentity().identity(account, clientIp);
            LockoutStatus lockout = bruteForceGuard.status(identity);
            if (lockout.blocked()) {
                rejectLocked(response, lockout);
                return;
            }
        }

        filterChain.doFilter(effectiveRequest, response);
    }

    private void rejectLocked(HttpServletResponse response, LockoutStatus lockout) throws IOException {
        response.setStatus(bruteForceProperties.getLockoutStatusCode());
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(lockout.remainingLockoutSeconds()));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "account_locked");
        body.put("message", lockout.message());
        body.put("retryAfterSeconds", lockout.remainingLockoutSeconds());
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }

    private void reject(HttpServletResponse response, RateLimitDecision decision) throws IOException {
        response.setStatus(decision.statusCode());
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "too_many_requests");
        body.put("message", decision.message());
        body.put("retryAfterSeconds", decision.retryAfterSeconds());
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }

    /**
     * Route header, then request parameters, then top-level JSON body fields,
     * then the authenticated principal.
     */
    private String resolveAccount(HttpServletRequest request, RateLimitProperties.Route route) {
        String header = route.getIdentifierHeader();
        if (header != null && !header.isBlank()) {
            String value = request.getHeader(header);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        List<String> params = route.getIdentifierParams();
        if (params != null) {
            for (String param : params) {
                String value = request.getParameter(param);
                if (value != null && !value.isBlank()) {
                    return value.trim();
                }
            }
            if (request instanceof CachedBodyHttpServletRequest cached) {
                String fromBody = fromJsonBody(cached.getBody(), params);
                if (fromBody != null) {
                    return fromBody;
                }
            }
        }
        return accountIdentifierResolver.resolve(request);
    }

    private String fromJsonBody(byte[] body, List<String> fields) {
        if (body.length == 0) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                return null;
            }
            for (String field : fields) {
                JsonNode value = root.get(field);
                if (value != null && value.isValueNode()) {
                    String text = value.asText().trim();
                    if (!text.isEmpty()) {
                        return text;
                    }
                }
            }
            return null;
        } catch (JsonProcessingException ex) {
            log.debug("request body is not valid JSON, keying by address only: {}", ex.getOriginalMessage());
            return null;
        } catch (IOException ex) {
            log.debug("could not read request body: {}", ex.getMessage());
            return null;
        }
    }

    private static boolean shouldReadBody(HttpServletRequest request, RateLimitProperties.Route route) {
        if (route.getIdentifierParams() == null || route.getIdentifierParams().isEmpty()) {
            return false;
        }
        String contentType = request.getContentType();
        return contentType != null && contentType.startsWith(MediaType.APPLICATION_JSON_VALUE);
    }
}
