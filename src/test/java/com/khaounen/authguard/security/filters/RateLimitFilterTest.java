package com.khaounen.authguard.security.filters;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.authguard.MutableClock;
import com.khaounen.authguard.config.RequestContext;
import com.khaounen.authguard.security.bruteforce.BruteForcePolicy;
import com.khaounen.authguard.security.bruteforce.BruteForceProperties;
import com.khaounen.authguard.security.bruteforce.InMemoryBruteForceGuard;
import com.khaounen.authguard.security.ratelimit.AccountIdentifierResolver;
import com.khaounen.authguard.security.ratelimit.InMemoryWindowCounterStore;
import com.khaounen.authguard.security.ratelimit.PolicyPresetRegistry;
import com.khaounen.authguard.security.ratelimit.RateLimitProperties;
import com.khaounen.authguard.security.ratelimit.RateLimitService;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.util.StreamUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class RateLimitFilterTest {

    private final MutableClock clock = MutableClock.atEpochMillis(1_700_000_000_000L);
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final InMemoryWindowCounterStore store = new InMemoryWindowCounterStore(clock);
    private final RateLimitService service = new RateLimitService(store, null, clock);

    @AfterEach
    void clearContext() {
        RequestContext.clear();
    }

    @Test
    void rejectsSixthLoginWithRetryAfterAndJsonBody() throws Exception {
        RateLimitFilter filter = filter(properties(), AccountIdentifierResolver.NONE);

        for (int i = 0; i < 5; i++) {
            MockHttpServletResponse ok = execute(filter, login("ama@farm.gh"), new MockFilterChain());
            assertEquals(200, ok.getStatus());
            assertEquals("5", ok.getHeader(RateLimitFilter.LIMIT_HEADER));
            assertEquals(String.valueOf(4 - i), ok.getHeader(RateLimitFilter.REMAINING_HEADER));
        }
        clock.advance(Duration.ofMinutes(5));

        MockHttpServletResponse denied = execute(filter, login("ama@farm.gh"), new MockFilterChain());

        assertEquals(429, denied.getStatus());
        assertEquals("600", denied.getHeader("Retry-After"));
        JsonNode body = objectMapper.readTree(denied.getContentAsString());
        assertEquals("too_many_requests", body.get("error").asText());
        assertEquals("Too many login attempts. Please try again later.", body.get("message").asText());
        assertEquals(600, body.get("retryAfterSeconds").asLong());
    }

    @Test
    void accountFromJsonBodySplitsTheBucketAndBodyIsStillReadable() throws Exception {
        RateLimitFilter filter = filter(properties(), AccountIdentifierResolver.NONE);
        List<String> downstreamBodies = new ArrayList<>();
        FilterChain capture = (req, res) ->
                downstreamBodies.add(StreamUtils.copyToString(req.getInputStream(), StandardCharsets.UTF_8));

        for (int i = 0; i < 5; i++) {
            execute(filter, login("ama@farm.gh"), capture);
        }
        assertEquals(429, execute(filter, login("ama@farm.gh"), capture).getStatus());
        assertEquals(200, execute(filter, login("kofi@farm.gh"), capture).getStatus());

        assertEquals(6, downstreamBodies.size());
        assertEquals("{\"email\":\"kofi@farm.gh\",\"password\":\"x\"}", downstreamBodies.get(5));
        assertEquals(6, store.entry("/api/auth/login|203.0.113.5#ama@farm.gh").orElseThrow().count());
    }

    @Test
    void accountResolverIsUsedWhenRouteNamesNoIdentifier() throws Exception {
        RateLimitProperties properties = properties();
        properties.getRoutes().get(0).setIdentifierParams(new ArrayList<>());
        RateLimitFilter filter = filter(properties, request -> "kwame");

        execute(filter, login("ignored@farm.gh"), new MockFilterChain());

        assertEquals(1, store.entry("/api/auth/login|203.0.113.5#kwame").orElseThrow().count());
    }

    @Test
    void accountIsLeftOutWhenDisabled() throws Exception {
        RateLimitProperties properties = properties();
        properties.setIncludeAccountInKey(false);
        RateLimitFilter filter = filter(properties, request -> "kwame");

        execute(filter, login("ama@farm.gh"), new MockFilterChain());

        assertEquals(1, store.entry("/api/auth/login|203.0.113.5").orElseThrow().count());
    }

    @Test
    void usesAddressFromRequestContext() throws Exception {
        RateLimitFilter filter = filter(properties(), AccountIdentifierResolver.NONE);
        RequestContext.setClientIp("192.0.2.10");
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/livestock");

        execute(filter, request, new MockFilterChain());

        assertEquals(1, store.entry("/api/**|192.0.2.10").orElseThrow().count());
    }

    @Test
    void unmatchedAndDisabledRequestsPassUntouched() throws Exception {
        RateLimitProperties properties = properties();
        RateLimitFilter filter = filter(properties, AccountIdentifierResolver.NONE);
        AtomicInteger passed = new AtomicInteger();
        FilterChain counting = (req, res) -> passed.incrementAndGet();

        MockHttpServletResponse unmatched = execute(filter, new MockHttpServletRequest("GET", "/health"), counting);
        assertNull(unmatched.getHeader(RateLimitFilter.LIMIT_HEADER));

        properties.setEnabled(false);
        for (int i = 0; i < 10; i++) {
            execute(filter, login("ama@farm.gh"), counting);
        }

        assertEquals(11, passed.get());
        assertEquals(0, store.size());
    }

    @Test
    void customStatusCodeIsUsed() throws Exception {
        RateLimitProperties properties = properties();
        RateLimitProperties.Preset strict = new RateLimitProperties.Preset();
        strict.setWindow(Duration.ofMinutes(1));
        strict.setMaxRequests(1);
        strict.setStatusCode(503);
        strict.setMessage("Export busy");
        properties.getPresets().put("export", strict);
        properties.getRoutes().add(0, route("/api/reports/export", "export"));
        RateLimitFilter filter = filter(properties, AccountIdentifierResolver.NONE);

        execute(filter, new MockHttpServletRequest("GET", "/api/reports/export"), new MockFilterChain());
        MockHttpServletResponse denied =
                execute(filter, new MockHttpServletRequest("GET", "/api/reports/export"), new MockFilterChain());

        assertEquals(503, denied.getStatus());
        assertEquals("Export busy", objectMapper.readTree(denied.getContentAsString()).get("message").asText());
    }

    @Test
    void lockedAccountIsRejectedBeforeLoginHandler() throws Exception {
        InMemoryBruteForceGuard guard = new InMemoryBruteForceGuard(BruteForcePolicy.DEFAULT, clock, null);
        RateLimitProperties properties = properties();
        properties.getRoutes().get(0).setEnforceLockout(true);
        RateLimitFilter filter = new RateLimitFilter(
                properties,
                PolicyPresetRegistry.fromProperties(properties),
                service,
                objectMapper,
                AccountIdentifierResolver.NONE,
                guard,
                new BruteForceProperties()
        );
        for (int i = 0; i < 5; i++) {
            guard.recordFailure("ama@farm.gh");
        }
        clock.advance(Duration.ofMinutes(1));
        AtomicInteger reachedHandler = new AtomicInteger();
        FilterChain handler = (req, res) -> reachedHandler.incrementAndGet();

        MockHttpServletResponse locked = execute(filter, login("Ama@Farm.gh"), handler);

        assertEquals(403, locked.getStatus());
        assertEquals("1740", locked.getHeader("Retry-After"));
        JsonNode body = objectMapper.readTree(locked.getContentAsString());
        assertEquals("account_locked", body.get("error").asText());
        assertEquals("Too many failed attempts. Try again in 1740 seconds.", body.get("message").asText());
        assertEquals(0, reachedHandler.get());

        assertEquals(200, execute(filter, login("kofi@farm.gh"), handler).getStatus());
        assertEquals(1, reachedHandler.get());
    }

    @Test
    void lockoutIsIgnoredOnRoutesWithoutTheFlag() throws Exception {
        InMemoryBruteForceGuard guard = new InMemoryBruteForceGuard(BruteForcePolicy.DEFAULT, clock, null);
        RateLimitProperties properties = properties();
        RateLimitFilter filter = new RateLimitFilter(
                properties,
                PolicyPresetRegistry.fromProperties(properties),
                service,
                objectMapper,
                AccountIdentifierResolver.NONE,
                guard,
                new BruteForceProperties()
        );
        for (int i = 0; i < 5; i++) {
            guard.recordFailure("ama@farm.gh");
        }

        assertEquals(200, execute(filter, login("ama@farm.gh"), new MockFilterChain()).getStatus());
    }

    private RateLimitFilter filter(RateLimitProperties properties, AccountIdentifierResolver resolver) {
        return new RateLimitFilter(
                properties,
                PolicyPresetRegistry.fromProperties(properties),
                service,
                objectMapper,
                resolver
        );
    }

    private static MockHttpServletResponse execute(
            RateLimitFilter filter,
            MockHttpServletRequest request,
            FilterChain chain
    ) throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, chain);
        return response;
    }

    private static MockHttpServletRequest login(String email) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/auth/login");
        request.setRemoteAddr("203.0.113.5");
        request.setContentType("application/json");
        request.setContent(("{\"email\":\"" + email + "\",\"password\":\"x\"}").getBytes(StandardCharsets.UTF_8));
        return request;
    }

    private static RateLimitProperties properties() {
        RateLimitProperties properties = new RateLimitProperties();
        RateLimitProperties.Route login = route("/api/auth/login", "login");
        login.setMethods(List.of("POST"));
        login.setIdentifierParams(new ArrayList<>(List.of("email")));
        properties.getRoutes().add(login);
        properties.getRoutes().add(route("/api/**", "general-api"));
        return properties;
    }

    private static RateLimitProperties.Route route(String path, String preset) {
        RateLimitProperties.Route route = new RateLimitProperties.Route();
        route.setPath(path);
        route.setPreset(preset);
        return route;
    }
}
