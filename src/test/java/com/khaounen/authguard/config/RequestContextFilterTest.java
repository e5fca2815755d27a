package com.khaounen.authguard.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class RequestContextFilterTest {

    @Test
    void exposesClientForTheRequestAndClearsAfterwards() throws Exception {
        RequestContextFilter filter = new RequestContextFilter(List.of("X-Forwarded-For"));
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/auth/login");
        request.addHeader("X-Forwarded-For", "203.0.113.20, 10.0.0.1");
        request.addHeader("User-Agent", "FarmApp/2.3");
        AtomicReference<String> seenIp = new AtomicReference<>();
        AtomicReference<String> seenAgent = new AtomicReference<>();

        filter.doFilter(request, new MockHttpServletResponse(), (req, res) -> {
            seenIp.set(RequestContext.getClientIp());
            seenAgent.set(RequestContext.getUserAgent());
        });

        assertEquals("203.0.113.20", seenIp.get());
        assertEquals("FarmApp/2.3", seenAgent.get());
        assertNull(RequestContext.getClientIp());
    }
}
