package com.khaounen.authguard.config;

import com.khaounen.authguard.utils.IpUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

public class RequestContextFilter extends OncePerRequestFilter {

    private final List<String> clientIpHeaders;

    public RequestContextFilter(List<String> clientIpHeaders) {
        this.clientIpHeaders = clientIpHeaders == null ? List.of() : List.copyOf(clientIpHeaders);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        try {
            RequestContext.setClientIp(IpUtils.resolveIp(request, clientIpHeaders));
            RequestContext.setUserAgent(request.getHeader("User-Agent"));
            filterChain.doFilter(request, response);
        } finally {
            RequestContext.clear();
        }
    }
}
