package com.prediction.worthhub.worth_hub.ratelimit;

import java.io.IOException;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import com.prediction.worthhub.worth_hub.security.RateLimiterService;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Throttles ledger instructions (every non-GET request).
 *
 * Authenticated callers are limited per signer, anonymous ones per IP. Over the
 * limit the request is answered with 429 and a Retry-After header.
 */
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    private final RateLimiterService rateLimiter;

    public RateLimitFilter(RateLimiterService rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return "GET".equalsIgnoreCase(request.getMethod());
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String identifier = getIdentifier(request);
        if (!rateLimiter.allowRequest(identifier)) {
            log.warn("Rate limit exceeded: {} {} by {}", request.getMethod(), request.getRequestURI(), identifier);
            sendRateLimitExceededResponse(response, identifier, rateLimiter.getRetryAfterSeconds());
            return;
        }

        response.setHeader("X-RateLimit-Identifier", identifier);
        filterChain.doFilter(request, response);
    }

    private String getIdentifier(HttpServletRequest request) {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.isAuthenticated() && auth.getPrincipal() instanceof String signer
                && !signer.equals("anonymousUser")) {
            return "signer:" + signer;
        }
        return "ip:" + getClientIp(request);
    }

    private String getClientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    private void sendRateLimitExceededResponse(
            HttpServletResponse response,
            String identifier,
            long retryAfter) throws IOException {

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader("Retry-After", String.valueOf(retryAfter));
        response.setHeader("X-RateLimit-Identifier", identifier);
        response.setContentType("application/json");

        String jsonResponse = String.format(
                "{\"error\":\"RateLimitExceeded\",\"category\":\"THROTTLED\",\"message\":\"Too many instructions from %s, retry after %ds\"}",
                identifier, retryAfter);
        response.getWriter().write(jsonResponse);
        response.getWriter().flush();
    }
}
