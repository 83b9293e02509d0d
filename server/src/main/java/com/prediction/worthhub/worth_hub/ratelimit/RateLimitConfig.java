package com.prediction.worthhub.worth_hub.ratelimit;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.prediction.worthhub.worth_hub.config.WorthHubProperties;
import com.prediction.worthhub.worth_hub.security.RateLimiterService;

/**
 * Instruction throttling. Limits come from {@code worthhub.rate-limit.*}.
 */
@Configuration
public class RateLimitConfig {

    @Bean
    public RateLimiterService rateLimiterService(WorthHubProperties properties) {
        return new RateLimiterService(
                properties.getRateLimit().getInstructionsPerSecond(),
                properties.getRateLimit().getTimeout());
    }

    @Bean
    public RateLimitFilter rateLimitFilter(RateLimiterService rateLimiterService) {
        return new RateLimitFilter(rateLimiterService);
    }

    // Only the security chain runs this filter.
    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration(RateLimitFilter rateLimitFilter) {
        FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>(rateLimitFilter);
        registration.setEnabled(false);
        return registration;
    }
}
