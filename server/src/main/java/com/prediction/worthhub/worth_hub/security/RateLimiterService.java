package com.prediction.worthhub.worth_hub.security;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.scheduling.annotation.Scheduled;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * One resilience4j limiter per caller key.
 */
@Slf4j
public class RateLimiterService {

    private final Map<String, RateLimiter> cache = new ConcurrentHashMap<>();
    private final RateLimiterConfig config;

    public RateLimiterService(int instructionsPerSecond, Duration timeout) {
        this.config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(instructionsPerSecond)
                .timeoutDuration(timeout)
                .build();
    }

    public boolean allowRequest(String key) {
        RateLimiter rateLimiter = cache.computeIfAbsent(key, k -> RateLimiter.of(k, config));
        return rateLimiter.acquirePermission();
    }

    public long getRetryAfterSeconds() {
        return Math.max(1, config.getLimitRefreshPeriod().toSeconds());
    }

    public int trackedKeys() {
        return cache.size();
    }

    /**
     * Drops limiters whose whole budget is available again; they carry no state worth keeping.
     */
    @Scheduled(fixedRate = 300000)
    public int evictIdle() {
        int before = cache.size();
        cache.entrySet().removeIf(e ->
                e.getValue().getMetrics().getAvailablePermissions() >= config.getLimitForPeriod());
        int evicted = before - cache.size();
        if (evicted > 0) {
            log.debug("Evicted {} idle rate limiters", evicted);
        }
        return evicted;
    }
}
