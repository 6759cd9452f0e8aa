package com.example.scenegen_backend.service;

import com.example.scenegen_backend.dto.RateLimitDecision;
import com.example.scenegen_backend.service.Interfaces.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local limiter. Counters are not shared between instances, so it only holds for a
 * single-instance deployment; use {@link JdbcRateLimiter} otherwise.
 */
public class InMemoryRateLimiter implements RateLimiter {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryRateLimiter.class);

    private record Window(long start, int count) {}

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Duration window;
    private final int maxRequests;
    private final Clock clock;

    public InMemoryRateLimiter(Duration window, int maxRequests, Clock clock) {
        this.window = window;
        this.maxRequests = maxRequests;
        this.clock = clock;
    }

    @Override
    public RateLimitDecision check(String identifier) {
        long now = clock.millis();
        long windowMs = window.toMillis();
        long start = now - (now % windowMs);
        AtomicBoolean allowed = new AtomicBoolean(true);
        Window updated = windows.compute(identifier, (k, current) -> {
            if (current == null || current.start() != start) return new Window(start, 1);
            if (current.count() >= maxRequests) {
                allowed.set(false);
                return current;
            }
            return new Window(start, current.count() + 1);
        });
        return decision(allowed.get(), updated.count(), Instant.ofEpochMilli(start + windowMs), now);
    }

    private RateLimitDecision decision(boolean allowed, int count, Instant resetAt, long now) {
        long retryAfter = allowed ? 0 : Math.max(1, (resetAt.toEpochMilli() - now + 999) / 1000);
        return new RateLimitDecision(allowed, Math.max(0, maxRequests - count), resetAt, retryAfter);
    }

    @Override
    @Scheduled(fixedDelayString = "${ratelimit.cleanup-interval-ms:60000}")
    public void cleanup() {
        long now = clock.millis();
        long windowMs = window.toMillis();
        int before = windows.size();
        windows.entrySet().removeIf(e -> e.getValue().start() + windowMs <= now);
        int removed = before - windows.size();
        if (removed > 0) {
            LOGGER.debug("RateLimiter cleanup removed={} remaining={}", removed, windows.size());
        }
    }
}
