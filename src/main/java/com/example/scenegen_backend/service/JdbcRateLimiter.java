package com.example.scenegen_backend.service;

import com.example.scenegen_backend.dto.RateLimitDecision;
import com.example.scenegen_backend.model.RateLimitWindow;
import com.example.scenegen_backend.model.RateLimitWindowId;
import com.example.scenegen_backend.repository.RateLimitWindowRepository;
import com.example.scenegen_backend.service.Interfaces.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Limiter backed by the {@code rate_limit_window} table so every instance sees the same counters.
 * Windows are aligned to multiples of the window length.
 */
public class JdbcRateLimiter implements RateLimiter {
    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcRateLimiter.class);

    private final RateLimitWindowRepository repository;
    private final Duration window;
    private final int maxRequests;
    private final Clock clock;

    public JdbcRateLimiter(RateLimitWindowRepository repository, Duration window, int maxRequests, Clock clock) {
        this.repository = repository;
        this.window = window;
        this.maxRequests = maxRequests;
        this.clock = clock;
    }

    @Override
    public RateLimitDecision check(String identifier) {
        long now = clock.millis();
        long windowMs = window.toMillis();
        long start = now - (now % windowMs);
        Instant resetAt = Instant.ofEpochMilli(start + windowMs);
        RateLimitWindowId id = new RateLimitWindowId(identifier, start);

        if (repository.tryIncrement(identifier, start, maxRequests) == 1) {
            return allowed(id, resetAt);
        }
        if (!repository.existsById(id)) {
            try {
                repository.saveAndFlush(new RateLimitWindow(id, 1));
                return new RateLimitDecision(true, maxRequests - 1, resetAt, 0);
            } catch (DataIntegrityViolationException race) {
                LOGGER.debug("RateLimiter window opened concurrently key={} start={}", identifier, start);
                if (repository.tryIncrement(identifier, start, maxRequests) == 1) {
                    return allowed(id, resetAt);
                }
            }
        }
        long retryAfter = Math.max(1, (resetAt.toEpochMilli() - now + 999) / 1000);
        return new RateLimitDecision(false, 0, resetAt, retryAfter);
    }

    private RateLimitDecision allowed(RateLimitWindowId id, Instant resetAt) {
        int count = repository.findById(id).map(RateLimitWindow::getRequestCount).orElse(maxRequests);
        return new RateLimitDecision(true, Math.max(0, maxRequests - count), resetAt, 0);
    }

    @Override
    @Scheduled(fixedDelayString = "${ratelimit.cleanup-interval-ms:60000}")
    public void cleanup() {
        long now = clock.millis();
        long windowMs = window.toMillis();
        long currentStart = now - (now % windowMs);
        int removed = repository.deleteWindowsStartedBefore(currentStart);
        if (removed > 0) {
            LOGGER.debug("RateLimiter cleanup removed={}", removed);
        }
    }
}
