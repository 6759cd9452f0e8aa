package com.example.scenegen_backend.service;

import com.example.scenegen_backend.dto.RateLimitDecision;
import com.example.scenegen_backend.service.Interfaces.RateLimiter;
import com.example.scenegen_backend.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRateLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T10:00:00Z"));
    private final InMemoryRateLimiter limiter = new InMemoryRateLimiter(Duration.ofSeconds(60), 10, clock);

    @Test
    void eleventhRequestInWindowIsRejectedAndNextWindowRecovers() {
        for (int i = 0; i < 10; i++) {
            assertThat(limiter.check("user:a").allowed()).isTrue();
        }
        clock.advance(Duration.ofSeconds(20));

        RateLimitDecision rejected = limiter.check("user:a");
        assertThat(rejected.allowed()).isFalse();
        assertThat(rejected.remaining()).isZero();
        assertThat(rejected.retryAfterSeconds()).isEqualTo(40);
        assertThat(rejected.resetAt()).isEqualTo(Instant.parse("2025-01-01T10:01:00Z"));

        clock.advance(Duration.ofSeconds(40));
        RateLimitDecision recovered = limiter.check("user:a");
        assertThat(recovered.allowed()).isTrue();
        assertThat(recovered.remaining()).isEqualTo(9);
    }

    @Test
    void identifiersHaveIndependentWindows() {
        for (int i = 0; i < 10; i++) limiter.check("ip:1.2.3.4");

        assertThat(limiter.check("ip:1.2.3.4").allowed()).isFalse();
        assertThat(limiter.check("ip:5.6.7.8").allowed()).isTrue();
    }

    @Test
    void identifierPrefersUserThenIpThenAnonymous() {
        assertThat(RateLimiter.identifier("u1", "1.2.3.4")).isEqualTo("user:u1");
        assertThat(RateLimiter.identifier(null, "1.2.3.4")).isEqualTo("ip:1.2.3.4");
        assertThat(RateLimiter.identifier(" ", null)).isEqualTo("anonymous");
    }

    @Test
    void cleanupKeepsCurrentWindowOnly() {
        limiter.check("user:old");
        clock.advance(Duration.ofSeconds(61));
        limiter.check("user:new");

        limiter.cleanup();

        for (int i = 0; i < 9; i++) limiter.check("user:new");
        assertThat(limiter.check("user:new").allowed()).isFalse();
        assertThat(limiter.check("user:old").remaining()).isEqualTo(9);
    }
}
