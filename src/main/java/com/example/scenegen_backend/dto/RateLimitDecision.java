package com.example.scenegen_backend.dto;

import java.time.Instant;

public record RateLimitDecision(boolean allowed, int remaining, Instant resetAt, long retryAfterSeconds) {
}
