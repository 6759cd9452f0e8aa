package com.example.scenegen_backend.service.Interfaces;

import com.example.scenegen_backend.dto.RateLimitDecision;

public interface RateLimiter {
    RateLimitDecision check(String identifier);

    /** Drops windows that can no longer affect a decision. */
    void cleanup();

    static String identifier(String userId, String clientIp) {
        if (userId != null && !userId.isBlank()) return "user:" + userId;
        if (clientIp != null && !clientIp.isBlank()) return "ip:" + clientIp;
        return "anonymous";
    }
}
