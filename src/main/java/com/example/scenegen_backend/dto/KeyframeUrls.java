package com.example.scenegen_backend.dto;

import java.time.Instant;

public record KeyframeUrls(String startUrl, String endUrl, Instant expiresAt) {
}
