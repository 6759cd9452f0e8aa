package com.example.scenegen_backend.dto;

import java.time.Instant;

public record SignedAccessGrant(String objectKey, String url, Instant expiresAt) {
}
