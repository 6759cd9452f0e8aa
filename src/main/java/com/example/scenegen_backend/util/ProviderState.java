package com.example.scenegen_backend.util;

import java.util.Locale;

public enum ProviderState {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    UNKNOWN;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ProviderState parse(String raw) {
        if (raw == null || raw.isBlank()) return UNKNOWN;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "queued", "pending" -> QUEUED;
            case "dreaming", "processing", "running", "in_progress" -> PROCESSING;
            case "completed", "succeeded", "success" -> COMPLETED;
            case "failed", "error", "cancelled" -> FAILED;
            default -> UNKNOWN;
        };
    }
}
