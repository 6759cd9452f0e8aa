package com.example.scenegen_backend.dto;

import java.time.Instant;
import java.util.UUID;

public record RefreshResult(UUID sceneId,
                            boolean refreshed,
                            String startUrl,
                            String endUrl,
                            Instant expiresAt,
                            String error) {
}
