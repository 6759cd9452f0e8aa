package com.example.scenegen_backend.dto;

import java.util.UUID;

public record QueuedGeneration(UUID sceneId, UUID generationId, int ordinal, int version, String idempotencyKey) {
}
