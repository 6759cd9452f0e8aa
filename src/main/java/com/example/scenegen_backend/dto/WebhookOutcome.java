package com.example.scenegen_backend.dto;

import java.util.UUID;

/**
 * {@code applied=false} means the generation had already moved on; the callback is still accepted.
 */
public record WebhookOutcome(boolean accepted, boolean applied, UUID sceneId, int version, String status) {
}
