package com.example.scenegen_backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SceneSubmission(UUID sceneId,
                              UUID generationId,
                              int ordinal,
                              int version,
                              String status,
                              String idempotencyKey,
                              String providerJobId,
                              boolean duplicate) {
}
