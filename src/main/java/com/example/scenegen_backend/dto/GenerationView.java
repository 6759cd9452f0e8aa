package com.example.scenegen_backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerationView(UUID generationId,
                             int version,
                             String status,
                             String providerJobId,
                             Integer progress,
                             String videoKey,
                             String errorCode,
                             String errorMessage,
                             Instant createdAt,
                             Instant updatedAt) {
}
