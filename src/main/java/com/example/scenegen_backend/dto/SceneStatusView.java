package com.example.scenegen_backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SceneStatusView(UUID sceneId,
                              UUID generationId,
                              int version,
                              String status,
                              String generationStatus,
                              String providerState,
                              Integer progress,
                              String videoUrl,
                              boolean isTerminal,
                              String errorCode,
                              String errorMessage) {
}
