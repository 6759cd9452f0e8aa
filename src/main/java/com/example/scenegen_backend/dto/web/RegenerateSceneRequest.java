package com.example.scenegen_backend.dto.web;

import jakarta.validation.constraints.Size;

public record RegenerateSceneRequest(@Size(max = 100) String shotTypeId) {
}
