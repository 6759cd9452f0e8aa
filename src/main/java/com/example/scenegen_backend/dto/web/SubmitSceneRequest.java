package com.example.scenegen_backend.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record SubmitSceneRequest(
        @NotBlank @Size(max = 50) @Pattern(regexp = "^[a-zA-Z0-9_-]+$", message = "project must be a slug") String project,
        @NotBlank @Size(max = 1024) String startKey,
        @Size(max = 1024) String endKey,
        @NotBlank @Size(max = 100) String shotTypeId,
        @Size(max = 2000) String prompt
) {
}
