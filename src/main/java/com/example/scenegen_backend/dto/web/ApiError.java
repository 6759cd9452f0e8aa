package com.example.scenegen_backend.dto.web;

import com.example.scenegen_backend.exception.UpstreamInfo;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ApiError(String code,
                       String message,
                       String correlationId,
                       Map<String, Object> detail,
                       UpstreamInfo upstream) {
}
