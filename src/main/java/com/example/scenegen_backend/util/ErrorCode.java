package com.example.scenegen_backend.util;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "Invalid request"),
    AUTH_ERROR(HttpStatus.UNAUTHORIZED, "Authentication required"),
    FORBIDDEN_ERROR(HttpStatus.FORBIDDEN, "Access denied"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "Resource not found"),
    CONFLICT_ERROR(HttpStatus.CONFLICT, "Resource conflict"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded"),
    SHOT_TYPE_NOT_FOUND(HttpStatus.BAD_REQUEST, "Shot type not found"),

    // provider-originated
    UPSTREAM_ERROR(HttpStatus.BAD_GATEWAY, "Upstream service error"),
    QUOTA_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Provider quota exceeded, try again later"),
    SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"),
    NETWORK_ERROR(HttpStatus.BAD_GATEWAY, "Could not reach the video provider"),
    API_ERROR(HttpStatus.BAD_GATEWAY, "Video provider returned an unexpected response"),
    PROVIDER_FAILED(HttpStatus.BAD_GATEWAY, "Video generation failed"),

    // local
    ARCHIVE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Rendered video could not be archived"),
    STORAGE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Storage operation failed");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
