package com.example.scenegen_backend.exception;

import com.example.scenegen_backend.util.ErrorCode;
import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single failure type of the scene generation flow. The {@link ErrorCode} tags the kind of failure;
 * callers never branch on subclasses.
 */
public class SceneGenException extends RuntimeException {
    private final ErrorCode code;
    private final Map<String, Object> detail;
    private final UpstreamInfo upstream;

    public SceneGenException(ErrorCode code, String message) {
        this(code, message, null, null, null);
    }

    public SceneGenException(ErrorCode code, String message, Map<String, ?> detail) {
        this(code, message, detail, null, null);
    }

    public SceneGenException(ErrorCode code, String message, Map<String, ?> detail, UpstreamInfo upstream, Throwable cause) {
        super(message == null || message.isBlank() ? code.getDefaultMessage() : message, cause);
        this.code = code;
        this.detail = detail == null || detail.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
        this.upstream = upstream;
    }

    public static SceneGenException validation(String message) {
        return new SceneGenException(ErrorCode.VALIDATION_ERROR, message);
    }

    public static SceneGenException notFound(String message) {
        return new SceneGenException(ErrorCode.NOT_FOUND, message);
    }

    public static SceneGenException forbidden(String message) {
        return new SceneGenException(ErrorCode.FORBIDDEN_ERROR, message);
    }

    public static SceneGenException unauthorized(String message) {
        return new SceneGenException(ErrorCode.AUTH_ERROR, message);
    }

    public static SceneGenException conflict(String message) {
        return new SceneGenException(ErrorCode.CONFLICT_ERROR, message);
    }

    public ErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getDetail() {
        return detail;
    }

    public UpstreamInfo getUpstream() {
        return upstream;
    }

    public HttpStatus httpStatus() {
        // a failed provider call is a gateway failure, whatever the upstream code was
        if (upstream != null) {
            return HttpStatus.BAD_GATEWAY;
        }
        return code.getStatus();
    }
}
