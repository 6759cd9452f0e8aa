package com.example.scenegen_backend.exception;

import com.example.scenegen_backend.config.CorrelationIdFilter;
import com.example.scenegen_backend.dto.web.ApiError;
import com.example.scenegen_backend.dto.web.ApiResponse;
import com.example.scenegen_backend.service.ErrorEventService;
import com.example.scenegen_backend.util.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final ObjectProvider<ErrorEventService> errorEvents;

    public GlobalExceptionHandler(ObjectProvider<ErrorEventService> errorEvents) {
        this.errorEvents = errorEvents;
    }

    @ExceptionHandler(SceneGenException.class)
    public ResponseEntity<ApiResponse<Void>> handleSceneGen(SceneGenException e, HttpServletRequest req) {
        return respond(req, e.httpStatus(), e.getCode(), e.getMessage(), e.getDetail(), e.getUpstream(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidBody(MethodArgumentNotValidException e, HttpServletRequest req) {
        Map<String, Object> fields = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors().forEach(fe -> fields.putIfAbsent(fe.getField(), fe.getDefaultMessage()));
        return respond(req, HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR, "Request validation failed",
                Map.of("fields", fields), null, null);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConstraint(ConstraintViolationException e, HttpServletRequest req) {
        return respond(req, HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR, e.getMessage(), null, null, null);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(Exception e, HttpServletRequest req) {
        return respond(req, HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR, "Malformed request", null, null, null);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleIntegrity(DataIntegrityViolationException e, HttpServletRequest req) {
        LOGGER.warn("Integrity violation route={} error={}", req.getRequestURI(), e.getMostSpecificCause().getMessage());
        return respond(req, HttpStatus.CONFLICT, ErrorCode.CONFLICT_ERROR, "Conflicting write, retry the request", null, null, null);
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ApiResponse<Void>> handleOptimisticLock(OptimisticLockingFailureException e, HttpServletRequest req) {
        return respond(req, HttpStatus.CONFLICT, ErrorCode.CONFLICT_ERROR, "Resource was modified concurrently", null, null, null);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiResponse<Void>> handleStatus(ResponseStatusException e, HttpServletRequest req) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        if (status == null) status = HttpStatus.INTERNAL_SERVER_ERROR;
        return respond(req, status, codeFor(status), e.getReason(), null, null, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleAny(Exception e, HttpServletRequest req) {
        LOGGER.error("Unhandled error route={} correlationId={}", req.getRequestURI(), CorrelationIdFilter.current(), e);
        return respond(req, HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.SERVER_ERROR,
                ErrorCode.SERVER_ERROR.getDefaultMessage(), null, null, null);
    }

    private ResponseEntity<ApiResponse<Void>> respond(HttpServletRequest req, HttpStatus status, ErrorCode code,
                                                      String message, Map<String, Object> detail,
                                                      UpstreamInfo upstream, String userId) {
        String correlationId = CorrelationIdFilter.current();
        String msg = message == null || message.isBlank() ? code.getDefaultMessage() : message;
        LOGGER.warn("Request FAIL correlationId={} method={} route={} status={} code={} message={}",
                correlationId, req.getMethod(), req.getRequestURI(), status.value(), code, msg);
        record(req, status, code, msg, correlationId, userId, detail);

        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status)
                .header(CorrelationIdFilter.HEADER, correlationId);
        Object retryAfter = detail == null ? null : detail.get("retryAfterSeconds");
        if (retryAfter != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
        }
        return builder.body(ApiResponse.fail(new ApiError(code.name(), msg, correlationId, detail, upstream)));
    }

    private void record(HttpServletRequest req, HttpStatus status, ErrorCode code, String message,
                        String correlationId, String userId, Map<String, Object> detail) {
        ErrorEventService service = errorEvents.getIfAvailable();
        if (service == null) return;
        try {
            service.record(req.getRequestURI(), req.getMethod(), status.value(), code.name(), message,
                    correlationId, userId, detail);
        } catch (RuntimeException e) {
            LOGGER.warn("ErrorEvent not recorded correlationId={} error={}", correlationId, e.toString());
        }
    }

    private static ErrorCode codeFor(HttpStatus status) {
        return switch (status) {
            case BAD_REQUEST -> ErrorCode.VALIDATION_ERROR;
            case UNAUTHORIZED -> ErrorCode.AUTH_ERROR;
            case FORBIDDEN -> ErrorCode.FORBIDDEN_ERROR;
            case NOT_FOUND, GONE -> ErrorCode.NOT_FOUND;
            case CONFLICT -> ErrorCode.CONFLICT_ERROR;
            case TOO_MANY_REQUESTS -> ErrorCode.RATE_LIMITED;
            default -> ErrorCode.SERVER_ERROR;
        };
    }
}
