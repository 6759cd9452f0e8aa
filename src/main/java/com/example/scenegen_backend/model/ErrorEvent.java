package com.example.scenegen_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "error_event", indexes = {
        @Index(name = "idx_error_event_created", columnList = "created_at"),
        @Index(name = "idx_error_event_correlation", columnList = "correlation_id")
})
public class ErrorEvent {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "route", nullable = false, length = 512)
    private String route;

    @Column(name = "method", nullable = false, length = 16)
    private String method;

    @Column(name = "status", nullable = false)
    private int status;

    @Column(name = "code", nullable = false, length = 64)
    private String code;

    @Column(name = "message", length = 2000)
    private String message;

    @Column(name = "correlation_id", nullable = false, length = 64)
    private String correlationId;

    @Column(name = "user_id", length = 255)
    private String userId;

    // JSON text
    @Column(name = "safe_context", length = 4000)
    private String safeContext;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ErrorEvent() {
    }

    public ErrorEvent(String route, String method, int status, String code, String message, String correlationId) {
        this.route = route;
        this.method = method;
        this.status = status;
        this.code = code;
        this.message = message;
        this.correlationId = correlationId;
    }

    public UUID getId() {
        return id;
    }

    public String getRoute() {
        return route;
    }

    public String getMethod() {
        return method;
    }

    public int getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getSafeContext() {
        return safeContext;
    }

    public void setSafeContext(String safeContext) {
        this.safeContext = safeContext;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
