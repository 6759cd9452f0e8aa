package com.example.scenegen_backend.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

@Entity
@Table(name = "rate_limit_window", indexes = {
        @Index(name = "idx_rate_limit_window_start", columnList = "window_start")
})
public class RateLimitWindow implements Persistable<RateLimitWindowId> {
    @EmbeddedId
    private RateLimitWindowId id;

    @Column(name = "request_count", nullable = false)
    private int requestCount;

    @Transient
    private boolean fresh = true;

    protected RateLimitWindow() {
    }

    public RateLimitWindow(RateLimitWindowId id, int requestCount) {
        this.id = id;
        this.requestCount = requestCount;
    }

    @Override
    public RateLimitWindowId getId() {
        return id;
    }

    // new windows are inserted, never merged; a lost insert race surfaces as a key violation
    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.fresh = false;
    }

    public int getRequestCount() {
        return requestCount;
    }
}
