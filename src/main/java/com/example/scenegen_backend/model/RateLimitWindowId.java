package com.example.scenegen_backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.io.Serializable;
import java.util.Objects;

@Embeddable
public class RateLimitWindowId implements Serializable {
    @Column(name = "bucket_key", nullable = false, length = 255)
    private String bucketKey;

    // epoch millis of the window start
    @Column(name = "window_start", nullable = false)
    private long windowStart;

    protected RateLimitWindowId() {
    }

    public RateLimitWindowId(String bucketKey, long windowStart) {
        this.bucketKey = bucketKey;
        this.windowStart = windowStart;
    }

    public String getBucketKey() {
        return bucketKey;
    }

    public long getWindowStart() {
        return windowStart;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RateLimitWindowId other)) return false;
        return windowStart == other.windowStart && Objects.equals(bucketKey, other.bucketKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucketKey, windowStart);
    }
}
