package com.example.scenegen_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "public_mirror", uniqueConstraints = {
        @UniqueConstraint(name = "uk_public_mirror_source", columnNames = {"source_key"})
})
public class PublicMirror {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "source_key", nullable = false, length = 1024)
    private String sourceKey;

    @Column(name = "public_key", nullable = false, length = 1024)
    private String publicKey;

    @Column(name = "public_url", nullable = false, length = 4096)
    private String publicUrl;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected PublicMirror() {
    }

    public PublicMirror(String sourceKey, String publicKey, String publicUrl) {
        this.sourceKey = sourceKey;
        this.publicKey = publicKey;
        this.publicUrl = publicUrl;
    }

    public UUID getId() {
        return id;
    }

    public String getSourceKey() {
        return sourceKey;
    }

    public String getPublicKey() {
        return publicKey;
    }

    public String getPublicUrl() {
        return publicUrl;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
