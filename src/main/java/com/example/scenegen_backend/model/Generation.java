package com.example.scenegen_backend.model;

import com.example.scenegen_backend.util.GenerationStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * One render attempt of a {@link Scene}. Rows are append-only per scene; status changes go through the
 * guarded updates in {@code GenerationRepository}.
 */
@Entity
@Table(
        name = "generation",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_generation_scene_version", columnNames = {"scene_id", "version_number"})
        },
        indexes = {
                @Index(name = "idx_generation_idempotency", columnList = "idempotency_key"),
                @Index(name = "idx_generation_provider_job", columnList = "provider_job_id")
        }
)
public class Generation {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "scene_id", nullable = false, foreignKey = @ForeignKey(name = "fk_generation_scene"))
    private Scene scene;

    @Column(name = "version_number", nullable = false, updatable = false)
    private int versionNumber;

    @Column(name = "provider_job_id", length = 128)
    private String providerJobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private GenerationStatus status = GenerationStatus.QUEUED;

    @Column(name = "progress_pct")
    private Integer progressPct;

    @Column(name = "video_key", length = 1024)
    private String videoKey;

    @Column(name = "video_url", length = 4096)
    private String videoUrl;

    @Column(name = "error_code", length = 64)
    private String errorCode;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "idempotency_key", nullable = false, length = 64)
    private String idempotencyKey;

    @Column(name = "prompt", length = 2000)
    private String prompt;

    @Column(name = "model", length = 64)
    private String model;

    // JSON text: provider job id, provider video url, archive time, source of completion
    @Column(name = "render_meta", length = 4000)
    private String renderMeta;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected Generation() {
    }

    public Generation(Scene scene, int versionNumber, String idempotencyKey, String prompt, String model) {
        this.scene = scene;
        this.versionNumber = versionNumber;
        this.idempotencyKey = idempotencyKey;
        this.prompt = prompt;
        this.model = model;
    }

    public UUID getId() {
        return id;
    }

    public Scene getScene() {
        return scene;
    }

    public int getVersionNumber() {
        return versionNumber;
    }

    public String getProviderJobId() {
        return providerJobId;
    }

    public GenerationStatus getStatus() {
        return status;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Integer getProgressPct() {
        return progressPct;
    }

    public String getVideoKey() {
        return videoKey;
    }

    public String getVideoUrl() {
        return videoUrl;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public String getPrompt() {
        return prompt;
    }

    public String getModel() {
        return model;
    }

    public String getRenderMeta() {
        return renderMeta;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }
}
