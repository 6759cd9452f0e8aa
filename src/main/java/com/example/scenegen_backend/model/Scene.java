package com.example.scenegen_backend.model;

import com.example.scenegen_backend.util.SceneStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * One shot in a project: a start keyframe, an optional end keyframe and a shot type.
 * Render attempts are kept as {@link Generation} rows.
 */
@Entity
@Table(
        name = "scene",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_scene_project_ordinal", columnNames = {"project_id", "ordinal"})
        },
        indexes = {
                @Index(name = "idx_scene_owner", columnList = "owner_id"),
                @Index(name = "idx_scene_signed_url_expires", columnList = "signed_url_expires_at")
        }
)
public class Scene {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false, foreignKey = @ForeignKey(name = "fk_scene_owner"))
    private Account owner;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "project_id", nullable = false, foreignKey = @ForeignKey(name = "fk_scene_project"))
    private Project project;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "shot_type_id", foreignKey = @ForeignKey(name = "fk_scene_shot_type"))
    private ShotType shotType;

    @Column(name = "ordinal", nullable = false, updatable = false)
    private int ordinal;

    @Column(name = "current_version", nullable = false)
    private int currentVersion = 1;

    @Column(name = "start_key", nullable = false, length = 1024)
    private String startKey;

    @Column(name = "end_key", length = 1024)
    private String endKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private SceneStatus status = SceneStatus.QUEUED;

    @Column(name = "start_frame_signed_url", length = 4096)
    private String startFrameSignedUrl;

    @Column(name = "end_frame_signed_url", length = 4096)
    private String endFrameSignedUrl;

    @Column(name = "signed_url_expires_at")
    private Instant signedUrlExpiresAt;

    @Column(name = "error_code", length = 64)
    private String errorCode;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected Scene() {
    }

    public Scene(Account owner, Project project, ShotType shotType, int ordinal, String startKey, String endKey) {
        this.owner = owner;
        this.project = project;
        this.shotType = shotType;
        this.ordinal = ordinal;
        this.startKey = startKey;
        this.endKey = endKey;
    }

    public UUID getId() {
        return id;
    }

    public Account getOwner() {
        return owner;
    }

    public Project getProject() {
        return project;
    }

    public ShotType getShotType() {
        return shotType;
    }

    public void setShotType(ShotType shotType) {
        this.shotType = shotType;
    }

    public int getOrdinal() {
        return ordinal;
    }

    public int getCurrentVersion() {
        return currentVersion;
    }

    public void setCurrentVersion(int currentVersion) {
        this.currentVersion = currentVersion;
    }

    public String getStartKey() {
        return startKey;
    }

    public String getEndKey() {
        return endKey;
    }

    public SceneStatus getStatus() {
        return status;
    }

    public void setStatus(SceneStatus status) {
        this.status = status;
    }

    public String getStartFrameSignedUrl() {
        return startFrameSignedUrl;
    }

    public void setStartFrameSignedUrl(String startFrameSignedUrl) {
        this.startFrameSignedUrl = startFrameSignedUrl;
    }

    public String getEndFrameSignedUrl() {
        return endFrameSignedUrl;
    }

    public void setEndFrameSignedUrl(String endFrameSignedUrl) {
        this.endFrameSignedUrl = endFrameSignedUrl;
    }

    public Instant getSignedUrlExpiresAt() {
        return signedUrlExpiresAt;
    }

    public void setSignedUrlExpiresAt(Instant signedUrlExpiresAt) {
        this.signedUrlExpiresAt = signedUrlExpiresAt;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(String errorCode) {
        this.errorCode = errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public Instant getDeletedAt() {
        return deletedAt;
    }

    public void setDeletedAt(Instant deletedAt) {
        this.deletedAt = deletedAt;
    }

    public boolean isDeleted() {
        return deletedAt != null;
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
