package com.example.scenegen_backend.model;

import com.example.scenegen_backend.util.ProfileStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "account")
public class Account {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    // user id as it appears in storage paths
    @Column(name = "external_subject", nullable = false, unique = true)
    private String externalSubject;

    @Column(name = "display_name")
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(name = "profile_status", nullable = false, length = 32)
    private ProfileStatus profileStatus = ProfileStatus.PENDING;

    @Column(name = "api_token_hash", length = 64, unique = true)
    private String apiTokenHash;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Account() {
    }

    public Account(String externalSubject, String displayName) {
        this.externalSubject = externalSubject;
        this.displayName = displayName;
    }

    public UUID getId() {
        return id;
    }

    public String getExternalSubject() {
        return externalSubject;
    }

    public void setExternalSubject(String externalSubject) {
        this.externalSubject = externalSubject;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public ProfileStatus getProfileStatus() {
        return profileStatus;
    }

    public void setProfileStatus(ProfileStatus profileStatus) {
        this.profileStatus = profileStatus;
    }

    public boolean isApproved() {
        return profileStatus == ProfileStatus.APPROVED;
    }

    public String getApiTokenHash() {
        return apiTokenHash;
    }

    public void setApiTokenHash(String apiTokenHash) {
        this.apiTokenHash = apiTokenHash;
    }

    public long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
