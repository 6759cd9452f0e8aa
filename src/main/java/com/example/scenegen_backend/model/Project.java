package com.example.scenegen_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "project", uniqueConstraints = {
        @UniqueConstraint(name = "uk_project_owner_name", columnNames = {"owner_id", "name"})
})
public class Project {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_project_owner"))
    private Account owner;

    @Column(name = "name", nullable = false, length = 50)
    private String name;

    // last ordinal handed out; only ever changed through ProjectRepository.incrementSceneCounter
    @Column(name = "scene_counter", nullable = false)
    private int sceneCounter = 0;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Project() {
    }

    public Project(Account owner, String name) {
        this.owner = owner;
        this.name = name;
    }

    public UUID getId() {
        return id;
    }

    public Account getOwner() {
        return owner;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getSceneCounter() {
        return sceneCounter;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
