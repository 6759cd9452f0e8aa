package com.example.scenegen_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "shot_type", uniqueConstraints = {
        @UniqueConstraint(name = "uk_shot_type_owner_name", columnNames = {"owner_id", "name"})
})
public class ShotType {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_shot_type_owner"))
    private Account owner;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "prompt_template", nullable = false, length = 2000)
    private String promptTemplate;

    @Column(name = "hotkey", length = 8)
    private String hotkey;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder = 0;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ShotType() {
    }

    public ShotType(Account owner, String name, String promptTemplate) {
        this.owner = owner;
        this.name = name;
        this.promptTemplate = promptTemplate;
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

    public String getPromptTemplate() {
        return promptTemplate;
    }

    public void setPromptTemplate(String promptTemplate) {
        this.promptTemplate = promptTemplate;
    }

    public String getHotkey() {
        return hotkey;
    }

    public void setHotkey(String hotkey) {
        this.hotkey = hotkey;
    }

    public int getSortOrder() {
        return sortOrder;
    }

    public void setSortOrder(int sortOrder) {
        this.sortOrder = sortOrder;
    }
}
