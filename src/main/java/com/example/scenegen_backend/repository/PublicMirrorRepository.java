package com.example.scenegen_backend.repository;

import com.example.scenegen_backend.model.PublicMirror;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface PublicMirrorRepository extends JpaRepository<PublicMirror, UUID> {
    Optional<PublicMirror> findBySourceKey(String sourceKey);
}
