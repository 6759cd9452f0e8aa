package com.example.scenegen_backend.repository;

import com.example.scenegen_backend.model.ShotType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ShotTypeRepository extends JpaRepository<ShotType, UUID> {
    Optional<ShotType> findByIdAndOwnerId(UUID id, UUID ownerId);

    Optional<ShotType> findByOwnerIdAndName(UUID ownerId, String name);

    List<ShotType> findByOwnerIdOrderBySortOrderAsc(UUID ownerId);
}
