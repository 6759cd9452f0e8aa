package com.example.scenegen_backend.repository;

import com.example.scenegen_backend.model.Project;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface ProjectRepository extends JpaRepository<Project, UUID> {
    Optional<Project> findByOwnerIdAndName(UUID ownerId, String name);

    /**
     * Bumps the per-project scene counter. The row lock taken here serializes concurrent scene
     * creation until the surrounding transaction commits; read the new value with
     * {@link #currentSceneCounter(UUID)} in the same transaction.
     */
    @Modifying
    @Query("update Project p set p.sceneCounter = p.sceneCounter + 1 where p.id = :id")
    int incrementSceneCounter(@Param("id") UUID id);

    @Query("select p.sceneCounter from Project p where p.id = :id")
    int currentSceneCounter(@Param("id") UUID id);
}
