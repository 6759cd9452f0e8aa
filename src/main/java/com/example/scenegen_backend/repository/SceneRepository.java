package com.example.scenegen_backend.repository;

import com.example.scenegen_backend.model.Scene;
import com.example.scenegen_backend.util.SceneStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SceneRepository extends JpaRepository<Scene, UUID> {

    @Query("""
       select s from Scene s
         join fetch s.owner
         join fetch s.project
         left join fetch s.shotType
       where s.id = :id and s.deletedAt is null
    """)
    Optional<Scene> findActiveById(@Param("id") UUID id);

    @Query("""
       select s from Scene s
         join fetch s.owner
         join fetch s.project
       where s.id = :id
    """)
    Optional<Scene> findWithRefsById(@Param("id") UUID id);

    @Query("select s.ordinal from Scene s where s.project.id = :projectId order by s.ordinal")
    List<Integer> findOrdinalsByProjectId(@Param("projectId") UUID projectId);

    /**
     * Moves the scene to the status of its current version. Rows that already settled, or whose
     * current version moved on through a regenerate, are left untouched.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
       update Scene s
          set s.status = :status,
              s.errorCode = :errorCode,
              s.errorMessage = :errorMessage,
              s.updatedAt = :now,
              s.version = s.version + 1
        where s.id = :id
          and s.currentVersion = :versionNumber
          and s.status in (com.example.scenegen_backend.util.SceneStatus.QUEUED,
                           com.example.scenegen_backend.util.SceneStatus.PROCESSING)
    """)
    int updateStatusIfNotTerminal(@Param("id") UUID id,
                                  @Param("versionNumber") int versionNumber,
                                  @Param("status") SceneStatus status,
                                  @Param("errorCode") String errorCode,
                                  @Param("errorMessage") String errorMessage,
                                  @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
       update Scene s
          set s.startFrameSignedUrl = :startUrl,
              s.endFrameSignedUrl = :endUrl,
              s.signedUrlExpiresAt = :expiresAt,
              s.updatedAt = :now,
              s.version = s.version + 1
        where s.id = :id
    """)
    int updateSignedUrls(@Param("id") UUID id,
                         @Param("startUrl") String startUrl,
                         @Param("endUrl") String endUrl,
                         @Param("expiresAt") Instant expiresAt,
                         @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("update Scene s set s.deletedAt = :now, s.updatedAt = :now, s.version = s.version + 1 where s.id = :id and s.deletedAt is null")
    int softDelete(@Param("id") UUID id, @Param("now") Instant now);
}
