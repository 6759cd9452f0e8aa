package com.example.scenegen_backend.repository;

import com.example.scenegen_backend.model.Generation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface GenerationRepository extends JpaRepository<Generation, UUID> {

    Optional<Generation> findFirstBySceneIdOrderByVersionNumberDesc(UUID sceneId);

    Optional<Generation> findBySceneIdAndVersionNumber(UUID sceneId, int versionNumber);

    List<Generation> findBySceneIdOrderByVersionNumberAsc(UUID sceneId);

    @Query("""
       select g from Generation g
         join fetch g.scene
       where g.idempotencyKey = :key
         and g.status in (com.example.scenegen_backend.util.GenerationStatus.QUEUED,
                          com.example.scenegen_backend.util.GenerationStatus.PROCESSING)
       order by g.createdAt desc
    """)
    List<Generation> findInFlightByIdempotencyKey(@Param("key") String idempotencyKey);

    @Query("""
       select count(g) > 0 from Generation g
       where g.scene.id = :sceneId
         and g.status in (com.example.scenegen_backend.util.GenerationStatus.QUEUED,
                          com.example.scenegen_backend.util.GenerationStatus.PROCESSING)
    """)
    boolean existsNonTerminalForScene(@Param("sceneId") UUID sceneId);

    // status writes go through the guarded updates below; 0 rows means another path already moved it
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
       update Generation g
          set g.status = com.example.scenegen_backend.util.GenerationStatus.PROCESSING,
              g.providerJobId = :jobId,
              g.updatedAt = :now,
              g.version = g.version + 1
        where g.id = :id
          and g.status = com.example.scenegen_backend.util.GenerationStatus.QUEUED
    """)
    int markProcessing(@Param("id") UUID id, @Param("jobId") String jobId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
       update Generation g
          set g.status = com.example.scenegen_backend.util.GenerationStatus.PROCESSING,
              g.progressPct = :progress,
              g.updatedAt = :now,
              g.version = g.version + 1
        where g.id = :id
          and g.status in (com.example.scenegen_backend.util.GenerationStatus.QUEUED,
                           com.example.scenegen_backend.util.GenerationStatus.PROCESSING)
    """)
    int markProgress(@Param("id") UUID id, @Param("progress") Integer progress, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
       update Generation g
          set g.status = com.example.scenegen_backend.util.GenerationStatus.COMPLETED,
              g.progressPct = 100,
              g.videoKey = :videoKey,
              g.videoUrl = :videoUrl,
              g.renderMeta = :renderMeta,
              g.updatedAt = :now,
              g.version = g.version + 1
        where g.id = :id
          and g.status = com.example.scenegen_backend.util.GenerationStatus.PROCESSING
    """)
    int markCompleted(@Param("id") UUID id,
                      @Param("videoKey") String videoKey,
                      @Param("videoUrl") String videoUrl,
                      @Param("renderMeta") String renderMeta,
                      @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
       update Generation g
          set g.status = com.example.scenegen_backend.util.GenerationStatus.ERROR,
              g.errorCode = :errorCode,
              g.errorMessage = :errorMessage,
              g.updatedAt = :now,
              g.version = g.version + 1
        where g.id = :id
          and g.status in (com.example.scenegen_backend.util.GenerationStatus.QUEUED,
                           com.example.scenegen_backend.util.GenerationStatus.PROCESSING)
    """)
    int markError(@Param("id") UUID id,
                  @Param("errorCode") String errorCode,
                  @Param("errorMessage") String errorMessage,
                  @Param("now") Instant now);

    @Modifying
    @Transactional
    @Query("delete from Generation g where g.scene.id = :sceneId")
    int deleteBySceneId(@Param("sceneId") UUID sceneId);
}
