package com.example.scenegen_backend.service;

import com.example.scenegen_backend.dto.KeyframeUrls;
import com.example.scenegen_backend.dto.QueuedGeneration;
import com.example.scenegen_backend.exception.SceneGenException;
import com.example.scenegen_backend.model.Generation;
import com.example.scenegen_backend.model.Scene;
import com.example.scenegen_backend.model.ShotType;
import com.example.scenegen_backend.repository.AccountRepository;
import com.example.scenegen_backend.repository.GenerationRepository;
import com.example.scenegen_backend.repository.ProjectRepository;
import com.example.scenegen_backend.repository.SceneRepository;
import com.example.scenegen_backend.repository.ShotTypeRepository;
import com.example.scenegen_backend.util.SceneStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Creates scenes and their queued generations. The ordinal comes from the project counter inside the
 * same transaction as the insert, so a failed insert never leaves a gap.
 */
@Service
public class SceneLedgerService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SceneLedgerService.class);

    private final ProjectRepository projects;
    private final AccountRepository accounts;
    private final ShotTypeRepository shotTypes;
    private final SceneRepository scenes;
    private final GenerationRepository generations;

    public SceneLedgerService(ProjectRepository projects,
                              AccountRepository accounts,
                              ShotTypeRepository shotTypes,
                              SceneRepository scenes,
                              GenerationRepository generations) {
        this.projects = projects;
        this.accounts = accounts;
        this.shotTypes = shotTypes;
        this.scenes = scenes;
        this.generations = generations;
    }

    @Transactional
    public int nextOrdinal(UUID projectId) {
        if (projects.incrementSceneCounter(projectId) != 1) {
            throw SceneGenException.notFound("Project not found");
        }
        return projects.currentSceneCounter(projectId);
    }

    @Transactional
    public QueuedGeneration createQueued(UUID ownerId,
                                         UUID projectId,
                                         UUID shotTypeId,
                                         String startKey,
                                         String endKey,
                                         KeyframeUrls urls,
                                         String idempotencyKey,
                                         String prompt,
                                         String model) {
        int ordinal = nextOrdinal(projectId);
        ShotType shotType = shotTypeId == null ? null : shotTypes.getReferenceById(shotTypeId);
        Scene scene = new Scene(accounts.getReferenceById(ownerId), projects.getReferenceById(projectId),
                shotType, ordinal, startKey, endKey);
        if (urls != null) {
            scene.setStartFrameSignedUrl(urls.startUrl());
            scene.setEndFrameSignedUrl(urls.endUrl());
            scene.setSignedUrlExpiresAt(urls.expiresAt());
        }
        scenes.save(scene);

        Generation generation = generations.save(new Generation(scene, 1, idempotencyKey, prompt, model));
        LOGGER.info("SceneLedger CREATED sceneId={} project={} ordinal={} generationId={}",
                scene.getId(), projectId, ordinal, generation.getId());
        return new QueuedGeneration(scene.getId(), generation.getId(), ordinal, 1, idempotencyKey);
    }

    /**
     * Appends the next version to a settled scene. Refused while any generation of the scene is
     * still queued or processing.
     */
    @Transactional
    public QueuedGeneration queueRegeneration(UUID sceneId, UUID shotTypeId, String idempotencyKey, String prompt, String model) {
        Scene scene = scenes.findActiveById(sceneId)
                .orElseThrow(() -> SceneGenException.notFound("Scene not found"));
        if (generations.existsNonTerminalForScene(sceneId)) {
            throw SceneGenException.conflict("Scene already has a render in progress");
        }
        int next = scene.getCurrentVersion() + 1;
        scene.setCurrentVersion(next);
        scene.setStatus(SceneStatus.QUEUED);
        scene.setErrorCode(null);
        scene.setErrorMessage(null);
        if (shotTypeId != null) {
            scene.setShotType(shotTypes.getReferenceById(shotTypeId));
        }
        scenes.saveAndFlush(scene);

        Generation generation = generations.save(new Generation(scene, next, idempotencyKey, prompt, model));
        LOGGER.info("SceneLedger REGENERATE sceneId={} version={} generationId={}", sceneId, next, generation.getId());
        return new QueuedGeneration(sceneId, generation.getId(), scene.getOrdinal(), next, idempotencyKey);
    }
}
