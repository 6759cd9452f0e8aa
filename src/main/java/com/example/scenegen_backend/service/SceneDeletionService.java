package com.example.scenegen_backend.service;

import com.example.scenegen_backend.exception.SceneGenException;
import com.example.scenegen_backend.model.Account;
import com.example.scenegen_backend.model.Scene;
import com.example.scenegen_backend.repository.GenerationRepository;
import com.example.scenegen_backend.repository.SceneRepository;
import com.example.scenegen_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Service
public class SceneDeletionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SceneDeletionService.class);

    private final AccountService accountService;
    private final SceneRepository scenes;
    private final GenerationRepository generations;
    private final SceneArchiveService archive;
    private final StorageService storage;
    private final Clock clock;

    public SceneDeletionService(AccountService accountService,
                                SceneRepository scenes,
                                GenerationRepository generations,
                                SceneArchiveService archive,
                                StorageService storage,
                                Clock clock) {
        this.accountService = accountService;
        this.scenes = scenes;
        this.generations = generations;
        this.archive = archive;
        this.storage = storage;
        this.clock = clock;
    }

    /**
     * Hides the scene from status, history and regenerate. Archived videos stay in storage until
     * {@link #hardDelete(UUID)} runs.
     */
    @Transactional
    public void softDelete(String bearerToken, UUID sceneId) {
        Account account = accountService.getUser(bearerToken);
        Scene scene = scenes.findActiveById(sceneId)
                .orElseThrow(() -> SceneGenException.notFound("Scene not found"));
        if (!scene.getOwner().getId().equals(account.getId())) {
            throw SceneGenException.forbidden("Scene belongs to another account");
        }
        int updated = scenes.softDelete(sceneId, clock.instant());
        LOGGER.info("SceneDelete SOFT sceneId={} owner={} updated={}", sceneId, account.getId(), updated);
    }

    /**
     * Removes archived videos of every version, then the generations, then the scene row.
     */
    @Transactional
    public void hardDelete(UUID sceneId) {
        Scene scene = scenes.findWithRefsById(sceneId)
                .orElseThrow(() -> SceneGenException.notFound("Scene not found"));
        // trailing dash keeps scene-1 from matching scene-10
        List<String> keys = storage.list(archive.scenePrefix(scene) + "-");
        if (!keys.isEmpty()) {
            storage.remove(keys);
        }
        int removedGenerations = generations.deleteBySceneId(sceneId);
        scenes.delete(scene);
        LOGGER.info("SceneDelete HARD sceneId={} objects={} generations={}", sceneId, keys.size(), removedGenerations);
    }
}
