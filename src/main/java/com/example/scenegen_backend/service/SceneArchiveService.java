package com.example.scenegen_backend.service;

import com.example.scenegen_backend.config.SceneProperties;
import com.example.scenegen_backend.engine.Interfaces.VideoGenerationEngine;
import com.example.scenegen_backend.exception.SceneGenException;
import com.example.scenegen_backend.exception.StorageException;
import com.example.scenegen_backend.model.Scene;
import com.example.scenegen_backend.service.Interfaces.StorageService;
import com.example.scenegen_backend.util.ErrorCode;
import com.example.scenegen_backend.util.LogRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Copies a finished render into durable storage and settles the generation. A download or upload
 * failure settles it as {@code ARCHIVE_ERROR} even though the provider succeeded.
 */
@Service
public class SceneArchiveService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SceneArchiveService.class);

    private final VideoGenerationEngine engine;
    private final StorageService storage;
    private final GenerationStateService states;
    private final SceneProperties sceneProps;
    private final Clock clock;

    public SceneArchiveService(VideoGenerationEngine engine,
                               StorageService storage,
                               GenerationStateService states,
                               SceneProperties sceneProps,
                               Clock clock) {
        this.engine = engine;
        this.storage = storage;
        this.states = states;
        this.sceneProps = sceneProps;
        this.clock = clock;
    }

    public String archiveKey(Scene scene, int version) {
        return scenePrefix(scene) + "-v" + version + ".mp4";
    }

    /** Prefix shared by every archived version of the scene. */
    public String scenePrefix(Scene scene) {
        return sceneProps.archivePrefix(scene.getOwner().getExternalSubject(), scene.getProject().getName())
                + "scene-" + scene.getOrdinal();
    }

    /**
     * @return true when this call settled the generation as completed
     */
    public boolean archiveAndComplete(Scene scene, int version, UUID generationId, String providerJobId,
                                      String videoUrl, String source, Map<String, Object> extraMeta) {
        String key = archiveKey(scene, version);
        try {
            byte[] bytes = engine.download(videoUrl);
            storage.upload(key, bytes);
            LOGGER.info("SceneArchive STORED sceneId={} version={} key={} bytes={}", scene.getId(), version, key, bytes.length);
        } catch (SceneGenException | StorageException e) {
            LOGGER.warn("SceneArchive FAIL sceneId={} version={} url={} error={}",
                    scene.getId(), version, LogRedactor.redact(videoUrl), e.getMessage());
            states.markError(scene.getId(), version, generationId, ErrorCode.ARCHIVE_ERROR,
                    "Video rendered but could not be archived: " + e.getMessage());
            return false;
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        if (extraMeta != null) meta.putAll(extraMeta);
        if (providerJobId != null) meta.put("provider_job_id", providerJobId);
        meta.put("video_url", LogRedactor.redact(videoUrl));
        meta.put("archived_at", clock.instant().toString());
        meta.put("source", source);
        return states.markCompleted(scene.getId(), version, generationId, key, videoUrl, meta);
    }
}
