package com.example.scenegen_backend.service;

import com.example.scenegen_backend.repository.GenerationRepository;
import com.example.scenegen_backend.repository.SceneRepository;
import com.example.scenegen_backend.util.ErrorCode;
import com.example.scenegen_backend.util.SceneStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Forward-only state changes shared by submitter, poller and webhook. Each method returns whether
 * this caller won the transition; the scene row follows only when it did.
 */
@Service
public class GenerationStateService {
    private static final Logger LOGGER = LoggerFactory.getLogger(GenerationStateService.class);
    private static final int MESSAGE_MAX = 2000;

    private final GenerationRepository generations;
    private final SceneRepository scenes;
    private final Clock clock;
    private final ObjectMapper om = new ObjectMapper();

    public GenerationStateService(GenerationRepository generations, SceneRepository scenes, Clock clock) {
        this.generations = generations;
        this.scenes = scenes;
        this.clock = clock;
    }

    @Transactional
    public boolean markProcessing(UUID sceneId, int version, UUID generationId, String providerJobId) {
        boolean won = generations.markProcessing(generationId, providerJobId, clock.instant()) == 1;
        if (won) {
            scenes.updateStatusIfNotTerminal(sceneId, version, SceneStatus.PROCESSING, null, null, clock.instant());
        }
        LOGGER.info("Generation PROCESSING id={} jobId={} applied={}", generationId, providerJobId, won);
        return won;
    }

    @Transactional
    public boolean markProgress(UUID sceneId, int version, UUID generationId, Integer progress) {
        boolean won = generations.markProgress(generationId, progress, clock.instant()) == 1;
        if (won) {
            scenes.updateStatusIfNotTerminal(sceneId, version, SceneStatus.PROCESSING, null, null, clock.instant());
        }
        return won;
    }

    @Transactional
    public boolean markCompleted(UUID sceneId, int version, UUID generationId, String videoKey, String videoUrl,
                                 Map<String, Object> renderMeta) {
        boolean won = generations.markCompleted(generationId, videoKey, videoUrl, toJson(renderMeta), clock.instant()) == 1;
        if (won) {
            scenes.updateStatusIfNotTerminal(sceneId, version, SceneStatus.READY, null, null, clock.instant());
        }
        LOGGER.info("Generation COMPLETED id={} videoKey={} applied={}", generationId, videoKey, won);
        return won;
    }

    @Transactional
    public boolean markError(UUID sceneId, int version, UUID generationId, ErrorCode code, String message) {
        String msg = message == null ? code.getDefaultMessage() : truncate(message);
        boolean won = generations.markError(generationId, code.name(), msg, clock.instant()) == 1;
        if (won) {
            scenes.updateStatusIfNotTerminal(sceneId, version, SceneStatus.ERROR, code.name(), msg, clock.instant());
        }
        LOGGER.info("Generation ERROR id={} code={} applied={}", generationId, code, won);
        return won;
    }

    private String toJson(Map<String, Object> meta) {
        if (meta == null || meta.isEmpty()) return null;
        try {
            return om.writeValueAsString(meta);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("render meta not serializable", e);
        }
    }

    private static String truncate(String s) {
        return s.length() <= MESSAGE_MAX ? s : s.substring(0, MESSAGE_MAX);
    }
}
