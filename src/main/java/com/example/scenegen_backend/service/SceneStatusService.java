package com.example.scenegen_backend.service;

import com.example.scenegen_backend.dto.GenerationView;
import com.example.scenegen_backend.dto.SceneStatusView;
import com.example.scenegen_backend.engine.Interfaces.VideoGenerationEngine;
import com.example.scenegen_backend.engine.Interfaces.VideoGenerationEngine.ProviderError;
import com.example.scenegen_backend.engine.Interfaces.VideoGenerationEngine.StatusResult;
import com.example.scenegen_backend.exception.SceneGenException;
import com.example.scenegen_backend.model.Account;
import com.example.scenegen_backend.model.Generation;
import com.example.scenegen_backend.model.Scene;
import com.example.scenegen_backend.repository.GenerationRepository;
import com.example.scenegen_backend.repository.SceneRepository;
import com.example.scenegen_backend.util.ErrorCode;
import com.example.scenegen_backend.util.ProviderState;
import com.example.scenegen_backend.util.SceneStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * One poll tick per call: at most one provider status request and one local state update. Settled
 * generations are answered from the database without touching the provider.
 */
@Service
public class SceneStatusService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SceneStatusService.class);

    private final AccountService accountService;
    private final SceneRepository scenes;
    private final GenerationRepository generations;
    private final VideoGenerationEngine engine;
    private final ProviderErrorClassifier classifier;
    private final GenerationStateService states;
    private final SceneArchiveService archive;
    private final SignedUrlService signedUrls;

    public SceneStatusService(AccountService accountService,
                              SceneRepository scenes,
                              GenerationRepository generations,
                              VideoGenerationEngine engine,
                              ProviderErrorClassifier classifier,
                              GenerationStateService states,
                              SceneArchiveService archive,
                              SignedUrlService signedUrls) {
        this.accountService = accountService;
        this.scenes = scenes;
        this.generations = generations;
        this.engine = engine;
        this.classifier = classifier;
        this.states = states;
        this.archive = archive;
        this.signedUrls = signedUrls;
    }

    public SceneStatusView pollOnce(String bearerToken, UUID sceneId) {
        Account account = accountService.getUser(bearerToken);
        return pollOnce(sceneId, account.getId());
    }

    public SceneStatusView pollOnce(UUID sceneId, UUID ownerId) {
        Scene scene = requireOwned(sceneId, ownerId);
        Generation generation = currentGeneration(scene);

        if (generation.isTerminal()) {
            return view(scene, generation, null, null);
        }
        if (generation.getProviderJobId() == null) {
            return view(scene, generation, null, null);
        }

        StatusResult status = engine.status(generation.getProviderJobId());
        int version = generation.getVersionNumber();
        if (!status.ok()) {
            ProviderError error = status.error();
            if (classifier.isRetryable(error.code())) {
                LOGGER.info("ScenePoll transient sceneId={} version={} code={}", sceneId, version, error.code());
                return view(scene, generation, null, error);
            }
            states.markError(sceneId, version, generation.getId(), error.code(), error.message());
            return reload(scene, generation, null);
        }

        ProviderState state = status.state();
        switch (state) {
            case COMPLETED -> {
                if (status.videoUrl() == null) {
                    states.markError(sceneId, version, generation.getId(), ErrorCode.ARCHIVE_ERROR,
                            "Provider completed without a video URL");
                } else {
                    archive.archiveAndComplete(scene, version, generation.getId(), generation.getProviderJobId(),
                            status.videoUrl(), "poll", null);
                }
            }
            case FAILED -> {
                String reason = status.failureReason() == null ? ErrorCode.PROVIDER_FAILED.getDefaultMessage() : status.failureReason();
                states.markError(sceneId, version, generation.getId(), ErrorCode.PROVIDER_FAILED, reason);
            }
            default -> states.markProgress(sceneId, version, generation.getId(), status.progress());
        }
        LOGGER.debug("ScenePoll sceneId={} version={} providerState={} progress={}", sceneId, version, state, status.progress());
        return reload(scene, generation, state);
    }

    public List<GenerationView> history(String bearerToken, UUID sceneId) {
        Account account = accountService.getUser(bearerToken);
        requireOwned(sceneId, account.getId());
        return generations.findBySceneIdOrderByVersionNumberAsc(sceneId).stream()
                .map(g -> new GenerationView(g.getId(), g.getVersionNumber(), lower(g.getStatus().name()),
                        g.getProviderJobId(), g.getProgressPct(), g.getVideoKey(), g.getErrorCode(),
                        g.getErrorMessage(), g.getCreatedAt(), g.getUpdatedAt()))
                .toList();
    }

    public Scene requireOwned(UUID sceneId, UUID ownerId) {
        Scene scene = scenes.findActiveById(sceneId)
                .orElseThrow(() -> SceneGenException.notFound("Scene not found"));
        if (!scene.getOwner().getId().equals(ownerId)) {
            throw SceneGenException.forbidden("Scene belongs to another account");
        }
        return scene;
    }

    private Generation currentGeneration(Scene scene) {
        return generations.findBySceneIdAndVersionNumber(scene.getId(), scene.getCurrentVersion())
                .or(() -> generations.findFirstBySceneIdOrderByVersionNumberDesc(scene.getId()))
                .orElseThrow(() -> SceneGenException.notFound("Scene has no generations"));
    }

    private SceneStatusView reload(Scene scene, Generation before, ProviderState state) {
        Scene freshScene = scenes.findActiveById(scene.getId()).orElse(scene);
        Generation fresh = generations.findById(before.getId()).orElse(before);
        return view(freshScene, fresh, state, null);
    }

    private SceneStatusView view(Scene scene, Generation g, ProviderState state, ProviderError transientError) {
        boolean terminal = g.isTerminal();
        SceneStatus sceneStatus = SceneStatus.of(g.getStatus());
        String errorCode = g.getErrorCode();
        String errorMessage = g.getErrorMessage();
        if (transientError != null) {
            errorCode = transientError.code().name();
            errorMessage = transientError.message();
        }
        String videoUrl = terminal ? signedUrls.readUrlOrNull(g.getVideoKey()) : null;
        return new SceneStatusView(scene.getId(), g.getId(), g.getVersionNumber(), lower(sceneStatus.name()),
                lower(g.getStatus().name()), state == null ? null : state.wireName(), g.getProgressPct(),
                videoUrl, terminal, errorCode, errorMessage);
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
