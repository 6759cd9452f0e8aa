package com.example.scenegen_backend.service;

import com.example.scenegen_backend.config.LumaProperties;
import com.example.scenegen_backend.config.SceneProperties;
import com.example.scenegen_backend.dto.KeyframeUrls;
import com.example.scenegen_backend.dto.QueuedGeneration;
import com.example.scenegen_backend.dto.RateLimitDecision;
import com.example.scenegen_backend.dto.SceneSubmission;
import com.example.scenegen_backend.dto.web.SubmitSceneRequest;
import com.example.scenegen_backend.engine.Interfaces.VideoGenerationEngine;
import com.example.scenegen_backend.engine.Interfaces.VideoGenerationEngine.ProviderError;
import com.example.scenegen_backend.engine.Interfaces.VideoGenerationEngine.SubmitResult;
import com.example.scenegen_backend.exception.SceneGenException;
import com.example.scenegen_backend.model.Account;
import com.example.scenegen_backend.model.Generation;
import com.example.scenegen_backend.model.Project;
import com.example.scenegen_backend.model.Scene;
import com.example.scenegen_backend.model.ShotType;
import com.example.scenegen_backend.repository.GenerationRepository;
import com.example.scenegen_backend.repository.ProjectRepository;
import com.example.scenegen_backend.repository.SceneRepository;
import com.example.scenegen_backend.repository.ShotTypeRepository;
import com.example.scenegen_backend.service.Interfaces.RateLimiter;
import com.example.scenegen_backend.util.ErrorCode;
import com.example.scenegen_backend.util.IdempotencyKeys;
import com.example.scenegen_backend.util.SceneStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Entry point for new renders: checks the caller, resolves keyframe URLs, persists a queued scene and
 * hands the job to the provider. A provider failure leaves the scene in {@code error} and is rethrown with
 * the upstream trail; the scene row is kept.
 */
@Service
public class SceneSubmissionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SceneSubmissionService.class);
    private static final Pattern PROJECT_SLUG = Pattern.compile("^[a-zA-Z0-9_-]{1,50}$");

    private final AccountService accountService;
    private final ProjectRepository projects;
    private final ShotTypeRepository shotTypes;
    private final SceneRepository scenes;
    private final GenerationRepository generations;
    private final SignedUrlService signedUrls;
    private final SceneLedgerService ledger;
    private final GenerationStateService states;
    private final VideoGenerationEngine engine;
    private final RateLimiter rateLimiter;
    private final SceneProperties sceneProps;
    private final LumaProperties lumaProps;

    public SceneSubmissionService(AccountService accountService,
                                  ProjectRepository projects,
                                  ShotTypeRepository shotTypes,
                                  SceneRepository scenes,
                                  GenerationRepository generations,
                                  SignedUrlService signedUrls,
                                  SceneLedgerService ledger,
                                  GenerationStateService states,
                                  VideoGenerationEngine engine,
                                  RateLimiter rateLimiter,
                                  SceneProperties sceneProps,
                                  LumaProperties lumaProps) {
        this.accountService = accountService;
        this.projects = projects;
        this.shotTypes = shotTypes;
        this.scenes = scenes;
        this.generations = generations;
        this.signedUrls = signedUrls;
        this.ledger = ledger;
        this.states = states;
        this.engine = engine;
        this.rateLimiter = rateLimiter;
        this.sceneProps = sceneProps;
        this.lumaProps = lumaProps;
    }

    public SceneSubmission submitScene(String bearerToken, String clientIp, SubmitSceneRequest request) {
        Account account = accountService.getUser(bearerToken);
        enforceRateLimit(account, clientIp);
        validateRequest(request);

        String owner = account.getExternalSubject();
        String endKey = blankToNull(request.endKey());
        verifyOwnership(owner, request.project(), request.startKey(), endKey);
        accountService.requireApproved(account);

        Project project = projects.findByOwnerIdAndName(account.getId(), request.project())
                .orElseThrow(() -> SceneGenException.notFound("Project not found"));
        ShotType shotType = resolveShotType(account, request.shotTypeId());
        String prompt = resolvePrompt(shotType, request.prompt());
        String model = lumaProps.getModel();
        String key = IdempotencyKeys.compute(owner, project.getName(), request.startKey(), endKey,
                shotType.getId().toString(), prompt);
        LOGGER.info("SceneSubmit START owner={} project={} shotType={} key={}", owner, project.getName(), shotType.getName(), key);

        Optional<SceneSubmission> replay = findInFlightDuplicate(key);
        if (replay.isPresent()) {
            return replay.get();
        }

        KeyframeUrls urls = signedUrls.resolveKeyframes(request.startKey(), endKey);
        QueuedGeneration queued = ledger.createQueued(account.getId(), project.getId(), shotType.getId(),
                request.startKey(), endKey, urls, key, prompt, model);
        return dispatch(queued, prompt, model, urls);
    }

    public SceneSubmission regenerate(String bearerToken, String clientIp, UUID sceneId, String shotTypeId) {
        Account account = accountService.getUser(bearerToken);
        enforceRateLimit(account, clientIp);
        accountService.requireApproved(account);

        Scene scene = scenes.findActiveById(sceneId)
                .orElseThrow(() -> SceneGenException.notFound("Scene not found"));
        if (!scene.getOwner().getId().equals(account.getId())) {
            throw SceneGenException.forbidden("Scene belongs to another account");
        }
        ShotType shotType = shotTypeId == null || shotTypeId.isBlank()
                ? scene.getShotType()
                : resolveShotType(account, shotTypeId);
        if (shotType == null) {
            throw new SceneGenException(ErrorCode.SHOT_TYPE_NOT_FOUND, "Scene has no shot type; pass shotTypeId");
        }
        String prompt = resolvePrompt(shotType, null);
        String model = lumaProps.getModel();
        String key = IdempotencyKeys.compute(account.getExternalSubject(), scene.getProject().getName(),
                scene.getStartKey(), scene.getEndKey(), shotType.getId().toString(), prompt);

        KeyframeUrls urls = signedUrls.ensureFresh(scene);
        QueuedGeneration queued = ledger.queueRegeneration(sceneId, shotType.getId(), key, prompt, model);
        return dispatch(queued, prompt, model, urls);
    }

    private SceneSubmission dispatch(QueuedGeneration queued, String prompt, String model, KeyframeUrls urls) {
        Map<String, Object> payload = engine.buildPayload(prompt, model, urls.startUrl(), urls.endUrl());
        SubmitResult result = engine.submit(payload);
        if (result.success()) {
            states.markProcessing(queued.sceneId(), queued.version(), queued.generationId(), result.jobId());
            LOGGER.info("SceneSubmit DONE sceneId={} version={} jobId={}", queued.sceneId(), queued.version(), result.jobId());
            return submission(queued, SceneStatus.PROCESSING, result.jobId());
        }

        ProviderError error = result.error();
        states.markError(queued.sceneId(), queued.version(), queued.generationId(), error.code(), error.message());
        LOGGER.warn("SceneSubmit FAIL sceneId={} version={} code={} upstreamStatus={}", queued.sceneId(), queued.version(),
                error.code(), error.upstream() == null ? null : error.upstream().status());
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("sceneId", queued.sceneId());
        detail.put("generationId", queued.generationId());
        detail.put("version", queued.version());
        if (error.upstreamDetail() != null) {
            detail.put("providerDetail", error.upstreamDetail());
        }
        throw new SceneGenException(error.code(), error.message(), detail, error.upstream(), null);
    }

    private Optional<SceneSubmission> findInFlightDuplicate(String key) {
        List<Generation> inFlight = generations.findInFlightByIdempotencyKey(key);
        if (inFlight.isEmpty()) {
            return Optional.empty();
        }
        Generation existing = inFlight.get(0);
        if (!sceneProps.getIdempotency().isEnforce()) {
            LOGGER.info("SceneSubmit duplicate in flight key={} existingGeneration={} enforce=false", key, existing.getId());
            return Optional.empty();
        }
        Scene scene = existing.getScene();
        LOGGER.info("SceneSubmit REPLAY key={} sceneId={} generationId={}", key, scene.getId(), existing.getId());
        return Optional.of(new SceneSubmission(scene.getId(), existing.getId(), scene.getOrdinal(),
                existing.getVersionNumber(), SceneStatus.of(existing.getStatus()).name().toLowerCase(Locale.ROOT),
                key, existing.getProviderJobId(), true));
    }

    void verifyOwnership(String owner, String project, String startKey, String endKey) {
        String prefix = sceneProps.keyPrefix(owner, project);
        checkKey(prefix, startKey, "startKey");
        if (endKey != null) {
            checkKey(prefix, endKey, "endKey");
        }
    }

    private static void checkKey(String prefix, String key, String field) {
        boolean traversal = key.contains("..") || key.contains("\\") || key.startsWith("/");
        if (traversal || !key.startsWith(prefix) || key.length() == prefix.length()) {
            throw new SceneGenException(ErrorCode.FORBIDDEN_ERROR, "Storage key is outside your project",
                    Map.of("field", field));
        }
    }

    private ShotType resolveShotType(Account account, String shotTypeId) {
        Optional<ShotType> found;
        UUID id = parseUuid(shotTypeId);
        if (id != null) {
            found = shotTypes.findByIdAndOwnerId(id, account.getId());
        } else {
            found = shotTypes.findByOwnerIdAndName(account.getId(), shotTypeId);
        }
        return found.orElseThrow(() -> new SceneGenException(ErrorCode.SHOT_TYPE_NOT_FOUND, "Shot type not found",
                Map.of("shotTypeId", shotTypeId)));
    }

    private static String resolvePrompt(ShotType shotType, String callerPrompt) {
        String template = shotType.getPromptTemplate();
        if (template != null && !template.isBlank()) {
            return template.trim();
        }
        if (callerPrompt != null && !callerPrompt.isBlank()) {
            return callerPrompt.trim();
        }
        throw SceneGenException.validation("Shot type has no prompt template and no prompt was given");
    }

    private void enforceRateLimit(Account account, String clientIp) {
        RateLimitDecision decision = rateLimiter.check(RateLimiter.identifier(account.getExternalSubject(), clientIp));
        if (!decision.allowed()) {
            throw new SceneGenException(ErrorCode.RATE_LIMITED,
                    "Rate limit exceeded. Try again in " + decision.retryAfterSeconds() + " seconds.",
                    Map.of("retryAfterSeconds", decision.retryAfterSeconds(), "resetAt", decision.resetAt().toString()));
        }
    }

    private static void validateRequest(SubmitSceneRequest request) {
        if (request == null) throw SceneGenException.validation("Request body is required");
        if (request.project() == null || !PROJECT_SLUG.matcher(request.project()).matches()) {
            throw SceneGenException.validation("project must be 1-50 letters, digits, '-' or '_'");
        }
        if (request.startKey() == null || request.startKey().isBlank()) {
            throw SceneGenException.validation("startKey is required");
        }
        if (request.shotTypeId() == null || request.shotTypeId().isBlank()) {
            throw SceneGenException.validation("shotTypeId is required");
        }
    }

    private static SceneSubmission submission(QueuedGeneration q, SceneStatus status, String jobId) {
        return new SceneSubmission(q.sceneId(), q.generationId(), q.ordinal(), q.version(),
                status.name().toLowerCase(Locale.ROOT), q.idempotencyKey(), jobId, false);
    }

    private static UUID parseUuid(String s) {
        try {
            return UUID.fromString(s);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
