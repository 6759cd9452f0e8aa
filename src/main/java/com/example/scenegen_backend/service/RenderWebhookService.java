package com.example.scenegen_backend.service;

import com.example.scenegen_backend.dto.WebhookOutcome;
import com.example.scenegen_backend.exception.SceneGenException;
import com.example.scenegen_backend.model.Generation;
import com.example.scenegen_backend.model.Scene;
import com.example.scenegen_backend.repository.GenerationRepository;
import com.example.scenegen_backend.repository.SceneRepository;
import com.example.scenegen_backend.util.ErrorCode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Applies signed render callbacks from the provider or the internal render pipeline. Uses the same
 * guarded transitions as the poller, so whichever path arrives second sees a no-op.
 */
@Service
public class RenderWebhookService {
    private static final Logger LOGGER = LoggerFactory.getLogger(RenderWebhookService.class);

    private final WebhookSignatureVerifier verifier;
    private final SceneRepository scenes;
    private final GenerationRepository generations;
    private final GenerationStateService states;
    private final SceneArchiveService archive;
    private final ObjectMapper om = new ObjectMapper();

    public RenderWebhookService(WebhookSignatureVerifier verifier,
                                SceneRepository scenes,
                                GenerationRepository generations,
                                GenerationStateService states,
                                SceneArchiveService archive) {
        this.verifier = verifier;
        this.scenes = scenes;
        this.generations = generations;
        this.states = states;
        this.archive = archive;
    }

    public WebhookOutcome handle(byte[] rawBody, String signatureHeader) {
        if (!verifier.verify(rawBody, signatureHeader)) {
            LOGGER.warn("Webhook REJECTED signaturePresent={} bytes={}", signatureHeader != null, rawBody == null ? 0 : rawBody.length);
            throw SceneGenException.unauthorized("Invalid webhook signature");
        }

        JsonNode body = parse(rawBody);
        UUID sceneId = parseSceneId(body);
        if (!body.hasNonNull("version") || !body.get("version").canConvertToInt() || body.get("version").asInt() <= 0) {
            throw SceneGenException.validation("version must be a positive integer");
        }
        int version = body.get("version").asInt();
        String status = text(body, "status");
        status = status == null ? "ready" : status.toLowerCase(Locale.ROOT);

        Scene scene = scenes.findWithRefsById(sceneId)
                .orElseThrow(() -> SceneGenException.notFound("Scene not found"));
        Generation generation = generations.findBySceneIdAndVersionNumber(sceneId, version)
                .orElseThrow(() -> SceneGenException.notFound("Scene version not found"));

        boolean applied = switch (status) {
            case "ready", "completed" -> complete(scene, generation, body);
            case "error", "failed" -> states.markError(sceneId, version, generation.getId(), ErrorCode.PROVIDER_FAILED,
                    firstNonNull(text(body, "errorMessage"), text(body, "failure_reason"), ErrorCode.PROVIDER_FAILED.getDefaultMessage()));
            case "processing", "queued" -> states.markProgress(sceneId, version, generation.getId(),
                    body.hasNonNull("progress") ? Math.max(0, Math.min(100, body.get("progress").asInt())) : null);
            default -> throw SceneGenException.validation("Unsupported status: " + status);
        };
        LOGGER.info("Webhook ACCEPTED sceneId={} version={} status={} applied={}", sceneId, version, status, applied);
        return new WebhookOutcome(true, applied, sceneId, version, status);
    }

    private boolean complete(Scene scene, Generation generation, JsonNode body) {
        String videoKey = text(body, "videoKey");
        String videoUrl = text(body, "videoUrl");
        if (videoKey == null && videoUrl == null) {
            throw SceneGenException.validation("videoUrl or videoKey is required for a completed render");
        }
        if (generation.isTerminal()) {
            return false;
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        JsonNode renderMeta = body.get("renderMeta");
        if (renderMeta != null && renderMeta.isObject()) {
            meta.putAll(om.convertValue(renderMeta, Map.class));
        }
        int version = generation.getVersionNumber();
        if (videoKey != null) {
            meta.put("source", "webhook");
            return states.markCompleted(scene.getId(), version, generation.getId(), videoKey, videoUrl, meta);
        }
        return archive.archiveAndComplete(scene, version, generation.getId(), generation.getProviderJobId(),
                videoUrl, "webhook", meta);
    }

    private JsonNode parse(byte[] rawBody) {
        try {
            JsonNode node = om.readTree(rawBody);
            if (node == null || !node.isObject()) throw SceneGenException.validation("Body must be a JSON object");
            return node;
        } catch (IOException e) {
            throw SceneGenException.validation("Body is not valid JSON");
        }
    }

    private static UUID parseSceneId(JsonNode body) {
        String raw = text(body, "sceneId");
        if (raw == null) throw SceneGenException.validation("sceneId is required");
        try {
            return UUID.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw SceneGenException.validation("sceneId must be a UUID");
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText();
        return s.isBlank() ? null : s;
    }

    private static String firstNonNull(String... values) {
        for (String v : values) if (v != null) return v;
        return null;
    }
}
