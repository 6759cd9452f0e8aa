package com.example.scenegen_backend.engine;

import com.example.scenegen_backend.config.LumaProperties;
import com.example.scenegen_backend.engine.Interfaces.VideoGenerationEngine;
import com.example.scenegen_backend.exception.SceneGenException;
import com.example.scenegen_backend.exception.UpstreamInfo;
import com.example.scenegen_backend.service.ProviderErrorClassifier;
import com.example.scenegen_backend.util.ErrorCode;
import com.example.scenegen_backend.util.LogRedactor;
import com.example.scenegen_backend.util.ProviderState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.*;

/**
 * Dream Machine client. Submissions are retried on 5xx and network failures with doubling backoff;
 * status reads are single shot because the caller polls again anyway.
 */
public class LumaVideoEngine implements VideoGenerationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(LumaVideoEngine.class);
    static final String GENERATIONS_PATH = "/generations";
    private static final String GENERATION_PATH = "/generations/{id}";

    private final WebClient client;
    private final WebClient assetClient;
    private final LumaProperties props;
    private final ProviderErrorClassifier classifier;
    private final Duration downloadTimeout;
    private final ObjectMapper om = new ObjectMapper();

    public LumaVideoEngine(WebClient client,
                           WebClient assetClient,
                           LumaProperties props,
                           ProviderErrorClassifier classifier,
                           Duration downloadTimeout) {
        this.client = client;
        this.assetClient = assetClient;
        this.props = props;
        this.classifier = classifier;
        this.downloadTimeout = downloadTimeout;
    }

    @Override
    public Map<String, Object> buildPayload(String prompt, String model, String startUrl, String endUrl) {
        String effectiveModel = model == null || model.isBlank() ? props.getModel() : model;
        Map<String, Object> keyframes = new LinkedHashMap<>();
        keyframes.put("frame0", Map.of("type", "image", "url", startUrl));
        if (endUrl != null && !endUrl.isBlank()) {
            keyframes.put("frame1", Map.of("type", "image", "url", endUrl));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prompt", prompt);
        payload.put("model", effectiveModel);
        payload.put("aspect_ratio", props.getAspectRatio());
        payload.put("resolution", props.getResolution());
        payload.put("loop", props.isLoop());
        payload.put("keyframes", keyframes);
        return whitelist(payload);
    }

    /**
     * Drops every top-level field the target model does not accept. Models without a configured
     * whitelist pass through untouched.
     */
    public Map<String, Object> whitelist(Map<String, Object> payload) {
        Object model = payload.get("model");
        List<String> allowed = model == null ? null : props.getModels().get(model.toString());
        if (allowed == null) {
            return new LinkedHashMap<>(payload);
        }
        Map<String, Object> filtered = new LinkedHashMap<>();
        List<String> stripped = new ArrayList<>();
        payload.forEach((k, v) -> {
            if (allowed.contains(k)) filtered.put(k, v);
            else stripped.add(k);
        });
        if (!stripped.isEmpty()) {
            LOGGER.info("LumaPayload stripped model={} fields={}", model, stripped);
        }
        return filtered;
    }

    @Override
    public SubmitResult submit(Map<String, Object> payload) {
        Map<String, Object> body = whitelist(payload);
        String endpoint = props.getBaseUrl() + GENERATIONS_PATH;
        int retries = Math.max(0, props.getMaxAttempts() - 1);
        Duration timeout = Duration.ofSeconds(props.getTimeoutSeconds());
        LOGGER.info("LumaSubmit START model={} payload={}", body.get("model"), redacted(body));

        Mono<String> mono = client.post()
                .uri(GENERATIONS_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .retryWhen(Retry.backoff(retries, props.getRetryBaseBackoff())
                        .jitter(0d)
                        .filter(classifier::isRetryable)
                        .doBeforeRetry(signal -> LOGGER.warn(
                                "LumaSubmit retry attempt={} code={} type={}",
                                signal.totalRetriesInARow() + 2,
                                classifier.classify(signal.failure()),
                                signal.failure().getClass().getSimpleName()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));

        String raw;
        try {
            raw = mono.block();
        } catch (RuntimeException e) {
            ProviderError error = classifier.toProviderError(Exceptions.unwrap(e), endpoint);
            LOGGER.warn("LumaSubmit FAIL code={} status={} snippet={}", error.code(),
                    error.upstream() == null ? null : error.upstream().status(),
                    error.upstream() == null ? null : error.upstream().bodySnippet());
            return SubmitResult.failed(error);
        }

        String jobId = readText(parse(raw), "id");
        if (jobId == null) {
            LOGGER.warn("LumaSubmit FAIL missing id snippet={}", LogRedactor.truncate(LogRedactor.redact(raw), 200));
            return SubmitResult.failed(new ProviderError(ErrorCode.API_ERROR,
                    "Video provider response did not contain a job id",
                    new UpstreamInfo(endpoint, 200,
                            LogRedactor.truncate(LogRedactor.redact(raw), 500)),
                    null));
        }
        LOGGER.info("LumaSubmit DONE jobId={}", jobId);
        return SubmitResult.ok(jobId);
    }

    @Override
    public StatusResult status(String jobId) {
        String endpoint = props.getBaseUrl() + GENERATIONS_PATH + "/" + jobId;
        String raw;
        try {
            raw = client.get()
                    .uri(GENERATION_PATH, jobId)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(props.getTimeoutSeconds()))
                    .block();
        } catch (RuntimeException e) {
            ProviderError error = classifier.toProviderError(Exceptions.unwrap(e), endpoint);
            LOGGER.warn("LumaStatus FAIL jobId={} code={}", jobId, error.code());
            return StatusResult.failed(jobId, error);
        }

        JsonNode root = parse(raw);
        if (root == null) {
            return StatusResult.failed(jobId, new ProviderError(ErrorCode.API_ERROR,
                    "Video provider returned an unreadable status",
                    new UpstreamInfo(endpoint, 200, LogRedactor.truncate(raw, 500)),
                    null));
        }
        ProviderState state = ProviderState.parse(readText(root, "state"));
        Integer progress = root.hasNonNull("progress") ? clampPct(root.get("progress").asDouble()) : null;
        String videoUrl = firstNonBlank(
                readPath(root, "assets", "video"),
                readPath(root, "video", "url"),
                readText(root, "download_url"));
        String failureReason = readText(root, "failure_reason");
        return new StatusResult(jobId, state, progress, videoUrl, failureReason, null);
    }

    @Override
    public byte[] download(String url) {
        try {
            byte[] bytes = assetClient.get()
                    .uri(URI.create(url))
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .timeout(downloadTimeout)
                    .block();
            if (bytes == null || bytes.length == 0) {
                throw new SceneGenException(ErrorCode.ARCHIVE_ERROR, "Downloaded video was empty");
            }
            return bytes;
        } catch (SceneGenException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable t = Exceptions.unwrap(e);
            String reason = t instanceof WebClientResponseException wcre
                    ? "status " + wcre.getStatusCode().value()
                    : t.getClass().getSimpleName();
            LOGGER.warn("LumaDownload FAIL url={} reason={}", LogRedactor.redact(url), reason);
            throw new SceneGenException(ErrorCode.ARCHIVE_ERROR, "Video download failed: " + reason,
                    Map.of("reason", reason), null, t);
        }
    }

    private String redacted(Map<String, Object> body) {
        try {
            return LogRedactor.redact(om.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            return "<unserializable>";
        }
    }

    private JsonNode parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return om.readTree(raw);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static Integer clampPct(double value) {
        return (int) Math.round(Math.max(0, Math.min(100, value)));
    }

    private static String readText(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || !v.isValueNode()) return null;
        String s = v.asText();
        return s.isBlank() ? null : s;
    }

    private static String readPath(JsonNode node, String parent, String field) {
        if (node == null) return null;
        return readText(node.get(parent), field);
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
