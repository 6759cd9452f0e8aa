package com.example.scenegen_backend.engine;

import com.example.scenegen_backend.config.LumaProperties;
import com.example.scenegen_backend.engine.Interfaces.VideoGenerationEngine;
import com.example.scenegen_backend.exception.SceneGenException;
import com.example.scenegen_backend.service.ProviderErrorClassifier;
import com.example.scenegen_backend.util.ErrorCode;
import com.example.scenegen_backend.util.ProviderState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LumaVideoEngineRetryTest {

    private LumaProperties props;
    private final ProviderErrorClassifier classifier = new ProviderErrorClassifier();

    @BeforeEach
    void setup() {
        props = new LumaProperties();
        props.setBaseUrl("https://luma.test/v1");
        props.setRetryBaseBackoff(Duration.ofMillis(1));
    }

    @Test
    void persistentServerErrorIsAttemptedThreeTimes() {
        AtomicInteger attempts = new AtomicInteger();
        LumaVideoEngine engine = engine(request -> {
            attempts.incrementAndGet();
            return Mono.just(json(HttpStatus.SERVICE_UNAVAILABLE, "{\"detail\":\"overloaded\"}"));
        });

        VideoGenerationEngine.SubmitResult result = engine.submit(samplePayload());

        assertThat(attempts.get()).isEqualTo(3);
        assertThat(result.success()).isFalse();
        assertThat(result.error().code()).isEqualTo(ErrorCode.SERVER_ERROR);
        assertThat(result.error().upstream().status()).isEqualTo(503);
        assertThat(result.error().upstream().bodySnippet()).contains("overloaded");
    }

    @Test
    void quotaExceededIsNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        LumaVideoEngine engine = engine(request -> {
            attempts.incrementAndGet();
            return Mono.just(json(HttpStatus.TOO_MANY_REQUESTS, "{\"detail\":\"slow down\"}"));
        });

        VideoGenerationEngine.SubmitResult result = engine.submit(samplePayload());

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(result.error().code()).isEqualTo(ErrorCode.QUOTA_EXCEEDED);
    }

    @Test
    void badRequestIsNotRetriedAndCarriesProviderDetail() {
        AtomicInteger attempts = new AtomicInteger();
        LumaVideoEngine engine = engine(request -> {
            attempts.incrementAndGet();
            return Mono.just(json(HttpStatus.BAD_REQUEST, "{\"detail\":\"frame0 url unreachable\"}"));
        });

        VideoGenerationEngine.SubmitResult result = engine.submit(samplePayload());

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(result.error().code()).isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(result.error().message()).contains("frame0 url unreachable");
    }

    @Test
    void retriesOnPrematureCloseThenSucceeds() {
        AtomicInteger attempts = new AtomicInteger();
        LumaVideoEngine engine = engine(request -> {
            if (attempts.incrementAndGet() < 3) {
                return Mono.error(new PrematureCloseException("closed"));
            }
            return Mono.just(json(HttpStatus.CREATED, "{\"id\":\"job-123\",\"state\":\"queued\"}"));
        });

        VideoGenerationEngine.SubmitResult result = engine.submit(samplePayload());

        assertThat(attempts.get()).isEqualTo(3);
        assertThat(result.success()).isTrue();
        assertThat(result.jobId()).isEqualTo("job-123");
    }

    @Test
    void statusIsSingleAttemptEvenOnServerError() {
        AtomicInteger attempts = new AtomicInteger();
        LumaVideoEngine engine = engine(request -> {
            attempts.incrementAndGet();
            return Mono.just(json(HttpStatus.BAD_GATEWAY, "{}"));
        });

        VideoGenerationEngine.StatusResult result = engine.status("job-1");

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(result.ok()).isFalse();
        assertThat(result.error().code()).isEqualTo(ErrorCode.SERVER_ERROR);
    }

    @Test
    void statusParsesDreamingProgressAndVideoAsset() {
        LumaVideoEngine processing = engine(request ->
                Mono.just(json(HttpStatus.OK, "{\"id\":\"j\",\"state\":\"dreaming\",\"progress\":142.0}")));
        VideoGenerationEngine.StatusResult running = processing.status("j");
        assertThat(running.state()).isEqualTo(ProviderState.PROCESSING);
        assertThat(running.progress()).isEqualTo(100);

        LumaVideoEngine completed = engine(request ->
                Mono.just(json(HttpStatus.OK, "{\"id\":\"j\",\"state\":\"completed\",\"assets\":{\"video\":\"https://cdn.test/v.mp4\"}}")));
        VideoGenerationEngine.StatusResult done = completed.status("j");
        assertThat(done.state()).isEqualTo(ProviderState.COMPLETED);
        assertThat(done.videoUrl()).isEqualTo("https://cdn.test/v.mp4");
    }

    @Test
    void downloadNotFoundBecomesArchiveError() {
        LumaVideoEngine engine = engine(request -> Mono.just(json(HttpStatus.NOT_FOUND, "{}")));

        SceneGenException ex = assertThrows(SceneGenException.class, () -> engine.download("https://cdn.test/gone.mp4"));

        assertThat(ex.getCode()).isEqualTo(ErrorCode.ARCHIVE_ERROR);
        assertThat(ex.getMessage()).contains("404");
    }

    @Test
    void whitelistStripsFieldsTheModelDoesNotAccept() {
        LumaVideoEngine engine = engine(request -> Mono.just(json(HttpStatus.OK, "{}")));
        Map<String, Object> payload = new LinkedHashMap<>(samplePayload());
        payload.put("model", "ray-1-6");
        payload.put("resolution", "1080p");
        payload.put("seed", 42);

        Map<String, Object> filtered = engine.whitelist(payload);

        assertThat(filtered).containsKeys("prompt", "model", "keyframes");
        assertThat(filtered).doesNotContainKeys("resolution", "seed");
    }

    @Test
    void buildPayloadOmitsSecondFrameWhenEndUrlMissing() {
        LumaVideoEngine engine = engine(request -> Mono.just(json(HttpStatus.OK, "{}")));

        Map<String, Object> payload = engine.buildPayload("slow pan", null, "https://files.test/a.jpg", null);

        assertThat(payload.get("model")).isEqualTo("ray-flash-2");
        @SuppressWarnings("unchecked")
        Map<String, Object> keyframes = (Map<String, Object>) payload.get("keyframes");
        assertThat(keyframes).containsOnlyKeys("frame0");
    }

    private LumaVideoEngine engine(ExchangeFunction exchangeFunction) {
        WebClient client = WebClient.builder().exchangeFunction(exchangeFunction).build();
        return new LumaVideoEngine(client, client, props, classifier, Duration.ofSeconds(5));
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    private static Map<String, Object> samplePayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prompt", "dolly in");
        payload.put("model", "ray-flash-2");
        payload.put("keyframes", Map.of("frame0", Map.of("type", "image", "url", "https://files.test/a.jpg")));
        return payload;
    }
}
