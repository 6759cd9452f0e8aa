package com.example.scenegen_backend.controller;

import com.example.scenegen_backend.dto.GenerationView;
import com.example.scenegen_backend.dto.RefreshResult;
import com.example.scenegen_backend.dto.SceneStatusView;
import com.example.scenegen_backend.dto.SceneSubmission;
import com.example.scenegen_backend.dto.web.ApiResponse;
import com.example.scenegen_backend.dto.web.RegenerateSceneRequest;
import com.example.scenegen_backend.dto.web.SubmitSceneRequest;
import com.example.scenegen_backend.model.Account;
import com.example.scenegen_backend.model.Scene;
import com.example.scenegen_backend.service.AccountService;
import com.example.scenegen_backend.service.GenerationWatchService;
import com.example.scenegen_backend.service.SceneDeletionService;
import com.example.scenegen_backend.service.SceneStatusService;
import com.example.scenegen_backend.service.SceneSubmissionService;
import com.example.scenegen_backend.service.SignedUrlService;
import com.example.scenegen_backend.config.SceneProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/v1/scenes")
public class SceneController {
    private static final Logger LOGGER = LoggerFactory.getLogger(SceneController.class);
    private static final long SSE_SLACK_MILLIS = 30_000L;

    private final SceneSubmissionService submissions;
    private final SceneStatusService statuses;
    private final GenerationWatchService watches;
    private final SignedUrlService signedUrls;
    private final SceneDeletionService deletions;
    private final AccountService accountService;
    private final SceneProperties sceneProps;

    public SceneController(SceneSubmissionService submissions,
                           SceneStatusService statuses,
                           GenerationWatchService watches,
                           SignedUrlService signedUrls,
                           SceneDeletionService deletions,
                           AccountService accountService,
                           SceneProperties sceneProps) {
        this.submissions = submissions;
        this.statuses = statuses;
        this.watches = watches;
        this.signedUrls = signedUrls;
        this.deletions = deletions;
        this.accountService = accountService;
        this.sceneProps = sceneProps;
    }

    @Operation(summary = "Submit a scene", description = "Creates a scene from two keyframes and submits it to the video provider.")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Scene queued or processing"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Rate limited"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Provider rejected the job; the scene is kept in error")
    })
    @PostMapping
    public ResponseEntity<ApiResponse<SceneSubmission>> submit(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody SubmitSceneRequest body,
            HttpServletRequest req) {
        SceneSubmission result = submissions.submitScene(authorization, clientIp(req), body);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(result));
    }

    @Operation(summary = "Regenerate a scene", description = "Adds a new version to an existing scene.")
    @PostMapping("/{id}/regenerate")
    public ResponseEntity<ApiResponse<SceneSubmission>> regenerate(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID id,
            @Valid @RequestBody(required = false) RegenerateSceneRequest body,
            HttpServletRequest req) {
        String shotTypeId = body == null ? null : body.shotTypeId();
        SceneSubmission result = submissions.regenerate(authorization, clientIp(req), id, shotTypeId);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(result));
    }

    @Operation(summary = "Poll scene status once")
    @GetMapping("/{id}/status")
    public ApiResponse<SceneStatusView> status(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID id) {
        return ApiResponse.ok(statuses.pollOnce(authorization, id));
    }

    @Operation(summary = "Stream scene status", description = "Server-sent events, one per poll tick, until the scene settles.")
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                             @PathVariable UUID id) {
        Account account = accountService.getUser(authorization);
        Scene scene = statuses.requireOwned(id, account.getId());

        long timeout = sceneProps.getPollInterval().toMillis() * sceneProps.getPollMaxAttempts() + SSE_SLACK_MILLIS;
        SseEmitter emitter = new SseEmitter(timeout);
        GenerationWatchService.Handle handle = watches.watch(scene.getId(), account.getId(), new GenerationWatchService.Listener() {
            @Override
            public void onUpdate(SceneStatusView view) {
                send(emitter, "status", view);
            }

            @Override
            public void onEnd(GenerationWatchService.EndReason reason) {
                send(emitter, "end", Map.of("reason", reason.name()));
                emitter.complete();
            }

            @Override
            public void onError(Exception error) {
                send(emitter, "error", Map.of("message", String.valueOf(error.getMessage())));
            }
        });
        emitter.onCompletion(handle::cancel);
        emitter.onTimeout(handle::cancel);
        emitter.onError(t -> handle.cancel());
        return emitter;
    }

    @Operation(summary = "List versions of a scene")
    @GetMapping("/{id}/generations")
    public ApiResponse<List<GenerationView>> generations(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID id) {
        return ApiResponse.ok(statuses.history(authorization, id));
    }

    @Operation(summary = "Refresh keyframe URLs", description = "Reissues signed keyframe URLs when expired, or always with force=true.")
    @PostMapping("/{id}/refresh-urls")
    public ApiResponse<RefreshResult> refreshUrls(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID id,
            @RequestParam(value = "force", defaultValue = "false") boolean force) {
        Account account = accountService.getUser(authorization);
        Scene scene = statuses.requireOwned(id, account.getId());
        return ApiResponse.ok(signedUrls.refresh(scene, force));
    }

    @Operation(summary = "Delete a scene")
    @DeleteMapping("/{id}")
    public ApiResponse<Map<String, Object>> delete(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable UUID id) {
        deletions.softDelete(authorization, id);
        return ApiResponse.ok(Map.of("sceneId", id, "deleted", true));
    }

    private static void send(SseEmitter emitter, String name, Object payload) {
        try {
            emitter.send(SseEmitter.event().name(name).data(payload));
        } catch (IOException | IllegalStateException e) {
            // client went away; the emitter callbacks cancel the watch
            LOGGER.debug("SSE send failed event={} error={}", name, e.getMessage());
            emitter.completeWithError(e);
        }
    }

    static String clientIp(HttpServletRequest req) {
        String forwarded = req.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return req.getRemoteAddr();
    }
}
