package com.example.scenegen_backend.controller;

import com.example.scenegen_backend.config.SceneProperties;
import com.example.scenegen_backend.dto.SceneStatusView;
import com.example.scenegen_backend.dto.SceneSubmission;
import com.example.scenegen_backend.exception.SceneGenException;
import com.example.scenegen_backend.exception.UpstreamInfo;
import com.example.scenegen_backend.service.AccountService;
import com.example.scenegen_backend.service.GenerationWatchService;
import com.example.scenegen_backend.service.SceneDeletionService;
import com.example.scenegen_backend.service.SceneStatusService;
import com.example.scenegen_backend.service.SceneSubmissionService;
import com.example.scenegen_backend.service.SignedUrlService;
import com.example.scenegen_backend.util.ErrorCode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = SceneController.class)
@AutoConfigureMockMvc(addFilters = false)
class SceneControllerTest {

    private static final String AUTH = "Bearer token-1";
    private static final String BODY = """
            {"project":"projA","startKey":"u1/projA/photos/a.png","endKey":"u1/projA/photos/b.png","shotTypeId":"dolly-in","prompt":"slow push"}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SceneSubmissionService submissions;
    @MockitoBean
    private SceneStatusService statuses;
    @MockitoBean
    private GenerationWatchService watches;
    @MockitoBean
    private SignedUrlService signedUrls;
    @MockitoBean
    private SceneDeletionService deletions;
    @MockitoBean
    private AccountService accountService;
    @MockitoBean
    private SceneProperties sceneProps;

    @Test
    void submitReturnsCreatedEnvelope() throws Exception {
        UUID sceneId = UUID.randomUUID();
        UUID genId = UUID.randomUUID();
        when(submissions.submitScene(eq(AUTH), eq("203.0.113.7"), any()))
                .thenReturn(new SceneSubmission(sceneId, genId, 3, 1, "processing", "abc123", "job-1", false));

        mockMvc.perform(post("/v1/scenes")
                        .header("Authorization", AUTH)
                        .header("X-Forwarded-For", "203.0.113.7, 10.0.0.1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.data.sceneId").value(sceneId.toString()))
                .andExpect(jsonPath("$.data.ordinal").value(3))
                .andExpect(jsonPath("$.data.providerJobId").value("job-1"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void submitWithoutStartKeyIsValidationError() throws Exception {
        mockMvc.perform(post("/v1/scenes")
                        .header("Authorization", AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"project\":\"projA\",\"shotTypeId\":\"dolly-in\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.detail.fields.startKey").exists());

        verifyNoInteractions(submissions);
    }

    @Test
    void rateLimitedCarriesRetryAfter() throws Exception {
        when(submissions.submitScene(any(), any(), any()))
                .thenThrow(new SceneGenException(ErrorCode.RATE_LIMITED, "Too many submissions",
                        Map.of("retryAfterSeconds", 42L)));

        mockMvc.perform(post("/v1/scenes")
                        .header("Authorization", AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "42"))
                .andExpect(header().exists("X-Correlation-Id"))
                .andExpect(jsonPath("$.error.code").value("RATE_LIMITED"))
                .andExpect(jsonPath("$.error.correlationId").exists());
    }

    @Test
    void providerRejectionIsBadGatewayWithUpstream() throws Exception {
        UUID sceneId = UUID.randomUUID();
        when(submissions.submitScene(any(), any(), any()))
                .thenThrow(new SceneGenException(ErrorCode.QUOTA_EXCEEDED, "Video provider quota exceeded. Try again later.",
                        Map.of("sceneId", sceneId), new UpstreamInfo("https://luma.test/v1/generations", 429, "{}"), null));

        mockMvc.perform(post("/v1/scenes")
                        .header("Authorization", AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.data").doesNotExist())
                .andExpect(jsonPath("$.error.code").value("QUOTA_EXCEEDED"))
                .andExpect(jsonPath("$.error.detail.sceneId").value(sceneId.toString()))
                .andExpect(jsonPath("$.error.upstream.endpoint").value("https://luma.test/v1/generations"))
                .andExpect(jsonPath("$.error.upstream.status").value(429))
                .andExpect(jsonPath("$.error.correlationId").exists());
    }

    @Test
    void regenerateAcceptsEmptyBody() throws Exception {
        UUID sceneId = UUID.randomUUID();
        when(submissions.regenerate(eq(AUTH), any(), eq(sceneId), eq(null)))
                .thenReturn(new SceneSubmission(sceneId, UUID.randomUUID(), 1, 2, "processing", "k", "job-2", false));

        mockMvc.perform(post("/v1/scenes/{id}/regenerate", sceneId).header("Authorization", AUTH))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.version").value(2));
    }

    @Test
    void statusOfForeignSceneIsForbidden() throws Exception {
        UUID sceneId = UUID.randomUUID();
        when(statuses.pollOnce(AUTH, sceneId)).thenThrow(SceneGenException.forbidden("Scene belongs to another user"));

        mockMvc.perform(get("/v1/scenes/{id}/status", sceneId).header("Authorization", AUTH))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("FORBIDDEN_ERROR"));
    }

    @Test
    void statusReturnsView() throws Exception {
        UUID sceneId = UUID.randomUUID();
        when(statuses.pollOnce(AUTH, sceneId)).thenReturn(new SceneStatusView(sceneId, UUID.randomUUID(), 1,
                "ready", "completed", "completed", 100, "http://files.test/v1/files/signed/x.mp4", true, null, null));

        mockMvc.perform(get("/v1/scenes/{id}/status", sceneId).header("Authorization", AUTH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("ready"))
                .andExpect(jsonPath("$.data.errorCode").doesNotExist());
    }

    @Test
    void malformedSceneIdIsValidationError() throws Exception {
        mockMvc.perform(get("/v1/scenes/{id}/status", "not-a-uuid").header("Authorization", AUTH))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void deleteSoftDeletes() throws Exception {
        UUID sceneId = UUID.randomUUID();

        mockMvc.perform(delete("/v1/scenes/{id}", sceneId).header("Authorization", AUTH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.deleted").value(true));

        verify(deletions).softDelete(AUTH, sceneId);
    }
}
