package com.example.scenegen_backend.controller;

import com.example.scenegen_backend.config.WebhookProperties;
import com.example.scenegen_backend.dto.WebhookOutcome;
import com.example.scenegen_backend.exception.SceneGenException;
import com.example.scenegen_backend.service.RenderWebhookService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = WebhookController.class)
@AutoConfigureMockMvc(addFilters = false)
class WebhookControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RenderWebhookService webhooks;
    @MockitoBean
    private WebhookProperties props;

    @BeforeEach
    void setup() {
        when(props.getSignatureHeader()).thenReturn("X-Hub-Signature-256");
    }

    @Test
    void passesRawBodyAndSignature() throws Exception {
        UUID sceneId = UUID.randomUUID();
        String body = "{\"sceneId\":\"" + sceneId + "\",\"version\":1,\"status\":\"ready\",\"videoKey\":\"v.mp4\"}";
        when(webhooks.handle(aryEq(body.getBytes(StandardCharsets.UTF_8)), eq("sha256=abc")))
                .thenReturn(new WebhookOutcome(true, true, sceneId, 1, "ready"));

        mockMvc.perform(post("/v1/webhooks/render")
                        .header("X-Hub-Signature-256", "sha256=abc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.data.applied").value(true))
                .andExpect(jsonPath("$.data.sceneId").value(sceneId.toString()));
    }

    @Test
    void badSignatureIsUnauthorized() throws Exception {
        when(webhooks.handle(any(), any())).thenThrow(SceneGenException.unauthorized("Invalid webhook signature"));

        mockMvc.perform(post("/v1/webhooks/render")
                        .header("X-Hub-Signature-256", "sha256=00")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error.code").value("AUTH_ERROR"));
    }
}
