package com.example.scenegen_backend.controller;

import com.example.scenegen_backend.config.WebhookProperties;
import com.example.scenegen_backend.dto.WebhookOutcome;
import com.example.scenegen_backend.dto.web.ApiResponse;
import com.example.scenegen_backend.service.RenderWebhookService;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/webhooks")
public class WebhookController {

    private final RenderWebhookService webhooks;
    private final WebhookProperties props;

    public WebhookController(RenderWebhookService webhooks, WebhookProperties props) {
        this.webhooks = webhooks;
        this.props = props;
    }

    @Operation(summary = "Render completion callback", description = "HMAC-SHA256 signed with the shared webhook secret.")
    @PostMapping("/render")
    public ApiResponse<WebhookOutcome> render(@RequestBody(required = false) byte[] body, HttpServletRequest req) {
        String signature = req.getHeader(props.getSignatureHeader());
        return ApiResponse.ok(webhooks.handle(body == null ? new byte[0] : body, signature));
    }
}
