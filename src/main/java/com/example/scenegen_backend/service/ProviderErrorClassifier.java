package com.example.scenegen_backend.service;

import com.example.scenegen_backend.engine.Interfaces.VideoGenerationEngine.ProviderError;
import com.example.scenegen_backend.exception.UpstreamInfo;
import com.example.scenegen_backend.util.ErrorCode;
import com.example.scenegen_backend.util.LogRedactor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.WriteTimeoutException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.netty.http.client.PrematureCloseException;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.TimeoutException;

@Component
public class ProviderErrorClassifier {
    static final int SNIPPET_MAX = 500;

    private final ObjectMapper om = new ObjectMapper();

    public ErrorCode classifyStatus(int status) {
        if (status == 403) return ErrorCode.AUTH_ERROR;
        if (status == 429) return ErrorCode.QUOTA_EXCEEDED;
        if (status == 400) return ErrorCode.VALIDATION_ERROR;
        if (status >= 500) return ErrorCode.SERVER_ERROR;
        return ErrorCode.API_ERROR;
    }

    public ErrorCode classify(Throwable failure) {
        Throwable t = Exceptions.unwrap(failure);
        if (t instanceof WebClientResponseException wcre) {
            return classifyStatus(wcre.getStatusCode().value());
        }
        if (isNetworkFailure(t)) return ErrorCode.NETWORK_ERROR;
        return ErrorCode.API_ERROR;
    }

    public boolean isRetryable(ErrorCode code) {
        return code == ErrorCode.SERVER_ERROR || code == ErrorCode.NETWORK_ERROR;
    }

    public boolean isRetryable(Throwable failure) {
        return isRetryable(classify(failure));
    }

    public ProviderError toProviderError(Throwable failure, String endpoint) {
        Throwable t = Exceptions.unwrap(failure);
        ErrorCode code = classify(t);
        if (t instanceof WebClientResponseException wcre) {
            String body = wcre.getResponseBodyAsString();
            String detail = upstreamDetail(body);
            int status = wcre.getStatusCode().value();
            UpstreamInfo upstream = new UpstreamInfo(endpoint, status, LogRedactor.redact(LogRedactor.truncate(body, SNIPPET_MAX)));
            return new ProviderError(code, userMessage(code, detail), upstream, detail);
        }
        // 408 mirrors a timed-out request, 0 means no response at all
        int status = hasCause(t, TimeoutException.class) || hasCause(t, ReadTimeoutException.class) ? 408 : 0;
        String snippet = LogRedactor.redact(LogRedactor.truncate(String.valueOf(t.getMessage()), SNIPPET_MAX));
        return new ProviderError(code, userMessage(code, null), new UpstreamInfo(endpoint, status, snippet), null);
    }

    public String userMessage(ErrorCode code, String upstreamDetail) {
        return switch (code) {
            case AUTH_ERROR -> "Video provider rejected our credentials; check the provider configuration";
            case QUOTA_EXCEEDED -> "Video provider quota exceeded. Try again later.";
            case VALIDATION_ERROR -> upstreamDetail == null || upstreamDetail.isBlank()
                    ? "Video provider rejected the request"
                    : "Video provider rejected the request: " + upstreamDetail;
            case SERVER_ERROR -> "Video provider is unavailable, retries exhausted";
            case NETWORK_ERROR -> "Could not reach the video provider";
            default -> code.getDefaultMessage();
        };
    }

    String upstreamDetail(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            JsonNode root = om.readTree(body);
            if (root == null) return null;
            for (String field : new String[]{"detail", "message", "error"}) {
                JsonNode node = root.get(field);
                if (node == null || node.isNull()) continue;
                if (node.isTextual()) return node.asText();
                if (node.has("message")) return node.get("message").asText();
                return node.toString();
            }
        } catch (IOException e) {
            return null;
        }
        return null;
    }

    private boolean isNetworkFailure(Throwable t) {
        return t instanceof WebClientRequestException
                || hasCause(t, PrematureCloseException.class)
                || hasCause(t, TimeoutException.class)
                || hasCause(t, ReadTimeoutException.class)
                || hasCause(t, WriteTimeoutException.class)
                || hasCause(t, ConnectException.class)
                || (t instanceof IOException);
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        Throwable cursor = t;
        while (cursor != null) {
            if (type.isInstance(cursor)) return true;
            if (cursor.getCause() == cursor) break;
            cursor = cursor.getCause();
        }
        return false;
    }
}
