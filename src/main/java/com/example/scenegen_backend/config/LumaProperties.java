package com.example.scenegen_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "luma")
public class LumaProperties {

    private String baseUrl = "https://api.lumalabs.ai/dream-machine/v1";
    private String apiKey;
    private String model = "ray-flash-2";
    private String aspectRatio = "16:9";
    private String resolution = "1080p";
    private boolean loop = false;
    private long timeoutSeconds = 30;
    private int connectTimeoutMillis = 10_000;
    private int maxAttempts = 3;
    private Duration retryBaseBackoff = Duration.ofMillis(250);
    private boolean requiresPublicUrls = false;
    private Map<String, List<String>> models = defaultModels();

    public LumaProperties() {
    }

    private static Map<String, List<String>> defaultModels() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        List<String> ray2 = List.of("prompt", "model", "aspect_ratio", "resolution", "duration", "loop", "keyframes", "callback_url");
        m.put("ray-flash-2", ray2);
        m.put("ray-2", ray2);
        m.put("ray-1-6", List.of("prompt", "model", "aspect_ratio", "loop", "keyframes", "callback_url"));
        return m;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getAspectRatio() {
        return aspectRatio;
    }

    public void setAspectRatio(String aspectRatio) {
        this.aspectRatio = aspectRatio;
    }

    public String getResolution() {
        return resolution;
    }

    public void setResolution(String resolution) {
        this.resolution = resolution;
    }

    public boolean isLoop() {
        return loop;
    }

    public void setLoop(boolean loop) {
        this.loop = loop;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public void setConnectTimeoutMillis(int connectTimeoutMillis) {
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getRetryBaseBackoff() {
        return retryBaseBackoff;
    }

    public void setRetryBaseBackoff(Duration retryBaseBackoff) {
        this.retryBaseBackoff = retryBaseBackoff;
    }

    public boolean isRequiresPublicUrls() {
        return requiresPublicUrls;
    }

    public void setRequiresPublicUrls(boolean requiresPublicUrls) {
        this.requiresPublicUrls = requiresPublicUrls;
    }

    public Map<String, List<String>> getModels() {
        return models;
    }

    public void setModels(Map<String, List<String>> models) {
        this.models = models;
    }
}
