package com.example.scenegen_backend.exception;

public record UpstreamInfo(String endpoint, int status, String bodySnippet) {
}
