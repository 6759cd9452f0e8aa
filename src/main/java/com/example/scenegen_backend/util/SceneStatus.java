package com.example.scenegen_backend.util;

public enum SceneStatus {
    QUEUED,
    PROCESSING,
    READY,
    ERROR;

    public boolean isTerminal() {
        return this == READY || this == ERROR;
    }

    public static SceneStatus of(GenerationStatus status) {
        return switch (status) {
            case QUEUED -> QUEUED;
            case PROCESSING -> PROCESSING;
            case COMPLETED -> READY;
            case ERROR -> ERROR;
        };
    }
}
