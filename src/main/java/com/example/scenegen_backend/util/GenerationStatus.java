package com.example.scenegen_backend.util;

import java.util.EnumSet;
import java.util.Set;

public enum GenerationStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }

    public boolean canTransitionTo(GenerationStatus target) {
        return allowedTargets().contains(target);
    }

    public Set<GenerationStatus> allowedTargets() {
        return switch (this) {
            case QUEUED -> EnumSet.of(PROCESSING, COMPLETED, ERROR);
            case PROCESSING -> EnumSet.of(COMPLETED, ERROR);
            case COMPLETED, ERROR -> EnumSet.noneOf(GenerationStatus.class);
        };
    }

    public static Set<GenerationStatus> nonTerminal() {
        return EnumSet.of(QUEUED, PROCESSING);
    }
}
