package com.starscape.rapidresize.features.trackprogress.api.dto;

import java.nio.file.Path;
import java.time.Instant;

public record LoadProgress(
    String operationId,
    int done,
    int total,
    Path currentPath,
    Instant occurredOn
) implements ProgressMessage {

    public static LoadProgress of(String operationId, int done, int total, Path currentPath) {
        return new LoadProgress(operationId, done, total, currentPath, Instant.now());
    }

    public int percent() {
        return total > 0 ? (int) ((done * 100L) / total) : 100;
    }

    @Override
    public String getMessageType() {
        return "LoadProgress";
    }

    @Override
    public String getOperationId() {
        return operationId;
    }

    @Override
    public Instant getOccurredOn() {
        return occurredOn;
    }
}
