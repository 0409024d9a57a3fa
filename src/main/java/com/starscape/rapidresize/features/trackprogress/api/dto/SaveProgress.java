package com.starscape.rapidresize.features.trackprogress.api.dto;

import java.nio.file.Path;
import java.time.Instant;

public record SaveProgress(
    String operationId,
    int done,
    int total,
    Path currentPath,
    Instant occurredOn
) implements ProgressMessage {

    public static SaveProgress of(String operationId, int done, int total, Path currentPath) {
        return new SaveProgress(operationId, done, total, currentPath, Instant.now());
    }

    public int percent() {
        return total > 0 ? (int) ((done * 100L) / total) : 100;
    }

    @Override
    public String getMessageType() {
        return "SaveProgress";
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
