package com.starscape.rapidresize.features.trackprogress.api.dto;

import com.starscape.rapidresize.common.domain.FailureKind;

import java.nio.file.Path;
import java.time.Instant;

public record SaveItemFailed(
    String operationId,
    Path sourcePath,
    FailureKind kind,
    String reason,
    boolean retryable,
    Instant occurredOn
) implements ProgressMessage {

    public static SaveItemFailed of(String operationId, Path sourcePath, FailureKind kind, String reason, boolean retryable) {
        return new SaveItemFailed(operationId, sourcePath, kind, reason, retryable, Instant.now());
    }

    @Override
    public String getMessageType() {
        return "SaveItemFailed";
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
