package com.starscape.rapidresize.features.trackprogress.api.dto;

import com.starscape.rapidresize.common.domain.FailureKind;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A candidate could not be decoded. The session continues with the next candidate.
 */
public record LoadItemFailed(
    String operationId,
    Path path,
    FailureKind kind,
    String reason,
    Instant occurredOn
) implements ProgressMessage {

    public static LoadItemFailed of(String operationId, Path path, FailureKind kind, String reason) {
        return new LoadItemFailed(operationId, path, kind, reason, Instant.now());
    }

    @Override
    public String getMessageType() {
        return "LoadItemFailed";
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
