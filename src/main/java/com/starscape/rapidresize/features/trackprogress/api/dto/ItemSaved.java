package com.starscape.rapidresize.features.trackprogress.api.dto;

import com.starscape.rapidresize.features.savebatch.domain.SaveResult;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One job was written, or estimated in a dry run.
 */
public record ItemSaved(
    String operationId,
    Path sourcePath,
    SaveResult result,
    Instant occurredOn
) implements ProgressMessage {

    public static ItemSaved of(String operationId, Path sourcePath, SaveResult result) {
        return new ItemSaved(operationId, sourcePath, result, Instant.now());
    }

    @Override
    public String getMessageType() {
        return "ItemSaved";
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
