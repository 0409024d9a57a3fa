package com.starscape.rapidresize.features.trackprogress.api.dto;

import com.starscape.rapidresize.features.savebatch.domain.BatchSaveStats;

import java.time.Instant;

/**
 * Terminal message of a save run that ran to the end.
 */
public record SaveCompleted(
    String operationId,
    BatchSaveStats stats,
    Instant occurredOn
) implements ProgressMessage {

    public static SaveCompleted of(String operationId, BatchSaveStats stats) {
        return new SaveCompleted(operationId, stats, Instant.now());
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public String getMessageType() {
        return "SaveCompleted";
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
