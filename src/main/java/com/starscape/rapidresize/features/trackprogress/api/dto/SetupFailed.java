package com.starscape.rapidresize.features.trackprogress.api.dto;

import java.time.Instant;

/**
 * Terminal message sent before any item was processed, e.g. when discovery found no candidates.
 */
public record SetupFailed(
    String operationId,
    String reason,
    Instant occurredOn
) implements ProgressMessage {

    public static SetupFailed of(String operationId, String reason) {
        return new SetupFailed(operationId, reason, Instant.now());
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public String getMessageType() {
        return "SetupFailed";
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
