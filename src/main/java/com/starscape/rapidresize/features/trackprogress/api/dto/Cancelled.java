package com.starscape.rapidresize.features.trackprogress.api.dto;

import java.time.Instant;

/**
 * Terminal message of a session or run stopped by a cancellation request.
 * The partial summary only counts items that finished before the request was observed.
 */
public record Cancelled(
    String operationId,
    OperationSummary partial,
    Instant occurredOn
) implements ProgressMessage {

    public static Cancelled of(String operationId, OperationSummary partial) {
        return new Cancelled(operationId, partial, Instant.now());
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public String getMessageType() {
        return "Cancelled";
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
