package com.starscape.rapidresize.features.trackprogress.api.dto;

import java.time.Instant;

/**
 * Sent periodically while discovery is still materializing candidates.
 */
public record ScanProgress(
    String operationId,
    int discovered,
    Instant occurredOn
) implements ProgressMessage {

    public static ScanProgress of(String operationId, int discovered) {
        return new ScanProgress(operationId, discovered, Instant.now());
    }

    @Override
    public String getMessageType() {
        return "ScanProgress";
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
