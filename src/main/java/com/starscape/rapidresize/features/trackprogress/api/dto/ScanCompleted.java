package com.starscape.rapidresize.features.trackprogress.api.dto;

import com.starscape.rapidresize.features.discovery.domain.DiscoveryWarning;

import java.time.Instant;
import java.util.List;

/**
 * Sent once when the candidate set is fixed and loading begins.
 * {@code overflow} is set when the candidate set was truncated to the configured maximum.
 */
public record ScanCompleted(
    String operationId,
    int total,
    boolean overflow,
    List<DiscoveryWarning> warnings,
    Instant occurredOn
) implements ProgressMessage {

    public ScanCompleted {
        warnings = List.copyOf(warnings);
    }

    public static ScanCompleted of(String operationId, int total, boolean overflow, List<DiscoveryWarning> warnings) {
        return new ScanCompleted(operationId, total, overflow, warnings, Instant.now());
    }

    @Override
    public String getMessageType() {
        return "ScanCompleted";
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
