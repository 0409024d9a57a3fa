package com.starscape.rapidresize.features.trackprogress.api.dto;

import com.starscape.rapidresize.features.loadimages.domain.ImageJob;

import java.time.Instant;

/**
 * Hands a freshly decoded job over to the consumer, which appends it to its working set.
 */
public record ItemLoaded(
    String operationId,
    ImageJob job,
    Instant occurredOn
) implements ProgressMessage {

    public static ItemLoaded of(String operationId, ImageJob job) {
        return new ItemLoaded(operationId, job, Instant.now());
    }

    @Override
    public String getMessageType() {
        return "ItemLoaded";
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
