package com.starscape.rapidresize.features.trackprogress.api.dto;

import java.time.Instant;

/**
 * A message travelling from a background worker to the consumer loop.
 * Messages of one operation are delivered in publication order; exactly one terminal
 * message closes each operation and is always the last one.
 */
public interface ProgressMessage {
    String getMessageType();
    String getOperationId();
    Instant getOccurredOn();

    default boolean isTerminal() {
        return false;
    }
}
