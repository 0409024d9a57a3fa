package com.starscape.rapidresize.common.exception;

import com.starscape.rapidresize.common.domain.FailureKind;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when persisting an output file fails. The destination is left in its previous state.
 */
public class AtomicWriteException extends IOException {

    private final Path destination;
    private final FailureKind kind;

    public AtomicWriteException(Path destination, FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.destination = destination;
        this.kind = kind;
    }

    public Path getDestination() {
        return destination;
    }

    public FailureKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
