package com.starscape.rapidresize.common.domain;

/**
 * Classification of a per-item failure, shared by the load and save phases.
 */
public enum FailureKind {
    CORRUPT("Image data is corrupt or truncated"),
    UNSUPPORTED_FORMAT("Image format is not supported"),
    READ_PERMISSION("Source file cannot be read"),
    NOT_FOUND("Source file no longer exists"),
    ENCODE_ERROR("Encoder rejected the image or its parameters"),
    PERMISSION_DENIED("Permission denied at the destination"),
    PATH_TOO_LONG("Destination path is too long"),
    INVALID_NAME("Destination file name is invalid"),
    LOCKED("Destination is locked by another process"),
    NO_SPACE("Not enough free space at the destination"),
    IO_ERROR("I/O error"),
    INTERRUPTED("Worker was stopped before the item finished"),
    UNEXPECTED("Unexpected error");

    private final String description;

    FailureKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Only a lock held by another process is expected to clear up by itself.
     */
    public boolean isRetryable() {
        return this == LOCKED;
    }
}
