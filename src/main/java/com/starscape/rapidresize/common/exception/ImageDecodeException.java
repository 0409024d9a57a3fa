package com.starscape.rapidresize.common.exception;

import com.starscape.rapidresize.common.domain.FailureKind;

import java.io.IOException;
import java.nio.file.Path;

public class ImageDecodeException extends IOException {

    private final Path path;
    private final FailureKind kind;

    public ImageDecodeException(Path path, FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
        this.kind = kind;
    }

    public Path getPath() {
        return path;
    }

    public FailureKind getKind() {
        return kind;
    }
}
