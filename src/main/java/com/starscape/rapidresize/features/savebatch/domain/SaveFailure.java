package com.starscape.rapidresize.features.savebatch.domain;

import com.starscape.rapidresize.common.domain.FailureKind;

import java.nio.file.Path;

public record SaveFailure(Path path, FailureKind kind, String message, boolean retryable) {
}
