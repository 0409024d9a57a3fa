package com.starscape.rapidresize.features.loadimages.domain;

import com.starscape.rapidresize.common.domain.FailureKind;

import java.nio.file.Path;

public record LoadFailure(Path path, FailureKind kind, String reason) {
}
