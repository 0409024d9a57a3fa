package com.starscape.rapidresize.features.metadata.domain;

public enum MetadataOutcome {
    APPLIED,
    FALLBACK,
    SKIPPED
}
