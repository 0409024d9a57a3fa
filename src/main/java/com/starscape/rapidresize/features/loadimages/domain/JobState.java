package com.starscape.rapidresize.features.loadimages.domain;

public enum JobState {
    UNPROCESSED,
    LOADED,
    PROCESSING,
    SUCCEEDED,
    FAILED
}
