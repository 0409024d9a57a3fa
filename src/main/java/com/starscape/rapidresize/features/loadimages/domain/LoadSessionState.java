package com.starscape.rapidresize.features.loadimages.domain;

public enum LoadSessionState {
    SCANNING,
    LOADING,
    COMPLETED,
    CANCELLED
}
