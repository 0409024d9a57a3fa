package com.starscape.rapidresize.features.transcode.domain;

public record TargetDimensions(int width, int height, boolean scaled) {

    public TargetDimensions {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Dimensions must be positive: " + width + "x" + height);
        }
    }

    public int longerSide() {
        return Math.max(width, height);
    }
}
