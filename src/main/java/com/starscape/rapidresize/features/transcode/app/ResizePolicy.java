package com.starscape.rapidresize.features.transcode.app;

import com.starscape.rapidresize.features.transcode.domain.TargetDimensions;

/**
 * Fits an image into a square bound on its longer side. Never upscales.
 */
public final class ResizePolicy {

    private ResizePolicy() {
    }

    /**
     * @param maxDimension bound for the longer side; 0 or less disables resizing
     */
    public static TargetDimensions fit(int width, int height, int maxDimension) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Source dimensions must be positive: " + width + "x" + height);
        }
        int longer = Math.max(width, height);
        if (maxDimension <= 0 || longer <= maxDimension) {
            return new TargetDimensions(width, height, false);
        }
        double scale = (double) maxDimension / longer;
        int targetWidth = clamp((int) Math.round(width * scale), maxDimension);
        int targetHeight = clamp((int) Math.round(height * scale), maxDimension);
        return new TargetDimensions(targetWidth, targetHeight, true);
    }

    private static int clamp(int value, int maxDimension) {
        return Math.max(1, Math.min(value, maxDimension));
    }
}
