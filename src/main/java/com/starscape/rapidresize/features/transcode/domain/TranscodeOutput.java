package com.starscape.rapidresize.features.transcode.domain;

/**
 * Encoded image. {@code bytes} is null for an estimate.
 */
public record TranscodeOutput(
    OutputFormat format,
    int width,
    int height,
    byte[] bytes,
    long size
) {

    public static TranscodeOutput encoded(OutputFormat format, int width, int height, byte[] bytes) {
        return new TranscodeOutput(format, width, height, bytes, bytes.length);
    }

    public static TranscodeOutput estimate(OutputFormat format, int width, int height, long size) {
        return new TranscodeOutput(format, width, height, null, size);
    }

    public boolean isEstimate() {
        return bytes == null;
    }
}
