package com.starscape.rapidresize.features.transcode.app;

import com.starscape.rapidresize.features.transcode.domain.EncoderSettings;
import com.starscape.rapidresize.features.transcode.domain.OutputFormat;

/**
 * Deterministic mapping from the user-facing quality and balance knobs to encoder settings.
 *
 * Balance runs from 1 (smallest files) to 10 (best quality). With {@code b = (balance - 1) / 9}
 * and {@code q} the normalized quality:
 * <ul>
 *   <li>JPEG quality {@code q * (0.7 + 0.5 b)}, capped at 95</li>
 *   <li>WebP quality {@code q * (0.6 + 0.5 b)}</li>
 *   <li>PNG deflate level {@code round((100 - q) / 100 * 9)}</li>
 * </ul>
 * Results are clamped to the encoder's range.
 */
public final class QualityMapper {

    public static final int MIN_QUALITY = 5;
    public static final int MAX_QUALITY = 100;
    public static final int QUALITY_STEP = 5;
    public static final int JPEG_QUALITY_CAP = 95;

    private QualityMapper() {
    }

    /**
     * Round to the nearest step of 5 within 5..100.
     */
    public static int normalizeQuality(int quality) {
        int stepped = Math.round(quality / (float) QUALITY_STEP) * QUALITY_STEP;
        return Math.max(MIN_QUALITY, Math.min(MAX_QUALITY, stepped));
    }

    public static EncoderSettings settingsFor(OutputFormat format, int quality, int balance) {
        int q = normalizeQuality(quality);
        double b = (Math.max(1, Math.min(10, balance)) - 1) / 9.0;
        int pngLevel = (int) Math.round((100 - q) / 100.0 * 9);

        int effective = switch (format) {
            case JPEG -> Math.min(JPEG_QUALITY_CAP, clampQuality(q * (0.7 + 0.5 * b)));
            case WEBP -> clampQuality(q * (0.6 + 0.5 * b));
            default -> q;
        };
        return new EncoderSettings(effective, pngLevel, true, true);
    }

    private static int clampQuality(double value) {
        return (int) Math.max(1, Math.min(100, Math.round(value)));
    }
}
