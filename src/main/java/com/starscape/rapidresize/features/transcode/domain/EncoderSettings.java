package com.starscape.rapidresize.features.transcode.domain;

/**
 * Concrete encoder configuration derived from quality and balance.
 *
 * @param quality 1..100 quality for lossy formats
 * @param pngCompressionLevel deflate level 0..9
 * @param progressive whether JPEG is written progressive
 * @param optimize whether JPEG Huffman tables are optimized
 */
public record EncoderSettings(
    int quality,
    int pngCompressionLevel,
    boolean progressive,
    boolean optimize
) {

    public EncoderSettings {
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("Quality must be between 1 and 100");
        }
        if (pngCompressionLevel < 0 || pngCompressionLevel > 9) {
            throw new IllegalArgumentException("PNG compression level must be between 0 and 9");
        }
    }
}
