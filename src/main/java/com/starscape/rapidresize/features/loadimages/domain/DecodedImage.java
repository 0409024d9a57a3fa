package com.starscape.rapidresize.features.loadimages.domain;

import com.starscape.rapidresize.features.metadata.domain.SourceMetadata;

import java.awt.image.BufferedImage;

/**
 * Pixels of a source file after orientation correction, with what was read from its header.
 */
public record DecodedImage(
    BufferedImage image,
    String sourceFormat,
    long sourceBytes,
    SourceMetadata metadata
) {

    public DecodedImage {
        if (image == null) {
            throw new IllegalArgumentException("Image cannot be null");
        }
        if (metadata == null) {
            metadata = SourceMetadata.empty();
        }
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }

    public boolean hasAlpha() {
        return image.getColorModel().hasAlpha();
    }
}
