package com.starscape.rapidresize.features.metadata.domain;

import org.apache.commons.imaging.formats.tiff.TiffImageMetadata;

/**
 * What was found in the header of a source file at decode time.
 *
 * @param hasGps whether a GPS directory with at least one tag is present
 * @param orientation EXIF orientation, 1 when absent
 * @param exif parsed EXIF block used to rebuild output metadata, or null
 */
public record SourceMetadata(
    boolean hasGps,
    int orientation,
    TiffImageMetadata exif
) {

    public static SourceMetadata empty() {
        return new SourceMetadata(false, 1, null);
    }

    public boolean hasExif() {
        return exif != null;
    }
}
