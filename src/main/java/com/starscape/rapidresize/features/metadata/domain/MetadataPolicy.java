package com.starscape.rapidresize.features.metadata.domain;

public enum MetadataPolicy {
    /** Carry the source EXIF over to the output. */
    KEEP,
    /** Write no metadata at all. */
    REMOVE,
    /** Carry the source EXIF over with field-level edits applied. */
    EDIT
}
