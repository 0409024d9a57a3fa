package com.starscape.rapidresize.features.metadata.domain;

import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;

import java.util.List;

/**
 * Result of planning the metadata of one output file. Never an error: a plan that cannot be
 * honoured reports {@link MetadataOutcome#FALLBACK} and the image is saved without metadata.
 *
 * @param outputSet EXIF to embed, null unless the outcome is APPLIED
 * @param payloadBytes serialized EXIF size, 0 without payload
 * @param gpsRemoved whether GPS data present in the source is left out
 * @param editedFields names of the tags the edit overlay touched
 * @param fallbackReason why the metadata could not be carried, or null
 */
public record MetadataPlan(
    MetadataPolicy policy,
    MetadataOutcome outcome,
    TiffOutputSet outputSet,
    int payloadBytes,
    boolean gpsRemoved,
    List<String> editedFields,
    String fallbackReason
) {

    public MetadataPlan {
        editedFields = editedFields == null ? List.of() : List.copyOf(editedFields);
    }

    public static MetadataPlan skipped(MetadataPolicy policy, boolean gpsRemoved) {
        return new MetadataPlan(policy, MetadataOutcome.SKIPPED, null, 0, gpsRemoved, List.of(), null);
    }

    public static MetadataPlan applied(MetadataPolicy policy, TiffOutputSet outputSet, int payloadBytes,
                                       boolean gpsRemoved, List<String> editedFields) {
        return new MetadataPlan(policy, MetadataOutcome.APPLIED, outputSet, payloadBytes, gpsRemoved, editedFields, null);
    }

    public static MetadataPlan fallback(MetadataPolicy policy, boolean gpsRemoved, List<String> editedFields,
                                        String reason) {
        return new MetadataPlan(policy, MetadataOutcome.FALLBACK, null, 0, gpsRemoved, editedFields, reason);
    }

    public boolean hasPayload() {
        return outputSet != null;
    }

    public boolean isFallbackRequired() {
        return outcome == MetadataOutcome.FALLBACK;
    }
}
