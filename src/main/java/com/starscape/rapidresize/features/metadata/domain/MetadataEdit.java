package com.starscape.rapidresize.features.metadata.domain;

import com.starscape.rapidresize.common.exception.InvalidRequestException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Field overlay applied under {@link MetadataPolicy#EDIT}.
 * For every field: null leaves the source tag alone, blank removes it, anything else replaces it.
 */
public record MetadataEdit(
    String artist,
    String copyright,
    String description,
    String dateTimeOriginal
) {

    private static final Pattern EXIF_DATE_TIME = Pattern.compile("\\d{4}:\\d{2}:\\d{2} \\d{2}:\\d{2}:\\d{2}");

    public MetadataEdit {
        if (dateTimeOriginal != null && !dateTimeOriginal.isBlank()
                && !EXIF_DATE_TIME.matcher(dateTimeOriginal.trim()).matches()) {
            throw new InvalidRequestException(
                "DateTimeOriginal must use the form yyyy:MM:dd HH:mm:ss, got: " + dateTimeOriginal);
        }
    }

    public static MetadataEdit none() {
        return new MetadataEdit(null, null, null, null);
    }

    public boolean isEmpty() {
        return artist == null && copyright == null && description == null && dateTimeOriginal == null;
    }

    public List<String> touchedFieldNames() {
        List<String> names = new ArrayList<>();
        if (artist != null) names.add("Artist");
        if (copyright != null) names.add("Copyright");
        if (description != null) names.add("ImageDescription");
        if (dateTimeOriginal != null) names.add("DateTimeOriginal");
        return names;
    }
}
