package com.starscape.rapidresize.features.metadata.app;

import com.starscape.rapidresize.features.metadata.domain.MetadataEdit;
import com.starscape.rapidresize.features.metadata.domain.MetadataPlan;
import com.starscape.rapidresize.features.metadata.domain.MetadataPolicy;
import com.starscape.rapidresize.features.metadata.domain.MetadataSettings;
import com.starscape.rapidresize.features.metadata.domain.SourceMetadata;
import com.starscape.rapidresize.features.metadata.infra.ExifEmbedder;
import com.starscape.rapidresize.features.transcode.domain.OutputFormat;
import org.apache.commons.imaging.formats.tiff.constants.ExifTagConstants;
import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.apache.commons.imaging.formats.tiff.taginfos.TagInfoAscii;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputDirectory;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Decides which EXIF block, if any, goes into an output file.
 *
 * Planning never throws. When the target format cannot carry the computed block, or the block
 * cannot be serialized, the plan asks for a fallback and the caller saves without metadata.
 */
@Service
public class MetadataProcessor {

    private static final Logger log = LoggerFactory.getLogger(MetadataProcessor.class);

    /** Largest EXIF block that fits in one JPEG APP1 segment. Applied to PNG output too. */
    static final int MAX_EXIF_BYTES = 65_533;

    private final ExifEmbedder exifEmbedder;

    public MetadataProcessor(ExifEmbedder exifEmbedder) {
        this.exifEmbedder = exifEmbedder;
    }

    /**
     * Plan without a target format, for showing what a run would do.
     */
    public MetadataPlan preview(SourceMetadata source, MetadataSettings settings) {
        return plan(source, settings, null);
    }

    /**
     * @param targetFormat concrete output format, or null to ignore format limitations
     */
    public MetadataPlan plan(SourceMetadata source, MetadataSettings settings, OutputFormat targetFormat) {
        if (source == null) {
            source = SourceMetadata.empty();
        }
        MetadataPolicy policy = settings.policy();
        MetadataEdit edit = policy == MetadataPolicy.EDIT ? settings.edit() : MetadataEdit.none();
        List<String> editedFields = edit.touchedFieldNames();
        boolean gpsRemoved = source.hasGps() && (policy == MetadataPolicy.REMOVE || settings.stripLocation());

        if (policy == MetadataPolicy.REMOVE) {
            return MetadataPlan.skipped(policy, gpsRemoved);
        }
        if (!source.hasExif() && (policy == MetadataPolicy.KEEP || !hasValues(edit))) {
            return MetadataPlan.skipped(policy, gpsRemoved);
        }

        TiffOutputSet outputSet;
        int payloadBytes;
        try {
            outputSet = source.hasExif() ? source.exif().getOutputSet() : new TiffOutputSet();
            resetOrientation(outputSet);
            applyEdit(outputSet, edit);
            if (settings.stripLocation()) {
                outputSet = withoutGps(outputSet);
            }
            if (countFields(outputSet) == 0) {
                return MetadataPlan.skipped(policy, gpsRemoved);
            }
            payloadBytes = exifEmbedder.serializedSize(outputSet);
        } catch (IOException | RuntimeException e) {
            log.warn("EXIF block cannot be serialized, output will carry no metadata: {}", e.getMessage());
            return MetadataPlan.fallback(policy, gpsRemoved, editedFields,
                "EXIF serialization failed: " + e.getMessage());
        }

        if (payloadBytes > MAX_EXIF_BYTES) {
            return MetadataPlan.fallback(policy, gpsRemoved, editedFields,
                "EXIF block of " + payloadBytes + " bytes exceeds " + MAX_EXIF_BYTES);
        }
        if (targetFormat != null && !targetFormat.carriesExif()) {
            return MetadataPlan.fallback(policy, gpsRemoved, editedFields,
                targetFormat + " output cannot carry EXIF");
        }
        return MetadataPlan.applied(policy, outputSet, payloadBytes, gpsRemoved, editedFields);
    }

    private static boolean hasValues(MetadataEdit edit) {
        return isSet(edit.artist()) || isSet(edit.copyright())
            || isSet(edit.description()) || isSet(edit.dateTimeOriginal());
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    // Pixels are already rotated at decode time
    private static void resetOrientation(TiffOutputSet outputSet) throws IOException {
        TiffOutputDirectory root = outputSet.getRootDirectory();
        if (root != null && root.findField(TiffTagConstants.TIFF_TAG_ORIENTATION) != null) {
            root.removeField(TiffTagConstants.TIFF_TAG_ORIENTATION);
            root.add(TiffTagConstants.TIFF_TAG_ORIENTATION, (short) 1);
        }
    }

    private static void applyEdit(TiffOutputSet outputSet, MetadataEdit edit) throws IOException {
        if (edit.isEmpty()) {
            return;
        }
        if (edit.artist() != null || edit.copyright() != null || edit.description() != null) {
            TiffOutputDirectory root = outputSet.getOrCreateRootDirectory();
            applyAscii(root, TiffTagConstants.TIFF_TAG_ARTIST, edit.artist());
            applyAscii(root, TiffTagConstants.TIFF_TAG_COPYRIGHT, edit.copyright());
            applyAscii(root, TiffTagConstants.TIFF_TAG_IMAGE_DESCRIPTION, edit.description());
        }
        if (isSet(edit.dateTimeOriginal())) {
            applyAscii(outputSet.getOrCreateExifDirectory(),
                ExifTagConstants.EXIF_TAG_DATE_TIME_ORIGINAL, edit.dateTimeOriginal());
        } else if (edit.dateTimeOriginal() != null && outputSet.getExifDirectory() != null) {
            outputSet.getExifDirectory().removeField(ExifTagConstants.EXIF_TAG_DATE_TIME_ORIGINAL);
        }
    }

    private static void applyAscii(TiffOutputDirectory directory, TagInfoAscii tag, String value) throws IOException {
        if (value == null) {
            return;
        }
        directory.removeField(tag);
        if (!value.isBlank()) {
            directory.add(tag, value.trim());
        }
    }

    private static TiffOutputSet withoutGps(TiffOutputSet outputSet) throws IOException {
        TiffOutputDirectory gps = outputSet.getGpsDirectory();
        if (gps == null) {
            return outputSet;
        }
        TiffOutputSet stripped = new TiffOutputSet(outputSet.byteOrder);
        for (TiffOutputDirectory directory : outputSet.getDirectories()) {
            if (directory != gps) {
                stripped.addDirectory(directory);
            }
        }
        stripped.removeField(ExifTagConstants.EXIF_TAG_GPSINFO);
        return stripped;
    }

    private static int countFields(TiffOutputSet outputSet) {
        int count = 0;
        for (TiffOutputDirectory directory : outputSet.getDirectories()) {
            count += directory.getFields().size();
        }
        return count;
    }
}
