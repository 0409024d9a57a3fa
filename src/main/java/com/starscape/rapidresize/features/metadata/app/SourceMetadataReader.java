package com.starscape.rapidresize.features.metadata.app;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.GpsDirectory;
import com.starscape.rapidresize.features.metadata.domain.SourceMetadata;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.tiff.TiffImageMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Reads the EXIF summary and the rewritable EXIF block of a source file.
 * Unreadable metadata never fails the load; the image simply has none.
 */
@Component
public class SourceMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(SourceMetadataReader.class);

    public SourceMetadata read(byte[] imageBytes) {
        boolean hasGps = false;
        int orientation = 1;

        try {
            Metadata metadata = ImageMetadataReader.readMetadata(new ByteArrayInputStream(imageBytes));

            for (Directory directory : metadata.getDirectories()) {
                if (directory instanceof GpsDirectory && directory.getTagCount() > 0) {
                    hasGps = true;
                }
            }

            ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
            if (ifd0 != null) {
                Integer value = ifd0.getInteger(ExifDirectoryBase.TAG_ORIENTATION);
                if (value != null && value >= 1 && value <= 8) {
                    orientation = value;
                }
            }
        } catch (ImageProcessingException | IOException e) {
            log.debug("Failed to extract EXIF summary: {}", e.getMessage());
        }

        return new SourceMetadata(hasGps, orientation, readExif(imageBytes));
    }

    private TiffImageMetadata readExif(byte[] imageBytes) {
        try {
            if (Imaging.getMetadata(imageBytes) instanceof JpegImageMetadata jpegMetadata) {
                return jpegMetadata.getExif();
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Failed to parse EXIF block: {}", e.getMessage());
        }
        return null;
    }
}
