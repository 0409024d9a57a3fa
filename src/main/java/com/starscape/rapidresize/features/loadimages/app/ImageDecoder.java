package com.starscape.rapidresize.features.loadimages.app;

import com.starscape.rapidresize.common.domain.FailureKind;
import com.starscape.rapidresize.common.exception.ImageDecodeException;
import com.starscape.rapidresize.features.loadimages.domain.DecodedImage;
import com.starscape.rapidresize.features.metadata.app.SourceMetadataReader;
import com.starscape.rapidresize.features.metadata.domain.SourceMetadata;
import net.coobird.thumbnailator.Thumbnails;
import net.coobird.thumbnailator.tasks.UnsupportedFormatException;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;

/**
 * Reads a source file into upright pixels plus its metadata summary.
 */
@Component
public class ImageDecoder {

    private final SourceMetadataReader metadataReader;

    public ImageDecoder(SourceMetadataReader metadataReader) {
        this.metadataReader = metadataReader;
    }

    public DecodedImage decode(Path path) throws ImageDecodeException {
        byte[] bytes = readBytes(path);
        if (bytes.length == 0) {
            throw new ImageDecodeException(path, FailureKind.CORRUPT, "File is empty", null);
        }

        String format = detectFormat(path, bytes);

        BufferedImage image;
        try {
            // Thumbnailator applies the EXIF orientation while reading
            image = Thumbnails.of(new ByteArrayInputStream(bytes))
                    .scale(1.0)
                    .asBufferedImage();
        } catch (UnsupportedFormatException e) {
            throw new ImageDecodeException(path, FailureKind.UNSUPPORTED_FORMAT,
                "No decoder for " + path.getFileName(), e);
        } catch (IOException | RuntimeException e) {
            throw new ImageDecodeException(path, FailureKind.CORRUPT,
                "Failed to decode " + path.getFileName() + ": " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ImageDecodeException(path, FailureKind.CORRUPT, "Decoder returned no image", null);
        }

        SourceMetadata metadata = metadataReader.read(bytes);
        return new DecodedImage(image, format, bytes.length, metadata);
    }

    private static byte[] readBytes(Path path) throws ImageDecodeException {
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new ImageDecodeException(path, FailureKind.NOT_FOUND, "File not found: " + path, e);
        } catch (AccessDeniedException e) {
            throw new ImageDecodeException(path, FailureKind.READ_PERMISSION, "Permission denied: " + path, e);
        } catch (IOException e) {
            throw new ImageDecodeException(path, FailureKind.IO_ERROR, "Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Name of the format an ImageIO reader recognizes in the data. Data no reader recognizes is
     * reported as corrupt when the extension belongs to a readable format, unsupported otherwise.
     */
    private static String detectFormat(Path path, byte[] bytes) throws ImageDecodeException {
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            Iterator<ImageReader> readers = in == null ? null : ImageIO.getImageReaders(in);
            if (readers != null && readers.hasNext()) {
                ImageReader reader = readers.next();
                try {
                    return reader.getFormatName().toLowerCase(Locale.ROOT);
                } finally {
                    reader.dispose();
                }
            }
        } catch (IOException e) {
            throw new ImageDecodeException(path, FailureKind.CORRUPT, "Unreadable image header: " + e.getMessage(), e);
        }

        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        String suffix = lastDot >= 0 ? fileName.substring(lastDot + 1) : "";
        if (!suffix.isEmpty() && ImageIO.getImageReadersBySuffix(suffix).hasNext()) {
            throw new ImageDecodeException(path, FailureKind.CORRUPT,
                "Not a valid " + suffix.toUpperCase(Locale.ROOT) + " image: " + fileName, null);
        }
        throw new ImageDecodeException(path, FailureKind.UNSUPPORTED_FORMAT, "Unsupported image format: " + fileName, null);
    }
}
