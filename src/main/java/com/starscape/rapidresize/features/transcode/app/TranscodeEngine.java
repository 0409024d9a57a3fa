package com.starscape.rapidresize.features.transcode.app;

import com.starscape.rapidresize.common.exception.EncodeException;
import com.starscape.rapidresize.features.loadimages.domain.DecodedImage;
import com.starscape.rapidresize.features.transcode.domain.EncoderSettings;
import com.starscape.rapidresize.features.transcode.domain.OutputFormat;
import com.starscape.rapidresize.features.transcode.domain.TargetDimensions;
import com.starscape.rapidresize.features.transcode.domain.TranscodeOutput;
import net.coobird.thumbnailator.Thumbnails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.plugins.jpeg.JPEGImageWriteParam;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Resizes and encodes decoded images in memory. Never touches the file system.
 */
@Service
public class TranscodeEngine {

    private static final Logger log = LoggerFactory.getLogger(TranscodeEngine.class);

    /**
     * Pick the concrete format for one image. AUTO keeps transparency by choosing PNG for images
     * with an alpha channel and JPEG otherwise; a format without an available writer falls back to JPEG.
     * The bundled ImageIO has no WebP writer, so WebP requests fall back unless a plugin is installed.
     */
    public OutputFormat resolveFormat(OutputFormat requested, DecodedImage decoded) {
        OutputFormat format = requested;
        if (format == null || format == OutputFormat.AUTO) {
            format = decoded != null && decoded.hasAlpha() ? OutputFormat.PNG : OutputFormat.JPEG;
        }
        if (!isWriterAvailable(format)) {
            log.warn("No encoder available for {}, falling back to JPEG", format);
            return OutputFormat.JPEG;
        }
        return format;
    }

    public boolean isWriterAvailable(OutputFormat format) {
        return format.isConcrete() && ImageIO.getImageWritersByFormatName(format.getImageIoName()).hasNext();
    }

    public TranscodeOutput transcode(DecodedImage decoded, int maxDimension, OutputFormat format,
                                     EncoderSettings settings) throws EncodeException {
        OutputFormat target = format.isConcrete() ? format : resolveFormat(format, decoded);
        BufferedImage resized = resize(decoded.image(), maxDimension);
        byte[] bytes = encode(resized, target, settings);
        log.debug("Encoded {}x{} {} into {} bytes", resized.getWidth(), resized.getHeight(), target, bytes.length);
        return TranscodeOutput.encoded(target, resized.getWidth(), resized.getHeight(), bytes);
    }

    /**
     * Size of the output {@link #transcode} would produce, measured through the same path.
     */
    public TranscodeOutput estimate(DecodedImage decoded, int maxDimension, OutputFormat format,
                                    EncoderSettings settings) throws EncodeException {
        TranscodeOutput output = transcode(decoded, maxDimension, format, settings);
        return TranscodeOutput.estimate(output.format(), output.width(), output.height(), output.size());
    }

    BufferedImage resize(BufferedImage source, int maxDimension) throws EncodeException {
        TargetDimensions target = ResizePolicy.fit(source.getWidth(), source.getHeight(), maxDimension);
        if (!target.scaled()) {
            return source;
        }
        try {
            return Thumbnails.of(source)
                    .forceSize(target.width(), target.height())
                    .asBufferedImage();
        } catch (IOException e) {
            throw new EncodeException("Failed to resize to " + target.width() + "x" + target.height(), e);
        }
    }

    private byte[] encode(BufferedImage image, OutputFormat format, EncoderSettings settings) throws EncodeException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.getImageIoName());
        if (!writers.hasNext()) {
            throw new EncodeException("No ImageIO writer for " + format);
        }
        BufferedImage prepared = format == OutputFormat.JPEG ? flattenOntoWhite(image) : image;

        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream imageOut = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(imageOut);
            ImageWriteParam param = writer.getDefaultWriteParam();
            configure(param, format, settings);
            writer.write(null, new IIOImage(prepared, null, null), param);
        } catch (IOException | RuntimeException e) {
            throw new EncodeException("Failed to encode " + format + ": " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
        if (out.size() == 0) {
            throw new EncodeException("Encoder produced no data for " + format);
        }
        return out.toByteArray();
    }

    private void configure(ImageWriteParam param, OutputFormat format, EncoderSettings settings) {
        if (format == OutputFormat.JPEG && param.canWriteProgressive()) {
            param.setProgressiveMode(settings.progressive()
                ? ImageWriteParam.MODE_DEFAULT
                : ImageWriteParam.MODE_DISABLED);
        }
        if (param instanceof JPEGImageWriteParam jpegParam) {
            jpegParam.setOptimizeHuffmanTables(settings.optimize());
        }
        if (!param.canWriteCompressed()) {
            return;
        }
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        String[] types = param.getCompressionTypes();
        if (types != null && types.length > 0 && param.getCompressionType() == null) {
            param.setCompressionType(types[0]);
        }
        switch (format) {
            // The JDK PNG writer truncates 9 * (1 - quality) into the deflate level
            case PNG -> param.setCompressionQuality(
                Math.max(0f, 1f - (settings.pngCompressionLevel() + 0.5f) / 9f));
            default -> param.setCompressionQuality(settings.quality() / 100f);
        }
    }

    private static BufferedImage flattenOntoWhite(BufferedImage image) {
        if (!image.getColorModel().hasAlpha() && image.getType() != BufferedImage.TYPE_CUSTOM) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = rgb.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, image.getWidth(), image.getHeight());
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return rgb;
    }
}
