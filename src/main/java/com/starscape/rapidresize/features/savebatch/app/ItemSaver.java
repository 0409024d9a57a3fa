package com.starscape.rapidresize.features.savebatch.app;

import com.starscape.rapidresize.common.config.ProcessingProperties;
import com.starscape.rapidresize.common.domain.FailureKind;
import com.starscape.rapidresize.common.exception.AtomicWriteException;
import com.starscape.rapidresize.common.exception.EncodeException;
import com.starscape.rapidresize.features.loadimages.domain.DecodedImage;
import com.starscape.rapidresize.features.loadimages.domain.ImageJob;
import com.starscape.rapidresize.features.metadata.app.MetadataProcessor;
import com.starscape.rapidresize.features.metadata.domain.MetadataPlan;
import com.starscape.rapidresize.features.metadata.infra.ExifEmbedder;
import com.starscape.rapidresize.features.savebatch.domain.SaveOptions;
import com.starscape.rapidresize.features.savebatch.domain.SaveResult;
import com.starscape.rapidresize.features.savebatch.infra.AtomicFileWriter;
import com.starscape.rapidresize.features.transcode.app.QualityMapper;
import com.starscape.rapidresize.features.transcode.app.TranscodeEngine;
import com.starscape.rapidresize.features.transcode.domain.EncoderSettings;
import com.starscape.rapidresize.features.transcode.domain.OutputFormat;
import com.starscape.rapidresize.features.transcode.domain.TranscodeOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;

/**
 * Saves one job: destination, metadata plan, transcode, then an estimate or an atomic write.
 * Item-level problems come back as a failed {@link SaveResult}; nothing here aborts a run.
 */
@Component
public class ItemSaver {

    private static final Logger log = LoggerFactory.getLogger(ItemSaver.class);


    private final TranscodeEngine transcodeEngine;
    private final MetadataProcessor metadataProcessor;
    private final ExifEmbedder exifEmbedder;
    private final AtomicFileWriter fileWriter;
    private final DestinationResolver destinationResolver;
    private final ProcessingProperties properties;

    public ItemSaver(
            TranscodeEngine transcodeEngine,
            MetadataProcessor metadataProcessor,
            ExifEmbedder exifEmbedder,
            AtomicFileWriter fileWriter,
            DestinationResolver destinationResolver,
            ProcessingProperties properties) {
        this.transcodeEngine = transcodeEngine;
        this.metadataProcessor = metadataProcessor;
        this.exifEmbedder = exifEmbedder;
        this.fileWriter = fileWriter;
        this.destinationResolver = destinationResolver;
        this.properties = properties;
    }

    /**
     * @param reservedDestinations output paths already handed out in this run; updated in place
     */
    public SaveResult save(ImageJob job, SaveOptions options, Set<Path> reservedDestinations)
            throws InterruptedException {
        Path source = job.getSourcePath();
        DecodedImage decoded = job.getDecoded();
        if (decoded == null) {
            return SaveResult.failed(source, null, FailureKind.UNEXPECTED, "Image was released before saving", 0);
        }

        OutputFormat format = transcodeEngine.resolveFormat(options.format(), decoded);
        Path destination = destinationResolver.resolve(source, options.outputDirectory(), format,
            options.dryRun(), reservedDestinations);
        MetadataPlan plan = metadataProcessor.plan(decoded.metadata(), options.metadata(), format);
        if (plan.isFallbackRequired()) {
            log.warn("Saving {} without metadata: {}", source, plan.fallbackReason());
        }
        EncoderSettings settings = QualityMapper.settingsFor(format, options.quality(), options.balance());

        try {
            if (options.dryRun()) {
                TranscodeOutput estimate = transcodeEngine.estimate(decoded, options.maxDimension(), format, settings);
                long exifBytes = plan.hasPayload() ? plan.payloadBytes() + exifEmbedder.containerOverhead(format) : 0;
                long size = estimate.size() + exifBytes;
                log.debug("Dry run {} -> {} ({} bytes estimated)", source, destination, size);
                return SaveResult.estimated(source, destination, format, size, plan);
            }

            TranscodeOutput output = transcodeEngine.transcode(decoded, options.maxDimension(), format, settings);
            byte[] bytes = output.bytes();
            if (plan.hasPayload()) {
                try {
                    bytes = exifEmbedder.embed(bytes, format, plan.outputSet());
                } catch (IOException | RuntimeException e) {
                    log.warn("Failed to embed EXIF into {}, saving without metadata: {}", destination, e.getMessage());
                    plan = MetadataPlan.fallback(plan.policy(), plan.gpsRemoved(), plan.editedFields(),
                        "EXIF embedding failed: " + e.getMessage());
                    bytes = output.bytes();
                }
            }
            return writeWithRetry(source, destination, format, bytes, plan);
        } catch (EncodeException e) {
            log.error("Failed to encode {}: {}", source, e.getMessage());
            return SaveResult.failed(source, destination, FailureKind.ENCODE_ERROR, e.getMessage(), 0);
        }
    }

    private SaveResult writeWithRetry(Path source, Path destination, OutputFormat format, byte[] bytes,
                                      MetadataPlan plan) throws InterruptedException {
        int maxAttempts = Math.max(1, properties.getSaveRetryAttempts());
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                fileWriter.write(destination, bytes);
                log.debug("Saved {} -> {} ({} bytes, attempt {})", source, destination, bytes.length, attempt);
                return SaveResult.written(source, destination, format, bytes.length, plan, attempt);
            } catch (AtomicWriteException e) {
                if (e.isRetryable() && attempt < maxAttempts) {
                    Duration delay = retryDelay(attempt);
                    log.warn("Write to {} failed ({}), retrying in {} ms", destination, e.getKind(), delay.toMillis());
                    Thread.sleep(delay.toMillis());
                    continue;
                }
                log.error("Failed to save {}: {} ({})", source, e.getKind(), e.getMessage());
                return SaveResult.failed(source, destination, e.getKind(), e.getMessage(), attempt);
            }
        }
    }

    Duration retryDelay(int attempt) {
        Duration linear = properties.getSaveRetryDelay().multipliedBy(attempt);
        Duration cap = properties.getMaxSaveRetryDelay();
        return linear.compareTo(cap) > 0 ? cap : linear;
    }
}
