package com.starscape.rapidresize.features.savebatch.domain;

import com.starscape.rapidresize.common.exception.InvalidRequestException;
import com.starscape.rapidresize.features.metadata.domain.MetadataEdit;
import com.starscape.rapidresize.features.metadata.domain.MetadataPolicy;
import com.starscape.rapidresize.features.metadata.domain.MetadataSettings;
import com.starscape.rapidresize.features.transcode.app.QualityMapper;
import com.starscape.rapidresize.features.transcode.domain.OutputFormat;

import java.nio.file.Path;

/**
 * One save configuration, applied unchanged to every job of a run.
 *
 * @param outputDirectory directory outputs are written to; also used to name dry-run outputs
 * @param maxDimension bound for the longer side, 0 to keep the source size
 * @param quality 1..100, normalized to a multiple of 5 (at least 5)
 * @param balance 1 (smallest files) to 10 (best quality)
 */
public record SaveOptions(
    Path outputDirectory,
    OutputFormat format,
    int maxDimension,
    int quality,
    int balance,
    MetadataSettings metadata,
    boolean dryRun
) {

    public SaveOptions {
        if (outputDirectory == null) {
            throw new InvalidRequestException("Output directory is required");
        }
        if (format == null) {
            throw new InvalidRequestException("Output format is required");
        }
        if (maxDimension < 0) {
            throw new InvalidRequestException("Max dimension cannot be negative: " + maxDimension);
        }
        if (quality < 1 || quality > 100) {
            throw new InvalidRequestException("Quality must be between 1 and 100: " + quality);
        }
        if (balance < 1 || balance > 10) {
            throw new InvalidRequestException("Balance must be between 1 and 10: " + balance);
        }
        if (metadata == null) {
            metadata = MetadataSettings.keep();
        }
        quality = QualityMapper.normalizeQuality(quality);
    }

    /**
     * JPEG at quality 85, longer side 1280, metadata kept.
     */
    public static SaveOptions defaults(Path outputDirectory) {
        return new SaveOptions(outputDirectory, OutputFormat.JPEG, 1280, 85, 5,
            MetadataSettings.keep(), false);
    }

    public SaveOptions withFormat(OutputFormat format) {
        return new SaveOptions(outputDirectory, format, maxDimension, quality, balance, metadata, dryRun);
    }

    public SaveOptions withMaxDimension(int maxDimension) {
        return new SaveOptions(outputDirectory, format, maxDimension, quality, balance, metadata, dryRun);
    }

    public SaveOptions withMetadata(MetadataPolicy policy, MetadataEdit edit, boolean stripLocation) {
        return new SaveOptions(outputDirectory, format, maxDimension, quality, balance,
            new MetadataSettings(policy, edit, stripLocation), dryRun);
    }

    public SaveOptions withDryRun(boolean dryRun) {
        return new SaveOptions(outputDirectory, format, maxDimension, quality, balance, metadata, dryRun);
    }
}
