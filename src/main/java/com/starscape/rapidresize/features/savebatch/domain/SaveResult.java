package com.starscape.rapidresize.features.savebatch.domain;

import com.starscape.rapidresize.common.domain.FailureKind;
import com.starscape.rapidresize.features.metadata.domain.MetadataOutcome;
import com.starscape.rapidresize.features.metadata.domain.MetadataPlan;
import com.starscape.rapidresize.features.transcode.domain.OutputFormat;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of saving one job. Consumed right away by the run statistics; never persisted.
 *
 * @param size bytes written, or the estimated size in a dry run
 * @param attempts write attempts used, 0 in a dry run or when the item failed before writing
 */
public record SaveResult(
    Path sourcePath,
    boolean success,
    boolean dryRun,
    Path outputPath,
    OutputFormat format,
    long size,
    FailureKind failureKind,
    String message,
    boolean retryable,
    MetadataOutcome metadataOutcome,
    boolean gpsRemoved,
    List<String> editedFields,
    int attempts
) {

    public SaveResult {
        editedFields = editedFields == null ? List.of() : List.copyOf(editedFields);
    }

    public static SaveResult written(Path sourcePath, Path outputPath, OutputFormat format, long size,
                                     MetadataPlan plan, int attempts) {
        return new SaveResult(sourcePath, true, false, outputPath, format, size, null, null, false,
            plan.outcome(), plan.gpsRemoved(), plan.editedFields(), attempts);
    }

    public static SaveResult estimated(Path sourcePath, Path outputPath, OutputFormat format, long size,
                                       MetadataPlan plan) {
        return new SaveResult(sourcePath, true, true, outputPath, format, size, null, null, false,
            plan.outcome(), plan.gpsRemoved(), plan.editedFields(), 0);
    }

    public static SaveResult failed(Path sourcePath, Path outputPath, FailureKind kind, String message, int attempts) {
        return new SaveResult(sourcePath, false, false, outputPath, null, 0, kind, message,
            kind.isRetryable(), MetadataOutcome.SKIPPED, false, List.of(), attempts);
    }
}
