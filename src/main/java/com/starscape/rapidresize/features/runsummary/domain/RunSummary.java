package com.starscape.rapidresize.features.runsummary.domain;

import com.starscape.rapidresize.features.savebatch.domain.BatchSaveStats;
import com.starscape.rapidresize.features.savebatch.domain.SaveFailure;
import com.starscape.rapidresize.features.savebatch.domain.SaveOptions;

import java.time.Instant;
import java.util.List;

/**
 * One entry of the JSON run log.
 */
public record RunSummary(
    String operationId,
    String outcome,
    Instant startedAt,
    Instant finishedAt,
    String outputDirectory,
    String format,
    int maxDimension,
    int quality,
    int balance,
    String metadataPolicy,
    boolean stripLocation,
    boolean dryRun,
    int succeeded,
    int failed,
    int dryRunCount,
    int metadataApplied,
    int metadataFallback,
    int gpsRemoved,
    long bytesWritten,
    List<FailedItem> failures
) {

    public record FailedItem(String path, String kind, String message, boolean retryable) {
    }

    public static RunSummary of(String operationId, boolean cancelled, Instant startedAt,
                                SaveOptions options, BatchSaveStats stats) {
        List<FailedItem> failures = stats.failures().stream()
            .map(RunSummary::toFailedItem)
            .toList();
        return new RunSummary(
            operationId,
            cancelled ? "CANCELLED" : "COMPLETED",
            startedAt,
            Instant.now(),
            options.outputDirectory().toString(),
            options.format().name(),
            options.maxDimension(),
            options.quality(),
            options.balance(),
            options.metadata().policy().name(),
            options.metadata().stripLocation(),
            options.dryRun(),
            stats.succeeded(),
            stats.failed(),
            stats.dryRun(),
            stats.metadataApplied(),
            stats.metadataFallback(),
            stats.gpsRemoved(),
            stats.bytesWritten(),
            failures
        );
    }

    private static FailedItem toFailedItem(SaveFailure failure) {
        return new FailedItem(failure.path().toString(),
            failure.kind() == null ? null : failure.kind().name(), failure.message(), failure.retryable());
    }
}
