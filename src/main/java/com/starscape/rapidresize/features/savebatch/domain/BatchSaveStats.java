package com.starscape.rapidresize.features.savebatch.domain;

import com.starscape.rapidresize.features.metadata.domain.MetadataOutcome;
import com.starscape.rapidresize.features.trackprogress.api.dto.OperationSummary;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Running totals of one save run.
 *
 * Mutated only by the run's worker. The consumer receives immutable copies taken with
 * {@link #snapshot()}. Every recorded item lands in exactly one of succeeded, failed or dry run.
 */
public final class BatchSaveStats implements OperationSummary {

    private final boolean frozen;
    private int succeeded;
    private int failed;
    private int dryRun;
    private int metadataApplied;
    private int metadataFallback;
    private int gpsRemoved;
    private long bytesWritten;
    private final List<SaveFailure> failures;

    public BatchSaveStats() {
        this.frozen = false;
        this.failures = new ArrayList<>();
    }

    private BatchSaveStats(BatchSaveStats source) {
        this.frozen = true;
        this.succeeded = source.succeeded;
        this.failed = source.failed;
        this.dryRun = source.dryRun;
        this.metadataApplied = source.metadataApplied;
        this.metadataFallback = source.metadataFallback;
        this.gpsRemoved = source.gpsRemoved;
        this.bytesWritten = source.bytesWritten;
        this.failures = List.copyOf(source.failures);
    }

    public void record(SaveResult result) {
        if (frozen) {
            throw new IllegalStateException("Snapshot statistics cannot be modified");
        }
        if (!result.success()) {
            failed++;
            failures.add(new SaveFailure(result.sourcePath(), result.failureKind(), result.message(), result.retryable()));
            return;
        }
        if (result.dryRun()) {
            dryRun++;
        } else {
            succeeded++;
            bytesWritten += result.size();
        }
        if (result.metadataOutcome() == MetadataOutcome.APPLIED) {
            metadataApplied++;
        } else if (result.metadataOutcome() == MetadataOutcome.FALLBACK) {
            metadataFallback++;
        }
        if (result.gpsRemoved()) {
            gpsRemoved++;
        }
    }

    public BatchSaveStats snapshot() {
        return new BatchSaveStats(this);
    }

    public int succeeded() { return succeeded; }
    public int failed() { return failed; }
    public int dryRun() { return dryRun; }
    public int metadataApplied() { return metadataApplied; }
    public int metadataFallback() { return metadataFallback; }
    public int gpsRemoved() { return gpsRemoved; }
    public long bytesWritten() { return bytesWritten; }

    public List<SaveFailure> failures() {
        return Collections.unmodifiableList(failures);
    }

    public int total() {
        return succeeded + failed + dryRun;
    }

    @Override
    public int completedCount() {
        return succeeded + dryRun;
    }

    @Override
    public int failedCount() {
        return failed;
    }

    @Override
    public List<Path> failedPaths() {
        return failures.stream().map(SaveFailure::path).toList();
    }

    @Override
    public String toString() {
        return "BatchSaveStats{succeeded=" + succeeded + ", failed=" + failed + ", dryRun=" + dryRun
            + ", metadataApplied=" + metadataApplied + ", metadataFallback=" + metadataFallback
            + ", gpsRemoved=" + gpsRemoved + "}";
    }
}
