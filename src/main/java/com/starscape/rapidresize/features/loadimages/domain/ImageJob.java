package com.starscape.rapidresize.features.loadimages.domain;

import com.starscape.rapidresize.common.domain.FailureKind;
import com.starscape.rapidresize.features.metadata.domain.MetadataOutcome;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One source image tracked through the load and save phases. Identity is the source path.
 *
 * State moves UNPROCESSED → LOADED → PROCESSING → {SUCCEEDED, FAILED}. A SUCCEEDED job may be
 * processed again by a later run; a FAILED job only through a retry of failed items.
 * The load worker mutates a job before handing it over, and a save worker only between
 * picking it up and publishing its result.
 */
public class ImageJob {

    private final Path sourcePath;
    private volatile DecodedImage decoded;
    private volatile int width;
    private volatile int height;
    private volatile JobState state;
    private volatile FailureKind lastFailureKind;
    private volatile String lastError;
    private volatile MetadataOutcome lastMetadataOutcome;
    private volatile Path lastOutputPath;

    public ImageJob(Path sourcePath) {
        if (sourcePath == null) {
            throw new IllegalArgumentException("Source path cannot be null");
        }
        this.sourcePath = sourcePath;
        this.state = JobState.UNPROCESSED;
    }

    public static ImageJob loaded(Path sourcePath, DecodedImage decoded) {
        ImageJob job = new ImageJob(sourcePath);
        job.markLoaded(decoded);
        return job;
    }

    public Path getSourcePath() { return sourcePath; }
    public DecodedImage getDecoded() { return decoded; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public JobState getState() { return state; }
    public FailureKind getLastFailureKind() { return lastFailureKind; }
    public String getLastError() { return lastError; }
    public MetadataOutcome getLastMetadataOutcome() { return lastMetadataOutcome; }
    public Path getLastOutputPath() { return lastOutputPath; }

    public boolean isReleased() {
        return decoded == null;
    }

    public synchronized void markLoaded(DecodedImage decoded) {
        requireState(JobState.UNPROCESSED, "load");
        if (decoded == null) {
            throw new IllegalArgumentException("Decoded image cannot be null");
        }
        this.decoded = decoded;
        this.width = decoded.width();
        this.height = decoded.height();
        this.state = JobState.LOADED;
    }

    /**
     * @param retryOfFailed whether the run was requested as a retry of failed items
     */
    public synchronized void markProcessing(boolean retryOfFailed) {
        boolean allowed = switch (state) {
            case LOADED, SUCCEEDED -> true;
            case FAILED -> retryOfFailed;
            default -> false;
        };
        if (!allowed) {
            throw new IllegalStateException(
                "Cannot start processing " + sourcePath + " in state " + state
                    + (state == JobState.FAILED ? " without a retry request" : ""));
        }
        this.state = JobState.PROCESSING;
        this.lastFailureKind = null;
        this.lastError = null;
    }

    public synchronized void markSucceeded(Path outputPath, MetadataOutcome metadataOutcome) {
        requireState(JobState.PROCESSING, "complete");
        this.lastOutputPath = outputPath;
        this.lastMetadataOutcome = metadataOutcome;
        this.state = JobState.SUCCEEDED;
    }

    public synchronized void markFailed(FailureKind kind, String message) {
        requireState(JobState.PROCESSING, "fail");
        this.lastFailureKind = kind;
        this.lastError = message;
        this.state = JobState.FAILED;
    }

    /**
     * Drop the pixel buffer. The job keeps its identity, dimensions and history.
     */
    public synchronized void release() {
        DecodedImage current = this.decoded;
        this.decoded = null;
        if (current != null) {
            current.image().flush();
        }
    }

    private void requireState(JobState expected, String action) {
        if (state != expected) {
            throw new IllegalStateException(
                "Cannot " + action + " " + sourcePath + " in state " + state + ", expected " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageJob other)) return false;
        return sourcePath.equals(other.sourcePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourcePath);
    }

    @Override
    public String toString() {
        return "ImageJob{" + sourcePath + ", " + state + "}";
    }
}
