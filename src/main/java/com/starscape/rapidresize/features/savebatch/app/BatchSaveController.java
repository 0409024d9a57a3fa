package com.starscape.rapidresize.features.savebatch.app;

import com.starscape.rapidresize.common.config.ProcessingProperties;
import com.starscape.rapidresize.common.exception.InvalidRequestException;
import com.starscape.rapidresize.features.loadimages.domain.ImageJob;
import com.starscape.rapidresize.features.loadimages.domain.JobState;
import com.starscape.rapidresize.features.savebatch.domain.BatchSaveStats;
import com.starscape.rapidresize.features.savebatch.domain.SaveOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Starts batch save runs on the worker pool.
 */
@Service
public class BatchSaveController {

    private static final Logger log = LoggerFactory.getLogger(BatchSaveController.class);

    private final ItemSaver itemSaver;
    private final ProcessingProperties properties;
    private final TaskExecutor executor;

    public BatchSaveController(
            ItemSaver itemSaver,
            ProcessingProperties properties,
            @Qualifier("resizeWorkerExecutor") TaskExecutor executor) {
        this.itemSaver = itemSaver;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Save every job with one set of options.
     *
     * @throws InvalidRequestException if there is nothing to save, a job has no image, a job failed
     *         in an earlier run (those go through {@link #retryFailed}), or the output directory is a file
     */
    public BatchRunHandle start(List<ImageJob> jobs, SaveOptions options) {
        List<ImageJob> selected = distinct(jobs);
        validate(selected, options, false);
        return launch(selected, options, false);
    }

    /**
     * Save again exactly the jobs whose paths failed in {@code previous}, in the order they failed.
     * Failed paths no longer in {@code jobs} are skipped.
     */
    public BatchRunHandle retryFailed(List<ImageJob> jobs, BatchSaveStats previous, SaveOptions options) {
        if (previous == null || previous.failedPaths().isEmpty()) {
            throw new InvalidRequestException("Previous run has no failed items to retry");
        }
        Map<Path, ImageJob> byPath = new LinkedHashMap<>();
        for (ImageJob job : jobs) {
            byPath.putIfAbsent(job.getSourcePath(), job);
        }
        List<ImageJob> selected = new ArrayList<>();
        for (Path failedPath : new LinkedHashSet<>(previous.failedPaths())) {
            ImageJob job = byPath.get(failedPath);
            if (job == null) {
                log.warn("Failed item {} is no longer in the working set, skipping", failedPath);
                continue;
            }
            selected.add(job);
        }
        validate(selected, options, true);
        return launch(selected, options, true);
    }

    private BatchRunHandle launch(List<ImageJob> selected, SaveOptions options, boolean retryOfFailed) {
        BatchRunHandle handle = new BatchRunHandle(selected, options, retryOfFailed, itemSaver,
            properties.getChannelCapacity());
        log.info("Starting batch save: operationId={}, jobs={}, outputDirectory={}",
            handle.getOperationId(), selected.size(), options.outputDirectory());
        handle.start(executor);
        return handle;
    }

    private static List<ImageJob> distinct(List<ImageJob> jobs) {
        if (jobs == null) {
            return List.of();
        }
        Set<ImageJob> unique = new LinkedHashSet<>(jobs);
        return new ArrayList<>(unique);
    }

    private static void validate(List<ImageJob> selected, SaveOptions options, boolean retryOfFailed) {
        if (options == null) {
            throw new InvalidRequestException("Save options are required");
        }
        if (selected.isEmpty()) {
            throw new InvalidRequestException("No jobs to save");
        }
        for (ImageJob job : selected) {
            JobState state = job.getState();
            if (state == JobState.FAILED && !retryOfFailed) {
                throw new InvalidRequestException(
                    "Job " + job.getSourcePath() + " failed earlier and can only be saved through a retry of failed items");
            }
            if (state == JobState.UNPROCESSED || state == JobState.PROCESSING) {
                throw new InvalidRequestException("Job " + job.getSourcePath() + " is not ready to save: " + state);
            }
            if (job.isReleased()) {
                throw new InvalidRequestException("Job " + job.getSourcePath() + " has no image loaded");
            }
        }
        Path outputDirectory = options.outputDirectory();
        if (Files.exists(outputDirectory) && !Files.isDirectory(outputDirectory)) {
            throw new InvalidRequestException("Output path is not a directory: " + outputDirectory);
        }
    }
}
