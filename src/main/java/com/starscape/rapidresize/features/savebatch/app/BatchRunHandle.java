package com.starscape.rapidresize.features.savebatch.app;

import com.starscape.rapidresize.common.domain.FailureKind;
import com.starscape.rapidresize.features.loadimages.domain.ImageJob;
import com.starscape.rapidresize.features.savebatch.domain.BatchSaveStats;
import com.starscape.rapidresize.features.savebatch.domain.SaveOptions;
import com.starscape.rapidresize.features.savebatch.domain.SaveResult;
import com.starscape.rapidresize.features.trackprogress.api.dto.Cancelled;
import com.starscape.rapidresize.features.trackprogress.api.dto.ItemSaved;
import com.starscape.rapidresize.features.trackprogress.api.dto.ProgressMessage;
import com.starscape.rapidresize.features.trackprogress.api.dto.SaveCompleted;
import com.starscape.rapidresize.features.trackprogress.api.dto.SaveItemFailed;
import com.starscape.rapidresize.features.trackprogress.api.dto.SaveProgress;
import com.starscape.rapidresize.features.trackprogress.app.BackgroundOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Handle to one batch save run over a fixed list of jobs and one {@link SaveOptions}.
 */
public class BatchRunHandle extends BackgroundOperation {

    private static final Logger log = LoggerFactory.getLogger(BatchRunHandle.class);

    private final List<ImageJob> jobs;
    private final SaveOptions options;
    private final boolean retryOfFailed;
    private final ItemSaver itemSaver;
    private final BatchSaveStats stats = new BatchSaveStats();
    private final Set<Path> reservedDestinations = new HashSet<>();

    BatchRunHandle(List<ImageJob> jobs, SaveOptions options, boolean retryOfFailed, ItemSaver itemSaver,
                   int channelCapacity) {
        super(channelCapacity);
        this.jobs = List.copyOf(jobs);
        this.options = options;
        this.retryOfFailed = retryOfFailed;
        this.itemSaver = itemSaver;
    }

    @Override
    protected void execute() throws InterruptedException {
        int total = jobs.size();
        log.info("Batch save started: operationId={}, jobs={}, format={}, dryRun={}, retry={}",
            getOperationId(), total, options.format(), options.dryRun(), retryOfFailed);

        int done = 0;
        for (ImageJob job : jobs) {
            if (isCancellationRequested()) {
                BatchSaveStats partial = stats.snapshot();
                log.info("Batch save cancelled: operationId={}, {}", getOperationId(), partial);
                publish(Cancelled.of(getOperationId(), partial));
                return;
            }

            Path source = job.getSourcePath();
            job.markProcessing(retryOfFailed);
            SaveResult result;
            try {
                result = saveOne(job, source);
            } catch (InterruptedException e) {
                abandon(job, source);
                throw e;
            }
            if (result.success()) {
                job.markSucceeded(result.outputPath(), result.metadataOutcome());
            } else {
                job.markFailed(result.failureKind(), result.message());
            }
            stats.record(result);
            done++;

            if (result.success()) {
                publish(ItemSaved.of(getOperationId(), source, result));
            } else {
                publish(SaveItemFailed.of(getOperationId(), source, result.failureKind(), result.message(),
                    result.retryable()));
            }
            publish(SaveProgress.of(getOperationId(), done, total, source));
        }

        BatchSaveStats finalStats = stats.snapshot();
        log.info("Batch save completed: operationId={}, {}", getOperationId(), finalStats);
        publish(SaveCompleted.of(getOperationId(), finalStats));
    }

    private SaveResult saveOne(ImageJob job, Path source) throws InterruptedException {
        try {
            return itemSaver.save(job, options, reservedDestinations);
        } catch (RuntimeException e) {
            log.error("Unexpected error saving {}", source, e);
            return SaveResult.failed(source, null, FailureKind.UNEXPECTED, String.valueOf(e.getMessage()), 0);
        }
    }

    /**
     * Leave the interrupted job FAILED so a retry of failed items picks it up again.
     */
    private void abandon(ImageJob job, Path source) {
        log.warn("Save of {} interrupted: operationId={}", source, getOperationId());
        SaveResult result = SaveResult.failed(source, null, FailureKind.INTERRUPTED,
            FailureKind.INTERRUPTED.getDescription(), 0);
        job.markFailed(result.failureKind(), result.message());
        stats.record(result);
    }

    @Override
    protected ProgressMessage fatalMessage(Exception failure) {
        if (failure instanceof InterruptedException) {
            return Cancelled.of(getOperationId(), stats.snapshot());
        }
        return SaveCompleted.of(getOperationId(), stats.snapshot());
    }

    public SaveOptions getOptions() {
        return options;
    }
}
