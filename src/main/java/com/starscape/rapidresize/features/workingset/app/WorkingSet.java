package com.starscape.rapidresize.features.workingset.app;

import com.starscape.rapidresize.common.exception.InvalidRequestException;
import com.starscape.rapidresize.common.exception.OperationInProgressException;
import com.starscape.rapidresize.features.loadimages.app.LoadSessionHandle;
import com.starscape.rapidresize.features.loadimages.app.LoadSessionService;
import com.starscape.rapidresize.features.loadimages.domain.ImageJob;
import com.starscape.rapidresize.features.loadimages.domain.JobState;
import com.starscape.rapidresize.features.loadimages.domain.LoadRequest;
import com.starscape.rapidresize.features.loadimages.domain.LoadSummary;
import com.starscape.rapidresize.features.savebatch.app.BatchRunHandle;
import com.starscape.rapidresize.features.savebatch.app.BatchSaveController;
import com.starscape.rapidresize.features.savebatch.domain.BatchSaveStats;
import com.starscape.rapidresize.features.savebatch.domain.SaveOptions;
import com.starscape.rapidresize.features.trackprogress.api.dto.Cancelled;
import com.starscape.rapidresize.features.trackprogress.api.dto.ItemLoaded;
import com.starscape.rapidresize.features.trackprogress.api.dto.LoadCompleted;
import com.starscape.rapidresize.features.trackprogress.api.dto.ProgressMessage;
import com.starscape.rapidresize.features.trackprogress.api.dto.SaveCompleted;
import com.starscape.rapidresize.features.trackprogress.app.BackgroundOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The consumer's list of jobs, together with the one operation allowed to run on it.
 *
 * Not thread-safe: owned by the consumer thread. Workers never touch it; their results arrive
 * through {@link #pump()}, which drains the active handle and applies each message here.
 */
public class WorkingSet {

    private static final Logger log = LoggerFactory.getLogger(WorkingSet.class);

    private final LoadSessionService loadSessionService;
    private final BatchSaveController batchSaveController;
    private final int pollBatchSize;
    private final Duration pollInterval;
    private final Duration cancelTimeout;

    private final Map<Path, ImageJob> jobs = new LinkedHashMap<>();
    private BackgroundOperation active;
    private LoadSummary lastLoadSummary;
    private BatchSaveStats lastSaveStats;

    public WorkingSet(LoadSessionService loadSessionService, BatchSaveController batchSaveController,
                      int pollBatchSize, Duration pollInterval, Duration cancelTimeout) {
        this.loadSessionService = loadSessionService;
        this.batchSaveController = batchSaveController;
        this.pollBatchSize = Math.max(1, pollBatchSize);
        this.pollInterval = pollInterval;
        this.cancelTimeout = cancelTimeout;
    }

    /**
     * Start loading. A load still in flight is cancelled and awaited first; its results so far
     * are kept.
     *
     * @throws OperationInProgressException if a save run is in flight, or the previous load
     *         does not stop within the cancel timeout
     */
    public LoadSessionHandle load(LoadRequest request) throws InterruptedException {
        replaceActiveLoad();
        LoadSessionHandle handle = loadSessionService.start(request);
        active = handle;
        return handle;
    }

    /**
     * Load again exactly the paths that failed in the last finished load session.
     */
    public LoadSessionHandle retryFailedLoads() throws InterruptedException {
        if (lastLoadSummary == null) {
            throw new InvalidRequestException("No finished load session to retry");
        }
        replaceActiveLoad();
        LoadSessionHandle handle = loadSessionService.retryFailed(lastLoadSummary);
        active = handle;
        return handle;
    }

    /**
     * Save every job that has not failed in an earlier run. Failed jobs are only saved again
     * through {@link #retryFailedSaves}.
     *
     * @throws OperationInProgressException if a load session or save run is in flight
     */
    public BatchRunHandle save(SaveOptions options) {
        requireIdle("save");
        List<ImageJob> eligible = new ArrayList<>();
        for (ImageJob job : jobs.values()) {
            if (job.getState() != JobState.FAILED) {
                eligible.add(job);
            }
        }
        if (eligible.size() < jobs.size()) {
            log.info("Skipping {} jobs that failed earlier", jobs.size() - eligible.size());
        }
        BatchRunHandle handle = batchSaveController.start(eligible, options);
        active = handle;
        return handle;
    }

    /**
     * Save again exactly the jobs that failed in the last finished save run, with new options.
     */
    public BatchRunHandle retryFailedSaves(SaveOptions options) {
        requireIdle("retry failed saves");
        if (lastSaveStats == null) {
            throw new InvalidRequestException("No finished save run to retry");
        }
        BatchRunHandle handle = batchSaveController.retryFailed(new ArrayList<>(jobs.values()), lastSaveStats, options);
        active = handle;
        return handle;
    }

    /**
     * Drain at most one poll batch from the active operation and apply it. Never blocks.
     *
     * @return the applied messages, in delivery order
     */
    public List<ProgressMessage> pump() {
        if (active == null) {
            return List.of();
        }
        BackgroundOperation operation = active;
        List<ProgressMessage> messages = operation.poll(pollBatchSize);
        for (ProgressMessage message : messages) {
            apply(message);
        }
        if (operation.isFinished()) {
            active = null;
        }
        return messages;
    }

    private void apply(ProgressMessage message) {
        if (message instanceof ItemLoaded loaded) {
            ImageJob job = loaded.job();
            ImageJob previous = jobs.put(job.getSourcePath(), job);
            if (previous != null && previous != job) {
                previous.release();
            }
        } else if (message instanceof LoadCompleted completed) {
            lastLoadSummary = completed.summary();
        } else if (message instanceof SaveCompleted completed) {
            lastSaveStats = completed.stats();
        } else if (message instanceof Cancelled cancelled) {
            if (cancelled.partial() instanceof LoadSummary summary) {
                lastLoadSummary = summary;
            } else if (cancelled.partial() instanceof BatchSaveStats stats) {
                lastSaveStats = stats;
            }
        }
    }

    /**
     * Request cancellation of the active operation, if any. Its terminal message still arrives through {@link #pump()}.
     */
    public void cancel() {
        if (active != null) {
            active.cancel();
        }
    }

    /**
     * Pump until the active operation has delivered its terminal message.
     *
     * @return false if the timeout passed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (active != null) {
            pump();
            if (active == null) {
                break;
            }
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(pollInterval.toMillis());
        }
        return true;
    }

    private void replaceActiveLoad() throws InterruptedException {
        if (active instanceof BatchRunHandle) {
            throw new OperationInProgressException("A save run is in progress: " + active.getOperationId());
        }
        if (active instanceof LoadSessionHandle previous) {
            log.info("Cancelling load session {} before starting a new one", previous.getOperationId());
            previous.cancel();
            if (!awaitIdle(cancelTimeout)) {
                throw new OperationInProgressException("Load session " + previous.getOperationId()
                    + " did not stop within " + cancelTimeout.toMillis() + " ms");
            }
        }
    }

    private void requireIdle(String action) {
        if (active != null) {
            throw new OperationInProgressException(
                "Cannot " + action + " while operation " + active.getOperationId() + " is in progress");
        }
    }

    /**
     * Remove one job and release its image.
     */
    public void remove(Path sourcePath) {
        requireIdle("remove jobs");
        ImageJob removed = jobs.remove(sourcePath);
        if (removed != null) {
            removed.release();
        }
    }

    public void clear() {
        requireIdle("clear the working set");
        jobs.values().forEach(ImageJob::release);
        jobs.clear();
        lastLoadSummary = null;
        lastSaveStats = null;
    }

    public boolean isBusy() {
        return active != null;
    }

    public BackgroundOperation getActiveOperation() {
        return active;
    }

    public List<ImageJob> getJobs() {
        return List.copyOf(jobs.values());
    }

    public ImageJob getJob(Path sourcePath) {
        return jobs.get(sourcePath);
    }

    public int size() {
        return jobs.size();
    }

    public LoadSummary getLastLoadSummary() {
        return lastLoadSummary;
    }

    public BatchSaveStats getLastSaveStats() {
        return lastSaveStats;
    }
}
