package com.starscape.rapidresize.features.loadimages.app;

import com.starscape.rapidresize.common.domain.FailureKind;
import com.starscape.rapidresize.common.exception.ImageDecodeException;
import com.starscape.rapidresize.features.discovery.app.DiscoveredFiles;
import com.starscape.rapidresize.features.loadimages.domain.DecodedImage;
import com.starscape.rapidresize.features.loadimages.domain.ImageJob;
import com.starscape.rapidresize.features.loadimages.domain.LoadFailure;
import com.starscape.rapidresize.features.loadimages.domain.LoadSessionState;
import com.starscape.rapidresize.features.loadimages.domain.LoadSummary;
import com.starscape.rapidresize.features.trackprogress.api.dto.Cancelled;
import com.starscape.rapidresize.features.trackprogress.api.dto.ItemLoaded;
import com.starscape.rapidresize.features.trackprogress.api.dto.LoadCompleted;
import com.starscape.rapidresize.features.trackprogress.api.dto.LoadItemFailed;
import com.starscape.rapidresize.features.trackprogress.api.dto.LoadProgress;
import com.starscape.rapidresize.features.trackprogress.api.dto.ProgressMessage;
import com.starscape.rapidresize.features.trackprogress.api.dto.ScanCompleted;
import com.starscape.rapidresize.features.trackprogress.api.dto.ScanProgress;
import com.starscape.rapidresize.features.trackprogress.api.dto.SetupFailed;
import com.starscape.rapidresize.features.trackprogress.app.BackgroundOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Handle to one load session: scanning, then decoding candidates one at a time.
 *
 * A session created for a retry skips scanning and decodes exactly the given paths.
 */
public class LoadSessionHandle extends BackgroundOperation {

    private static final Logger log = LoggerFactory.getLogger(LoadSessionHandle.class);

    private final DiscoveredFiles discoveredFiles;
    private final List<Path> retryPaths;
    private final ImageDecoder decoder;
    private final int maxFiles;
    private final int scanProgressInterval;

    private volatile LoadSessionState state = LoadSessionState.SCANNING;
    private volatile int loaded;
    private volatile int failed;

    private final List<LoadFailure> failures = new ArrayList<>();
    private int total;
    private boolean overflow;

    LoadSessionHandle(DiscoveredFiles discoveredFiles, List<Path> retryPaths, ImageDecoder decoder,
                      int maxFiles, int scanProgressInterval, int channelCapacity) {
        super(channelCapacity);
        this.discoveredFiles = discoveredFiles;
        this.retryPaths = retryPaths == null ? null : List.copyOf(retryPaths);
        this.decoder = decoder;
        this.maxFiles = maxFiles;
        this.scanProgressInterval = Math.max(1, scanProgressInterval);
    }

    @Override
    protected void execute() throws InterruptedException {
        List<Path> candidates = retryPaths != null ? retryPaths : scan();
        if (candidates == null) {
            return;
        }
        if (candidates.isEmpty()) {
            state = LoadSessionState.COMPLETED;
            log.info("Load session found no candidates: operationId={}", getOperationId());
            publish(SetupFailed.of(getOperationId(), "No candidate images found"));
            return;
        }
        load(candidates);
    }

    /**
     * @return the candidate list, or null if the session was cancelled while scanning
     */
    private List<Path> scan() throws InterruptedException {
        log.info("Scanning {} (recursive={})", discoveredFiles.roots(), discoveredFiles.isRecursive());
        List<Path> candidates = new ArrayList<>();
        for (Path path : discoveredFiles) {
            if (isCancellationRequested()) {
                state = LoadSessionState.CANCELLED;
                log.info("Load session cancelled while scanning: operationId={}, discovered={}",
                    getOperationId(), candidates.size());
                publish(Cancelled.of(getOperationId(), summary()));
                return null;
            }
            if (maxFiles > 0 && candidates.size() >= maxFiles) {
                overflow = true;
                break;
            }
            candidates.add(path);
            if (candidates.size() % scanProgressInterval == 0) {
                publish(ScanProgress.of(getOperationId(), candidates.size()));
            }
        }
        if (overflow) {
            log.warn("Discovery stopped at the configured maximum of {} files", maxFiles);
        }
        publish(ScanCompleted.of(getOperationId(), candidates.size(), overflow, discoveredFiles.warnings()));
        return candidates;
    }

    private void load(List<Path> candidates) throws InterruptedException {
        state = LoadSessionState.LOADING;
        total = candidates.size();
        log.info("Loading {} images: operationId={}, retry={}", total, getOperationId(), isRetry());

        int done = 0;
        for (Path path : candidates) {
            if (isCancellationRequested()) {
                state = LoadSessionState.CANCELLED;
                log.info("Load session cancelled: operationId={}, loaded={}, failed={}",
                    getOperationId(), loaded, failed);
                publish(Cancelled.of(getOperationId(), summary()));
                return;
            }

            loadOne(path);
            done++;
            publish(LoadProgress.of(getOperationId(), done, total, path));
        }

        state = LoadSessionState.COMPLETED;
        log.info("Load session completed: operationId={}, loaded={}, failed={}", getOperationId(), loaded, failed);
        publish(LoadCompleted.of(getOperationId(), summary()));
    }

    private void loadOne(Path path) throws InterruptedException {
        try {
            DecodedImage decoded = decoder.decode(path);
            ImageJob job = ImageJob.loaded(path, decoded);
            loaded++;
            log.debug("Loaded {} ({}x{} {})", path, decoded.width(), decoded.height(), decoded.sourceFormat());
            publish(ItemLoaded.of(getOperationId(), job));
        } catch (ImageDecodeException e) {
            log.error("Failed to load {}: {} ({})", path, e.getKind(), e.getMessage());
            recordFailure(path, e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error loading {}", path, e);
            recordFailure(path, FailureKind.UNEXPECTED, String.valueOf(e.getMessage()));
        }
    }

    private void recordFailure(Path path, FailureKind kind, String reason) throws InterruptedException {
        failures.add(new LoadFailure(path, kind, reason));
        failed++;
        publish(LoadItemFailed.of(getOperationId(), path, kind, reason));
    }

    private LoadSummary summary() {
        return new LoadSummary(total, loaded, failures, overflow);
    }

    @Override
    protected ProgressMessage fatalMessage(Exception failure) {
        if (failure instanceof InterruptedException) {
            state = LoadSessionState.CANCELLED;
            return Cancelled.of(getOperationId(), summary());
        }
        if (state == LoadSessionState.SCANNING) {
            state = LoadSessionState.COMPLETED;
            return SetupFailed.of(getOperationId(), "Scan failed: " + failure.getMessage());
        }
        state = LoadSessionState.COMPLETED;
        return LoadCompleted.of(getOperationId(), summary());
    }

    public boolean isRetry() {
        return retryPaths != null;
    }

    public LoadSessionState getState() {
        return state;
    }

    public int getLoadedCount() {
        return loaded;
    }

    public int getFailedCount() {
        return failed;
    }
}
