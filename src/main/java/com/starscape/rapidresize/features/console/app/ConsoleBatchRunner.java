package com.starscape.rapidresize.features.console.app;

import com.starscape.rapidresize.common.config.ConsoleProperties;
import com.starscape.rapidresize.common.config.ProcessingProperties;
import com.starscape.rapidresize.common.exception.InvalidRequestException;
import com.starscape.rapidresize.features.loadimages.domain.LoadRequest;
import com.starscape.rapidresize.features.metadata.domain.MetadataEdit;
import com.starscape.rapidresize.features.metadata.domain.MetadataSettings;
import com.starscape.rapidresize.features.runsummary.app.RunSummaryRecorder;
import com.starscape.rapidresize.features.runsummary.domain.RunSummary;
import com.starscape.rapidresize.features.savebatch.app.BatchRunHandle;
import com.starscape.rapidresize.features.savebatch.domain.BatchSaveStats;
import com.starscape.rapidresize.features.savebatch.domain.SaveOptions;
import com.starscape.rapidresize.features.trackprogress.api.dto.Cancelled;
import com.starscape.rapidresize.features.trackprogress.api.dto.LoadCompleted;
import com.starscape.rapidresize.features.trackprogress.api.dto.LoadItemFailed;
import com.starscape.rapidresize.features.trackprogress.api.dto.LoadProgress;
import com.starscape.rapidresize.features.trackprogress.api.dto.ProgressMessage;
import com.starscape.rapidresize.features.trackprogress.api.dto.SaveCompleted;
import com.starscape.rapidresize.features.trackprogress.api.dto.SaveItemFailed;
import com.starscape.rapidresize.features.trackprogress.api.dto.SaveProgress;
import com.starscape.rapidresize.features.trackprogress.api.dto.ScanCompleted;
import com.starscape.rapidresize.features.trackprogress.api.dto.SetupFailed;
import com.starscape.rapidresize.features.workingset.app.WorkingSet;
import com.starscape.rapidresize.features.workingset.app.WorkingSetFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Drives one load-and-save pass from app.console.* properties, the same way an interactive
 * front end would: start an operation, then poll its handle until the terminal message.
 */
@Component
@ConditionalOnProperty(prefix = "app.console", name = "enabled", havingValue = "true")
public class ConsoleBatchRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ConsoleBatchRunner.class);

    private final WorkingSetFactory workingSetFactory;
    private final RunSummaryRecorder runSummaryRecorder;
    private final ConsoleProperties console;
    private final ProcessingProperties processing;

    public ConsoleBatchRunner(
            WorkingSetFactory workingSetFactory,
            RunSummaryRecorder runSummaryRecorder,
            ConsoleProperties console,
            ProcessingProperties processing) {
        this.workingSetFactory = workingSetFactory;
        this.runSummaryRecorder = runSummaryRecorder;
        this.console = console;
        this.processing = processing;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        SaveOptions options = buildSaveOptions();
        WorkingSet workingSet = workingSetFactory.create();

        workingSet.load(buildLoadRequest());
        drain(workingSet);
        if (workingSet.size() == 0) {
            log.warn("Nothing to save");
            return;
        }

        BatchSaveStats stats = runSave(workingSet, workingSet.save(options), options);
        if (console.isRetryFailed() && stats != null && stats.failed() > 0) {
            log.info("Retrying {} failed items", stats.failed());
            runSave(workingSet, workingSet.retryFailedSaves(options), options);
        }
    }

    private BatchSaveStats runSave(WorkingSet workingSet, BatchRunHandle handle, SaveOptions options)
            throws InterruptedException {
        Instant startedAt = Instant.now();
        ProgressMessage terminal = drain(workingSet);
        BatchSaveStats stats = workingSet.getLastSaveStats();
        if (stats == null) {
            return null;
        }
        try {
            runSummaryRecorder.append(RunSummary.of(handle.getOperationId(), terminal instanceof Cancelled,
                startedAt, options, stats));
        } catch (IOException e) {
            log.error("Failed to record run summary: {}", e.getMessage(), e);
        }
        return stats;
    }

    /**
     * Poll until the active operation finishes, reporting each message.
     *
     * @return the terminal message
     */
    private ProgressMessage drain(WorkingSet workingSet) throws InterruptedException {
        ProgressMessage last = null;
        while (workingSet.isBusy()) {
            List<ProgressMessage> messages = workingSet.pump();
            for (ProgressMessage message : messages) {
                report(message);
                last = message;
            }
            if (workingSet.isBusy()) {
                Thread.sleep(processing.getPollInterval().toMillis());
            }
        }
        return last;
    }

    private void report(ProgressMessage message) {
        if (message instanceof ScanCompleted scan) {
            log.info("Found {} images{}", scan.total(), scan.overflow() ? " (limit reached)" : "");
        } else if (message instanceof LoadProgress progress) {
            log.info("Loading {}/{} ({}%) {}", progress.done(), progress.total(), progress.percent(),
                progress.currentPath().getFileName());
        } else if (message instanceof LoadItemFailed failed) {
            log.warn("Could not load {}: {}", failed.path(), failed.reason());
        } else if (message instanceof LoadCompleted completed) {
            log.info("Loaded {} images, {} failed", completed.succeeded(), completed.failed());
        } else if (message instanceof SaveProgress progress) {
            log.info("Saving {}/{} ({}%) {}", progress.done(), progress.total(), progress.percent(),
                progress.currentPath().getFileName());
        } else if (message instanceof SaveItemFailed failed) {
            log.warn("Could not save {}: {}{}", failed.sourcePath(), failed.reason(),
                failed.retryable() ? " (retryable)" : "");
        } else if (message instanceof SaveCompleted completed) {
            log.info("Run finished: {}", completed.stats());
        } else if (message instanceof Cancelled cancelled) {
            log.info("Cancelled after {} completed, {} failed",
                cancelled.partial().completedCount(), cancelled.partial().failedCount());
        } else if (message instanceof SetupFailed setupFailed) {
            log.warn("Nothing loaded: {}", setupFailed.reason());
        }
    }

    LoadRequest buildLoadRequest() {
        if (console.getSources() == null || console.getSources().isEmpty()) {
            throw new InvalidRequestException("app.console.sources must name at least one file or directory");
        }
        List<Path> roots = console.getSources().stream().map(Path::of).toList();
        return new LoadRequest(roots, console.isRecursive(), new LinkedHashSet<>(processing.getSupportedExtensions()));
    }

    SaveOptions buildSaveOptions() {
        if (console.getOutputDir() == null || console.getOutputDir().isBlank()) {
            throw new InvalidRequestException("app.console.output-dir is required");
        }
        MetadataEdit edit = new MetadataEdit(console.getEditArtist(), console.getEditCopyright(),
            console.getEditDescription(), console.getEditDateTimeOriginal());
        return new SaveOptions(
            Path.of(console.getOutputDir()),
            console.getFormat(),
            console.getMaxDimension(),
            console.getQuality(),
            console.getBalance(),
            new MetadataSettings(console.getMetadata(), edit, console.isRemoveGps()),
            console.isDryRun());
    }
}
