package com.starscape.rapidresize.features.loadimages.app;

import com.starscape.rapidresize.common.config.ProcessingProperties;
import com.starscape.rapidresize.common.exception.InvalidRequestException;
import com.starscape.rapidresize.features.discovery.app.DiscoveredFiles;
import com.starscape.rapidresize.features.discovery.app.ImageDiscovery;
import com.starscape.rapidresize.features.loadimages.domain.LoadRequest;
import com.starscape.rapidresize.features.loadimages.domain.LoadSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Starts load sessions on the worker pool.
 * Requests are validated here, on the caller's thread, before any background work starts.
 */
@Service
public class LoadSessionService {

    private static final Logger log = LoggerFactory.getLogger(LoadSessionService.class);

    private final ImageDiscovery discovery;
    private final ImageDecoder decoder;
    private final ProcessingProperties properties;
    private final TaskExecutor executor;

    public LoadSessionService(
            ImageDiscovery discovery,
            ImageDecoder decoder,
            ProcessingProperties properties,
            @Qualifier("resizeWorkerExecutor") TaskExecutor executor) {
        this.discovery = discovery;
        this.decoder = decoder;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * @throws InvalidRequestException if a root does not exist or the allow-list is empty
     */
    public LoadSessionHandle start(LoadRequest request) {
        DiscoveredFiles files = discovery.discover(request.roots(), request.recursive(), request.extensions());
        LoadSessionHandle handle = new LoadSessionHandle(files, null, decoder,
            properties.getMaxFiles(), properties.getScanProgressInterval(), properties.getChannelCapacity());
        log.info("Starting load session: operationId={}, roots={}", handle.getOperationId(), request.roots());
        handle.start(executor);
        return handle;
    }

    /**
     * Load again exactly the paths that failed in a previous session, deduplicated, in their original order.
     *
     * @throws InvalidRequestException if the previous session had no failures
     */
    public LoadSessionHandle retryFailed(LoadSummary previous) {
        if (previous == null || previous.failedPaths().isEmpty()) {
            throw new InvalidRequestException("Previous load session has no failed paths to retry");
        }
        List<Path> paths = new ArrayList<>(new LinkedHashSet<>(previous.failedPaths()));
        LoadSessionHandle handle = new LoadSessionHandle(null, paths, decoder,
            0, properties.getScanProgressInterval(), properties.getChannelCapacity());
        log.info("Retrying {} failed loads: operationId={}", paths.size(), handle.getOperationId());
        handle.start(executor);
        return handle;
    }
}
