package com.starscape.rapidresize.features.workingset.app;

import com.starscape.rapidresize.common.config.ProcessingProperties;
import com.starscape.rapidresize.features.loadimages.app.LoadSessionService;
import com.starscape.rapidresize.features.savebatch.app.BatchSaveController;
import org.springframework.stereotype.Component;

/**
 * Creates working sets. Each consumer owns its own; nothing is shared between them.
 */
@Component
public class WorkingSetFactory {

    private final LoadSessionService loadSessionService;
    private final BatchSaveController batchSaveController;
    private final ProcessingProperties properties;

    public WorkingSetFactory(LoadSessionService loadSessionService, BatchSaveController batchSaveController,
                             ProcessingProperties properties) {
        this.loadSessionService = loadSessionService;
        this.batchSaveController = batchSaveController;
        this.properties = properties;
    }

    public WorkingSet create() {
        return new WorkingSet(loadSessionService, batchSaveController,
            properties.getPollBatchSize(), properties.getPollInterval(), properties.getCancelTimeout());
    }
}
