package com.starscape.rapidresize.features.trackprogress.api.dto;

import java.nio.file.Path;
import java.util.List;

/**
 * Counts carried by terminal messages, for load sessions and save runs alike.
 */
public interface OperationSummary {
    int completedCount();
    int failedCount();
    List<Path> failedPaths();
}
