package com.starscape.rapidresize.features.loadimages.domain;

import com.starscape.rapidresize.features.trackprogress.api.dto.OperationSummary;

import java.nio.file.Path;
import java.util.List;

/**
 * Final or partial counts of a load session.
 *
 * @param total candidates the session set out to load
 * @param succeeded candidates decoded into jobs
 * @param failures decode failures in processing order
 * @param overflow whether discovery found more candidates than the configured maximum
 */
public record LoadSummary(
    int total,
    int succeeded,
    List<LoadFailure> failures,
    boolean overflow
) implements OperationSummary {

    public LoadSummary {
        failures = List.copyOf(failures);
    }

    public int failed() {
        return failures.size();
    }

    @Override
    public List<Path> failedPaths() {
        return failures.stream().map(LoadFailure::path).toList();
    }

    @Override
    public int completedCount() {
        return succeeded;
    }

    @Override
    public int failedCount() {
        return failed();
    }
}
