package com.starscape.rapidresize.features.trackprogress.api.dto;

import com.starscape.rapidresize.features.loadimages.domain.LoadSummary;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Terminal message of a load session that ran to the end.
 */
public record LoadCompleted(
    String operationId,
    LoadSummary summary,
    Instant occurredOn
) implements ProgressMessage {

    public static LoadCompleted of(String operationId, LoadSummary summary) {
        return new LoadCompleted(operationId, summary, Instant.now());
    }

    public int succeeded() {
        return summary.succeeded();
    }

    public int failed() {
        return summary.failed();
    }

    public List<Path> failedPaths() {
        return summary.failedPaths();
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public String getMessageType() {
        return "LoadCompleted";
    }

    @Override
    public String getOperationId() {
        return operationId;
    }

    @Override
    public Instant getOccurredOn() {
        return occurredOn;
    }
}
