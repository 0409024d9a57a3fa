package com.starscape.rapidresize.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Configuration properties for discovery, loading and batch saving.
 * Binds to app.processing.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.processing")
public class ProcessingProperties {

    private List<String> supportedExtensions = new ArrayList<>(List.of("jpg", "jpeg", "png"));
    private int maxFiles = 0;
    private int scanProgressInterval = 40;
    private int channelCapacity = 8;
    private int pollBatchSize = 30;
    private Duration pollInterval = Duration.ofMillis(40);
    private int saveRetryAttempts = 2;
    private Duration saveRetryDelay = Duration.ofMillis(350);
    private Duration maxSaveRetryDelay = Duration.ofMillis(1500);
    private int workerThreads = 2;
    private Duration cancelTimeout = Duration.ofSeconds(30);
    private String runSummaryFile = "rapid-resize-runs.json";

    public List<String> getSupportedExtensions() {
        return supportedExtensions;
    }

    public void setSupportedExtensions(List<String> supportedExtensions) {
        this.supportedExtensions = supportedExtensions;
    }

    /**
     * Maximum number of candidates a load session materializes. 0 means unlimited.
     */
    public int getMaxFiles() {
        return maxFiles;
    }

    public void setMaxFiles(int maxFiles) {
        this.maxFiles = maxFiles;
    }

    public int getScanProgressInterval() {
        return scanProgressInterval;
    }

    public void setScanProgressInterval(int scanProgressInterval) {
        this.scanProgressInterval = scanProgressInterval;
    }

    public int getChannelCapacity() {
        return channelCapacity;
    }

    public void setChannelCapacity(int channelCapacity) {
        this.channelCapacity = channelCapacity;
    }

    public int getPollBatchSize() {
        return pollBatchSize;
    }

    public void setPollBatchSize(int pollBatchSize) {
        this.pollBatchSize = pollBatchSize;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getSaveRetryAttempts() {
        return saveRetryAttempts;
    }

    public void setSaveRetryAttempts(int saveRetryAttempts) {
        this.saveRetryAttempts = saveRetryAttempts;
    }

    public Duration getSaveRetryDelay() {
        return saveRetryDelay;
    }

    public void setSaveRetryDelay(Duration saveRetryDelay) {
        this.saveRetryDelay = saveRetryDelay;
    }

    public Duration getMaxSaveRetryDelay() {
        return maxSaveRetryDelay;
    }

    public void setMaxSaveRetryDelay(Duration maxSaveRetryDelay) {
        this.maxSaveRetryDelay = maxSaveRetryDelay;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    /**
     * How long a consumer waits for a cancelled load session to stop before giving up.
     */
    public Duration getCancelTimeout() {
        return cancelTimeout;
    }

    public void setCancelTimeout(Duration cancelTimeout) {
        this.cancelTimeout = cancelTimeout;
    }

    public String getRunSummaryFile() {
        return runSummaryFile;
    }

    public void setRunSummaryFile(String runSummaryFile) {
        this.runSummaryFile = runSummaryFile;
    }

    public static String normalizeExtension(String extension) {
        String trimmed = extension.toLowerCase(Locale.ROOT).trim();
        return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
    }
}
