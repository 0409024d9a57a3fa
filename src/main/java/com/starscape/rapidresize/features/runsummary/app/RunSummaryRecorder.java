package com.starscape.rapidresize.features.runsummary.app;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.rapidresize.common.config.ProcessingProperties;
import com.starscape.rapidresize.features.runsummary.domain.RunSummary;
import com.starscape.rapidresize.features.savebatch.infra.AtomicFileWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Appends run summaries to a JSON array file, newest last. The file is replaced atomically on
 * every append and keeps at most {@value #MAX_ENTRIES} entries.
 */
@Service
public class RunSummaryRecorder {

    private static final Logger log = LoggerFactory.getLogger(RunSummaryRecorder.class);

    static final int MAX_ENTRIES = 200;

    private static final TypeReference<List<RunSummary>> SUMMARY_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final AtomicFileWriter fileWriter;
    private final Path logFile;

    @Autowired
    public RunSummaryRecorder(ObjectMapper objectMapper, AtomicFileWriter fileWriter,
                              ProcessingProperties properties) {
        this(objectMapper, fileWriter, Path.of(properties.getRunSummaryFile()));
    }

    public RunSummaryRecorder(ObjectMapper objectMapper, AtomicFileWriter fileWriter, Path logFile) {
        this.objectMapper = objectMapper;
        this.fileWriter = fileWriter;
        this.logFile = logFile;
    }

    public void append(RunSummary summary) throws IOException {
        List<RunSummary> entries = new ArrayList<>(readAll());
        entries.add(summary);
        if (entries.size() > MAX_ENTRIES) {
            entries = new ArrayList<>(entries.subList(entries.size() - MAX_ENTRIES, entries.size()));
        }
        byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(entries);
        fileWriter.write(logFile, json);
        log.info("Recorded run summary: operationId={}, file={}", summary.operationId(), logFile);
    }

    /**
     * @return recorded summaries, oldest first; empty if the file does not exist yet
     */
    public List<RunSummary> readAll() throws IOException {
        if (!Files.exists(logFile)) {
            return List.of();
        }
        byte[] content = Files.readAllBytes(logFile);
        if (content.length == 0) {
            return List.of();
        }
        return objectMapper.readValue(content, SUMMARY_LIST);
    }

    public Path getLogFile() {
        return logFile;
    }
}
