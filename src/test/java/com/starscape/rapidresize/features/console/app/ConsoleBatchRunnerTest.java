package com.starscape.rapidresize.features.console.app;

import com.starscape.rapidresize.features.runsummary.app.RunSummaryRecorder;
import com.starscape.rapidresize.features.runsummary.domain.RunSummary;
import com.starscape.rapidresize.integration.BaseIntegrationTest;
import com.starscape.rapidresize.integration.TestUtils;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The runner executes during context startup, so the source folder is prepared before the context exists.
 */
class ConsoleBatchRunnerTest extends BaseIntegrationTest {

    private static final Path SOURCE_DIR = WORK_DIR.resolve("console-source");
    private static final Path OUTPUT_DIR = WORK_DIR.resolve("console-output");

    @Autowired
    private RunSummaryRecorder runSummaryRecorder;

    @DynamicPropertySource
    static void consoleProperties(DynamicPropertyRegistry registry) {
        try {
            for (int i = 0; i < 3; i++) {
                TestUtils.writeFile(SOURCE_DIR, "shot" + i + ".jpg", TestUtils.createTestImage(900, 600));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        registry.add("app.console.enabled", () -> "true");
        registry.add("app.console.sources", SOURCE_DIR::toString);
        registry.add("app.console.output-dir", OUTPUT_DIR::toString);
        registry.add("app.console.format", () -> "PNG");
        registry.add("app.console.max-dimension", () -> "300");
    }

    @Test
    void shouldRunLoadAndSaveAtStartup() throws Exception {
        List<Path> outputs = TestUtils.listFiles(OUTPUT_DIR);
        assertEquals(3, outputs.size());
        assertTrue(outputs.stream().allMatch(p -> p.toString().endsWith("_resized.png")));

        List<RunSummary> runs = runSummaryRecorder.readAll();
        RunSummary last = runs.get(runs.size() - 1);
        assertEquals("COMPLETED", last.outcome());
        assertEquals(3, last.succeeded());
        assertEquals("PNG", last.format());
        assertEquals(300, last.maxDimension());
    }
}
