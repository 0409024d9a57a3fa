package com.starscape.rapidresize.features.savebatch.app;

import com.drew.imaging.ImageMetadataReader;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.GpsDirectory;
import com.starscape.rapidresize.common.config.ProcessingProperties;
import com.starscape.rapidresize.common.domain.FailureKind;
import com.starscape.rapidresize.common.exception.InvalidRequestException;
import com.starscape.rapidresize.features.loadimages.domain.ImageJob;
import com.starscape.rapidresize.features.loadimages.domain.JobState;
import com.starscape.rapidresize.features.metadata.domain.MetadataEdit;
import com.starscape.rapidresize.features.metadata.domain.MetadataPolicy;
import com.starscape.rapidresize.features.savebatch.domain.BatchSaveStats;
import com.starscape.rapidresize.features.savebatch.domain.SaveOptions;
import com.starscape.rapidresize.features.savebatch.infra.AtomicFileWriter;
import com.starscape.rapidresize.features.trackprogress.api.dto.Cancelled;
import com.starscape.rapidresize.features.trackprogress.api.dto.ItemSaved;
import com.starscape.rapidresize.features.trackprogress.api.dto.ProgressMessage;
import com.starscape.rapidresize.features.trackprogress.api.dto.SaveCompleted;
import com.starscape.rapidresize.features.trackprogress.api.dto.SaveItemFailed;
import com.starscape.rapidresize.features.trackprogress.api.dto.SaveProgress;
import com.starscape.rapidresize.features.transcode.domain.OutputFormat;
import com.starscape.rapidresize.integration.TestPipeline;
import com.starscape.rapidresize.integration.TestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

class BatchSaveControllerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldSaveAllJobsAndConserveCounts() throws Exception {
        Path outputDir = tempDir.resolve("out");
        List<ImageJob> jobs = jobs(4, 1600, 1200);
        TestPipeline pipeline = TestPipeline.create();

        List<ProgressMessage> messages = TestUtils.drain(
                pipeline.batchSaveController.start(jobs, SaveOptions.defaults(outputDir).withMaxDimension(400)));

        BatchSaveStats stats = ((SaveCompleted) TestUtils.last(messages)).stats();
        assertEquals(4, stats.succeeded());
        assertEquals(0, stats.failed());
        assertEquals(jobs.size(), stats.total());
        assertEquals(4, TestUtils.ofType(messages, ItemSaved.class).size());
        assertEquals(4, TestUtils.ofType(messages, SaveProgress.class).size());
        assertEquals(1, messages.stream().filter(ProgressMessage::isTerminal).count());

        List<Path> written = TestUtils.listFiles(outputDir);
        assertEquals(4, written.size());
        assertTrue(written.stream().allMatch(p -> p.getFileName().toString().endsWith("_resized.jpg")));
        assertEquals(stats.bytesWritten(), written.stream().mapToLong(BatchSaveControllerTest::size).sum());
        assertTrue(jobs.stream().allMatch(j -> j.getState() == JobState.SUCCEEDED));
    }

    @Test
    void shouldEstimateWithoutWritingOnDryRun() throws Exception {
        Path outputDir = tempDir.resolve("dry");
        List<ImageJob> jobs = jobs(5, 800, 600);
        TestPipeline pipeline = TestPipeline.create();

        List<ProgressMessage> messages = TestUtils.drain(
                pipeline.batchSaveController.start(jobs, SaveOptions.defaults(outputDir).withDryRun(true)));

        BatchSaveStats stats = ((SaveCompleted) TestUtils.last(messages)).stats();
        assertEquals(5, stats.dryRun());
        assertEquals(0, stats.succeeded());
        assertEquals(0, stats.bytesWritten());
        assertEquals(5, stats.completedCount());
        List<ItemSaved> saved = TestUtils.ofType(messages, ItemSaved.class);
        assertEquals(5, saved.size());
        assertTrue(saved.stream().allMatch(m -> m.result().dryRun() && m.result().size() > 0));
        assertFalse(Files.exists(outputDir));
    }

    @Test
    void shouldReturnEqualEstimatesForRepeatedDryRuns() throws Exception {
        Path outputDir = tempDir.resolve("dry");
        List<ImageJob> jobs = jobs(3, 900, 700);
        TestPipeline pipeline = TestPipeline.create();
        SaveOptions options = SaveOptions.defaults(outputDir).withDryRun(true).withMaxDimension(500);

        List<ProgressMessage> first = TestUtils.drain(pipeline.batchSaveController.start(jobs, options));
        List<ProgressMessage> second = TestUtils.drain(pipeline.batchSaveController.start(jobs, options));

        assertEquals(estimates(first), estimates(second));
        assertEquals(3, ((SaveCompleted) TestUtils.last(second)).stats().dryRun());
        assertFalse(Files.exists(outputDir));
    }

    @Test
    void shouldIsolateFailuresAndRetryOnlyThoseItems() throws Exception {
        Path outputDir = tempDir.resolve("out");
        AtomicBoolean denyB = new AtomicBoolean(true);
        AtomicFileWriter writer = new AtomicFileWriter() {
            @Override
            protected void writeTemporary(Path temp, byte[] bytes) throws IOException {
                if (denyB.get() && temp.getFileName().toString().startsWith(".b_")) {
                    throw new AccessDeniedException(temp.toString());
                }
                super.writeTemporary(temp, bytes);
            }
        };
        TestPipeline pipeline = TestPipeline.withWriter(writer);
        ImageJob a = job("a.jpg", 200, 100);
        ImageJob b = job("b.jpg", 200, 100);
        ImageJob c = job("c.jpg", 200, 100);
        List<ImageJob> jobs = List.of(a, b, c);
        SaveOptions options = SaveOptions.defaults(outputDir);

        List<ProgressMessage> first = TestUtils.drain(pipeline.batchSaveController.start(jobs, options));

        BatchSaveStats stats = ((SaveCompleted) TestUtils.last(first)).stats();
        assertEquals(2, stats.succeeded());
        assertEquals(1, stats.failed());
        assertEquals(List.of(b.getSourcePath()), stats.failedPaths());
        SaveItemFailed failure = TestUtils.ofType(first, SaveItemFailed.class).get(0);
        assertEquals(FailureKind.PERMISSION_DENIED, failure.kind());
        assertFalse(failure.retryable());
        assertEquals(JobState.FAILED, b.getState());

        assertThrows(InvalidRequestException.class, () -> pipeline.batchSaveController.start(jobs, options));

        denyB.set(false);
        List<ProgressMessage> second = TestUtils.drain(pipeline.batchSaveController.retryFailed(jobs, stats, options));

        BatchSaveStats retryStats = ((SaveCompleted) TestUtils.last(second)).stats();
        assertEquals(1, retryStats.succeeded());
        assertEquals(0, retryStats.failed());
        assertEquals(b.getSourcePath(), TestUtils.ofType(second, ItemSaved.class).get(0).sourcePath());
        assertEquals(JobState.SUCCEEDED, b.getState());
        assertEquals(3, TestUtils.listFiles(outputDir).size());
    }

    @Test
    void shouldRetryLockedDestination() throws Exception {
        Set<Path> lockedOnce = ConcurrentHashMap.newKeySet();
        AtomicFileWriter writer = new AtomicFileWriter() {
            @Override
            protected void moveIntoPlace(Path temp, Path destination) throws IOException {
                if (lockedOnce.add(destination)) {
                    throw new FileSystemException(destination.toString(), null,
                            "The process cannot access the file because it is being used by another process");
                }
                super.moveIntoPlace(temp, destination);
            }
        };
        TestPipeline pipeline = TestPipeline.withWriter(writer);

        List<ProgressMessage> messages = TestUtils.drain(pipeline.batchSaveController
                .start(List.of(job("locked.jpg", 100, 100)), SaveOptions.defaults(tempDir.resolve("out"))));

        ItemSaved saved = TestUtils.ofType(messages, ItemSaved.class).get(0);
        assertEquals(2, saved.result().attempts());
        assertTrue(Files.exists(saved.result().outputPath()));
    }

    @Test
    void shouldGiveUpOnPersistentLockAsRetryableFailure() throws Exception {
        AtomicFileWriter writer = new AtomicFileWriter() {
            @Override
            protected void moveIntoPlace(Path temp, Path destination) throws IOException {
                throw new FileSystemException(destination.toString(), null, "Resource temporarily locked");
            }
        };
        TestPipeline pipeline = TestPipeline.withWriter(writer);

        List<ProgressMessage> messages = TestUtils.drain(pipeline.batchSaveController
                .start(List.of(job("locked.jpg", 100, 100)), SaveOptions.defaults(tempDir.resolve("out"))));

        SaveItemFailed failed = TestUtils.ofType(messages, SaveItemFailed.class).get(0);
        assertEquals(FailureKind.LOCKED, failed.kind());
        assertTrue(failed.retryable());
        assertTrue(TestUtils.listFiles(tempDir.resolve("out")).isEmpty());
    }

    @Test
    void shouldStopAfterCurrentItemWhenCancelled() throws Exception {
        AtomicReference<BatchRunHandle> handleRef = new AtomicReference<>();
        CountDownLatch handleReady = new CountDownLatch(1);
        AtomicInteger writes = new AtomicInteger();
        AtomicFileWriter writer = new AtomicFileWriter() {
            @Override
            protected void writeTemporary(Path temp, byte[] bytes) throws IOException {
                try {
                    handleReady.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException(e);
                }
                super.writeTemporary(temp, bytes);
                if (writes.incrementAndGet() == 2) {
                    handleRef.get().cancel();
                }
            }
        };
        TestPipeline pipeline = TestPipeline.withWriter(writer);
        List<ImageJob> jobs = jobs(6, 100, 100);

        BatchRunHandle handle = pipeline.batchSaveController.start(jobs, SaveOptions.defaults(tempDir.resolve("out")));
        handleRef.set(handle);
        handleReady.countDown();
        List<ProgressMessage> messages = TestUtils.drain(handle);

        assertTrue(TestUtils.last(messages) instanceof Cancelled);
        assertEquals(1, messages.stream().filter(ProgressMessage::isTerminal).count());
        BatchSaveStats partial = (BatchSaveStats) ((Cancelled) TestUtils.last(messages)).partial();
        assertEquals(2, partial.succeeded());
        assertEquals(2, TestUtils.listFiles(tempDir.resolve("out")).size());
        assertEquals(4, jobs.stream().filter(j -> j.getState() == JobState.LOADED).count());
    }

    @Test
    void shouldFailInterruptedItemAndPublishTerminal() throws Exception {
        CountDownLatch firstAttempt = new CountDownLatch(1);
        AtomicFileWriter lockedWriter = new AtomicFileWriter() {
            @Override
            protected void moveIntoPlace(Path temp, Path destination) throws IOException {
                firstAttempt.countDown();
                throw new FileSystemException(destination.toString(), null, "Resource temporarily locked");
            }
        };
        ProcessingProperties properties = TestPipeline.testProperties();
        properties.setSaveRetryDelay(Duration.ofSeconds(5));
        properties.setMaxSaveRetryDelay(Duration.ofSeconds(5));
        TestPipeline pipeline = new TestPipeline(properties, null, lockedWriter);
        ImageJob job = job("locked.jpg", 100, 100);
        SaveOptions options = SaveOptions.defaults(tempDir.resolve("out"));

        BatchRunHandle handle = pipeline.batchSaveController.start(List.of(job), options);
        assertTrue(firstAttempt.await(10, TimeUnit.SECONDS));
        ((ThreadPoolTaskExecutor) pipeline.executor).shutdown();

        assertTrue(handle.awaitWorker(Duration.ofSeconds(10)));
        List<ProgressMessage> messages = handle.poll(10);
        assertTrue(handle.isFinished());
        assertTrue(TestUtils.last(messages) instanceof Cancelled);
        BatchSaveStats partial = (BatchSaveStats) ((Cancelled) TestUtils.last(messages)).partial();
        assertEquals(List.of(job.getSourcePath()), partial.failedPaths());
        assertEquals(JobState.FAILED, job.getState());
        assertEquals(FailureKind.INTERRUPTED, job.getLastFailureKind());

        List<ProgressMessage> retry = TestUtils.drain(
                TestPipeline.create().batchSaveController.retryFailed(List.of(job), partial, options));

        assertEquals(1, ((SaveCompleted) TestUtils.last(retry)).stats().succeeded());
        assertEquals(JobState.SUCCEEDED, job.getState());
    }

    @Test
    void shouldRemoveAllMetadataIncludingLocation() throws Exception {
        Path outputDir = tempDir.resolve("out");
        TestPipeline pipeline = TestPipeline.create();
        ImageJob job = exifJob(pipeline);

        List<ProgressMessage> messages = TestUtils.drain(pipeline.batchSaveController.start(List.of(job),
                SaveOptions.defaults(outputDir).withMetadata(MetadataPolicy.REMOVE, null, true)));

        BatchSaveStats stats = ((SaveCompleted) TestUtils.last(messages)).stats();
        assertEquals(1, stats.gpsRemoved());
        assertEquals(0, stats.metadataApplied());
        Metadata written = readMetadata(TestUtils.ofType(messages, ItemSaved.class).get(0).result().outputPath());
        assertNull(written.getFirstDirectoryOfType(ExifIFD0Directory.class));
        assertNull(written.getFirstDirectoryOfType(GpsDirectory.class));
    }

    @Test
    void shouldEditMetadataAndStripLocation() throws Exception {
        TestPipeline pipeline = TestPipeline.create();
        ImageJob job = exifJob(pipeline);
        MetadataEdit edit = new MetadataEdit("Edited Artist", null, null, null);

        List<ProgressMessage> messages = TestUtils.drain(pipeline.batchSaveController.start(List.of(job),
                SaveOptions.defaults(tempDir.resolve("out")).withMetadata(MetadataPolicy.EDIT, edit, true)));

        ItemSaved saved = TestUtils.ofType(messages, ItemSaved.class).get(0);
        assertTrue(saved.result().gpsRemoved());
        assertEquals(List.of("Artist"), saved.result().editedFields());
        Metadata written = readMetadata(saved.result().outputPath());
        assertEquals("Edited Artist",
                written.getFirstDirectoryOfType(ExifIFD0Directory.class).getString(ExifDirectoryBase.TAG_ARTIST));
        assertNull(written.getFirstDirectoryOfType(GpsDirectory.class));
    }

    @Test
    void shouldKeepExifInPngOutput() throws Exception {
        TestPipeline pipeline = TestPipeline.create();
        ImageJob job = exifJob(pipeline);

        List<ProgressMessage> messages = TestUtils.drain(pipeline.batchSaveController.start(List.of(job),
                SaveOptions.defaults(tempDir.resolve("out")).withFormat(OutputFormat.PNG)
                        .withMetadata(MetadataPolicy.KEEP, null, true)));

        BatchSaveStats stats = ((SaveCompleted) TestUtils.last(messages)).stats();
        assertEquals(1, stats.metadataApplied());
        assertEquals(0, stats.metadataFallback());
        Path output = TestUtils.ofType(messages, ItemSaved.class).get(0).result().outputPath();
        assertTrue(output.getFileName().toString().endsWith(".png"));
        Metadata written = readMetadata(output);
        assertEquals("Original Artist",
                written.getFirstDirectoryOfType(ExifIFD0Directory.class).getString(ExifDirectoryBase.TAG_ARTIST));
        assertNull(written.getFirstDirectoryOfType(GpsDirectory.class));
    }

    @Test
    void shouldSaveWithoutMetadataWhenBlockIsTooLarge() throws Exception {
        TestPipeline pipeline = TestPipeline.create();
        ImageJob job = exifJob(pipeline);
        MetadataEdit edit = new MetadataEdit(null, null, "x".repeat(70_000), null);

        List<ProgressMessage> messages = TestUtils.drain(pipeline.batchSaveController.start(List.of(job),
                SaveOptions.defaults(tempDir.resolve("out")).withMetadata(MetadataPolicy.EDIT, edit, false)));

        BatchSaveStats stats = ((SaveCompleted) TestUtils.last(messages)).stats();
        assertEquals(1, stats.succeeded());
        assertEquals(1, stats.metadataFallback());
        Metadata written = readMetadata(TestUtils.ofType(messages, ItemSaved.class).get(0).result().outputPath());
        assertNull(written.getFirstDirectoryOfType(ExifIFD0Directory.class));
    }

    @Test
    void shouldSaveWebpRequestAsJpegWithoutWebpWriter() throws Exception {
        TestPipeline pipeline = TestPipeline.create();
        assumeFalse(pipeline.transcodeEngine.isWriterAvailable(OutputFormat.WEBP), "WebP writer installed");

        List<ProgressMessage> messages = TestUtils.drain(pipeline.batchSaveController.start(
                List.of(job("photo.jpg", 300, 200)),
                SaveOptions.defaults(tempDir.resolve("out")).withFormat(OutputFormat.WEBP)));

        ItemSaved saved = TestUtils.ofType(messages, ItemSaved.class).get(0);
        assertEquals(OutputFormat.JPEG, saved.result().format());
        assertTrue(saved.result().outputPath().getFileName().toString().endsWith("_resized.jpg"));
    }

    @Test
    void shouldRejectInvalidRuns() throws Exception {
        TestPipeline pipeline = TestPipeline.create();
        Path notADirectory = Files.writeString(tempDir.resolve("file.txt"), "x");
        ImageJob released = job("released.jpg", 10, 10);
        released.release();

        assertThrows(InvalidRequestException.class,
                () -> pipeline.batchSaveController.start(List.of(), SaveOptions.defaults(tempDir)));
        assertThrows(InvalidRequestException.class,
                () -> pipeline.batchSaveController.start(List.of(job("a.jpg", 10, 10)), SaveOptions.defaults(notADirectory)));
        assertThrows(InvalidRequestException.class,
                () -> pipeline.batchSaveController.start(List.of(released), SaveOptions.defaults(tempDir)));
        assertThrows(InvalidRequestException.class,
                () -> pipeline.batchSaveController.start(List.of(new ImageJob(tempDir.resolve("x.jpg"))),
                        SaveOptions.defaults(tempDir)));
        assertThrows(InvalidRequestException.class,
                () -> pipeline.batchSaveController.retryFailed(List.of(job("a.jpg", 10, 10)), new BatchSaveStats(),
                        SaveOptions.defaults(tempDir)));
    }

    @Test
    void shouldCapRetryDelay() {
        TestPipeline pipeline = TestPipeline.create();

        assertEquals(10, pipeline.itemSaver.retryDelay(1).toMillis());
        assertEquals(30, pipeline.itemSaver.retryDelay(3).toMillis());
        assertEquals(50, pipeline.itemSaver.retryDelay(20).toMillis());
    }

    private static List<Long> estimates(List<ProgressMessage> messages) {
        return TestUtils.ofType(messages, ItemSaved.class).stream().map(m -> m.result().size()).toList();
    }

    private ImageJob exifJob(TestPipeline pipeline) throws Exception {
        Path source = TestUtils.writeFile(tempDir.resolve("src"), "gps.jpg",
                TestUtils.createJpegWithExif(300, 200, true, "Original Artist"));
        return ImageJob.loaded(source, pipeline.decoder.decode(source));
    }

    private List<ImageJob> jobs(int count, int width, int height) {
        List<ImageJob> jobs = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            jobs.add(job("photo" + i + ".jpg", width, height));
        }
        return jobs;
    }

    private ImageJob job(String name, int width, int height) {
        return ImageJob.loaded(tempDir.resolve("src").resolve(name), TestUtils.decodedImage(width, height));
    }

    private static Metadata readMetadata(Path file) throws Exception {
        return ImageMetadataReader.readMetadata(file.toFile());
    }

    private static long size(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
