package com.starscape.rapidresize.features.savebatch.infra;

import com.starscape.rapidresize.common.domain.FailureKind;
import com.starscape.rapidresize.common.exception.AtomicWriteException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class AtomicFileWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteNewFileAndCreateParents() throws Exception {
        Path destination = tempDir.resolve("nested/out/photo_resized.jpg");

        new AtomicFileWriter().write(destination, bytes("new content"));

        assertEquals("new content", Files.readString(destination));
        assertNoTemporaryFiles(destination.getParent());
    }

    @Test
    void shouldReplaceExistingFile() throws Exception {
        Path destination = Files.writeString(tempDir.resolve("photo.jpg"), "old");

        new AtomicFileWriter().write(destination, bytes("replacement"));

        assertEquals("replacement", Files.readString(destination));
        assertNoTemporaryFiles(tempDir);
    }

    @Test
    void shouldLeaveDestinationUntouchedWhenWriteFails() throws Exception {
        Path destination = Files.writeString(tempDir.resolve("photo.jpg"), "old");
        AtomicFileWriter failing = new AtomicFileWriter() {
            @Override
            protected void writeTemporary(Path temp, byte[] bytes) throws IOException {
                Files.write(temp, new byte[] {1, 2, 3});
                throw new IOException("simulated failure mid-write");
            }
        };

        AtomicWriteException e = assertThrows(AtomicWriteException.class,
                () -> failing.write(destination, bytes("replacement")));

        assertEquals(FailureKind.IO_ERROR, e.getKind());
        assertEquals("old", Files.readString(destination));
        assertNoTemporaryFiles(tempDir);
    }

    @Test
    void shouldLeaveNoFileWhenRenameFails() throws Exception {
        Path destination = tempDir.resolve("photo.jpg");
        AtomicFileWriter failing = new AtomicFileWriter() {
            @Override
            protected void moveIntoPlace(Path temp, Path target) throws IOException {
                throw new FileSystemException(target.toString(), null,
                        "The process cannot access the file because it is being used by another process");
            }
        };

        AtomicWriteException e = assertThrows(AtomicWriteException.class,
                () -> failing.write(destination, bytes("data")));

        assertEquals(FailureKind.LOCKED, e.getKind());
        assertTrue(e.isRetryable());
        assertFalse(Files.exists(destination));
        assertNoTemporaryFiles(tempDir);
    }

    @Test
    void shouldReportNoSpaceBeforeWriting() {
        Path destination = tempDir.resolve("photo.jpg");
        AtomicFileWriter full = new AtomicFileWriter() {
            @Override
            protected long usableSpace(Path directory) {
                return 2;
            }
        };

        AtomicWriteException e = assertThrows(AtomicWriteException.class,
                () -> full.write(destination, bytes("more than two bytes")));

        assertEquals(FailureKind.NO_SPACE, e.getKind());
        assertFalse(e.isRetryable());
        assertFalse(Files.exists(destination));
    }

    @Test
    void shouldRejectOverlongFileName() {
        Path destination = tempDir.resolve("x".repeat(300) + ".jpg");

        AtomicWriteException e = assertThrows(AtomicWriteException.class,
                () -> new AtomicFileWriter().write(destination, bytes("data")));

        assertEquals(FailureKind.PATH_TOO_LONG, e.getKind());
    }

    @Test
    void shouldClassifyPlatformErrors() {
        Path destination = tempDir.resolve("photo.jpg");

        assertEquals(FailureKind.PERMISSION_DENIED,
                AtomicFileWriter.classify(destination, new AccessDeniedException("photo.jpg")).getKind());
        assertEquals(FailureKind.PERMISSION_DENIED,
                AtomicFileWriter.classify(destination,
                        new FileSystemException("photo.jpg", null, "Read-only file system")).getKind());
        assertEquals(FailureKind.PATH_TOO_LONG,
                AtomicFileWriter.classify(destination,
                        new FileSystemException("photo.jpg", null, "File name too long")).getKind());
        assertEquals(FailureKind.NO_SPACE,
                AtomicFileWriter.classify(destination, new IOException("No space left on device")).getKind());
        assertEquals(FailureKind.INVALID_NAME,
                AtomicFileWriter.classify(destination, new IOException("Invalid argument")).getKind());
        assertEquals(FailureKind.IO_ERROR,
                AtomicFileWriter.classify(destination, new IOException("Input/output error")).getKind());
    }

    private static byte[] bytes(String content) {
        return content.getBytes(StandardCharsets.UTF_8);
    }

    private static void assertNoTemporaryFiles(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")),
                    "temporary file left behind in " + directory);
        }
    }
}
