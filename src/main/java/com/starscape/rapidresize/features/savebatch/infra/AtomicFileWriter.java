package com.starscape.rapidresize.features.savebatch.infra;

import com.starscape.rapidresize.common.domain.FailureKind;
import com.starscape.rapidresize.common.exception.AtomicWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Writes files so that the destination path only ever shows the old content or the complete
 * new content.
 *
 * Data goes to a hidden sibling {@code .<name>.<random>.tmp} first and is then renamed over the
 * destination. If anything fails before the rename, the temporary file is removed and the
 * destination is untouched.
 */
@Component
public class AtomicFileWriter {

    private static final Logger log = LoggerFactory.getLogger(AtomicFileWriter.class);

    static final int MAX_NAME_BYTES = 255;
    static final int MAX_PATH_LENGTH = 4096;
    private static final int MAX_TEMP_BASE_LENGTH = 200;

    public void write(Path destination, byte[] bytes) throws AtomicWriteException {
        Path target = destination.toAbsolutePath();
        validate(target);
        Path parent = target.getParent();

        try {
            Files.createDirectories(parent);
        } catch (IOException | RuntimeException e) {
            throw classify(target, e);
        }
        checkFreeSpace(target, parent, bytes.length);

        Path temp = parent.resolve(temporaryName(target));
        try {
            writeTemporary(temp, bytes);
            moveIntoPlace(temp, target);
        } catch (IOException | RuntimeException e) {
            deleteTemporary(temp);
            throw classify(target, e);
        }
        log.debug("Wrote {} bytes to {}", bytes.length, target);
    }

    protected void writeTemporary(Path temp, byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    protected void moveIntoPlace(Path temp, Path destination) throws IOException {
        try {
            Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing instead", destination);
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    protected long usableSpace(Path directory) throws IOException {
        return Files.getFileStore(directory).getUsableSpace();
    }

    private void validate(Path target) throws AtomicWriteException {
        Path fileName = target.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        if (name.isEmpty() || name.equals(".") || name.equals("..") || name.indexOf('\0') >= 0) {
            throw new AtomicWriteException(target, FailureKind.INVALID_NAME, "Invalid file name: '" + name + "'", null);
        }
        if (name.getBytes(StandardCharsets.UTF_8).length > MAX_NAME_BYTES) {
            throw new AtomicWriteException(target, FailureKind.PATH_TOO_LONG,
                "File name exceeds " + MAX_NAME_BYTES + " bytes: " + name, null);
        }
        if (target.toString().length() > MAX_PATH_LENGTH) {
            throw new AtomicWriteException(target, FailureKind.PATH_TOO_LONG,
                "Path exceeds " + MAX_PATH_LENGTH + " characters", null);
        }
    }

    private void checkFreeSpace(Path target, Path parent, long required) throws AtomicWriteException {
        long usable;
        try {
            usable = usableSpace(parent);
        } catch (IOException e) {
            log.debug("Cannot determine free space in {}: {}", parent, e.getMessage());
            return;
        }
        if (usable < required) {
            throw new AtomicWriteException(target, FailureKind.NO_SPACE,
                "Not enough free space in " + parent + ": need " + required + " bytes, " + usable + " available", null);
        }
    }

    private static String temporaryName(Path target) {
        String name = target.getFileName().toString();
        if (name.length() > MAX_TEMP_BASE_LENGTH) {
            name = name.substring(0, MAX_TEMP_BASE_LENGTH);
        }
        String random = Long.toHexString(ThreadLocalRandom.current().nextLong() & 0xffffffffL);
        return "." + name + "." + random + ".tmp";
    }

    private static void deleteTemporary(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temporary file {}: {}", temp, e.getMessage());
        }
    }

    static AtomicWriteException classify(Path destination, Throwable failure) {
        if (failure instanceof AtomicWriteException alreadyClassified) {
            return alreadyClassified;
        }
        String message = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
        String lower = message.toLowerCase(Locale.ROOT);
        if (failure instanceof FileSystemException fsException && fsException.getReason() != null) {
            lower = lower + " " + fsException.getReason().toLowerCase(Locale.ROOT);
        }

        FailureKind kind;
        if (failure instanceof AccessDeniedException || lower.contains("permission denied")
                || lower.contains("access is denied") || lower.contains("read-only file system")) {
            kind = FailureKind.PERMISSION_DENIED;
        } else if (lower.contains("name too long") || lower.contains("path too long")
                || lower.contains("filename or extension is too long")) {
            kind = FailureKind.PATH_TOO_LONG;
        } else if (failure instanceof InvalidPathException || lower.contains("invalid argument")
                || lower.contains("syntax is incorrect")) {
            kind = FailureKind.INVALID_NAME;
        } else if (lower.contains("no space left") || lower.contains("not enough space")
                || lower.contains("disk full") || lower.contains("quota exceeded")) {
            kind = FailureKind.NO_SPACE;
        } else if (lower.contains("being used by another process") || lower.contains("sharing violation")
                || lower.contains("locked")) {
            kind = FailureKind.LOCKED;
        } else {
            kind = FailureKind.IO_ERROR;
        }
        return new AtomicWriteException(destination, kind, kind.getDescription() + ": " + message, failure);
    }
}
