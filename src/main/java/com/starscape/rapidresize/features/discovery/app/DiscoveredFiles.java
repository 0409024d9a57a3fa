package com.starscape.rapidresize.features.discovery.app;

import com.starscape.rapidresize.common.config.ProcessingProperties;
import com.starscape.rapidresize.features.discovery.domain.DiscoveryWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Lazy, restartable sequence of candidate image files.
 *
 * Every call to {@link #iterator()} starts a fresh walk. Directories are listed only when the
 * iteration reaches them, and files are never opened. Entries come out in file-system
 * enumeration order.
 */
public class DiscoveredFiles implements Iterable<Path> {

    private static final Logger log = LoggerFactory.getLogger(DiscoveredFiles.class);

    private final List<Path> roots;
    private final boolean recursive;
    private final Set<String> extensions;
    private final List<DiscoveryWarning> warnings = new CopyOnWriteArrayList<>();

    DiscoveredFiles(List<Path> roots, boolean recursive, Set<String> extensions) {
        this.roots = List.copyOf(roots);
        this.recursive = recursive;
        this.extensions = Set.copyOf(extensions);
    }

    @Override
    public Iterator<Path> iterator() {
        warnings.clear();
        return new WalkIterator();
    }

    /**
     * Warnings recorded by the most recent iteration so far.
     */
    public List<DiscoveryWarning> warnings() {
        return Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public List<Path> roots() {
        return roots;
    }

    public boolean isRecursive() {
        return recursive;
    }

    boolean matches(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        int lastDot = name.lastIndexOf('.');
        if (lastDot <= 0 || lastDot == name.length() - 1) {
            return false;
        }
        return extensions.contains(ProcessingProperties.normalizeExtension(name.substring(lastDot + 1)));
    }

    private void warn(Path path, DiscoveryWarning.Reason reason, String detail) {
        warnings.add(new DiscoveryWarning(path, reason, detail));
        log.warn("Skipping {} during discovery: {} ({})", path, reason, detail);
    }

    private final class WalkIterator implements Iterator<Path> {

        private final Deque<Path> pendingDirectories = new ArrayDeque<>();
        private final Deque<Path> pendingFiles = new ArrayDeque<>();
        private final Set<Path> visitedDirectories = new HashSet<>();
        private final Iterator<Path> rootIterator = roots.iterator();
        private Path next;

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public Path next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Path result = next;
            next = null;
            return result;
        }

        private Path advance() {
            while (true) {
                if (!pendingFiles.isEmpty()) {
                    return pendingFiles.pollFirst();
                }
                if (!pendingDirectories.isEmpty()) {
                    listDirectory(pendingDirectories.pollFirst());
                    continue;
                }
                if (!rootIterator.hasNext()) {
                    return null;
                }
                Path root = rootIterator.next();
                if (Files.isDirectory(root)) {
                    enterDirectory(root);
                } else if (Files.isRegularFile(root) && matches(root)) {
                    pendingFiles.add(root);
                }
            }
        }

        private void enterDirectory(Path directory) {
            Path realPath;
            try {
                realPath = directory.toRealPath();
            } catch (IOException e) {
                warn(directory, DiscoveryWarning.Reason.UNREADABLE, e.getMessage());
                return;
            }
            if (!visitedDirectories.add(realPath)) {
                warn(directory, DiscoveryWarning.Reason.SYMLINK_LOOP, "already visited as " + realPath);
                return;
            }
            pendingDirectories.addLast(directory);
        }

        private void listDirectory(Path directory) {
            List<Path> subdirectories = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
                for (Path entry : stream) {
                    if (Files.isDirectory(entry)) {
                        if (recursive) {
                            subdirectories.add(entry);
                        }
                    } else if (Files.isRegularFile(entry) && matches(entry)) {
                        pendingFiles.addLast(entry);
                    }
                }
            } catch (AccessDeniedException e) {
                warn(directory, DiscoveryWarning.Reason.ACCESS_DENIED, e.getMessage());
            } catch (IOException | DirectoryIteratorException e) {
                warn(directory, DiscoveryWarning.Reason.UNREADABLE, e.getMessage());
            }
            // Depth-first: children are visited before the directory's remaining siblings
            for (int i = subdirectories.size() - 1; i >= 0; i--) {
                Path subdirectory = subdirectories.get(i);
                Path realPath;
                try {
                    realPath = subdirectory.toRealPath();
                } catch (IOException e) {
                    warn(subdirectory, DiscoveryWarning.Reason.UNREADABLE, e.getMessage());
                    continue;
                }
                if (!visitedDirectories.add(realPath)) {
                    warn(subdirectory, DiscoveryWarning.Reason.SYMLINK_LOOP, "already visited as " + realPath);
                    continue;
                }
                pendingDirectories.addFirst(subdirectory);
            }
        }
    }
}
