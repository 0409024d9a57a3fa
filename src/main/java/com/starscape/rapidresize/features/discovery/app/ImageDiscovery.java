package com.starscape.rapidresize.features.discovery.app;

import com.starscape.rapidresize.common.config.ProcessingProperties;
import com.starscape.rapidresize.common.exception.InvalidRequestException;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Enumerates candidate image files under one or more roots.
 * Pure and synchronous; it only reads directory listings.
 */
@Service
public class ImageDiscovery {

    public DiscoveredFiles discover(Path root, boolean recursive, Collection<String> extensions) {
        return discover(List.of(root), recursive, extensions);
    }

    /**
     * @param roots directories to scan, or single files to take as they are
     * @param recursive whether to descend into subdirectories
     * @param extensions allow-list, case-insensitive, with or without a leading dot
     * @throws InvalidRequestException if no root is given, a root does not exist, or the allow-list is empty
     */
    public DiscoveredFiles discover(List<Path> roots, boolean recursive, Collection<String> extensions) {
        if (roots == null || roots.isEmpty()) {
            throw new InvalidRequestException("At least one root path is required");
        }
        for (Path root : roots) {
            if (root == null || !Files.exists(root)) {
                throw new InvalidRequestException("Root path does not exist: " + root);
            }
            if (!Files.isDirectory(root) && !Files.isRegularFile(root)) {
                throw new InvalidRequestException("Root path is neither a directory nor a file: " + root);
            }
        }
        Set<String> normalized = new LinkedHashSet<>();
        if (extensions != null) {
            for (String extension : extensions) {
                if (extension != null && !extension.isBlank()) {
                    normalized.add(ProcessingProperties.normalizeExtension(extension));
                }
            }
        }
        if (normalized.isEmpty()) {
            throw new InvalidRequestException("Extension allow-list must not be empty");
        }
        return new DiscoveredFiles(roots, recursive, normalized);
    }
}
