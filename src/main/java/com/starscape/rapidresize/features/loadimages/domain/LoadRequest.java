package com.starscape.rapidresize.features.loadimages.domain;

import com.starscape.rapidresize.common.exception.InvalidRequestException;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Roots and filters of one load session.
 */
public record LoadRequest(
    List<Path> roots,
    boolean recursive,
    Set<String> extensions
) {

    public LoadRequest {
        if (roots == null || roots.isEmpty()) {
            throw new InvalidRequestException("At least one root path is required");
        }
        if (extensions == null || extensions.isEmpty()) {
            throw new InvalidRequestException("Extension allow-list must not be empty");
        }
        roots = List.copyOf(roots);
        extensions = Set.copyOf(extensions);
    }

    public static LoadRequest of(Path root, boolean recursive, Set<String> extensions) {
        return new LoadRequest(List.of(root), recursive, extensions);
    }
}
