package com.starscape.rapidresize.features.discovery.domain;

import java.nio.file.Path;

/**
 * A directory or entry that discovery skipped instead of failing the scan.
 */
public record DiscoveryWarning(Path path, Reason reason, String detail) {

    public enum Reason {
        ACCESS_DENIED,
        SYMLINK_LOOP,
        UNREADABLE
    }
}
