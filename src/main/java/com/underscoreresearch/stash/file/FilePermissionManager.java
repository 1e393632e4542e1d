package com.underscoreresearch.stash.file;

import java.nio.file.Path;

/**
 * Reads and applies a platform specific, serialized description of who may access a file.
 */
public interface FilePermissionManager {
    /**
     * @return the descriptor of path, or null if it could not be read or the platform has none.
     */
    String getPermissionDescriptor(Path path);

    /**
     * Applies a descriptor previously returned by {@link #getPermissionDescriptor(Path)}. Failures are
     * logged and otherwise ignored.
     */
    void setPermissionDescriptor(Path path, String descriptor);
}
