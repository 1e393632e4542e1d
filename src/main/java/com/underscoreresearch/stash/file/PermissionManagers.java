package com.underscoreresearch.stash.file;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.AclFileAttributeView;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import com.underscoreresearch.stash.file.implementation.AclPermissionManager;
import com.underscoreresearch.stash.file.implementation.NullPermissionManager;
import com.underscoreresearch.stash.file.implementation.PosixPermissionManager;

@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class PermissionManagers {
    /**
     * The file store holding path, or of its nearest existing parent when path does not exist yet.
     */
    public static Optional<FileStore> fileStore(Path path) {
        try {
            Path existing = path.toAbsolutePath();
            while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
                existing = existing.getParent();
            }
            if (existing == null) {
                return Optional.empty();
            }
            return Optional.of(Files.getFileStore(existing));
        } catch (IOException exc) {
            log.warn("Could not determine file system of {}, permissions will not be preserved", path, exc);
            return Optional.empty();
        }
    }

    /**
     * Picks the permission manager matching a file system. ACLs win over POSIX permissions where a file
     * system supports both.
     */
    public static FilePermissionManager forStore(FileStore store) {
        if (store.supportsFileAttributeView(AclFileAttributeView.class)) {
            return new AclPermissionManager();
        }
        if (store.supportsFileAttributeView(PosixFileAttributeView.class)) {
            return new PosixPermissionManager();
        }
        return new NullPermissionManager();
    }
}
