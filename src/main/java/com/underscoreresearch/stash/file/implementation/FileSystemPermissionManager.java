package com.underscoreresearch.stash.file.implementation;

import java.nio.file.FileStore;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import lombok.extern.slf4j.Slf4j;

import com.underscoreresearch.stash.file.FilePermissionManager;
import com.underscoreresearch.stash.file.PermissionManagers;

/**
 * Hands every path to the permission manager of the file system it lives on, so roots on different
 * mounts each get the descriptor format their file system supports.
 */
@Slf4j
public class FileSystemPermissionManager implements FilePermissionManager {
    private static final FilePermissionManager NONE = new NullPermissionManager();

    private final Function<Path, Optional<FileStore>> fileStores;
    private final Map<FileStore, FilePermissionManager> managers = new ConcurrentHashMap<>();

    public FileSystemPermissionManager() {
        this(PermissionManagers::fileStore);
    }

    public FileSystemPermissionManager(Function<Path, Optional<FileStore>> fileStores) {
        this.fileStores = fileStores;
    }

    public FilePermissionManager managerFor(Path path) {
        return fileStores.apply(path)
                .map(store -> managers.computeIfAbsent(store, key -> {
                    FilePermissionManager manager = PermissionManagers.forStore(key);
                    log.info("Using {} for file system {}", manager.getClass().getSimpleName(), key.name());
                    return manager;
                }))
                .orElse(NONE);
    }

    @Override
    public String getPermissionDescriptor(Path path) {
        return managerFor(path).getPermissionDescriptor(path);
    }

    @Override
    public void setPermissionDescriptor(Path path, String descriptor) {
        managerFor(path).setPermissionDescriptor(path, descriptor);
    }
}
