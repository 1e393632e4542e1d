package com.underscoreresearch.stash.file.implementation;

import java.nio.file.Path;

import com.underscoreresearch.stash.file.FilePermissionManager;

public class NullPermissionManager implements FilePermissionManager {
    @Override
    public String getPermissionDescriptor(Path path) {
        return null;
    }

    @Override
    public void setPermissionDescriptor(Path path, String descriptor) {
    }
}
