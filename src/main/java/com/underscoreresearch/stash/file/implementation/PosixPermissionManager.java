package com.underscoreresearch.stash.file.implementation;

import static com.underscoreresearch.stash.utils.LogUtil.debug;
import static com.underscoreresearch.stash.utils.SerializationUtils.MAPPER;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.GroupPrincipal;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.UserPrincipal;
import java.nio.file.attribute.UserPrincipalLookupService;
import java.util.EnumSet;
import java.util.Set;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.underscoreresearch.stash.file.FilePermissionManager;

/**
 * Descriptor is JSON holding owner, group and the classic octal mode bits.
 */
@Slf4j
public class PosixPermissionManager implements FilePermissionManager {
    private static final ObjectReader READER = MAPPER.readerFor(PosixPermissions.class);
    private static final ObjectWriter WRITER = MAPPER.writerFor(PosixPermissions.class);
    private static final PosixFilePermission[] MODE_ORDER = new PosixFilePermission[]{
            PosixFilePermission.OTHERS_EXECUTE,
            PosixFilePermission.OTHERS_WRITE,
            PosixFilePermission.OTHERS_READ,
            PosixFilePermission.GROUP_EXECUTE,
            PosixFilePermission.GROUP_WRITE,
            PosixFilePermission.GROUP_READ,
            PosixFilePermission.OWNER_EXECUTE,
            PosixFilePermission.OWNER_WRITE,
            PosixFilePermission.OWNER_READ
    };

    public static int toMode(Set<PosixFilePermission> permissions) {
        int mode = 0;
        for (int i = 0; i < MODE_ORDER.length; i++) {
            if (permissions.contains(MODE_ORDER[i])) {
                mode |= 1 << i;
            }
        }
        return mode;
    }

    public static Set<PosixFilePermission> fromMode(int mode) {
        Set<PosixFilePermission> result = EnumSet.noneOf(PosixFilePermission.class);
        for (int i = 0; i < MODE_ORDER.length; i++) {
            if ((mode & (1 << i)) != 0) {
                result.add(MODE_ORDER[i]);
            }
        }
        return result;
    }

    @Override
    public String getPermissionDescriptor(Path path) {
        try {
            PosixFileAttributeView posixView = Files.getFileAttributeView(path, PosixFileAttributeView.class,
                    LinkOption.NOFOLLOW_LINKS);
            if (posixView == null) {
                return null;
            }
            PosixFileAttributes attributes = posixView.readAttributes();

            return WRITER.writeValueAsString(new PosixPermissions(attributes.owner().getName(),
                    attributes.group().getName(),
                    toMode(attributes.permissions())));
        } catch (IOException exc) {
            log.warn("Failed to get permissions for {}", path, exc);
            return null;
        }
    }

    @Override
    public void setPermissionDescriptor(Path path, String descriptor) {
        if (descriptor == null) {
            return;
        }
        PosixPermissions posixPermissions;
        try {
            posixPermissions = READER.readValue(descriptor);
        } catch (IOException exc) {
            log.warn("Ignoring unreadable permissions for {}", path);
            return;
        }

        PosixFileAttributeView posixView = Files.getFileAttributeView(path, PosixFileAttributeView.class,
                LinkOption.NOFOLLOW_LINKS);
        if (posixView == null) {
            return;
        }
        try {
            if (posixPermissions.permissions != null && !Files.isSymbolicLink(path)) {
                posixView.setPermissions(fromMode(posixPermissions.permissions));
            }
        } catch (IOException exc) {
            log.warn("Failed to set permissions for {}", path, exc);
        }

        // Changing ownership normally requires elevated privileges, so only complain when it matters.
        UserPrincipalLookupService lookupService = path.getFileSystem().getUserPrincipalLookupService();
        try {
            PosixFileAttributes current = posixView.readAttributes();
            if (posixPermissions.owner != null && !posixPermissions.owner.equals(current.owner().getName())) {
                UserPrincipal owner = lookupService.lookupPrincipalByName(posixPermissions.owner);
                posixView.setOwner(owner);
            }
            if (posixPermissions.group != null && !posixPermissions.group.equals(current.group().getName())) {
                GroupPrincipal group = lookupService.lookupPrincipalByGroupName(posixPermissions.group);
                posixView.setGroup(group);
            }
        } catch (IOException exc) {
            debug(() -> log.debug("Failed to set owner of {} to {}:{}", path, posixPermissions.owner,
                    posixPermissions.group));
        }
    }

    @AllArgsConstructor
    @NoArgsConstructor
    @Data
    private static class PosixPermissions {
        @JsonProperty("o")
        String owner;
        @JsonProperty("g")
        String group;
        @JsonProperty("m")
        Integer permissions;
    }
}
