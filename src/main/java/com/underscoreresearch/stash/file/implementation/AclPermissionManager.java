package com.underscoreresearch.stash.file.implementation;

import static com.underscoreresearch.stash.utils.SerializationUtils.MAPPER;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.AclEntry;
import java.nio.file.attribute.AclEntryFlag;
import java.nio.file.attribute.AclEntryPermission;
import java.nio.file.attribute.AclEntryType;
import java.nio.file.attribute.AclFileAttributeView;
import java.nio.file.attribute.UserPrincipalLookupService;
import java.nio.file.attribute.UserPrincipalNotFoundException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
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
 * Descriptor is JSON holding the owner and one (principal, bitmask) pair per ACL entry. The bitmask packs
 * entry type, permissions and inheritance flags.
 */
@Slf4j
public class AclPermissionManager implements FilePermissionManager {
    private static final ObjectReader READER = MAPPER.readerFor(AclPermissions.class);
    private static final ObjectWriter WRITER = MAPPER.writerFor(AclPermissions.class);
    private static final int TYPE_MASK = 0xf00000;

    private static final Map<AclEntryFlag, Integer> FLAG_BITS = new EnumMap<>(AclEntryFlag.class);
    private static final Map<AclEntryType, Integer> TYPE_BITS = new EnumMap<>(AclEntryType.class);
    private static final Map<AclEntryPermission, Integer> PERMISSION_BITS = new EnumMap<>(AclEntryPermission.class);

    static {
        FLAG_BITS.put(AclEntryFlag.DIRECTORY_INHERIT, 0x00001);
        FLAG_BITS.put(AclEntryFlag.FILE_INHERIT, 0x00002);
        FLAG_BITS.put(AclEntryFlag.NO_PROPAGATE_INHERIT, 0x00004);
        FLAG_BITS.put(AclEntryFlag.INHERIT_ONLY, 0x00008);

        PERMISSION_BITS.put(AclEntryPermission.APPEND_DATA, 0x00010);
        PERMISSION_BITS.put(AclEntryPermission.DELETE, 0x00020);
        PERMISSION_BITS.put(AclEntryPermission.DELETE_CHILD, 0x00040);
        PERMISSION_BITS.put(AclEntryPermission.READ_ACL, 0x00080);
        PERMISSION_BITS.put(AclEntryPermission.EXECUTE, 0x00100);
        PERMISSION_BITS.put(AclEntryPermission.READ_ATTRIBUTES, 0x00200);
        PERMISSION_BITS.put(AclEntryPermission.READ_DATA, 0x00400);
        PERMISSION_BITS.put(AclEntryPermission.WRITE_ACL, 0x00800);
        PERMISSION_BITS.put(AclEntryPermission.READ_NAMED_ATTRS, 0x01000);
        PERMISSION_BITS.put(AclEntryPermission.SYNCHRONIZE, 0x02000);
        PERMISSION_BITS.put(AclEntryPermission.WRITE_ATTRIBUTES, 0x04000);
        PERMISSION_BITS.put(AclEntryPermission.WRITE_DATA, 0x08000);
        PERMISSION_BITS.put(AclEntryPermission.WRITE_NAMED_ATTRS, 0x10000);
        PERMISSION_BITS.put(AclEntryPermission.WRITE_OWNER, 0x20000);

        TYPE_BITS.put(AclEntryType.ALARM, 0x100000);
        TYPE_BITS.put(AclEntryType.ALLOW, 0x200000);
        TYPE_BITS.put(AclEntryType.AUDIT, 0x400000);
        TYPE_BITS.put(AclEntryType.DENY, 0x800000);
    }

    static int encode(AclEntry entry) {
        int ret = TYPE_BITS.get(entry.type());
        for (AclEntryPermission permission : entry.permissions()) {
            ret |= PERMISSION_BITS.get(permission);
        }
        for (AclEntryFlag flag : entry.flags()) {
            ret |= FLAG_BITS.get(flag);
        }
        return ret;
    }

    static AclEntryType decodeType(int options) {
        for (Map.Entry<AclEntryType, Integer> entry : TYPE_BITS.entrySet()) {
            if ((options & TYPE_MASK) == entry.getValue()) {
                return entry.getKey();
            }
        }
        throw new IllegalArgumentException("Unknown ACL entry type: " + Integer.toHexString(options & TYPE_MASK));
    }

    static Set<AclEntryPermission> decodePermissions(int options) {
        Set<AclEntryPermission> result = EnumSet.noneOf(AclEntryPermission.class);
        PERMISSION_BITS.forEach((permission, bit) -> {
            if ((options & bit) != 0) {
                result.add(permission);
            }
        });
        return result;
    }

    static Set<AclEntryFlag> decodeFlags(int options) {
        Set<AclEntryFlag> result = EnumSet.noneOf(AclEntryFlag.class);
        FLAG_BITS.forEach((flag, bit) -> {
            if ((options & bit) != 0) {
                result.add(flag);
            }
        });
        return result;
    }

    @Override
    public String getPermissionDescriptor(Path path) {
        try {
            AclFileAttributeView aclView = Files.getFileAttributeView(path, AclFileAttributeView.class,
                    LinkOption.NOFOLLOW_LINKS);
            if (aclView == null) {
                return null;
            }
            List<AclEntry> acl = aclView.getAcl();
            List<Object[]> entries = new ArrayList<>(acl.size());
            for (AclEntry entry : acl) {
                entries.add(new Object[]{entry.principal().getName(), encode(entry)});
            }

            return WRITER.writeValueAsString(new AclPermissions(aclView.getOwner().getName(), entries));
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
        AclPermissions aclPermissions;
        try {
            aclPermissions = READER.readValue(descriptor);
        } catch (IOException exc) {
            log.warn("Ignoring unreadable permissions for {}", path);
            return;
        }

        AclFileAttributeView aclView = Files.getFileAttributeView(path, AclFileAttributeView.class,
                LinkOption.NOFOLLOW_LINKS);
        if (aclView == null) {
            return;
        }
        UserPrincipalLookupService lookupService = path.getFileSystem().getUserPrincipalLookupService();
        try {
            List<AclEntry> entries = new ArrayList<>();
            if (aclPermissions.permissions != null) {
                for (Object[] aclEntry : aclPermissions.permissions) {
                    String principal = (String) aclEntry[0];
                    int options = ((Number) aclEntry[1]).intValue();
                    try {
                        entries.add(AclEntry.newBuilder()
                                .setType(decodeType(options))
                                .setPrincipal(lookupService.lookupPrincipalByName(principal))
                                .setPermissions(decodePermissions(options))
                                .setFlags(decodeFlags(options))
                                .build());
                    } catch (UserPrincipalNotFoundException exc) {
                        log.warn("Skipping permission of unknown principal {} on {}", principal, path);
                    }
                }
            }
            aclView.setAcl(entries);
        } catch (IOException exc) {
            log.warn("Failed to set permissions for {}", path, exc);
        }

        if (aclPermissions.owner != null) {
            try {
                if (!aclView.getOwner().getName().equals(aclPermissions.owner)) {
                    aclView.setOwner(lookupService.lookupPrincipalByName(aclPermissions.owner));
                }
            } catch (IOException exc) {
                log.warn("Failed to set owner of file {} to {}", path, aclPermissions.owner);
            }
        }
    }

    @AllArgsConstructor
    @NoArgsConstructor
    @Data
    private static class AclPermissions {
        @JsonProperty("o")
        String owner;
        @JsonProperty("p")
        List<Object[]> permissions;
    }
}
