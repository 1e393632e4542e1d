package com.underscoreresearch.stash.file.implementation;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.mockito.Mockito.mock;

import java.nio.file.attribute.AclEntry;
import java.nio.file.attribute.AclEntryFlag;
import java.nio.file.attribute.AclEntryPermission;
import java.nio.file.attribute.AclEntryType;
import java.nio.file.attribute.UserPrincipal;
import java.util.EnumSet;
import java.util.Set;

import org.hamcrest.core.Is;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AclPermissionManagerTest {
    private static final UserPrincipal PRINCIPAL = mock(UserPrincipal.class);

    @Test
    public void encodeDecode() {
        for (AclEntryType type : AclEntryType.values()) {
            Set<AclEntryPermission> permissions = EnumSet.of(AclEntryPermission.READ_DATA,
                    AclEntryPermission.WRITE_ACL, AclEntryPermission.SYNCHRONIZE);
            Set<AclEntryFlag> flags = EnumSet.of(AclEntryFlag.FILE_INHERIT, AclEntryFlag.INHERIT_ONLY);
            AclEntry entry = AclEntry.newBuilder()
                    .setType(type)
                    .setPrincipal(PRINCIPAL)
                    .setPermissions(permissions)
                    .setFlags(flags)
                    .build();

            int encoded = AclPermissionManager.encode(entry);
            assertThat(AclPermissionManager.decodeType(encoded), Is.is(type));
            assertThat(AclPermissionManager.decodePermissions(encoded), Is.is(permissions));
            assertThat(AclPermissionManager.decodeFlags(encoded), Is.is(flags));
        }
    }

    @Test
    public void allPermissions() {
        AclEntry entry = AclEntry.newBuilder()
                .setType(AclEntryType.ALLOW)
                .setPrincipal(PRINCIPAL)
                .setPermissions(EnumSet.allOf(AclEntryPermission.class))
                .setFlags(EnumSet.allOf(AclEntryFlag.class))
                .build();

        int encoded = AclPermissionManager.encode(entry);
        Set<AclEntryPermission> permissions = EnumSet.allOf(AclEntryPermission.class);
        Set<AclEntryFlag> flags = EnumSet.allOf(AclEntryFlag.class);
        assertThat(AclPermissionManager.decodePermissions(encoded), Is.is(permissions));
        assertThat(AclPermissionManager.decodeFlags(encoded), Is.is(flags));
    }

    @Test
    public void unknownType() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> AclPermissionManager.decodeType(0x00400));
    }
}
