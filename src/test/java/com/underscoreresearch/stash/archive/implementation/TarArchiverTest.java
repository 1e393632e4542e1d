package com.underscoreresearch.stash.archive.implementation;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.tar.TarConstants;
import org.hamcrest.core.Is;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.underscoreresearch.stash.archive.ArchiveStats;
import com.underscoreresearch.stash.file.FilePermissionManager;
import com.underscoreresearch.stash.file.implementation.NullPermissionManager;

class TarArchiverTest {
    @TempDir
    Path tempDir;
    private Path source;

    @BeforeEach
    public void setup() throws IOException {
        source = tempDir.resolve("source");
        Files.createDirectories(source.resolve("uploads").resolve("2024"));
        Files.createDirectories(source.resolve("config"));
        Files.createDirectories(source.resolve("empty"));
        write(source.resolve("root.txt"), "root");
        write(source.resolve("uploads").resolve("a.jpg"), "image a");
        write(source.resolve("uploads").resolve("2024").resolve("b.jpg"), "image b");
        write(source.resolve("config").resolve("app.yml"), "setting: true");
    }

    private static void write(Path file, String contents) throws IOException {
        Files.write(file, contents.getBytes(StandardCharsets.UTF_8));
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private static byte[] archive(TarArchiver archiver, Path root, List<String> includeFolders) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        archiver.createArchive(out, root, includeFolders);
        return out.toByteArray();
    }

    private void roundTrip(boolean compression) throws IOException {
        TarArchiver archiver = new TarArchiver(compression, false, new NullPermissionManager());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ArchiveStats created = archiver.createArchive(out, source, null);
        assertThat(created.getFilesProcessed(), Is.is(4L));
        assertThat(created.getSkipped(), Is.is(0L));
        assertThat(created.getTotalSize(), Is.is(4L + 7L + 7L + 13L));

        byte[] data = out.toByteArray();
        assertThat(data.length > 1 && (data[0] & 0xff) == 0x1f && (data[1] & 0xff) == 0x8b, Is.is(compression));

        Path destination = tempDir.resolve("restore");
        ArchiveStats extracted = archiver.extractArchive(new ByteArrayInputStream(data), destination);
        assertThat(extracted.getFilesProcessed(), Is.is(4L));
        assertThat(read(destination.resolve("root.txt")), Is.is("root"));
        assertThat(read(destination.resolve("uploads").resolve("2024").resolve("b.jpg")), Is.is("image b"));
        assertThat(read(destination.resolve("config").resolve("app.yml")), Is.is("setting: true"));
        assertThat(Files.isDirectory(destination.resolve("empty")), Is.is(true));
    }

    @Test
    public void roundTripCompressed() throws IOException {
        roundTrip(true);
    }

    @Test
    public void roundTripUncompressed() throws IOException {
        roundTrip(false);
    }

    @Test
    public void extractDetectsCompression() throws IOException {
        byte[] data = archive(new TarArchiver(true, false, new NullPermissionManager()), source, null);

        Path destination = tempDir.resolve("restore");
        new TarArchiver(false, false, new NullPermissionManager())
                .extractArchive(new ByteArrayInputStream(data), destination);
        assertThat(read(destination.resolve("uploads").resolve("a.jpg")), Is.is("image a"));
    }

    @Test
    public void includeFolders() throws IOException {
        write(source.resolve("uploads-old"), "sibling");
        TarArchiver archiver = new TarArchiver(true, false, new NullPermissionManager());
        assertThat(archiver.countFiles(source, List.of("uploads")), Is.is(3L));

        Path destination = tempDir.resolve("restore");
        archiver.extractArchive(new ByteArrayInputStream(archive(archiver, source, List.of("uploads"))),
                destination);
        assertThat(Files.exists(destination.resolve("uploads").resolve("2024").resolve("b.jpg")), Is.is(true));
        assertThat(Files.exists(destination.resolve("uploads-old")), Is.is(true));
        assertThat(Files.exists(destination.resolve("config")), Is.is(false));
        assertThat(Files.exists(destination.resolve("root.txt")), Is.is(false));
    }

    @Test
    public void countFiles() throws IOException {
        TarArchiver archiver = new TarArchiver(false, false, new NullPermissionManager());
        assertThat(archiver.countFiles(source, null), Is.is(4L));
        assertThat(archiver.countFiles(source, List.of("config")), Is.is(1L));
    }

    @Test
    public void invalidRoot() throws IOException {
        TarArchiver archiver = new TarArchiver(true, false, new NullPermissionManager());
        Assertions.assertThrows(IOException.class,
                () -> archiver.createArchive(new ByteArrayOutputStream(), tempDir.resolve("missing"), null));
        Assertions.assertThrows(IOException.class,
                () -> archiver.createArchive(new ByteArrayOutputStream(), source.resolve("root.txt"), null));
        Assertions.assertThrows(IOException.class, () -> archiver.countFiles(tempDir.resolve("missing"), null));
    }

    @Test
    public void symbolicLinks() throws IOException {
        Path link = source.resolve("current");
        try {
            Files.createSymbolicLink(link, source.getFileSystem().getPath("uploads"));
        } catch (UnsupportedOperationException | IOException exc) {
            assumeTrue(false, "Symbolic links not supported");
        }

        TarArchiver archiver = new TarArchiver(false, false, new NullPermissionManager());
        assertThat(archiver.countFiles(source, null), Is.is(4L));

        Path destination = tempDir.resolve("restore");
        archiver.extractArchive(new ByteArrayInputStream(archive(archiver, source, null)), destination);
        Path restored = destination.resolve("current");
        assertThat(Files.isSymbolicLink(restored), Is.is(true));
        assertThat(Files.readSymbolicLink(restored).toString(), Is.is("uploads"));
    }

    @Test
    public void posixModePreserved() throws IOException {
        Path secret = source.resolve("config").resolve("app.yml");
        try {
            Files.setPosixFilePermissions(secret, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException exc) {
            assumeTrue(false, "POSIX permissions not supported");
        }

        TarArchiver archiver = new TarArchiver(true, false, new NullPermissionManager());
        Path destination = tempDir.resolve("restore");
        archiver.extractArchive(new ByteArrayInputStream(archive(archiver, source, null)), destination);
        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(
                destination.resolve("config").resolve("app.yml"))), Is.is("rw-------"));
    }

    @Test
    public void permissionDescriptors() throws IOException {
        String descriptor = "{\"o\":\"www\",\"m\":420}";
        FilePermissionManager permissionManager = mock(FilePermissionManager.class);
        when(permissionManager.getPermissionDescriptor(any(Path.class))).thenReturn(descriptor);

        TarArchiver archiver = new TarArchiver(true, true, permissionManager);
        Path destination = tempDir.resolve("restore");
        archiver.extractArchive(new ByteArrayInputStream(archive(archiver, source, null)), destination);

        verify(permissionManager).setPermissionDescriptor(eq(destination.toAbsolutePath().normalize()
                .resolve("root.txt")), eq(descriptor));
        verify(permissionManager, atLeastOnce()).setPermissionDescriptor(eq(destination.toAbsolutePath()
                .normalize().resolve("uploads")), eq(descriptor));
    }

    @Test
    public void permissionDescriptorsIgnoredWhenDisabled() throws IOException {
        FilePermissionManager permissionManager = mock(FilePermissionManager.class);
        when(permissionManager.getPermissionDescriptor(any(Path.class))).thenReturn("{}");

        byte[] data = archive(new TarArchiver(true, true, permissionManager), source, null);
        FilePermissionManager restoreManager = mock(FilePermissionManager.class);
        new TarArchiver(true, false, restoreManager).extractArchive(new ByteArrayInputStream(data),
                tempDir.resolve("restore"));
        verify(restoreManager, never()).setPermissionDescriptor(any(Path.class), any());
    }

    @Test
    public void traversalEntriesSkipped() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(out)) {
            byte[] evil = "evil".getBytes(StandardCharsets.UTF_8);
            TarArchiveEntry entry = new TarArchiveEntry("../evil.txt", true);
            entry.setSize(evil.length);
            tar.putArchiveEntry(entry);
            tar.write(evil);
            tar.closeArchiveEntry();

            byte[] good = "good".getBytes(StandardCharsets.UTF_8);
            entry = new TarArchiveEntry("good.txt");
            entry.setSize(good.length);
            tar.putArchiveEntry(entry);
            tar.write(good);
            tar.closeArchiveEntry();
        }

        Path destination = tempDir.resolve("nested").resolve("restore");
        ArchiveStats stats = new TarArchiver(false, false, new NullPermissionManager())
                .extractArchive(new ByteArrayInputStream(out.toByteArray()), destination);
        assertThat(stats.getSkipped(), Is.is(1L));
        assertThat(stats.getFilesProcessed(), Is.is(1L));
        assertThat(Files.exists(tempDir.resolve("nested").resolve("evil.txt")), Is.is(false));
        assertThat(read(destination.resolve("good.txt")), Is.is("good"));
    }

    @Test
    public void entriesBelowExtractedLinkSkipped() throws IOException {
        Path outside = tempDir.resolve("outside");
        Files.createDirectories(outside);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(out)) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            TarArchiveEntry link = new TarArchiveEntry("link", TarConstants.LF_SYMLINK);
            link.setLinkName(outside.toAbsolutePath().toString());
            tar.putArchiveEntry(link);
            tar.closeArchiveEntry();

            TarArchiveEntry directory = new TarArchiveEntry("link/sub/");
            tar.putArchiveEntry(directory);
            tar.closeArchiveEntry();

            byte[] data = "pwned".getBytes(StandardCharsets.UTF_8);
            TarArchiveEntry entry = new TarArchiveEntry("link/sub/pwned.txt");
            entry.setSize(data.length);
            tar.putArchiveEntry(entry);
            tar.write(data);
            tar.closeArchiveEntry();
        }

        Path destination = tempDir.resolve("dest");
        ArchiveStats stats = new TarArchiver(false, false, new NullPermissionManager())
                .extractArchive(new ByteArrayInputStream(out.toByteArray()), destination);
        assumeTrue(Files.isSymbolicLink(destination.resolve("link")), "Symbolic links not supported");

        assertThat(stats.getSkipped(), Is.is(2L));
        assertThat(stats.getFilesProcessed(), Is.is(0L));
        assertThat(Files.exists(outside.resolve("sub")), Is.is(false));
        assertThat(Files.exists(outside.resolve("sub").resolve("pwned.txt")), Is.is(false));
    }

    @Test
    public void throughLink() throws IOException {
        Path root = tempDir.resolve("restore").toAbsolutePath().normalize();
        Files.createDirectories(root.resolve("real"));
        try {
            Files.createSymbolicLink(root.resolve("link"), tempDir.toAbsolutePath());
        } catch (UnsupportedOperationException | IOException exc) {
            assumeTrue(false, "Symbolic links not supported");
        }

        assertThat(TarArchiver.throughLink(root, root, true), Is.is(false));
        assertThat(TarArchiver.throughLink(root, root.resolve("real").resolve("a.txt"), false), Is.is(false));
        assertThat(TarArchiver.throughLink(root, root.resolve("link"), false), Is.is(false));
        assertThat(TarArchiver.throughLink(root, root.resolve("link"), true), Is.is(true));
        assertThat(TarArchiver.throughLink(root, root.resolve("link").resolve("a.txt"), false), Is.is(true));
    }

    @Test
    public void resolveEntry() {
        Path root = tempDir.resolve("restore").toAbsolutePath().normalize();
        assertThat(TarArchiver.resolveEntry(root, "./"), Is.is(root));
        assertThat(TarArchiver.resolveEntry(root, "a/b.txt"), Is.is(root.resolve("a").resolve("b.txt")));
        assertThat(TarArchiver.resolveEntry(root, "./a/../b.txt"), Is.is(root.resolve("b.txt")));
        assertThat(TarArchiver.resolveEntry(root, "../escape.txt"), Is.is((Path) null));
        assertThat(TarArchiver.resolveEntry(root, "a/../../escape.txt"), Is.is((Path) null));
        assertThat(TarArchiver.resolveEntry(root, "/etc/passwd"), Is.is((Path) null));
        assertThat(TarArchiver.resolveEntry(root, "C:/Windows"), Is.is((Path) null));
    }
}
