package com.underscoreresearch.stash.archive.implementation;

import static com.underscoreresearch.stash.utils.LogUtil.debug;
import static com.underscoreresearch.stash.utils.LogUtil.readableNumber;
import static com.underscoreresearch.stash.utils.LogUtil.readableSize;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.tar.TarConstants;

import com.google.common.base.Stopwatch;
import com.google.common.io.BaseEncoding;
import com.underscoreresearch.stash.archive.ArchiveStats;
import com.underscoreresearch.stash.archive.Archiver;
import com.underscoreresearch.stash.archive.IncludeFilter;
import com.underscoreresearch.stash.file.FilePermissionManager;
import com.underscoreresearch.stash.file.implementation.PosixPermissionManager;

/**
 * POSIX tar archiver with optional gzip compression.
 * <p>
 * When permission preservation is on every entry carries the serialized permission descriptor, base64
 * encoded, in the {@value #PERMISSION_PAX_KEY} PAX header. Extraction detects gzip by its magic bytes, so
 * compressed and uncompressed archives restore regardless of how this archiver is configured.
 */
@Slf4j
public class TarArchiver implements Archiver {
    public static final String PERMISSION_PAX_KEY = "STASH.acl";
    public static final String ROOT_ENTRY = "./";
    private static final int BUFFER_SIZE = 65536;
    private static final int GZIP_MAGIC_FIRST = 0x1f;
    private static final int GZIP_MAGIC_SECOND = 0x8b;
    private static final int DEFAULT_FILE_MODE = 0644;
    private static final int DEFAULT_DIRECTORY_MODE = 0755;
    private static final int PERMISSION_BITS = 0777;
    private static final BaseEncoding BASE64 = BaseEncoding.base64();

    @Getter
    private final boolean compression;
    private final boolean preservePermissions;
    private final FilePermissionManager permissionManager;

    public TarArchiver(boolean compression, boolean preservePermissions, FilePermissionManager permissionManager) {
        this.compression = compression;
        this.preservePermissions = preservePermissions;
        this.permissionManager = permissionManager;
    }

    private static void checkRoot(Path root) throws IOException {
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(root, BasicFileAttributes.class);
        } catch (IOException exc) {
            throw new IOException("Source path " + root + " is not accessible", exc);
        }
        if (!attributes.isDirectory()) {
            throw new IOException("Source path " + root + " is not a directory");
        }
        if (!Files.isReadable(root)) {
            throw new IOException("Source path " + root + " is not readable");
        }
    }

    private static void checkInterrupted() throws InterruptedIOException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedIOException("Archive operation interrupted");
        }
    }

    private static int readMode(Path path, int defaultMode) {
        PosixFileAttributeView view = Files.getFileAttributeView(path, PosixFileAttributeView.class,
                LinkOption.NOFOLLOW_LINKS);
        if (view != null) {
            try {
                return PosixPermissionManager.toMode(view.readAttributes().permissions());
            } catch (IOException | UnsupportedOperationException exc) {
                debug(() -> log.debug("Could not read mode of {}", path));
            }
        }
        return defaultMode;
    }

    @Override
    public ArchiveStats createArchive(OutputStream out, Path root, List<String> includeFolders) throws IOException {
        checkRoot(root);
        IncludeFilter filter = new IncludeFilter(includeFolders);
        ArchiveStats stats = new ArchiveStats();
        Stopwatch stopwatch = Stopwatch.createStarted();

        log.info("Creating archive from {}", root);
        if (!filter.getFolders().isEmpty()) {
            log.info("Including specific folders: {}", String.join(", ", filter.getFolders()));
        }

        GZIPOutputStream gzipStream = compression ? new GZIPOutputStream(out, BUFFER_SIZE) : null;
        TarArchiveOutputStream tar = new TarArchiveOutputStream(gzipStream != null ? gzipStream : out,
                StandardCharsets.UTF_8.name());
        tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
        tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
        tar.setAddPaxHeadersForNonAsciiNames(true);

        Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                        checkInterrupted();
                        String name = IncludeFilter.relativeName(root, dir);
                        if (!filter.includes(name)) {
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        TarArchiveEntry entry = new TarArchiveEntry(IncludeFilter.ROOT.equals(name)
                                ? ROOT_ENTRY : name + "/");
                        entry.setMode(TarArchiveEntry.DEFAULT_DIR_MODE & ~PERMISSION_BITS
                                | readMode(dir, DEFAULT_DIRECTORY_MODE));
                        entry.setModTime(attrs.lastModifiedTime());
                        addPermissions(entry, dir);
                        tar.putArchiveEntry(entry);
                        tar.closeArchiveEntry();
                        stats.addDirectory();
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                        checkInterrupted();
                        String name = IncludeFilter.relativeName(root, file);
                        if (!filter.includes(name)) {
                            return FileVisitResult.CONTINUE;
                        }
                        if (attrs.isSymbolicLink()) {
                            writeLink(tar, file, name, attrs, stats);
                        } else if (attrs.isRegularFile()) {
                            writeFile(tar, file, name, attrs, stats);
                        } else {
                            log.warn("Skipping {}, not a regular file, directory or link", file);
                            stats.addSkipped();
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                        if (file.equals(root)) {
                            throw exc;
                        }
                        log.warn("Error accessing {}: {}", file, exc.getMessage());
                        stats.addSkipped();
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                        if (exc != null) {
                            log.warn("Failed to read all of directory {}: {}", dir, exc.getMessage());
                            stats.addSkipped();
                        }
                        return FileVisitResult.CONTINUE;
                    }
                });

        tar.finish();
        if (gzipStream != null) {
            gzipStream.finish();
        }
        out.flush();

        log.info("Archive created: {} files, {} in {} ({} skipped)",
                readableNumber(stats.getFilesProcessed()), readableSize(stats.getTotalSize()),
                stopwatch, readableNumber(stats.getSkipped()));
        return stats;
    }

    private void addPermissions(TarArchiveEntry entry, Path path) {
        if (!preservePermissions) {
            return;
        }
        String descriptor = permissionManager.getPermissionDescriptor(path);
        if (descriptor != null && !descriptor.isEmpty()) {
            entry.addPaxHeader(PERMISSION_PAX_KEY, BASE64.encode(descriptor.getBytes(StandardCharsets.UTF_8)));
        }
    }

    private void writeLink(TarArchiveOutputStream tar, Path file, String name, BasicFileAttributes attrs,
                           ArchiveStats stats) throws IOException {
        Path target;
        try {
            target = Files.readSymbolicLink(file);
        } catch (IOException exc) {
            log.warn("Failed to read link {}: {}", file, exc.getMessage());
            stats.addSkipped();
            return;
        }
        TarArchiveEntry entry = new TarArchiveEntry(name, TarConstants.LF_SYMLINK);
        entry.setLinkName(target.toString().replace(file.getFileSystem().getSeparator(), "/"));
        entry.setModTime(attrs.lastModifiedTime());
        addPermissions(entry, file);
        tar.putArchiveEntry(entry);
        tar.closeArchiveEntry();
    }

    private void writeFile(TarArchiveOutputStream tar, Path file, String name, BasicFileAttributes attrs,
                           ArchiveStats stats) throws IOException {
        InputStream in;
        try {
            in = Files.newInputStream(file);
        } catch (IOException exc) {
            log.warn("Failed to open file {}: {}", file, exc.getMessage());
            stats.addSkipped();
            return;
        }

        long size = attrs.size();
        TarArchiveEntry entry = new TarArchiveEntry(name);
        entry.setSize(size);
        entry.setMode(TarArchiveEntry.DEFAULT_FILE_MODE & ~PERMISSION_BITS | readMode(file, DEFAULT_FILE_MODE));
        entry.setModTime(attrs.lastModifiedTime());
        addPermissions(entry, file);

        try (in) {
            tar.putArchiveEntry(entry);
            long written = 0;
            boolean failed = false;
            byte[] buffer = new byte[BUFFER_SIZE];
            while (written < size) {
                int read;
                try {
                    read = in.read(buffer, 0, (int) Math.min(buffer.length, size - written));
                } catch (IOException exc) {
                    log.warn("Failed to read file {}: {}", file, exc.getMessage());
                    failed = true;
                    break;
                }
                if (read < 0) {
                    log.warn("File {} shrank while archiving", file);
                    failed = true;
                    break;
                }
                tar.write(buffer, 0, read);
                written += read;
            }
            if (failed) {
                // The header already promised size bytes so the entry is padded to keep the stream readable.
                byte[] zeros = new byte[BUFFER_SIZE];
                while (written < size) {
                    int chunk = (int) Math.min(zeros.length, size - written);
                    tar.write(zeros, 0, chunk);
                    written += chunk;
                }
                stats.addSkipped();
            } else {
                stats.addFile(size);
                debug(() -> log.debug("Added file: {} ({})", name, readableSize(size)));
            }
            tar.closeArchiveEntry();
        }
    }

    @Override
    public ArchiveStats extractArchive(InputStream in, Path destination) throws IOException {
        Path root = destination.toAbsolutePath().normalize();
        Files.createDirectories(root);
        ArchiveStats stats = new ArchiveStats();
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<DeferredDirectory> directories = new ArrayList<>();

        log.info("Extracting archive to {}", root);

        BufferedInputStream buffered = new BufferedInputStream(in, BUFFER_SIZE);
        InputStream source = isGzip(buffered) ? new GZIPInputStream(buffered, BUFFER_SIZE) : buffered;
        TarArchiveInputStream tar = new TarArchiveInputStream(source, StandardCharsets.UTF_8.name());

        TarArchiveEntry entry;
        while ((entry = tar.getNextEntry()) != null) {
            checkInterrupted();
            Path target = resolveEntry(root, entry.getName());
            if (target == null) {
                log.warn("Skipping entry {}, it points outside of {}", entry.getName(), root);
                stats.addSkipped();
                continue;
            }
            if (throughLink(root, target, entry.isDirectory())) {
                log.warn("Skipping entry {}, it passes through a symbolic link", entry.getName());
                stats.addSkipped();
                continue;
            }

            try {
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    directories.add(new DeferredDirectory(target, entry.getMode(), permissionDescriptor(entry),
                            entry.getModTime().getTime()));
                    stats.addDirectory();
                } else if (entry.isSymbolicLink()) {
                    extractLink(entry, target, stats);
                } else if (isRegularFile(entry)) {
                    extractFile(tar, entry, target);
                    applyMetadata(target, entry.getMode(), permissionDescriptor(entry), entry.getModTime().getTime());
                    stats.addFile(entry.getSize());
                    debug(() -> log.debug("Extracted file: {}", target));
                } else {
                    log.warn("Unsupported entry type for {}: {}", entry.getName(), (char) entry.getLinkFlag());
                    stats.addSkipped();
                }
            } catch (InterruptedIOException exc) {
                throw exc;
            } catch (IOException exc) {
                log.warn("Failed to extract {}: {}", entry.getName(), exc.getMessage());
                stats.addSkipped();
            }
        }

        // Deepest first so restrictive parent permissions do not block their children.
        Collections.reverse(directories);
        for (DeferredDirectory directory : directories) {
            applyMetadata(directory.path, directory.mode, directory.descriptor, directory.modified);
        }

        log.info("Archive extracted: {} files, {} in {} ({} skipped)",
                readableNumber(stats.getFilesProcessed()), readableSize(stats.getTotalSize()),
                stopwatch, readableNumber(stats.getSkipped()));
        return stats;
    }

    private static boolean isRegularFile(TarArchiveEntry entry) {
        byte flag = entry.getLinkFlag();
        return flag == TarConstants.LF_NORMAL || flag == TarConstants.LF_OLDNORM || flag == TarConstants.LF_CONTIG;
    }

    private static boolean isGzip(BufferedInputStream stream) throws IOException {
        stream.mark(2);
        int first = stream.read();
        int second = stream.read();
        stream.reset();
        return first == GZIP_MAGIC_FIRST && second == GZIP_MAGIC_SECOND;
    }

    static Path resolveEntry(Path root, String name) {
        String normalized = name.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        if (normalized.isEmpty() || normalized.equals(".")) {
            return root;
        }
        if (normalized.startsWith("/") || normalized.matches("^[A-Za-z]:.*")) {
            return null;
        }
        Path target = root.resolve(normalized.replace("/", root.getFileSystem().getSeparator())).normalize();
        if (!target.startsWith(root)) {
            return null;
        }
        return target;
    }

    /**
     * True if any existing path element between root and target is a symbolic link. Writing through such a
     * link could land outside of root. Directory entries also check the target itself.
     */
    static boolean throughLink(Path root, Path target, boolean includeTarget) {
        if (target.equals(root)) {
            return false;
        }
        Path relative = root.relativize(target);
        int count = includeTarget ? relative.getNameCount() : relative.getNameCount() - 1;
        Path current = root;
        for (int i = 0; i < count; i++) {
            current = current.resolve(relative.getName(i));
            if (Files.isSymbolicLink(current)) {
                return true;
            }
        }
        return false;
    }

    private String permissionDescriptor(TarArchiveEntry entry) {
        if (!preservePermissions) {
            return null;
        }
        String encoded = entry.getExtraPaxHeader(PERMISSION_PAX_KEY);
        if (encoded == null || encoded.isEmpty()) {
            return null;
        }
        try {
            return new String(BASE64.decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException exc) {
            log.warn("Ignoring malformed permissions of {}", entry.getName());
            return null;
        }
    }

    private void extractLink(TarArchiveEntry entry, Path target, ArchiveStats stats) throws IOException {
        Files.createDirectories(target.getParent());
        if (Files.isSymbolicLink(target)) {
            Files.delete(target);
        }
        try {
            Files.createSymbolicLink(target, target.getFileSystem().getPath(entry.getLinkName()));
        } catch (UnsupportedOperationException | IOException exc) {
            log.warn("Failed to create link {} to {}: {}", target, entry.getLinkName(), exc.getMessage());
            stats.addSkipped();
            return;
        }
        String descriptor = permissionDescriptor(entry);
        if (descriptor != null) {
            permissionManager.setPermissionDescriptor(target, descriptor);
        }
    }

    private static void extractFile(TarArchiveInputStream tar, TarArchiveEntry entry, Path target)
            throws IOException {
        Files.createDirectories(target.getParent());
        if (Files.isSymbolicLink(target)) {
            Files.delete(target);
        }
        try (OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            long remaining = entry.getSize();
            int read;
            while (remaining > 0 && (read = tar.read(buffer, 0, (int) Math.min(buffer.length, remaining))) >= 0) {
                out.write(buffer, 0, read);
                remaining -= read;
            }
            if (remaining > 0) {
                throw new IOException("Archive ended in the middle of " + entry.getName());
            }
        }
    }

    private void applyMetadata(Path target, int mode, String descriptor, long modified) {
        int permissions = mode & PERMISSION_BITS;
        if (permissions != 0) {
            PosixFileAttributeView view = Files.getFileAttributeView(target, PosixFileAttributeView.class,
                    LinkOption.NOFOLLOW_LINKS);
            if (view != null) {
                try {
                    view.setPermissions(PosixPermissionManager.fromMode(permissions));
                } catch (IOException | UnsupportedOperationException exc) {
                    log.warn("Failed to set mode of {}: {}", target, exc.getMessage());
                }
            }
        }
        if (descriptor != null) {
            permissionManager.setPermissionDescriptor(target, descriptor);
        }
        if (modified > 0) {
            try {
                Files.setLastModifiedTime(target, FileTime.fromMillis(modified));
            } catch (IOException exc) {
                debug(() -> log.debug("Failed to set modification time of {}", target));
            }
        }
    }

    @Override
    public long countFiles(Path root, List<String> includeFolders) throws IOException {
        checkRoot(root);
        IncludeFilter filter = new IncludeFilter(includeFolders);
        AtomicLong count = new AtomicLong();
        Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                        return filter.includes(IncludeFilter.relativeName(root, dir))
                                ? FileVisitResult.CONTINUE : FileVisitResult.SKIP_SUBTREE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile() && filter.includes(IncludeFilter.relativeName(root, file))) {
                            count.incrementAndGet();
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                        if (file.equals(root)) {
                            throw exc;
                        }
                        return FileVisitResult.CONTINUE;
                    }
                });
        return count.get();
    }

    private static class DeferredDirectory {
        private final Path path;
        private final int mode;
        private final String descriptor;
        private final long modified;

        DeferredDirectory(Path path, int mode, String descriptor, long modified) {
            this.path = path;
            this.mode = mode;
            this.descriptor = descriptor;
            this.modified = modified;
        }
    }
}
