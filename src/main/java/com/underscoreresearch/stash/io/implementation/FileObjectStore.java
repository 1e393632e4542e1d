package com.underscoreresearch.stash.io.implementation;

import static com.underscoreresearch.stash.io.BackupKeyCodec.PATH_SEPARATOR;
import static com.underscoreresearch.stash.io.IOUtils.createDirectory;
import static com.underscoreresearch.stash.io.IOUtils.deleteFile;
import static com.underscoreresearch.stash.io.IOUtils.deleteFileException;
import static com.underscoreresearch.stash.utils.LogUtil.debug;
import static com.underscoreresearch.stash.utils.LogUtil.readableSize;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import lombok.extern.slf4j.Slf4j;

import com.underscoreresearch.stash.io.BackupKeyCodec;
import com.underscoreresearch.stash.io.IOUtils;
import com.underscoreresearch.stash.io.ObjectStore;
import com.underscoreresearch.stash.model.BackupRecord;

/**
 * Object store backed by a local directory, one file per key. Mostly useful for testing and for
 * backing up to mounted network storage.
 */
@Slf4j
public class FileObjectStore implements ObjectStore {
    private static final String TEMP_SUFFIX = ".partial";

    private final Path root;
    private final BackupKeyCodec keyCodec;

    public FileObjectStore(Path root, BackupKeyCodec keyCodec) throws IOException {
        this.root = root.toAbsolutePath().normalize();
        this.keyCodec = keyCodec;

        try {
            Files.createDirectories(this.root);
        } catch (IOException exc) {
            throw new IOException("Cannot access storage directory \"" + this.root + "\"", exc);
        }
        if (!Files.isDirectory(this.root) || !Files.isWritable(this.root)) {
            throw new IOException("Storage directory \"" + this.root + "\" is not a writable directory");
        }
    }

    private Path getFile(String key) throws IOException {
        Path file = root.resolve(key.replace(PATH_SEPARATOR, root.getFileSystem().getSeparator())).normalize();
        if (!file.startsWith(root) || file.equals(root)) {
            throw new IOException("Invalid object key \"" + key + "\"");
        }
        return file;
    }

    private static String etag(BasicFileAttributes attributes) {
        return Long.toHexString(attributes.lastModifiedTime().toMillis()) + "-" + Long.toHexString(attributes.size());
    }

    @Override
    public BackupRecord put(String key, Path source) throws IOException {
        try (InputStream stream = Files.newInputStream(source)) {
            return put(key, stream, Files.size(source));
        }
    }

    @Override
    public BackupRecord put(String key, InputStream stream, long length) throws IOException {
        Path file = getFile(key);
        createDirectory(file.getParent(), true);
        Path temp = file.resolveSibling(file.getFileName() + TEMP_SUFFIX);
        try {
            long written;
            try (OutputStream out = Files.newOutputStream(temp)) {
                written = IOUtils.copyStream(stream, out);
            }
            if (written != length) {
                throw new IOException("Expected " + length + " bytes for \"" + key + "\" but got " + written);
            }
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException exc) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            deleteFile(temp);
        }

        BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
        debug(() -> log.debug("Wrote \"{}\" ({})", file, readableSize(attributes.size())));
        return keyCodec.requireRecord(key, attributes.size(), etag(attributes));
    }

    @Override
    public InputStream get(String key) throws IOException {
        Path file = getFile(key);
        try {
            return Files.newInputStream(file);
        } catch (NoSuchFileException exc) {
            throw new IOException("Object \"" + key + "\" does not exist", exc);
        }
    }

    private Path listingStart(String prefix) throws IOException {
        int index = prefix.lastIndexOf(PATH_SEPARATOR);
        if (index <= 0) {
            return root;
        }
        return getFile(prefix.substring(0, index));
    }

    @Override
    public List<BackupRecord> list(String prefix) throws IOException {
        List<BackupRecord> ret = new ArrayList<>();
        Path start = listingStart(prefix);
        if (!Files.isDirectory(start)) {
            debug(() -> log.debug("No archives under \"{}\"", prefix));
            return ret;
        }
        try (Stream<Path> files = Files.walk(start)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                String key = root.relativize(file).toString().replace(root.getFileSystem().getSeparator(),
                        PATH_SEPARATOR);
                if (!key.startsWith(prefix) || key.endsWith(TEMP_SUFFIX)) {
                    continue;
                }
                BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
                if (attributes.isRegularFile()) {
                    keyCodec.toRecord(key, attributes.size(), etag(attributes)).ifPresent(ret::add);
                }
            }
        } catch (UncheckedIOException exc) {
            throw new IOException("Failed to list \"" + prefix + "\"", exc.getCause());
        }
        debug(() -> log.debug("Listed {} archives under \"{}\"", ret.size(), prefix));
        return ret;
    }

    @Override
    public void delete(String key) throws IOException {
        Path file = getFile(key);
        deleteFileException(file);
        debug(() -> log.debug("Deleted \"{}\"", file));
    }

    @Override
    public void deleteMany(List<String> keys) throws IOException {
        List<String> failed = new ArrayList<>();
        for (String key : keys) {
            try {
                delete(key);
            } catch (IOException exc) {
                log.warn("Failed to delete \"{}\"", key, exc);
                failed.add(key);
            }
        }
        if (!failed.isEmpty()) {
            throw new IOException("Failed to delete objects: " + String.join(", ", failed));
        }
    }

    @Override
    public BackupKeyCodec getKeyCodec() {
        return keyCodec;
    }
}
