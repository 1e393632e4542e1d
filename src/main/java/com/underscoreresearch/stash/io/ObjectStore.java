package com.underscoreresearch.stash.io;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

import com.underscoreresearch.stash.model.BackupRecord;

/**
 * Durable storage for archives, addressed by key.
 * <p>
 * An upload is either fully visible under its key or not visible at all. Implementations must be safe
 * to call from several threads.
 */
public interface ObjectStore extends Closeable {
    BackupRecord put(String key, Path source) throws IOException;

    BackupRecord put(String key, InputStream stream, long length) throws IOException;

    /**
     * Opens the archive stored under key. The caller closes the stream.
     */
    InputStream get(String key) throws IOException;

    /**
     * All archives whose key starts with prefix. Keys that are not archive keys are left out.
     */
    List<BackupRecord> list(String prefix) throws IOException;

    void delete(String key) throws IOException;

    void deleteMany(List<String> keys) throws IOException;

    BackupKeyCodec getKeyCodec();

    @Override
    default void close() throws IOException {
    }
}
