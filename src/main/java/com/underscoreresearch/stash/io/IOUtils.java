package com.underscoreresearch.stash.io;

import static com.underscoreresearch.stash.utils.LogUtil.debug;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class IOUtils {
    private static final int DEFAULT_BUFFER_SIZE = 8192;

    public static long copyStream(InputStream in, OutputStream out) throws IOException {
        long transferred = 0;
        byte[] buffer = new byte[DEFAULT_BUFFER_SIZE];
        int read;
        while ((read = in.read(buffer, 0, DEFAULT_BUFFER_SIZE)) >= 0) {
            if (Thread.currentThread().isInterrupted()) {
                throw new IOException("Interrupted while copying data");
            }
            out.write(buffer, 0, read);
            transferred += read;
        }
        return transferred;
    }

    public static void createDirectory(Path directory, boolean warning) {
        try {
            Files.createDirectories(directory);
        } catch (IOException exc) {
            if (warning)
                log.warn("Failed to create directory {}", directory);
            else
                debug(() -> log.debug("Failed to create directory {}", directory));
        }
    }

    public static void deleteFile(Path file) {
        try {
            deleteFileException(file);
        } catch (IOException e) {
            log.warn(e.getMessage());
        }
    }

    public static void deleteFileException(Path file) throws IOException {
        try {
            Files.deleteIfExists(file);
        } catch (IOException exc) {
            throw new IOException("Failed to delete " + file, exc);
        }
    }

    /**
     * Creates an empty scratch file for staging an archive, creating the directory if needed.
     */
    public static Path createScratchFile(Path directory, String prefix, String suffix) throws IOException {
        Files.createDirectories(directory);
        return Files.createTempFile(directory, prefix, suffix);
    }
}
