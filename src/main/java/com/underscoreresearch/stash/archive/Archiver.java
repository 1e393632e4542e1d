package com.underscoreresearch.stash.archive;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Turns a directory tree into a single sequential stream and back. The archiver never closes the
 * streams it is given.
 */
public interface Archiver {
    /**
     * Writes every entry under root that passes the include filter. Only an inaccessible root fails the
     * whole call, problems with individual entries are logged and counted as skipped.
     */
    ArchiveStats createArchive(OutputStream out, Path root, List<String> includeFolders) throws IOException;

    ArchiveStats extractArchive(InputStream in, Path destination) throws IOException;

    /**
     * Number of regular files {@link #createArchive} would write for the same arguments.
     */
    long countFiles(Path root, List<String> includeFolders) throws IOException;

    boolean isCompression();
}
