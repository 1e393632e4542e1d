package com.underscoreresearch.stash.archive;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Restricts an archive to a set of folders below its root.
 * <p>
 * A relative path is kept when it starts with one of the folders, or when one of the folders starts with
 * it, so parents of an included folder are walked. The comparison is a plain string prefix, so
 * {@code uploads} also matches {@code uploads-old}. The root itself is always kept and an empty folder
 * list keeps everything.
 */
public class IncludeFilter {
    public static final String ROOT = ".";
    public static final IncludeFilter ALL = new IncludeFilter(null);

    private final List<String> folders;

    public IncludeFilter(List<String> folders) {
        List<String> normalized = new ArrayList<>();
        if (folders != null) {
            for (String folder : folders) {
                String term = normalize(folder);
                if (!term.isEmpty()) {
                    normalized.add(term);
                }
            }
        }
        this.folders = Collections.unmodifiableList(normalized);
    }

    private static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String ret = path.trim().replace('\\', '/');
        while (ret.startsWith("./")) {
            ret = ret.substring(2);
        }
        while (ret.startsWith("/")) {
            ret = ret.substring(1);
        }
        while (ret.endsWith("/")) {
            ret = ret.substring(0, ret.length() - 1);
        }
        return ret;
    }

    /**
     * Forward slash path of file relative to root, {@code "."} for the root itself.
     */
    public static String relativeName(Path root, Path file) {
        Path relative = root.relativize(file);
        String ret = relative.toString().replace(root.getFileSystem().getSeparator(), "/");
        return ret.isEmpty() ? ROOT : ret;
    }

    public List<String> getFolders() {
        return folders;
    }

    public boolean includes(String relativePath) {
        String path = normalize(relativePath);
        if (path.isEmpty() || ROOT.equals(path) || folders.isEmpty()) {
            return true;
        }
        for (String folder : folders) {
            if (path.startsWith(folder) || folder.startsWith(path)) {
                return true;
            }
        }
        return false;
    }
}
