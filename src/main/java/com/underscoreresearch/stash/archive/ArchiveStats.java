package com.underscoreresearch.stash.archive;

import lombok.Data;

@Data
public class ArchiveStats {
    private long filesProcessed;
    private long directories;
    private long totalSize;
    private long skipped;

    public void addFile(long size) {
        filesProcessed++;
        totalSize += size;
    }

    public void addDirectory() {
        directories++;
    }

    public void addSkipped() {
        skipped++;
    }
}
