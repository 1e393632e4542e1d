package com.underscoreresearch.stash.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CleanupResult {
    private boolean preview;
    @Builder.Default
    private List<BackupRecord> deleted = new ArrayList<>();
    private long bytesFreed;
    @Builder.Default
    private Map<String, Exception> errors = new TreeMap<>();

    public boolean isFailed() {
        return !errors.isEmpty();
    }
}
