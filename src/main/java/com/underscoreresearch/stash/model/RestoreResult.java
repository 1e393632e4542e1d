package com.underscoreresearch.stash.model;

import java.nio.file.Path;
import java.time.Duration;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RestoreResult implements ItemResult {
    private String service;
    private String path;
    private BackupRecord record;
    private Path restorePath;
    private boolean dryRun;
    private long filesRestored;
    private Duration duration;
    private Exception error;
}
