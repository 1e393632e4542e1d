package com.underscoreresearch.stash.model;

import java.time.Duration;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class BackupResult implements ItemResult {
    private String service;
    private String path;
    private BackupRecord record;
    private long archiveSize;
    private long filesProcessed;
    private Duration duration;
    private Exception error;
}
