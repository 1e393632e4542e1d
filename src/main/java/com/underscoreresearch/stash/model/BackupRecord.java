package com.underscoreresearch.stash.model;

import java.time.LocalDateTime;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

import com.underscoreresearch.stash.utils.BackupTimestamp;

/**
 * One uploaded archive generation. Identity is the object key.
 */
@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BackupRecord {
    String service;
    String pathName;
    LocalDateTime timestamp;
    @EqualsAndHashCode.Include
    String key;
    long size;
    String etag;

    public String timestampText() {
        return BackupTimestamp.format(timestamp);
    }
}
