package com.underscoreresearch.stash.io;

import java.time.LocalDateTime;

import lombok.Value;

@Value
public class BackupKey {
    String service;
    String pathName;
    LocalDateTime timestamp;
}
