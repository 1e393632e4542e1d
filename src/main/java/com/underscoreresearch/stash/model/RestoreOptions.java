package com.underscoreresearch.stash.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestoreOptions {
    private String serviceName;
    private String date;
    private boolean latest;
    private boolean dryRun;
    private boolean force;
    private String destination;
}
