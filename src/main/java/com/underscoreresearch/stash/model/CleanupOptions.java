package com.underscoreresearch.stash.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleanupOptions {
    public static final String ALL_SERVICES = "all";

    private String serviceName;
    private Integer olderThanDays;
    private int keepLatest;
    private boolean preview;

    public boolean allServices() {
        return serviceName == null || serviceName.isEmpty() || ALL_SERVICES.equals(serviceName);
    }
}
