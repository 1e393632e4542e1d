package com.underscoreresearch.stash.model;

import java.util.Collection;

import lombok.Value;

/**
 * Succeeded and failed item counts of one run. A run has failed as soon as one item failed.
 */
@Value
public class RunSummary {
    int succeeded;
    int failed;

    public static RunSummary of(Collection<? extends ItemResult> results) {
        int succeeded = 0;
        int failed = 0;
        for (ItemResult result : results) {
            if (result.isSuccessful()) {
                succeeded++;
            } else {
                failed++;
            }
        }
        return new RunSummary(succeeded, failed);
    }

    public boolean isFailed() {
        return failed > 0;
    }
}
