package com.underscoreresearch.stash.utils;

/**
 * Thrown by an engine when its thread was interrupted between items. Results gathered before
 * the interruption are discarded.
 */
public class ProcessingStoppedException extends RuntimeException {
    public ProcessingStoppedException(String operation) {
        super("Processing of " + operation + " stopped");
    }

    public ProcessingStoppedException(String operation, Throwable cause) {
        super("Processing of " + operation + " stopped", cause);
    }
}
