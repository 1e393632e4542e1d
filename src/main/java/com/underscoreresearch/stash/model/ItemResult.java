package com.underscoreresearch.stash.model;

public interface ItemResult {
    String getService();

    String getPath();

    Exception getError();

    default boolean isSuccessful() {
        return getError() == null;
    }
}
