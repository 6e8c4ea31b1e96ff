package com.di.geoingest.load.metadata;

public enum LoadJobStatus {
    /** Iteration reached the source's feature count. */
    COMPLETED,
    /** Iteration stopped early; re-run with {@code startAt = resumeAt}. */
    INTERRUPTED
}
