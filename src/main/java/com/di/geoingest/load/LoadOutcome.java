package com.di.geoingest.load;

import com.di.geoingest.load.metadata.LoadJobStatus;

/**
 * What a loader reports back once iteration stops.
 *
 * @param rowsVisited source rows read, including skipped and rejected ones
 * @param resumeAt    row index a re-run should start at to continue where this one stopped
 */
public record LoadOutcome(long insertedFeatures,
                          long invalidFeatureCount,
                          long rowsVisited,
                          long resumeAt,
                          LoadJobStatus status,
                          String errorMessage) {
}
