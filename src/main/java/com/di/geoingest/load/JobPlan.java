package com.di.geoingest.load;

/**
 * Batch sizing for one load job.
 *
 * @param jobSize        features per batch (bulk) or rows per insert chunk (streaming)
 * @param jobCount       batches needed to cover {@code featureCount - startAt}
 * @param optimumJobSize smallest batch size that keeps the job count within the daily quota
 * @param overridden     whether a requested size was raised to the optimum
 */
public record JobPlan(long jobSize, long jobCount, long optimumJobSize, boolean overridden) {
}
