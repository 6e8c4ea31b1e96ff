package com.di.geoingest.load;

import com.di.geoingest.config.GeoIngestProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Sizes bulk batches so a full load never exceeds the warehouse's per-table daily load-job quota.
 *
 * <pre>
 *   optimum  = ceil(featureCount / quota), at least 1
 *   jobCount = ceil((featureCount - startAt) / jobSize)
 * </pre>
 */
@Slf4j
@Component
public class JobSizer {

    public static final long AUTO = -1L;

    private final int dailyJobQuota;

    @Autowired
    public JobSizer(GeoIngestProperties properties) {
        this(properties.getQuota().getJobsPerTablePerDay());
    }

    public JobSizer(int dailyJobQuota) {
        if (dailyJobQuota < 1) {
            throw new IllegalArgumentException("Daily job quota must be >= 1, got: " + dailyJobQuota);
        }
        this.dailyJobQuota = dailyJobQuota;
    }

    public int getDailyJobQuota() {
        return dailyJobQuota;
    }

    public long optimumJobSize(long featureCount) {
        return Math.max(1L, ceilDiv(Math.max(0L, featureCount), dailyJobQuota));
    }

    /**
     * Plans a bulk load.
     *
     * @param requestedJobSize {@code null} or {@link #AUTO} for the optimum; a smaller value than the
     *                         optimum is raised to it
     */
    public JobPlan plan(long featureCount, long startAt, Long requestedJobSize) {
        long optimum = optimumJobSize(featureCount);
        long jobSize = optimum;
        boolean overridden = false;
        if (requestedJobSize != null && requestedJobSize != AUTO) {
            if (requestedJobSize < optimum) {
                log.warn("[SIZER] Requested job size {} would exceed {} load jobs per day for {} features; using {}",
                        requestedJobSize, dailyJobQuota, featureCount, optimum);
                overridden = true;
            } else {
                jobSize = requestedJobSize;
            }
        }
        return new JobPlan(jobSize, jobCount(featureCount, startAt, jobSize), optimum, overridden);
    }

    /**
     * Plans a streaming load, where the chunk size is free of the load-job quota.
     */
    public JobPlan chunked(long featureCount, long startAt, int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("Chunk size must be >= 1, got: " + chunkSize);
        }
        return new JobPlan(chunkSize, jobCount(featureCount, startAt, chunkSize), optimumJobSize(featureCount), false);
    }

    static long jobCount(long featureCount, long startAt, long jobSize) {
        long remaining = Math.max(0L, featureCount - startAt);
        return ceilDiv(remaining, jobSize);
    }

    private static long ceilDiv(long dividend, long divisor) {
        return (dividend + divisor - 1) / divisor;
    }
}
