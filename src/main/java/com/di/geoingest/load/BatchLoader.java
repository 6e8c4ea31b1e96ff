package com.di.geoingest.load;

import com.di.geoingest.load.metadata.LoadJobStatus;
import com.di.geoingest.source.Feature;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Shared iteration for both load paths.
 *
 * <pre>
 *   OPEN → (VALIDATING → {ACCUMULATING | REJECTED}) → FLUSHING → DONE | INTERRUPTED
 * </pre>
 *
 * The feature iterator is already positioned on {@code startAt} (see
 * {@link com.di.geoingest.source.SourceDataset#features(long)}), so earlier rows are neither decoded
 * nor validated. Every admitted feature joins exactly one batch; a batch is flushed when it holds {@code jobSize} features and the partial last batch
 * is flushed when the source is exhausted. An exception escaping {@link #flush} (or the source)
 * stops the job; batches flushed before it stay committed.
 */
@Slf4j
public abstract class BatchLoader {

    private final FeatureAdmission admission;

    protected BatchLoader(FeatureAdmission admission) {
        this.admission = admission;
    }

    /** Metrics tag and log label of this path. */
    protected abstract String pathTag();

    /**
     * Writes one batch.
     *
     * @return rows the warehouse applied
     */
    protected abstract long flush(LoadJobContext context, List<Feature> batch);

    /**
     * @param iterationComplete whether the source was read up to its feature count
     */
    protected LoadJobStatus resolveStatus(boolean iterationComplete, long attempted, long applied) {
        return iterationComplete ? LoadJobStatus.COMPLETED : LoadJobStatus.INTERRUPTED;
    }

    /**
     * @param features source rows from {@code context.getStartAt()} onwards
     */
    public LoadOutcome load(LoadJobContext context, Iterator<Feature> features) {
        long startAt = context.getStartAt();
        long jobSize = context.getJobSize();
        List<Feature> batch = new ArrayList<>((int) Math.min(jobSize, 10_000L));

        long index = startAt;
        long inserted = 0;
        long invalid = 0;
        long attempted = 0;
        long completedJobs = 0;
        long resumeAt = startAt;
        String error = null;

        if (startAt > 0) {
            log.info("[{}] Resuming {} at row {}", pathTag(), context.getTable(), startAt);
        }
        try {
            while (features.hasNext()) {
                Feature feature = features.next();
                long row = index++;
                if (!admission.admit(context, row, feature)) {
                    invalid++;
                    continue;
                }
                batch.add(feature);
                if (batch.size() >= jobSize) {
                    attempted += batch.size();
                    inserted += flush(context, batch);
                    completedJobs++;
                    resumeAt = row + 1;
                    logProgress(context, completedJobs, row + 1, invalid);
                    batch.clear();
                }
            }
            if (!batch.isEmpty()) {
                attempted += batch.size();
                inserted += flush(context, batch);
                completedJobs++;
                logProgress(context, completedJobs, index, invalid);
                batch.clear();
            }
            resumeAt = Math.max(resumeAt, index);
        } catch (RuntimeException e) {
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("[{}] Load into {} interrupted at row {}: {}", pathTag(), context.getTable(), index, error, e);
        }

        boolean iterationComplete = error == null && index >= context.getFeatureCount();
        LoadJobStatus status = resolveStatus(iterationComplete, attempted, inserted);
        if (status == LoadJobStatus.INTERRUPTED && error == null) {
            error = iterationComplete
                    ? "None of " + attempted + " attempted rows were applied"
                    : "Source ended after " + index + " of " + context.getFeatureCount() + " features";
        }
        if (status == LoadJobStatus.INTERRUPTED && inserted == 0) {
            resumeAt = startAt;
        }
        return new LoadOutcome(inserted, invalid, index, resumeAt, status, error);
    }

    private void logProgress(LoadJobContext context, long completedJobs, long featuresDone, long invalid) {
        log.info("[{}] Loading {} Completed Jobs {}/{} Completed Features {}/{} Invalid features {}",
                pathTag(), context.getTable(), completedJobs, context.getJobCount(),
                featuresDone, context.getFeatureCount(), invalid);
    }
}
