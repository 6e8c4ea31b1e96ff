package com.di.geoingest.load;

import com.di.geoingest.load.metadata.LoadJobStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for load jobs: batch flushes, inserted and rejected features, job outcomes.
 */
@Slf4j
@Component
public class LoadMetrics {

    public static final String PATH_BULK = "bulk";
    public static final String PATH_STREAMING = "streaming";

    private final MeterRegistry meterRegistry;

    private final Timer bulkFlushTimer;
    private final Timer streamingFlushTimer;
    private final Counter bulkFlushErrorCounter;
    private final Counter streamingRowErrorCounter;
    private final DistributionSummary batchSizeDistribution;

    public LoadMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.bulkFlushTimer = Timer.builder("geoingest.batch.flush.duration")
                .description("Time taken to flush one batch to the warehouse")
                .tag("path", PATH_BULK)
                .register(meterRegistry);

        this.streamingFlushTimer = Timer.builder("geoingest.batch.flush.duration")
                .description("Time taken to flush one batch to the warehouse")
                .tag("path", PATH_STREAMING)
                .register(meterRegistry);

        this.bulkFlushErrorCounter = Counter.builder("geoingest.bulk.load.failures")
                .description("Bulk load jobs that failed and interrupted their load job")
                .register(meterRegistry);

        this.streamingRowErrorCounter = Counter.builder("geoingest.streaming.row.errors")
                .description("Rows rejected by streaming inserts")
                .register(meterRegistry);

        this.batchSizeDistribution = DistributionSummary.builder("geoingest.batch.size")
                .description("Features per flushed batch")
                .baseUnit("features")
                .register(meterRegistry);
    }

    // ============================================================================
    // Batches
    // ============================================================================

    public void recordFlush(String path, int batchSize, long durationMs) {
        Timer timer = PATH_BULK.equals(path) ? bulkFlushTimer : streamingFlushTimer;
        timer.record(durationMs, TimeUnit.MILLISECONDS);
        batchSizeDistribution.record(batchSize);
    }

    public void recordInserted(String path, long features) {
        meterRegistry.counter("geoingest.features.inserted", "path", path).increment(features);
    }

    public void recordBulkFailure() {
        bulkFlushErrorCounter.increment();
    }

    public void recordStreamingRowErrors(int errors) {
        streamingRowErrorCounter.increment(errors);
    }

    // ============================================================================
    // Features and jobs
    // ============================================================================

    public void recordRejected(ValidationErrorType reason) {
        meterRegistry.counter("geoingest.features.rejected", "reason", reason.name()).increment();
    }

    public void recordJob(LoadJobStatus status) {
        meterRegistry.counter("geoingest.jobs", "status", status.name()).increment();
        log.debug("Recorded load job outcome: {}", status);
    }
}
