package com.di.geoingest.load.metadata;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Domain model for the {@code load_jobs} ledger table. One row is appended when a load job ends,
 * whether it completed or was interrupted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadJob {

    private String  jobId;

    // ---- source / target ---------------------------------------------------
    private String  sourcePath;
    private String  layerName;
    private String  tableId;
    private Long    inputFeatureCount;

    // ---- plan --------------------------------------------------------------
    private Long    jobSize;
    private Long    jobCount;
    private Long    startAt;
    private Boolean validateFeature;

    // ---- results -----------------------------------------------------------
    private Long    invalidFeatureCount;
    private Long    insertedFeatures;
    /** Target table row count after the job; {@code null} when it could not be read. */
    private Long    tableRowCount;
    private Long    resumeAt;

    // ---- lifecycle ---------------------------------------------------------
    private Instant startTime;
    private Instant endTime;
    private String  duration;
    private LoadJobStatus status;
    private String  errorMessage;
}
