package com.di.geoingest.load.dto;

import com.di.geoingest.load.metadata.LoadJob;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * REST response for a finished load job; mirrors the ledger row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadJobResponse {

    private String jobId;
    private String status;
    private String tableId;
    private String sourcePath;
    private String layerName;

    private long inputFeatureCount;
    private long insertedFeatures;
    private long invalidFeatureCount;
    /** {@code null} when the row count could not be read after the load. */
    private Long tableRowCount;

    private long jobSize;
    private long jobCount;
    private long startAt;
    /** Pass as {@code startAt} to continue an interrupted job. */
    private long resumeAt;

    private String startTime;
    private String endTime;
    private String duration;

    /** Human-readable summary or error detail. */
    private String message;

    public static LoadJobResponse from(LoadJob job) {
        return LoadJobResponse.builder()
                .jobId(job.getJobId())
                .status(job.getStatus() != null ? job.getStatus().name() : null)
                .tableId(job.getTableId())
                .sourcePath(job.getSourcePath())
                .layerName(job.getLayerName())
                .inputFeatureCount(orZero(job.getInputFeatureCount()))
                .insertedFeatures(orZero(job.getInsertedFeatures()))
                .invalidFeatureCount(orZero(job.getInvalidFeatureCount()))
                .tableRowCount(job.getTableRowCount())
                .jobSize(orZero(job.getJobSize()))
                .jobCount(orZero(job.getJobCount()))
                .startAt(orZero(job.getStartAt()))
                .resumeAt(orZero(job.getResumeAt()))
                .startTime(job.getStartTime() != null ? job.getStartTime().toString() : null)
                .endTime(job.getEndTime() != null ? job.getEndTime().toString() : null)
                .duration(job.getDuration())
                .message(job.getErrorMessage() != null
                        ? job.getErrorMessage()
                        : "Loaded " + orZero(job.getInsertedFeatures()) + " features into " + job.getTableId())
                .build();
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }
}
