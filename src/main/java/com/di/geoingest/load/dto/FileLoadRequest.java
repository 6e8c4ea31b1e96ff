package com.di.geoingest.load.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * REST request body for {@code POST /api/load/file}.
 *
 * <p>Spatial files go through bulk load jobs sized against the daily quota; files without
 * geometry are streamed in chunks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileLoadRequest {

    // ---- source -----------------------------------------------------------

    /** Local path of a {@code .shp}, {@code .gdb} or line-delimited GeoJSON file. */
    @NotBlank
    private String sourcePath;

    /** Layer to read; required for a geodatabase, ignored otherwise. */
    private String layerName;

    // ---- target -----------------------------------------------------------

    /** {@code dataset.table} or {@code project.dataset.table}. */
    @NotBlank
    private String tableId;

    // ---- plan -------------------------------------------------------------

    @Builder.Default
    private boolean validateFeature = true;

    /**
     * Features per bulk load job. {@code null} or {@code -1} picks the smallest size that stays
     * within the daily quota.
     */
    private Long jobSize;

    /** Row index to start from, usually the {@code resume_at} of an interrupted job. */
    @Builder.Default
    @PositiveOrZero
    private long startAt = 0L;

    /** Rows per streaming insert for files without geometry; defaults to the configured chunk size. */
    private Integer chunkSize;
}
