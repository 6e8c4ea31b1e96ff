package com.di.geoingest.load.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * REST request body for {@code POST /api/load/database}: syncs one PostgreSQL/PostGIS table
 * into the warehouse with streaming inserts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseLoadRequest {

    // ---- source -----------------------------------------------------------

    @NotBlank
    private String host;

    @Builder.Default
    private int port = 5432;

    @NotBlank
    private String database;

    @NotBlank
    private String username;

    private String password;

    /** {@code table} or {@code schema.table}; the schema defaults to {@code public}. */
    @NotBlank
    private String table;

    // ---- target -----------------------------------------------------------

    @NotBlank
    private String tableId;

    // ---- plan -------------------------------------------------------------

    @Builder.Default
    private boolean validateFeature = true;

    @Builder.Default
    @PositiveOrZero
    private long startAt = 0L;

    private Integer chunkSize;
}
