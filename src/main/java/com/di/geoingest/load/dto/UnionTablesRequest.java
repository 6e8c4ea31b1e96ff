package com.di.geoingest.load.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * REST request body for {@code POST /api/load/union}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnionTablesRequest {

    @NotEmpty
    private List<String> sourceTableIds;

    @NotBlank
    private String outputTableId;

    /** Replace the output table when it already exists. */
    @Builder.Default
    private boolean overwrite = false;
}
