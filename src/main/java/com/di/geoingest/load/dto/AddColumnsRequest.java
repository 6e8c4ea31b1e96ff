package com.di.geoingest.load.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * REST request body for {@code POST /api/load/tables/{tableId}/columns}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddColumnsRequest {

    @NotEmpty
    @Valid
    private List<ColumnRequest> columns;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ColumnRequest {

        @NotBlank
        private String name;

        /** Warehouse type name such as {@code STRING}, {@code INT64} or {@code GEOGRAPHY}. */
        @NotBlank
        private String type;

        /** {@code NULLABLE} (default) or {@code REPEATED}. */
        private String mode;

        private String description;
    }
}
