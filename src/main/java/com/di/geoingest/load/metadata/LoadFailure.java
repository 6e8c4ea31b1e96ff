package com.di.geoingest.load.metadata;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A quarantined feature, appended to {@code load_failures} once per rejection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadFailure {

    private String  jobId;
    private String  sourcePath;
    private String  layerName;
    private String  tableId;
    private Long    row;
    private Map<String, Object> props;
    private Instant failTime;
    private String  failReason;
}
