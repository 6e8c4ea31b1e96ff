package com.di.geoingest.load;

import com.di.geoingest.schema.SourceSchema;
import com.di.geoingest.schema.SpatialClassification;
import com.di.geoingest.schema.TargetColumn;
import com.di.geoingest.source.SourceFormat;
import com.di.geoingest.warehouse.TableRef;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Everything a loader needs to know about the job it is running. Built once before the first
 * feature is read and never changed; counters live in the loaders.
 */
@Value
@Builder
public class LoadJobContext {

    String jobId;

    // ---- source -----------------------------------------------------------
    String sourcePath;
    String layerName;
    SourceFormat format;
    SourceSchema sourceSchema;
    SpatialClassification classification;
    long featureCount;

    // ---- target -----------------------------------------------------------
    TableRef table;
    List<TargetColumn> targetColumns;

    // ---- plan -------------------------------------------------------------
    long startAt;
    long jobSize;
    long jobCount;
    boolean validateFeature;

    Instant startTime;

    public boolean isSpatial() {
        return classification == SpatialClassification.SPATIAL;
    }
}
