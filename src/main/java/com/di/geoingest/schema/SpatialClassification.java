package com.di.geoingest.schema;

/**
 * Decides the load path: spatial datasets go through bulk load jobs, the rest through streaming inserts.
 */
public enum SpatialClassification {
    SPATIAL,
    NON_SPATIAL
}
