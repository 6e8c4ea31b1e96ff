package com.di.geoingest.schema;

/**
 * Warehouse column types a source field can translate to.
 */
public enum ColumnType {
    INT64,
    FLOAT64,
    STRING,
    BOOL,
    DATE,
    DATETIME,
    TIMESTAMP,
    TIME,
    BYTES,
    JSON,
    GEOGRAPHY
}
