package com.di.geoingest.schema;

public enum ColumnMode {
    NULLABLE,
    REPEATED
}
