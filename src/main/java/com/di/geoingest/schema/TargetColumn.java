package com.di.geoingest.schema;

import java.util.Objects;

/**
 * One column of a warehouse table schema.
 */
public record TargetColumn(String name, ColumnType type, ColumnMode mode, String description) {

    public TargetColumn {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        mode = mode != null ? mode : ColumnMode.NULLABLE;
    }

    public static TargetColumn of(String name, ColumnType type) {
        return new TargetColumn(name, type, ColumnMode.NULLABLE, null);
    }

    public static TargetColumn repeated(String name, ColumnType type) {
        return new TargetColumn(name, type, ColumnMode.REPEATED, null);
    }

    public boolean isRepeated() {
        return mode == ColumnMode.REPEATED;
    }
}
