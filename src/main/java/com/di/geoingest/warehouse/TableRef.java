package com.di.geoingest.warehouse;

import java.util.Objects;

/**
 * Fully-qualified warehouse table identifier {@code project.dataset.table}.
 */
public record TableRef(String project, String dataset, String table) {

    public TableRef {
        Objects.requireNonNull(project, "project");
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(table, "table");
    }

    /**
     * Parses {@code project.dataset.table} or {@code dataset.table}; the short form takes
     * {@code defaultProject}. Backticks around the identifier are ignored.
     */
    public static TableRef parse(String id, String defaultProject) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Table id cannot be empty");
        }
        String[] parts = id.trim().replace("`", "").split("\\.");
        if (parts.length == 3) {
            return new TableRef(parts[0], parts[1], parts[2]);
        }
        if (parts.length == 2 && defaultProject != null && !defaultProject.isBlank()) {
            return new TableRef(defaultProject, parts[0], parts[1]);
        }
        throw new IllegalArgumentException("Table id must be project.dataset.table or dataset.table: " + id);
    }

    public String datasetId() {
        return project + "." + dataset;
    }

    @Override
    public String toString() {
        return project + "." + dataset + "." + table;
    }
}
