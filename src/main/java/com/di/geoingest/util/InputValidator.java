package com.di.geoingest.util;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Input validation for identifiers that end up inside SQL text (PostgreSQL source tables and
 * BigQuery table ids) and for the numeric knobs of a load request.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // Identifier Patterns
    // ============================================================================

    /** Unquoted PostgreSQL identifier, max 63 characters. */
    private static final Pattern POSTGRES_IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_$]{0,62}$");

    /** BigQuery dataset or table name. */
    private static final Pattern WAREHOUSE_NAME = Pattern.compile("^[a-zA-Z0-9_]{1,1024}$");

    /** BigQuery project id (letters, digits, dashes; optionally domain-scoped). */
    private static final Pattern WAREHOUSE_PROJECT = Pattern.compile("^[a-z][a-z0-9:.\\-]{0,62}[a-z0-9]$");

    /**
     * Statement keywords, comments, terminators and quotes. Keywords only count as whole words so
     * names such as {@code orders} or {@code landuse} pass.
     */
    private static final Pattern SQL_INJECTION_PATTERN = Pattern.compile(
            "(?i)(\\b(SELECT|INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|TRUNCATE|EXEC|EXECUTE|UNION|OR|AND)\\b|--|/\\*|\\*/|;|'|\"|`)"
    );

    // ============================================================================
    // PostgreSQL Identifiers
    // ============================================================================

    /**
     * Validates a PostgreSQL identifier (table, schema or column name).
     *
     * @return the trimmed identifier
     * @throws IllegalArgumentException if validation fails
     */
    public static String validateIdentifier(String identifier, String identifierType) {
        if (identifier == null) {
            throw new IllegalArgumentException(String.format("%s cannot be null", identifierType));
        }
        String trimmed = identifier.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(String.format("%s cannot be empty", identifierType));
        }
        rejectInjection(trimmed, identifierType);
        if (!POSTGRES_IDENTIFIER.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(String.format(
                    "Invalid %s '%s': must start with a letter or underscore and contain only letters, digits, underscores or dollar signs (max 63)",
                    identifierType, trimmed));
        }
        return trimmed;
    }

    /**
     * Validates {@code table} or {@code schema.table}.
     */
    public static String validateTableName(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        String trimmed = tableName.trim();
        String[] parts = trimmed.split("\\.", 2);
        if (parts.length == 2) {
            validateIdentifier(parts[0], "Schema name");
            validateIdentifier(parts[1], "Table name");
        } else {
            validateIdentifier(trimmed, "Table name");
        }
        return trimmed;
    }

    public static String validateColumnName(String columnName) {
        return validateIdentifier(columnName, "Column name");
    }

    // ============================================================================
    // Warehouse Identifiers
    // ============================================================================

    /**
     * Validates a BigQuery table id of the form {@code project.dataset.table} or {@code dataset.table}.
     */
    public static String validateWarehouseTableId(String tableId) {
        if (tableId == null || tableId.isBlank()) {
            throw new IllegalArgumentException("Table id cannot be null or empty");
        }
        String trimmed = tableId.trim();
        rejectInjection(trimmed, "Table id");
        String[] parts = trimmed.split("\\.");
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException("Table id must be project.dataset.table or dataset.table: " + trimmed);
        }
        int first = 0;
        if (parts.length == 3) {
            if (!WAREHOUSE_PROJECT.matcher(parts[0]).matches()) {
                throw new IllegalArgumentException("Invalid project id: " + parts[0]);
            }
            first = 1;
        }
        for (int i = first; i < parts.length; i++) {
            if (!WAREHOUSE_NAME.matcher(parts[i]).matches()) {
                throw new IllegalArgumentException("Invalid dataset or table name: " + parts[i]);
            }
        }
        return trimmed;
    }

    /**
     * Validates a BigQuery dataset id of the form {@code project.dataset} or {@code dataset}.
     */
    public static String validateWarehouseDatasetId(String datasetId) {
        if (datasetId == null || datasetId.isBlank()) {
            throw new IllegalArgumentException("Dataset id cannot be null or empty");
        }
        String trimmed = datasetId.trim();
        rejectInjection(trimmed, "Dataset id");
        String[] parts = trimmed.split("\\.");
        if (parts.length > 2
                || (parts.length == 2 && !WAREHOUSE_PROJECT.matcher(parts[0]).matches())
                || !WAREHOUSE_NAME.matcher(parts[parts.length - 1]).matches()) {
            throw new IllegalArgumentException("Dataset id must be project.dataset or dataset: " + trimmed);
        }
        return trimmed;
    }

    public static String validateWarehouseColumnName(String columnName) {
        if (columnName == null || columnName.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be null or empty");
        }
        String trimmed = columnName.trim();
        if (!WAREHOUSE_NAME.matcher(trimmed).matches() || Character.isDigit(trimmed.charAt(0)) || trimmed.length() > 300) {
            throw new IllegalArgumentException("Invalid column name: " + trimmed);
        }
        return trimmed;
    }

    // ============================================================================
    // Numeric Inputs
    // ============================================================================

    public static long validateStartAt(long startAt) {
        if (startAt < 0) {
            throw new IllegalArgumentException("startAt must be >= 0, got: " + startAt);
        }
        return startAt;
    }

    public static int validateChunkSize(int chunkSize) {
        if (chunkSize < 1 || chunkSize > 50_000) {
            throw new IllegalArgumentException("chunkSize must be between 1 and 50000, got: " + chunkSize);
        }
        return chunkSize;
    }

    /**
     * Masks passwords in connection strings before they are logged.
     */
    public static String sanitizeForLogging(String input) {
        if (input == null) {
            return "null";
        }
        if (input.contains("password=")) {
            return input.replaceAll("password=[^;&]+", "password=***");
        }
        return input;
    }

    private static void rejectInjection(String value, String identifierType) {
        if (SQL_INJECTION_PATTERN.matcher(value).find()) {
            log.warn("Potential SQL injection attempt detected in {}: {}", identifierType, value);
            throw new IllegalArgumentException(String.format(
                    "Invalid %s: contains potentially dangerous SQL patterns", identifierType));
        }
    }
}
