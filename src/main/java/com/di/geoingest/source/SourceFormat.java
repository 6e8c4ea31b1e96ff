package com.di.geoingest.source;

import java.util.Locale;

public enum SourceFormat {
    SHAPEFILE,
    FILE_GEODATABASE,
    GEOJSON_SEQ,
    DATABASE_TABLE;

    /**
     * Resolves a file format from its path. Geodatabases are directories ending in {@code .gdb}.
     *
     * @throws IllegalArgumentException for an unsupported extension
     */
    public static SourceFormat fromPath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Source path cannot be empty");
        }
        String lower = path.toLowerCase(Locale.ROOT);
        while (lower.endsWith("/")) {
            lower = lower.substring(0, lower.length() - 1);
        }
        if (lower.endsWith(".shp")) {
            return SHAPEFILE;
        }
        if (lower.endsWith(".gdb")) {
            return FILE_GEODATABASE;
        }
        if (lower.endsWith(".geojson") || lower.endsWith(".geojsonl")
                || lower.endsWith(".geojsons") || lower.endsWith(".ndjson")) {
            return GEOJSON_SEQ;
        }
        throw new IllegalArgumentException("Unsupported source file type: " + path);
    }
}
