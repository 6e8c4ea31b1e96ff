package com.di.geoingest.source;

import org.locationtech.jts.geom.Geometry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One source row: ordered properties plus an optional geometry.
 * Property values may be {@code null}.
 *
 * <p>A row the source could not decode carries a {@code readError} and whatever raw content was
 * recoverable in its properties; it is quarantined and never loaded.
 */
public record Feature(Map<String, Object> properties, Geometry geometry, String readError) {

    public Feature {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public Feature(Map<String, Object> properties, Geometry geometry) {
        this(properties, geometry, null);
    }

    public static Feature of(Map<String, Object> properties) {
        return new Feature(properties, null);
    }

    public static Feature unreadable(Map<String, Object> rawContent, String readError) {
        return new Feature(rawContent, null, readError);
    }

    public boolean hasGeometry() {
        return geometry != null;
    }

    public boolean isUnreadable() {
        return readError != null;
    }
}
