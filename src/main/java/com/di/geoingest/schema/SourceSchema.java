package com.di.geoingest.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declared schema of a source dataset: ordered property name to type descriptor, plus the
 * geometry type when the source keeps geometry apart from its properties (vector files).
 *
 * @param properties   ordered field name to type descriptor
 * @param geometryType geometry type name such as {@code Polygon} or {@code Unknown};
 *                     {@code null} or {@code None} when the source carries no separate geometry
 */
public record SourceSchema(Map<String, String> properties, String geometryType) {

    /** Declared type of a spatial field once it is carried as WKT text. */
    public static final String TEXT_TYPE = "text";
    public static final String UNKNOWN_GEOMETRY = "Unknown";

    public SourceSchema {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static SourceSchema nonSpatial(Map<String, String> properties) {
        return new SourceSchema(properties, null);
    }

    /** Whether geometry is kept apart from properties (the vector-file convention). */
    public boolean hasGeometryConvention() {
        return geometryType != null && !geometryType.isBlank() && !"None".equalsIgnoreCase(geometryType);
    }

    /** Property fields whose declared type is spatial, in declaration order. */
    public List<String> spatialFieldNames() {
        List<String> names = new ArrayList<>();
        properties.forEach((name, type) -> {
            if (SourceFieldType.parse(type).isSpatial()) {
                names.add(name);
            }
        });
        return names;
    }

    public SpatialClassification classification() {
        return hasGeometryConvention() || !spatialFieldNames().isEmpty()
                ? SpatialClassification.SPATIAL
                : SpatialClassification.NON_SPATIAL;
    }

    public Set<String> propertyNames() {
        return properties.keySet();
    }

    /**
     * Returns a copy where the first spatial field is renamed to {@code textFieldName} and every
     * spatial field is declared as text, keeping positions. The copy declares an
     * {@code Unknown} geometry so a geography column is still appended on translation.
     */
    public SourceSchema withSpatialFieldsAsText(String textFieldName) {
        Map<String, String> rewritten = new LinkedHashMap<>();
        boolean renamed = false;
        for (Map.Entry<String, String> e : properties.entrySet()) {
            if (SourceFieldType.parse(e.getValue()).isSpatial()) {
                String name = renamed ? e.getKey() : textFieldName;
                renamed = true;
                rewritten.put(name, TEXT_TYPE);
            } else {
                rewritten.put(e.getKey(), e.getValue());
            }
        }
        return new SourceSchema(rewritten, UNKNOWN_GEOMETRY);
    }
}
