package com.di.geoingest.schema;

import com.di.geoingest.config.GeoIngestProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates a source schema into an ordered warehouse column list.
 *
 * <p>Rules are evaluated in order and the first match wins, so the {@code int}, {@code str} and
 * {@code float} prefixes beat the exact-name table (a descriptor such as {@code int:10} or
 * {@code str:254} never reaches it). Array descriptors become REPEATED columns of the element type.
 * Types no rule accepts are dropped with a warning. Spatial fields are appended as GEOGRAPHY
 * columns after all other columns, whatever their declared position. A source that keeps its
 * geometry apart always gets the geometry column, so a property of the same name is refused.
 */
@Slf4j
@Component
public class SchemaTranslator {

    public static final List<TypeMappingRule> RULES = List.of(
            TypeMappingRule.prefix("int", ColumnType.INT64),
            TypeMappingRule.prefix("str", ColumnType.STRING),
            TypeMappingRule.prefix("float", ColumnType.FLOAT64),
            TypeMappingRule.exact(ColumnType.FLOAT64, "double", "numeric", "real", "double precision", "_float8"),
            TypeMappingRule.exact(ColumnType.BOOL, "bool", "boolean"),
            TypeMappingRule.exact(ColumnType.DATE, "date"),
            TypeMappingRule.exact(ColumnType.TIMESTAMP, "datetime", "timestamp with time zone"),
            TypeMappingRule.exact(ColumnType.DATETIME, "timestamp without time zone"),
            TypeMappingRule.exact(ColumnType.TIME, "time"),
            TypeMappingRule.exact(ColumnType.GEOGRAPHY, "geometry"),
            TypeMappingRule.exact(ColumnType.BYTES, "blob"),
            TypeMappingRule.exact(ColumnType.STRING, "character varying", "text", "_varchar", "_text", "uuid"),
            TypeMappingRule.exact(ColumnType.JSON, "jsonb", "json"),
            TypeMappingRule.exact(ColumnType.INT64, "bigint", "smallint", "_int4", "_int8")
    );

    private final String geometryColumn;

    @Autowired
    public SchemaTranslator(GeoIngestProperties properties) {
        this(properties.getBulk().getGeometryColumn());
    }

    public SchemaTranslator(String geometryColumn) {
        this.geometryColumn = geometryColumn;
    }

    public String getGeometryColumn() {
        return geometryColumn;
    }

    /**
     * @throws IllegalArgumentException if a source that keeps geometry apart also has a property
     *                                  named like the geometry column
     */
    public List<TargetColumn> translate(SourceSchema schema) {
        if (schema.hasGeometryConvention() && schema.properties().containsKey(geometryColumn)) {
            log.error("[SCHEMA] Property '{}' collides with the geometry column", geometryColumn);
            throw new IllegalArgumentException("Source property '" + geometryColumn
                    + "' collides with the geometry column; rename it in the source or configure "
                    + "geoingest.bulk.geometry-column");
        }
        List<TargetColumn> columns = new ArrayList<>();
        List<TargetColumn> geography = new ArrayList<>();

        for (Map.Entry<String, String> field : schema.properties().entrySet()) {
            SourceFieldType type = SourceFieldType.parse(field.getValue());
            if (type.isSpatial()) {
                geography.add(TargetColumn.of(field.getKey(), ColumnType.GEOGRAPHY));
                continue;
            }
            translateField(field.getKey(), type).ifPresent(columns::add);
        }

        if (schema.hasGeometryConvention()) {
            geography.add(TargetColumn.of(geometryColumn, ColumnType.GEOGRAPHY));
        }
        columns.addAll(geography);
        return List.copyOf(columns);
    }

    public Optional<TargetColumn> translateField(String name, String descriptor) {
        return translateField(name, SourceFieldType.parse(descriptor));
    }

    private Optional<TargetColumn> translateField(String name, SourceFieldType type) {
        Optional<ColumnType> resolved = resolve(type.elementType());
        if (resolved.isEmpty()) {
            log.warn("[SCHEMA] Dropping field '{}': no mapping for type '{}'", name, type.descriptor());
            return Optional.empty();
        }
        return Optional.of(type.array()
                ? TargetColumn.repeated(name, resolved.get())
                : TargetColumn.of(name, resolved.get()));
    }

    public static Optional<ColumnType> resolve(String typeName) {
        for (TypeMappingRule rule : RULES) {
            if (rule.matches(typeName)) {
                return Optional.of(rule.target());
            }
        }
        return Optional.empty();
    }
}
