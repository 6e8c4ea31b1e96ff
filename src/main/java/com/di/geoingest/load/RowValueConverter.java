package com.di.geoingest.load;

import com.di.geoingest.schema.ColumnType;
import com.di.geoingest.schema.TargetColumn;
import com.di.geoingest.source.Feature;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKTWriter;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts source values (JDBC objects, OGR fields, parsed JSON) into values the warehouse accepts
 * for a target column.
 *
 * <ul>
 *   <li>Numeric and decimal values become {@code double} for FLOAT64, {@code long} for INT64.</li>
 *   <li>JSON values are re-serialized as text; a JSON array contributes its first element, an
 *       empty array becomes {@code null}.</li>
 *   <li>Dates become {@code yyyy-MM-dd}, timestamps ISO-8601 text.</li>
 *   <li>Binary values become base64 text.</li>
 *   <li>Geography columns take WKT text.</li>
 * </ul>
 * Keys that have no target column are dropped from the row. Values that cannot be converted
 * are passed through as text and left for the warehouse to reject.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RowValueConverter {

    private final ObjectMapper objectMapper;

    /**
     * Row for a streaming insert.
     */
    public Map<String, Object> toInsertRow(Feature feature, List<TargetColumn> columns) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (TargetColumn column : columns) {
            Object value = valueFor(feature, column);
            if (value != null) {
                row.put(column.name(), value);
            }
        }
        return row;
    }

    /**
     * Row for a newline-delimited JSON load file. JSON columns carry the parsed document rather
     * than its text so the load job stores a JSON value, not a JSON string.
     */
    public Map<String, Object> toInterchangeRow(Feature feature, List<TargetColumn> columns) {
        Map<String, Object> row = toInsertRow(feature, columns);
        for (TargetColumn column : columns) {
            if (column.type() == ColumnType.JSON && !column.isRepeated() && row.get(column.name()) instanceof String) {
                row.put(column.name(), parseOrKeep((String) row.get(column.name())));
            }
        }
        return row;
    }

    private Object valueFor(Feature feature, TargetColumn column) {
        if (feature.properties().containsKey(column.name())) {
            return convert(feature.properties().get(column.name()), column);
        }
        if (column.type() == ColumnType.GEOGRAPHY && feature.hasGeometry()) {
            return toWkt(feature.geometry());
        }
        return null;
    }

    public Object convert(Object value, TargetColumn column) {
        if (value == null) {
            return null;
        }
        if (column.isRepeated()) {
            List<Object> items = new ArrayList<>();
            for (Object item : asCollection(value)) {
                Object converted = convertScalar(item, column.type(), column.name());
                if (converted != null) {
                    items.add(converted);
                }
            }
            return items;
        }
        return convertScalar(value, column.type(), column.name());
    }

    Object convertScalar(Object value, ColumnType type, String fieldName) {
        if (value == null) {
            return null;
        }
        switch (type) {
            case INT64:
                return toLong(value, fieldName);
            case FLOAT64:
                return toDouble(value, fieldName);
            case BOOL:
                return toBoolean(value);
            case DATE:
                return toDate(value);
            case TIMESTAMP:
                return toTimestamp(value);
            case DATETIME:
                return toDateTime(value);
            case TIME:
                return toTime(value);
            case BYTES:
                return value instanceof byte[] ? Base64.getEncoder().encodeToString((byte[]) value) : value.toString();
            case JSON:
                return toJsonText(value);
            case GEOGRAPHY:
                return value instanceof Geometry ? toWkt((Geometry) value) : value.toString();
            case STRING:
            default:
                return toText(value);
        }
    }

    // ============================================================================
    // Numbers
    // ============================================================================

    private static Object toLong(Object value, String fieldName) {
        if (value instanceof Number) {
            if (value instanceof BigDecimal || value instanceof Double || value instanceof Float) {
                double d = ((Number) value).doubleValue();
                if (d != Math.rint(d)) {
                    log.warn("Truncating fractional value {} for INT64 field '{}'", value, fieldName);
                }
            }
            return ((Number) value).longValue();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1L : 0L;
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            log.warn("Field '{}' is not an integer, passing '{}' through as text", fieldName, value);
            return value.toString();
        }
    }

    private static Object toDouble(Object value, String fieldName) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            log.warn("Field '{}' is not numeric, passing '{}' through as text", fieldName, value);
            return value.toString();
        }
    }

    private static Object toBoolean(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        String text = value.toString().trim();
        return "true".equalsIgnoreCase(text) || "t".equalsIgnoreCase(text) || "1".equals(text);
    }

    // ============================================================================
    // Dates and times
    // ============================================================================

    private static Object toDate(Object value) {
        if (value instanceof Date) {
            return ((Date) value).toLocalDate().toString();
        }
        if (value instanceof LocalDate) {
            return value.toString();
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toLocalDate().toString();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate().toString();
        }
        if (value instanceof java.util.Date) {
            return ((java.util.Date) value).toInstant().atZone(ZoneOffset.UTC).toLocalDate().toString();
        }
        return value.toString();
    }

    private static Object toTimestamp(Object value) {
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toInstant().toString();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant().toString();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant().toString();
        }
        if (value instanceof Instant || value instanceof LocalDateTime) {
            return value.toString();
        }
        if (value instanceof java.util.Date) {
            return ((java.util.Date) value).toInstant().toString();
        }
        return value.toString();
    }

    private static Object toDateTime(Object value) {
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toString();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDateTime().toString();
        }
        return value.toString();
    }

    private static Object toTime(Object value) {
        if (value instanceof Time) {
            return ((Time) value).toLocalTime().toString();
        }
        if (value instanceof LocalTime) {
            return value.toString();
        }
        return value.toString();
    }

    // ============================================================================
    // Text and JSON
    // ============================================================================

    private Object toText(Object value) {
        if (value instanceof String) {
            return value;
        }
        if (value instanceof Map || value instanceof Collection) {
            return writeJson(value);
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        return value.toString();
    }

    /**
     * JSON text for a JSON/JSONB value. Database drivers hand JSON over as text (or a driver object
     * whose {@code toString()} is the text); parsed sources hand over maps and lists.
     */
    private Object toJsonText(Object value) {
        JsonNode node;
        if (value instanceof Map || value instanceof Collection) {
            node = objectMapper.valueToTree(value);
        } else {
            String text = value.toString();
            try {
                node = objectMapper.readTree(text);
            } catch (JsonProcessingException e) {
                log.debug("JSON value is not parseable, keeping it as text: {}", e.getOriginalMessage());
                return text;
            }
        }
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            return node.isEmpty() ? null : node.get(0).toString();
        }
        return node.toString();
    }

    private Object parseOrKeep(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return text;
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static String toWkt(Geometry geometry) {
        return new WKTWriter().write(geometry);
    }

    private static Collection<?> asCollection(Object value) {
        if (value instanceof Collection) {
            return (Collection<?>) value;
        }
        if (value instanceof Object[]) {
            return Arrays.asList((Object[]) value);
        }
        if (value instanceof int[]) {
            List<Object> items = new ArrayList<>();
            for (int i : (int[]) value) {
                items.add(i);
            }
            return items;
        }
        if (value instanceof double[]) {
            List<Object> items = new ArrayList<>();
            for (double d : (double[]) value) {
                items.add(d);
            }
            return items;
        }
        return List.of(value);
    }
}
