package com.di.geoingest.source;

import com.di.geoingest.schema.SourceSchema;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Line-delimited GeoJSON (one Feature per line, RFC 8142 record separators tolerated).
 *
 * <p>The declared schema is inferred from the first parseable feature, so later features with a
 * different key set fail the schema check instead of widening the table. A line that cannot be
 * parsed comes back as an unreadable feature carrying the raw line.
 */
@Slf4j
public class GeoJsonSeqDataset implements SourceDataset {

    private static final char RECORD_SEPARATOR = '\u001e';
    private static final TypeReference<LinkedHashMap<String, Object>> PROPERTIES_TYPE = new TypeReference<>() {};
    private static final int RAW_LINE_LIMIT = 4096;
    static final String RAW_LINE = "raw_line";

    private final Path file;
    private final ObjectMapper mapper;
    private final GeoJsonReader geoJsonReader = new GeoJsonReader();
    private final SourceSchema schema;
    private final long featureCount;
    private final List<BufferedReader> openReaders = new ArrayList<>();

    private GeoJsonSeqDataset(Path file, ObjectMapper mapper, SourceSchema schema, long featureCount) {
        this.file = file;
        this.mapper = mapper;
        this.schema = schema;
        this.featureCount = featureCount;
    }

    public static GeoJsonSeqDataset open(Path file, ObjectMapper mapper) {
        if (!Files.isRegularFile(file)) {
            throw new SourceOpenException("GeoJSON sequence file not found: " + file);
        }
        long count = 0;
        JsonNode first = null;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String record = strip(line);
                if (record.isEmpty()) {
                    continue;
                }
                count++;
                if (first == null) {
                    try {
                        first = mapper.readTree(record);
                    } catch (JsonProcessingException e) {
                        log.warn("[SOURCE] Record {} of {} is not valid JSON, not used for the schema: {}",
                                count, file, e.getOriginalMessage());
                    }
                }
            }
        } catch (IOException e) {
            throw new SourceOpenException("Could not read " + file + ": " + e.getMessage(), e);
        }
        SourceSchema schema = inferSchema(first);
        log.info("[SOURCE] Opened GeoJSONSeq {} features={} fields={}", file, count, schema.properties().size());
        return new GeoJsonSeqDataset(file, mapper, schema, count);
    }

    @Override
    public String path() {
        return file.toString();
    }

    @Override
    public String layerName() {
        return null;
    }

    @Override
    public SourceFormat format() {
        return SourceFormat.GEOJSON_SEQ;
    }

    @Override
    public SourceSchema schema() {
        return schema;
    }

    @Override
    public long featureCount() {
        return featureCount;
    }

    @Override
    public Iterator<Feature> features(long startAt) {
        BufferedReader reader;
        try {
            reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not reopen " + file, e);
        }
        openReaders.add(reader);
        FeatureIterator iterator = new FeatureIterator(reader);
        long skipped = iterator.skipRecords(startAt);
        if (startAt > 0) {
            log.info("[SOURCE] Skipped {} records of {} to reach row {}", skipped, file, startAt);
        }
        return iterator;
    }

    @Override
    public void close() {
        for (BufferedReader reader : openReaders) {
            try {
                reader.close();
            } catch (IOException e) {
                log.warn("[SOURCE] Could not close reader for {}: {}", file, e.getMessage());
            }
        }
        openReaders.clear();
    }

    Feature parse(String record) {
        try {
            JsonNode node = mapper.readTree(record);
            if (!node.isObject()) {
                return unreadable(record, "Record is not a JSON object");
            }
            JsonNode props = node.get("properties");
            Map<String, Object> properties = props == null || props.isNull()
                    ? new LinkedHashMap<>()
                    : mapper.convertValue(props, PROPERTIES_TYPE);
            JsonNode geometryNode = node.get("geometry");
            Geometry geometry = geometryNode == null || geometryNode.isNull()
                    ? null
                    : geoJsonReader.read(geometryNode.toString());
            return new Feature(properties, geometry);
        } catch (JsonProcessingException e) {
            return unreadable(record, "Malformed JSON: " + e.getOriginalMessage());
        } catch (ParseException e) {
            return unreadable(record, "Malformed geometry: " + e.getMessage());
        } catch (RuntimeException e) {
            // GeoJsonReader and convertValue report bad shapes with unchecked exceptions
            return unreadable(record, "Malformed feature: " + e.getMessage());
        }
    }

    private static Feature unreadable(String record, String reason) {
        String raw = record.length() > RAW_LINE_LIMIT ? record.substring(0, RAW_LINE_LIMIT) : record;
        Map<String, Object> content = new LinkedHashMap<>();
        content.put(RAW_LINE, raw);
        return Feature.unreadable(content, reason);
    }

    /* ------------------------------------------------------------------ */
    /* Schema inference                                                     */
    /* ------------------------------------------------------------------ */

    static SourceSchema inferSchema(JsonNode first) {
        Map<String, String> properties = new LinkedHashMap<>();
        if (first == null) {
            return new SourceSchema(properties, SourceSchema.UNKNOWN_GEOMETRY);
        }
        JsonNode props = first.get("properties");
        if (props != null && props.isObject()) {
            props.fields().forEachRemaining(e -> properties.put(e.getKey(), describe(e.getValue())));
        }
        String geometryType = null;
        if (first.has("geometry")) {
            JsonNode geometry = first.get("geometry");
            geometryType = geometry != null && geometry.hasNonNull("type")
                    ? geometry.get("type").asText()
                    : SourceSchema.UNKNOWN_GEOMETRY;
        }
        return new SourceSchema(properties, geometryType);
    }

    private static String describe(JsonNode value) {
        if (value == null || value.isNull() || value.isTextual()) {
            return "str";
        }
        if (value.isBoolean()) {
            return "bool";
        }
        if (value.isIntegralNumber()) {
            return "int";
        }
        if (value.isNumber()) {
            return "float";
        }
        if (value.isArray()) {
            for (JsonNode item : value) {
                if (!item.isNull()) {
                    return "List[" + describe(item) + "]";
                }
            }
            return "List[str]";
        }
        return "json";
    }

    private static String strip(String line) {
        String trimmed = line.trim();
        while (!trimmed.isEmpty() && trimmed.charAt(0) == RECORD_SEPARATOR) {
            trimmed = trimmed.substring(1).trim();
        }
        return trimmed;
    }

    private final class FeatureIterator implements Iterator<Feature> {

        private final BufferedReader reader;
        private String pending;
        private boolean exhausted;

        private FeatureIterator(BufferedReader reader) {
            this.reader = reader;
        }

        @Override
        public boolean hasNext() {
            if (pending != null) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            try {
                String line;
                while ((line = reader.readLine()) != null) {
                    String record = strip(line);
                    if (!record.isEmpty()) {
                        pending = record;
                        return true;
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Could not read " + file, e);
            }
            exhausted = true;
            return false;
        }

        /** Passes over up to {@code count} records without parsing them. */
        long skipRecords(long count) {
            long skipped = 0;
            while (skipped < count && hasNext()) {
                pending = null;
                skipped++;
            }
            return skipped;
        }

        @Override
        public Feature next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String record = pending;
            pending = null;
            return parse(record);
        }
    }
}
