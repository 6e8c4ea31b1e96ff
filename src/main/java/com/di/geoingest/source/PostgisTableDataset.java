package com.di.geoingest.source;

import com.di.geoingest.config.DbConfigSnapshot;
import com.di.geoingest.schema.SourceFieldType;
import com.di.geoingest.schema.SourceSchema;
import com.di.geoingest.util.HikariPoolFactory;
import com.di.geoingest.util.InputValidator;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Array;
import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * A PostgreSQL/PostGIS table read row by row over a dedicated pool.
 *
 * <p>The declared schema comes from {@code information_schema.columns}: user-defined columns report
 * their UDT name (so PostGIS columns read as {@code geometry}) and array columns read as
 * {@code ARRAY[udt]}. Geometry columns are selected as WKT text under their own name; the features
 * carry no separate geometry.
 */
@Slf4j
public class PostgisTableDataset implements SourceDataset {

    private static final String COLUMNS_SQL = """
            SELECT column_name, data_type, udt_name
              FROM information_schema.columns
             WHERE table_schema = ? AND table_name = ?
             ORDER BY ordinal_position
            """;

    private static final int FETCH_SIZE = 1000;

    private final DbConfigSnapshot config;
    private final String schemaName;
    private final String tableName;
    private final HikariDataSource dataSource;
    private final JdbcTemplate jdbc;
    private final SourceSchema schema;
    private final long featureCount;
    private final List<Stream<Map<String, Object>>> openStreams = new ArrayList<>();

    private PostgisTableDataset(DbConfigSnapshot config, String schemaName, String tableName,
                                HikariDataSource dataSource) {
        this.config = config;
        this.schemaName = schemaName;
        this.tableName = tableName;
        this.dataSource = dataSource;
        this.jdbc = new JdbcTemplate(dataSource);
        this.jdbc.setFetchSize(FETCH_SIZE);
        this.schema = readSchema();
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM " + qualifiedName(), Long.class);
        this.featureCount = count != null ? count : 0L;
    }

    /**
     * @param table {@code table} or {@code schema.table}; the schema defaults to {@code public}
     */
    public static PostgisTableDataset open(DbConfigSnapshot config, String table) {
        String validated = InputValidator.validateTableName(table);
        String[] parts = validated.split("\\.", 2);
        String schemaName = parts.length == 2 ? parts[0] : "public";
        String tableName = parts.length == 2 ? parts[1] : parts[0];

        HikariDataSource dataSource = HikariPoolFactory.create(config);
        try {
            PostgisTableDataset dataset = new PostgisTableDataset(config, schemaName, tableName, dataSource);
            log.info("[SOURCE] Opened table {}.{} on {} rows={} columns={}",
                    schemaName, tableName, config.displayUrl(), dataset.featureCount, dataset.schema.properties().size());
            return dataset;
        } catch (SourceOpenException e) {
            dataSource.close();
            throw e;
        } catch (DataAccessException e) {
            dataSource.close();
            throw new SourceOpenException("Could not read table " + schemaName + "." + tableName
                    + " on " + config.displayUrl() + ": " + e.getMessage(), e);
        }
    }

    private SourceSchema readSchema() {
        Map<String, String> properties = new LinkedHashMap<>();
        jdbc.query(COLUMNS_SQL, rs -> {
            String dataType = rs.getString("data_type");
            String udt = rs.getString("udt_name");
            String descriptor;
            if ("USER-DEFINED".equalsIgnoreCase(dataType)) {
                descriptor = udt;
            } else if ("ARRAY".equalsIgnoreCase(dataType)) {
                descriptor = "ARRAY[" + udt + "]";
            } else {
                descriptor = dataType;
            }
            properties.put(rs.getString("column_name"), descriptor);
        }, schemaName, tableName);
        if (properties.isEmpty()) {
            throw new SourceOpenException("Table " + schemaName + "." + tableName + " not found or has no columns");
        }
        return SourceSchema.nonSpatial(properties);
    }

    @Override
    public String path() {
        return config.displayUrl();
    }

    @Override
    public String layerName() {
        return schemaName + "." + tableName;
    }

    @Override
    public SourceFormat format() {
        return SourceFormat.DATABASE_TABLE;
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
        Stream<Map<String, Object>> rows = jdbc.queryForStream(selectSql(startAt), ROW_MAPPER);
        openStreams.add(rows);
        return rows.map(Feature::of).iterator();
    }

    /** Rows before {@code startAt} are dropped by the server with {@code OFFSET}. */
    String selectSql(long startAt) {
        List<String> columns = new ArrayList<>();
        schema.properties().forEach((name, type) -> {
            String quoted = quote(name);
            columns.add(SourceFieldType.parse(type).isSpatial()
                    ? "ST_AsText(" + quoted + ") AS " + quoted
                    : quoted);
        });
        String sql = "SELECT " + String.join(", ", columns) + " FROM " + qualifiedName();
        return startAt > 0 ? sql + " OFFSET " + startAt : sql;
    }

    @Override
    public void close() {
        for (Stream<Map<String, Object>> stream : openStreams) {
            try {
                stream.close();
            } catch (RuntimeException e) {
                log.warn("[SOURCE] Could not close cursor on {}.{}: {}", schemaName, tableName, e.getMessage());
            }
        }
        openStreams.clear();
        dataSource.close();
    }

    private String qualifiedName() {
        return quote(schemaName) + "." + quote(tableName);
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private static final RowMapper<Map<String, Object>> ROW_MAPPER = (rs, n) -> {
        ResultSetMetaData meta = rs.getMetaData();
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            Object value = rs.getObject(i);
            if (value instanceof Array) {
                value = Arrays.asList((Object[]) ((Array) value).getArray());
            }
            row.put(meta.getColumnLabel(i), value);
        }
        return row;
    };
}
