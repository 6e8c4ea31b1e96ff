package com.di.geoingest.load;

import com.di.geoingest.schema.TargetColumn;
import com.di.geoingest.util.InputValidator;
import com.di.geoingest.warehouse.TableRef;
import com.di.geoingest.warehouse.WarehouseClient;
import com.di.geoingest.warehouse.WarehouseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Dataset and table housekeeping around load jobs: existence and creation, in-place column
 * additions, schema comparison, unions of several tables and geometry repair after relational syncs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableManager {

    public static final String UNION_ID_COLUMN = "id";
    public static final String UNION_SOURCE_COLUMN = "source_table";

    private final WarehouseClient warehouse;
    private final TableVisibilityWaiter visibilityWaiter;

    /**
     * Parses a user-supplied table id, filling in the default project for {@code dataset.table}.
     */
    public TableRef resolve(String tableId) {
        return TableRef.parse(InputValidator.validateWarehouseTableId(tableId), warehouse.defaultProject());
    }

    /* ------------------------------------------------------------------ */
    /* Existence and creation                                               */
    /* ------------------------------------------------------------------ */

    public void ensureDataset(String project, String dataset) {
        if (!warehouse.datasetExists(project, dataset)) {
            log.info("[TABLES] Dataset {}.{} missing, creating it", project, dataset);
            warehouse.createDataset(project, dataset);
        }
    }

    /**
     * Creates the table when it is missing and waits until it is visible.
     *
     * @return {@code true} if the table was created by this call
     */
    public boolean ensureTable(TableRef table, List<TargetColumn> columns, String description) {
        ensureDataset(table.project(), table.dataset());
        if (warehouse.tableExists(table)) {
            log.info("[TABLES] {} already exists", table);
            return false;
        }
        warehouse.createTable(table, columns, description);
        visibilityWaiter.awaitVisible(table);
        return true;
    }

    /**
     * Tables of {@code dataset} or {@code project.dataset}, the short form in the default project.
     */
    public List<TableRef> listTables(String datasetId) {
        String[] parts = InputValidator.validateWarehouseDatasetId(datasetId).split("\\.");
        String project = parts.length == 2 ? parts[0] : warehouse.defaultProject();
        String dataset = parts[parts.length - 1];
        List<TableRef> tables = warehouse.listTables(project, dataset);
        log.info("[TABLES] {}.{} holds {} table(s)", project, dataset, tables.size());
        return tables;
    }

    /* ------------------------------------------------------------------ */
    /* Schema edits and comparison                                          */
    /* ------------------------------------------------------------------ */

    /**
     * Appends columns to an existing table.
     *
     * @throws IllegalArgumentException if a name is invalid or already present
     */
    public List<TargetColumn> addColumns(TableRef table, List<TargetColumn> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("No columns to add");
        }
        Set<String> existing = new HashSet<>(fieldNames(table));
        Set<String> requested = new HashSet<>();
        for (TargetColumn column : columns) {
            InputValidator.validateWarehouseColumnName(column.name());
            if (existing.contains(column.name()) || !requested.add(column.name())) {
                throw new IllegalArgumentException("Column '" + column.name() + "' already exists in " + table);
            }
        }
        warehouse.addColumns(table, columns);
        return warehouse.getColumns(table);
    }

    public List<String> fieldNames(TableRef table) {
        return warehouse.getColumns(table).stream()
                .map(TargetColumn::name)
                .collect(Collectors.toList());
    }

    public SchemaDiff schemaDiff(TableRef base, TableRef other) {
        List<String> baseFields = fieldNames(base);
        List<String> otherFields = fieldNames(other);
        List<String> onlyInOther = otherFields.stream()
                .filter(f -> !baseFields.contains(f))
                .collect(Collectors.toList());
        List<String> missingFromOther = baseFields.stream()
                .filter(f -> !otherFields.contains(f))
                .collect(Collectors.toList());
        if (!onlyInOther.isEmpty() || !missingFromOther.isEmpty()) {
            log.info("[TABLES] {} vs {}: only in other {}, missing from other {}",
                    base, other, onlyInOther, missingFromOther);
        }
        return new SchemaDiff(base, other, onlyInOther, missingFromOther);
    }

    /**
     * Field names present in every table, in the order of the first table.
     */
    public List<String> commonFields(List<TableRef> tables) {
        if (tables.isEmpty()) {
            return List.of();
        }
        Set<String> common = new LinkedHashSet<>(fieldNames(tables.get(0)));
        for (TableRef table : tables.subList(1, tables.size())) {
            common.retainAll(new HashSet<>(fieldNames(table)));
        }
        return new ArrayList<>(common);
    }

    /* ------------------------------------------------------------------ */
    /* Union                                                                */
    /* ------------------------------------------------------------------ */

    /**
     * Creates {@code output} as the UNION ALL of the sources, keeping only the fields they all
     * share and adding a generated {@code id} and a {@code source_table} label.
     */
    public UnionResult unionTables(List<TableRef> sources, TableRef output, boolean overwrite) {
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("At least one source table is required for a union");
        }
        if (warehouse.tableExists(output)) {
            if (!overwrite) {
                log.error("[TABLES] Union output {} already exists and overwrite is off", output);
                return new UnionResult(output, false, sources, List.of(), null);
            }
            log.info("[TABLES] Overwriting union output {}", output);
            warehouse.deleteTable(output);
        }

        List<String> fields = commonFields(sources).stream()
                .filter(f -> !UNION_ID_COLUMN.equals(f) && !UNION_SOURCE_COLUMN.equals(f))
                .collect(Collectors.toList());
        if (fields.isEmpty()) {
            log.warn("[TABLES] Sources {} share no fields; the union carries only id and source_table", sources);
        }
        String sql = unionSql(sources, output, fields);
        ensureDataset(output.project(), output.dataset());
        warehouse.query(sql);
        log.info("[TABLES] Created {} from {} tables with {} common fields", output, sources.size(), fields.size());

        List<String> columns = new ArrayList<>();
        columns.add(UNION_ID_COLUMN);
        columns.addAll(fields);
        columns.add(UNION_SOURCE_COLUMN);
        return new UnionResult(output, true, sources, columns, sql);
    }

    static String unionSql(List<TableRef> sources, TableRef output, List<String> fields) {
        String selected = fields.stream()
                .map(f -> "`" + f + "`")
                .collect(Collectors.joining(", "));
        List<String> selects = new ArrayList<>();
        for (TableRef source : sources) {
            StringBuilder select = new StringBuilder("SELECT GENERATE_UUID() AS ").append(UNION_ID_COLUMN);
            if (!selected.isEmpty()) {
                select.append(", ").append(selected);
            }
            select.append(", '").append(source).append("' AS ").append(UNION_SOURCE_COLUMN)
                    .append(" FROM `").append(source).append('`');
            selects.add(select.toString());
        }
        return "CREATE TABLE `" + output + "` AS " + String.join(" UNION ALL ", selects);
    }

    /* ------------------------------------------------------------------ */
    /* Geometry repair                                                      */
    /* ------------------------------------------------------------------ */

    /**
     * Fills the geography column from its WKT twin, repairing invalid shapes on the way.
     * Best-effort: a failure is logged and reported as {@code false}.
     */
    public boolean repairGeometry(TableRef table, String textColumn, String geographyColumn) {
        String sql = "UPDATE `" + table + "` SET `" + geographyColumn + "` = ST_GEOGFROMTEXT(`" + textColumn
                + "`, make_valid => TRUE) WHERE `" + geographyColumn + "` IS NULL AND `" + textColumn + "` IS NOT NULL";
        try {
            warehouse.query(sql);
            log.info("[TABLES] Repaired {} from {} in {}", geographyColumn, textColumn, table);
            return true;
        } catch (WarehouseException e) {
            log.error("[TABLES] Geometry repair on {} failed, {} stays as text only: {}", table, textColumn, e.getMessage());
            return false;
        }
    }
}
