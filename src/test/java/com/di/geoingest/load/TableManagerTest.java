package com.di.geoingest.load;

import com.di.geoingest.schema.ColumnType;
import com.di.geoingest.schema.TargetColumn;
import com.di.geoingest.warehouse.InMemoryWarehouseClient;
import com.di.geoingest.warehouse.TableRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TableManager Tests")
class TableManagerTest {

    private static final TableRef NORTH = new TableRef("test-project", "parcels", "north");
    private static final TableRef SOUTH = new TableRef("test-project", "parcels", "south");
    private static final TableRef ALL = new TableRef("test-project", "merged", "all_parcels");

    private InMemoryWarehouseClient warehouse;
    private List<Long> waits;
    private TableManager manager;

    @BeforeEach
    void setUp() {
        warehouse = new InMemoryWarehouseClient();
        waits = new ArrayList<>();
        manager = new TableManager(warehouse, new TableVisibilityWaiter(warehouse,
                Duration.ofMillis(500), 2.0, Duration.ofSeconds(5), Duration.ofSeconds(60), waits::add));

        warehouse.putTable(NORTH, List.of(
                TargetColumn.of("id", ColumnType.STRING),
                TargetColumn.of("owner", ColumnType.STRING),
                TargetColumn.of("area", ColumnType.FLOAT64),
                TargetColumn.of("zone", ColumnType.STRING),
                TargetColumn.of("geometry", ColumnType.GEOGRAPHY)));
        warehouse.putTable(SOUTH, List.of(
                TargetColumn.of("geometry", ColumnType.GEOGRAPHY),
                TargetColumn.of("area", ColumnType.FLOAT64),
                TargetColumn.of("owner", ColumnType.STRING),
                TargetColumn.of("source_table", ColumnType.STRING),
                TargetColumn.of("district", ColumnType.STRING)));
    }

    // ============================================================================
    // Resolution and creation
    // ============================================================================

    @Test
    @DisplayName("Short table ids take the default project")
    void testResolve() {
        assertEquals(new TableRef("test-project", "landuse", "parcels"), manager.resolve("landuse.parcels"));
        assertEquals(new TableRef("other-project", "a", "b"), manager.resolve("other-project.a.b"));
        assertThrows(IllegalArgumentException.class, () -> manager.resolve("parcels"));
        assertThrows(IllegalArgumentException.class, () -> manager.resolve("a.b; DROP TABLE x"));
    }

    @Test
    @DisplayName("Missing tables are created with their dataset and waited for")
    void testEnsureTable_Creates() {
        warehouse.newTableInvisibleChecks = 2;
        TableRef table = new TableRef("test-project", "fresh", "roads");

        boolean created = manager.ensureTable(table, List.of(TargetColumn.of("name", ColumnType.STRING)), "roads");

        assertTrue(created);
        assertTrue(warehouse.datasetExists("test-project", "fresh"));
        assertEquals(List.of(500L, 1000L), waits);
    }

    @Test
    @DisplayName("Existing tables are left alone")
    void testEnsureTable_Exists() {
        assertFalse(manager.ensureTable(NORTH, List.of(), "ignored"));
        assertEquals(5, warehouse.getColumns(NORTH).size());
        assertTrue(waits.isEmpty());
    }

    @Test
    @DisplayName("Lists the tables of a dataset, short ids in the default project")
    void testListTables() {
        warehouse.putTable(new TableRef("other-project", "parcels", "east"), List.of());

        assertEquals(List.of(NORTH, SOUTH), manager.listTables("parcels"));
        assertEquals(List.of(new TableRef("other-project", "parcels", "east")),
                manager.listTables("other-project.parcels"));
        assertTrue(manager.listTables("empty").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> manager.listTables("a.b.c"));
    }

    // ============================================================================
    // Columns and diffs
    // ============================================================================

    @Test
    @DisplayName("Columns are appended in place")
    void testAddColumns() {
        List<TargetColumn> columns = manager.addColumns(NORTH, List.of(
                TargetColumn.of("surveyed_on", ColumnType.DATE),
                TargetColumn.repeated("tags", ColumnType.STRING)));

        assertEquals(7, columns.size());
        assertEquals(TargetColumn.repeated("tags", ColumnType.STRING), columns.get(6));
    }

    @Test
    @DisplayName("Should reject duplicate or invalid column names")
    void testAddColumns_Rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> manager.addColumns(NORTH, List.of(TargetColumn.of("owner", ColumnType.STRING))));
        assertThrows(IllegalArgumentException.class, () -> manager.addColumns(NORTH, List.of(
                TargetColumn.of("x", ColumnType.STRING), TargetColumn.of("x", ColumnType.INT64))));
        assertThrows(IllegalArgumentException.class,
                () -> manager.addColumns(NORTH, List.of(TargetColumn.of("bad-name", ColumnType.STRING))));
        assertThrows(IllegalArgumentException.class, () -> manager.addColumns(NORTH, List.of()));
        assertEquals(5, warehouse.getColumns(NORTH).size());
    }

    @Test
    @DisplayName("Schema diff lists the fields unique to each side")
    void testSchemaDiff() {
        SchemaDiff diff = manager.schemaDiff(NORTH, SOUTH);

        assertEquals(List.of("source_table", "district"), diff.onlyInTable());
        assertEquals(List.of("id", "zone"), diff.missingFromTable());
        assertFalse(diff.isIdentical());
        assertTrue(manager.schemaDiff(NORTH, NORTH).isIdentical());
    }

    // ============================================================================
    // Union
    // ============================================================================

    @Test
    @DisplayName("Union keeps the common fields and adds exactly id and source_table")
    void testUnion() {
        UnionResult result = manager.unionTables(List.of(NORTH, SOUTH), ALL, false);

        assertTrue(result.created());
        assertEquals(List.of("id", "owner", "area", "geometry", "source_table"), result.columns());
        assertTrue(warehouse.datasetExists("test-project", "merged"));
        assertEquals(1, warehouse.queries.size());
        assertEquals("CREATE TABLE `test-project.merged.all_parcels` AS "
                        + "SELECT GENERATE_UUID() AS id, `owner`, `area`, `geometry`, 'test-project.parcels.north' AS source_table"
                        + " FROM `test-project.parcels.north` UNION ALL "
                        + "SELECT GENERATE_UUID() AS id, `owner`, `area`, `geometry`, 'test-project.parcels.south' AS source_table"
                        + " FROM `test-project.parcels.south`",
                warehouse.queries.get(0));
    }

    @Test
    @DisplayName("An existing output is kept unless overwrite is set")
    void testUnion_ExistingOutput() {
        warehouse.putTable(ALL, List.of(TargetColumn.of("x", ColumnType.STRING)));

        UnionResult kept = manager.unionTables(List.of(NORTH, SOUTH), ALL, false);
        assertFalse(kept.created());
        assertTrue(warehouse.queries.isEmpty());
        assertTrue(warehouse.tableExists(ALL));

        UnionResult replaced = manager.unionTables(List.of(NORTH, SOUTH), ALL, true);
        assertTrue(replaced.created());
        assertFalse(warehouse.tableExists(ALL));
        assertEquals(1, warehouse.queries.size());
    }

    @Test
    @DisplayName("Should reject a union without sources")
    void testUnion_NoSources() {
        assertThrows(IllegalArgumentException.class, () -> manager.unionTables(List.of(), ALL, false));
    }

    // ============================================================================
    // Geometry repair
    // ============================================================================

    @Test
    @DisplayName("Geometry repair fills the geography column from WKT")
    void testRepairGeometry() {
        assertTrue(manager.repairGeometry(NORTH, "original_geometry", "geometry"));
        assertEquals("UPDATE `test-project.parcels.north` SET `geometry` = "
                        + "ST_GEOGFROMTEXT(`original_geometry`, make_valid => TRUE) "
                        + "WHERE `geometry` IS NULL AND `original_geometry` IS NOT NULL",
                warehouse.queries.get(0));
    }

    @Test
    @DisplayName("A failed geometry repair is reported, not thrown")
    void testRepairGeometry_Failure() {
        warehouse.failQuery = sql -> true;

        assertFalse(manager.repairGeometry(NORTH, "original_geometry", "geometry"));
    }
}
