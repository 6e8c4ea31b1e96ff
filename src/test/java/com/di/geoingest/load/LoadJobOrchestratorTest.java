package com.di.geoingest.load;

import com.di.geoingest.load.LoadJobOrchestrator.JobOptions;
import com.di.geoingest.load.dto.FileLoadRequest;
import com.di.geoingest.load.metadata.LoadJob;
import com.di.geoingest.load.metadata.LoadJobStatus;
import com.di.geoingest.schema.ColumnType;
import com.di.geoingest.schema.SourceSchema;
import com.di.geoingest.schema.TargetColumn;
import com.di.geoingest.source.Feature;
import com.di.geoingest.source.ListSourceDataset;
import com.di.geoingest.source.SourceFormat;
import com.di.geoingest.warehouse.TableRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LoadJobOrchestrator Tests")
class LoadJobOrchestratorTest {

    private static final GeometryFactory GEOMETRY = new GeometryFactory();
    private static final TableRef TARGET = new TableRef("test-project", "landuse", "parcels");
    private static final SourceSchema PARCEL_SCHEMA =
            new SourceSchema(props("name", "str", "area", "int"), "Point");

    private static Map<String, String> props(String... kv) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            map.put(kv[i], kv[i + 1]);
        }
        return map;
    }

    private static Feature parcel(int row) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("name", "parcel-" + row);
        properties.put("area", row);
        return new Feature(properties, GEOMETRY.createPoint(new Coordinate(row % 180, row % 90)));
    }

    /** Every 100th parcel lacks its {@code area}. */
    private static Feature parcelWithGaps(int row) {
        if (row % 100 == 0) {
            return new Feature(Map.of("name", "parcel-" + row), GEOMETRY.createPoint(new Coordinate(0, 0)));
        }
        return parcel(row);
    }

    private static JobOptions options(long startAt) {
        return new JobOptions(true, null, startAt, 1000);
    }

    @TempDir
    Path tempDir;

    /** Six parcels as GeoJSONSeq; the line at {@code truncatedRow} is cut off mid-record. */
    private Path writeParcelsTruncatedAt(int truncatedRow) throws IOException {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            String line = "{\"type\":\"Feature\",\"properties\":{\"name\":\"parcel-" + i + "\",\"area\":" + i
                    + "},\"geometry\":{\"type\":\"Point\",\"coordinates\":[" + i + ",1]}}";
            lines.add(i == truncatedRow ? line.substring(0, 50) : line);
        }
        Path file = tempDir.resolve("parcels.geojsonl");
        Files.write(file, lines, StandardCharsets.UTF_8);
        return file;
    }

    private static FileLoadRequest fileRequest(Path file, long startAt) {
        return FileLoadRequest.builder()
                .sourcePath(file.toString())
                .tableId("landuse.parcels")
                .jobSize(2L)
                .startAt(startAt)
                .build();
    }

    // ============================================================================
    // Bulk path
    // ============================================================================

    @Test
    @DisplayName("17,000 features with a quota of 1,500 load in 1,417 jobs of 12")
    void testBulkLoad_QuotaSizing() {
        LoadFixture fixture = new LoadFixture();
        ListSourceDataset dataset = new ListSourceDataset("/data/parcels.shp", SourceFormat.SHAPEFILE,
                PARCEL_SCHEMA, 17_000, LoadJobOrchestratorTest::parcelWithGaps);

        LoadJob job = fixture.orchestrator().run(dataset, TARGET, options(0));

        assertEquals(LoadJobStatus.COMPLETED, job.getStatus());
        assertEquals(12L, job.getJobSize());
        assertEquals(1417L, job.getJobCount());
        assertEquals(170L, job.getInvalidFeatureCount());
        assertEquals(17_000L, job.getInsertedFeatures() + job.getInvalidFeatureCount());
        assertEquals(16_830L, job.getTableRowCount());
        assertEquals(17_000L, job.getResumeAt());
        assertEquals(fixture.warehouse.bulkLoadCalls, (int) Math.ceil(16_830 / 12.0));
        assertEquals(170, fixture.failureRows());
        assertEquals(1, fixture.ledgerRows());
    }

    @Test
    @DisplayName("Creates the target table from the translated schema with geography last")
    void testBulkLoad_CreatesTable() {
        LoadFixture fixture = new LoadFixture();
        ListSourceDataset dataset = new ListSourceDataset("/data/parcels.shp", SourceFormat.SHAPEFILE,
                PARCEL_SCHEMA, 3, LoadJobOrchestratorTest::parcel);

        fixture.orchestrator().run(dataset, TARGET, options(0));

        assertEquals(List.of(
                TargetColumn.of("name", ColumnType.STRING),
                TargetColumn.of("area", ColumnType.INT64),
                TargetColumn.of("geometry", ColumnType.GEOGRAPHY)), fixture.warehouse.getColumns(TARGET));
        assertTrue(fixture.warehouse.description(TARGET).startsWith("Loaded from /data/parcels.shp at "));
        Map<String, Object> first = fixture.warehouse.rows(TARGET).get(0);
        assertEquals("parcel-0", first.get("name"));
        assertEquals("POINT (0 0)", first.get("geometry"));
    }

    @Test
    @DisplayName("Strict-subset keys are quarantined once and never inserted")
    void testBulkLoad_StrictSubsetQuarantined() {
        LoadFixture fixture = new LoadFixture();
        List<Feature> features = List.of(
                parcel(1),
                new Feature(Map.of("name", "orphan"), GEOMETRY.createPoint(new Coordinate(1, 1))),
                parcel(3));
        ListSourceDataset dataset = ListSourceDataset.of("/data/parcels.shp", SourceFormat.SHAPEFILE,
                PARCEL_SCHEMA, features);

        LoadJob job = fixture.orchestrator().run(dataset, TARGET, options(0));

        assertEquals(LoadJobStatus.COMPLETED, job.getStatus());
        assertEquals(2L, job.getInsertedFeatures());
        assertEquals(1L, job.getInvalidFeatureCount());
        assertEquals(1, fixture.failureRows());
        Map<String, Object> failure = fixture.warehouse.rows(fixture.failures.table()).get(0);
        assertEquals(1L, ((Number) failure.get("row")).longValue());
        assertTrue(failure.get("fail_reason").toString().startsWith("SCHEMAS_DONT_MATCH"));
        assertTrue(fixture.warehouse.rows(TARGET).stream().noneMatch(r -> "orphan".equals(r.get("name"))));
    }

    @Test
    @DisplayName("Interrupted bulk load resumes from resume_at without duplicates")
    void testBulkLoad_ResumeAfterInterruption() {
        LoadFixture fixture = new LoadFixture(10, 1000);
        ListSourceDataset dataset = new ListSourceDataset("/data/parcels.shp", SourceFormat.SHAPEFILE,
                PARCEL_SCHEMA, 100, LoadJobOrchestratorTest::parcel);
        fixture.warehouse.failBulkLoadOnCall = 3;

        LoadJob first = fixture.orchestrator().run(dataset, TARGET, options(0));

        assertEquals(LoadJobStatus.INTERRUPTED, first.getStatus());
        assertEquals(20L, first.getInsertedFeatures());
        assertEquals(20L, first.getResumeAt());
        assertTrue(first.getErrorMessage().contains("quota exceeded"));

        fixture.warehouse.failBulkLoadOnCall = 0;
        LoadJob second = fixture.orchestrator().run(dataset, TARGET, options(first.getResumeAt()));

        assertEquals(LoadJobStatus.COMPLETED, second.getStatus());
        assertEquals(20L, second.getStartAt());
        assertEquals(8L, second.getJobCount());
        assertEquals(80L, second.getInsertedFeatures());
        assertEquals(100, fixture.warehouse.rows(TARGET).size());
        assertEquals(2, fixture.ledgerRows());
    }

    @Test
    @DisplayName("A source that fails mid-read interrupts the job and still writes one ledger row")
    void testBulkLoad_SourceFailure() {
        LoadFixture fixture = new LoadFixture(10, 1000);
        ListSourceDataset dataset = new ListSourceDataset("/data/parcels.shp", SourceFormat.SHAPEFILE,
                PARCEL_SCHEMA, 100, LoadJobOrchestratorTest::parcel);
        dataset.failAtRow = 55;

        LoadJob job = fixture.orchestrator().run(dataset, TARGET, options(0));

        assertEquals(LoadJobStatus.INTERRUPTED, job.getStatus());
        assertEquals(50L, job.getInsertedFeatures());
        assertEquals(50L, job.getResumeAt());
        assertEquals(1, fixture.ledgerRows());
    }

    @Test
    @DisplayName("A truncated line is quarantined and the load completes around it")
    void testBulkLoad_TruncatedLineQuarantined() throws IOException {
        LoadFixture fixture = new LoadFixture();
        Path file = writeParcelsTruncatedAt(3);

        LoadJob job = fixture.orchestrator().loadFile(fileRequest(file, 0));

        assertEquals(LoadJobStatus.COMPLETED, job.getStatus());
        assertEquals(5L, job.getInsertedFeatures());
        assertEquals(1L, job.getInvalidFeatureCount());
        assertEquals(6L, job.getResumeAt());
        assertEquals(5, fixture.warehouse.rows(TARGET).size());
        assertEquals(1, fixture.failureRows());
        Map<String, Object> failure = fixture.warehouse.rows(fixture.failures.table()).get(0);
        assertEquals(3L, ((Number) failure.get("row")).longValue());
        assertTrue(failure.get("fail_reason").toString().startsWith("UNREADABLE_FEATURE"));
        assertTrue(failure.get("props").toString().contains("parcel-3"));
    }

    @Test
    @DisplayName("Resuming past a truncated line never reads it")
    void testBulkLoad_ResumePastTruncatedLine() throws IOException {
        LoadFixture fixture = new LoadFixture();
        Path file = writeParcelsTruncatedAt(3);

        LoadJob job = fixture.orchestrator().loadFile(fileRequest(file, 4));

        assertEquals(LoadJobStatus.COMPLETED, job.getStatus());
        assertEquals(4L, job.getStartAt());
        assertEquals(2L, job.getInsertedFeatures());
        assertEquals(0L, job.getInvalidFeatureCount());
        assertEquals(6L, job.getResumeAt());
        assertEquals(0, fixture.failureRows());
        assertEquals("parcel-4", fixture.warehouse.rows(TARGET).get(0).get("name"));
    }

    @Test
    @DisplayName("A property named like the geometry column fails before any table or ledger row")
    void testBulkLoad_GeometryColumnCollision() {
        LoadFixture fixture = new LoadFixture();
        ListSourceDataset dataset = new ListSourceDataset("/data/parcels.shp", SourceFormat.SHAPEFILE,
                new SourceSchema(props("name", "str", "geometry", "str"), "Polygon"), 1,
                row -> new Feature(Map.of("name", "p", "geometry", "x"), GEOMETRY.createPoint(new Coordinate(0, 0))));

        assertThrows(IllegalArgumentException.class, () -> fixture.orchestrator().run(dataset, TARGET, options(0)));
        assertFalse(fixture.warehouse.tableExists(TARGET));
        assertEquals(0, fixture.ledgerRows());
    }

    // ============================================================================
    // Streaming path
    // ============================================================================

    @Test
    @DisplayName("Files without geometry are streamed in chunks")
    void testStreaming_NonSpatialFile() {
        LoadFixture fixture = new LoadFixture();
        SourceSchema schema = SourceSchema.nonSpatial(props("code", "str", "count", "int"));
        ListSourceDataset dataset = new ListSourceDataset("/data/codes.geojsonl", SourceFormat.GEOJSON_SEQ,
                schema, 5, row -> Feature.of(Map.of("code", "c" + row, "count", row)));

        LoadJob job = fixture.orchestrator().run(dataset, TARGET, new JobOptions(true, null, 0, 2));

        assertEquals(LoadJobStatus.COMPLETED, job.getStatus());
        assertEquals(2L, job.getJobSize());
        assertEquals(3L, job.getJobCount());
        assertEquals(5L, job.getInsertedFeatures());
        assertEquals(0, fixture.warehouse.bulkLoadCalls);
    }

    @Test
    @DisplayName("Streaming load with no row applied is interrupted")
    void testStreaming_NothingApplied() {
        LoadFixture fixture = new LoadFixture();
        SourceSchema schema = SourceSchema.nonSpatial(props("code", "str"));
        ListSourceDataset dataset = new ListSourceDataset("/data/codes.ndjson", SourceFormat.GEOJSON_SEQ,
                schema, 4, row -> Feature.of(Map.of("code", "c" + row)));
        fixture.warehouse.failingInsertTables.add(TARGET.toString());

        LoadJob job = fixture.orchestrator().run(dataset, TARGET, options(0));

        assertEquals(LoadJobStatus.INTERRUPTED, job.getStatus());
        assertEquals(0L, job.getInsertedFeatures());
        assertEquals(0L, job.getResumeAt());
        assertNotNull(job.getErrorMessage());
        assertEquals(1, fixture.ledgerRows());
    }

    @Test
    @DisplayName("Relational sync keeps geometry as text and repairs it into the geography column")
    void testStreaming_RelationalSync() {
        LoadFixture fixture = new LoadFixture();
        SourceSchema schema = SourceSchema.nonSpatial(props(
                "id", "integer", "name", "character varying", "geom", "geometry"));
        ListSourceDataset dataset = new ListSourceDataset("postgresql://db:5432/gis", "public.roads",
                SourceFormat.DATABASE_TABLE, schema, 3, row -> {
                    Map<String, Object> properties = new LinkedHashMap<>();
                    properties.put("id", row);
                    properties.put("name", "road-" + row);
                    properties.put("geom", "LINESTRING (0 0, 1 " + row + ")");
                    return Feature.of(properties);
                });

        LoadJob job = fixture.orchestrator().run(dataset, TARGET, options(0));

        assertEquals(LoadJobStatus.COMPLETED, job.getStatus());
        assertEquals(3L, job.getInsertedFeatures());
        assertEquals(0L, job.getInvalidFeatureCount());
        assertEquals(List.of(
                TargetColumn.of("id", ColumnType.INT64),
                TargetColumn.of("name", ColumnType.STRING),
                TargetColumn.of("original_geometry", ColumnType.STRING),
                TargetColumn.of("geometry", ColumnType.GEOGRAPHY)), fixture.warehouse.getColumns(TARGET));
        Map<String, Object> row = fixture.warehouse.rows(TARGET).get(1);
        assertEquals("LINESTRING (0 0, 1 1)", row.get("original_geometry"));
        assertFalse(row.containsKey("geom"));
        assertTrue(fixture.warehouse.queries.stream().anyMatch(sql ->
                sql.startsWith("UPDATE `test-project.landuse.parcels`")
                        && sql.contains("ST_GEOGFROMTEXT(`original_geometry`, make_valid => TRUE)")));
    }

    @Test
    @DisplayName("A failed geometry repair leaves the job completed")
    void testStreaming_RepairFailureIsNotFatal() {
        LoadFixture fixture = new LoadFixture();
        fixture.warehouse.failQuery = sql -> sql.startsWith("UPDATE");
        SourceSchema schema = SourceSchema.nonSpatial(props("id", "integer", "geom", "USER-DEFINED"));
        ListSourceDataset dataset = new ListSourceDataset("postgresql://db:5432/gis", "public.roads",
                SourceFormat.DATABASE_TABLE, schema, 1,
                row -> Feature.of(Map.of("id", row, "geom", "POINT (1 1)")));

        LoadJob job = fixture.orchestrator().run(dataset, TARGET, options(0));

        assertEquals(LoadJobStatus.COMPLETED, job.getStatus());
        assertEquals(1, fixture.warehouse.queries.size());
    }

    // ============================================================================
    // Ledger
    // ============================================================================

    @Test
    @DisplayName("An unreadable row count is recorded as null, the job still completes")
    void testLedger_RowCountUnavailable() {
        LoadFixture fixture = new LoadFixture();
        fixture.warehouse.failRowCount = true;
        ListSourceDataset dataset = new ListSourceDataset("/data/parcels.shp", SourceFormat.SHAPEFILE,
                PARCEL_SCHEMA, 2, LoadJobOrchestratorTest::parcel);

        LoadJob job = fixture.orchestrator().run(dataset, TARGET, options(0));

        assertEquals(LoadJobStatus.COMPLETED, job.getStatus());
        assertNull(job.getTableRowCount());
        assertNotNull(job.getDuration());
        assertFalse(fixture.warehouse.rows(fixture.ledger.table()).get(0).containsKey("table_row_count"));
    }

    @Test
    @DisplayName("The job id is in the MDC only while the job runs")
    void testLedger_MdcCleared() {
        LoadFixture fixture = new LoadFixture();
        ListSourceDataset dataset = new ListSourceDataset("/data/parcels.shp", SourceFormat.SHAPEFILE,
                PARCEL_SCHEMA, 1, LoadJobOrchestratorTest::parcel);

        LoadJob job = fixture.orchestrator().run(dataset, TARGET, options(0));

        assertNotNull(job.getJobId());
        assertNull(MDC.get(LoadJobOrchestrator.MDC_JOB_ID));
        assertEquals(job.getJobId(), fixture.warehouse.rows(fixture.ledger.table()).get(0).get("job_id"));
    }

    @Test
    @DisplayName("renaming() moves one key and keeps its position")
    void testRenaming() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("a", 1);
        properties.put("geom", "POINT (0 0)");
        properties.put("b", 2);

        Feature renamed = LoadJobOrchestrator.renaming(List.of(Feature.of(properties)).iterator(),
                "geom", "original_geometry").next();

        assertEquals(List.of("a", "original_geometry", "b"), List.copyOf(renamed.properties().keySet()));
        assertEquals("POINT (0 0)", renamed.properties().get("original_geometry"));
    }
}
