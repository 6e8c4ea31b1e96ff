package com.di.geoingest.load;

import com.di.geoingest.load.metadata.LoadJobStatus;
import com.di.geoingest.schema.ColumnType;
import com.di.geoingest.schema.SourceSchema;
import com.di.geoingest.schema.SpatialClassification;
import com.di.geoingest.schema.TargetColumn;
import com.di.geoingest.source.Feature;
import com.di.geoingest.warehouse.TableRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;

import java.nio.file.Files;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Bulk and streaming loaders against the in-memory warehouse.
 */
@DisplayName("BatchLoader Tests")
class BatchLoaderTest {

    private static final GeometryFactory GEOMETRY = new GeometryFactory();
    private static final TableRef TABLE = new TableRef("test-project", "transport", "stops");
    private static final List<TargetColumn> COLUMNS = List.of(
            TargetColumn.of("code", ColumnType.STRING),
            TargetColumn.of("geometry", ColumnType.GEOGRAPHY));

    private static LoadJobContext context(long featureCount, long startAt, long jobSize) {
        return context(featureCount, startAt, jobSize, true);
    }

    private static LoadJobContext context(long featureCount, long startAt, long jobSize, boolean validate) {
        Map<String, String> properties = new LinkedHashMap<>();
        properties.put("code", "str");
        return LoadJobContext.builder()
                .jobId("job-1")
                .sourcePath("/data/stops.geojsonl")
                .sourceSchema(new SourceSchema(properties, "Point"))
                .classification(SpatialClassification.SPATIAL)
                .featureCount(featureCount)
                .table(TABLE)
                .targetColumns(COLUMNS)
                .startAt(startAt)
                .jobSize(jobSize)
                .jobCount(JobSizer.jobCount(featureCount, startAt, jobSize))
                .validateFeature(validate)
                .build();
    }

    private static Feature stop(int row) {
        return new Feature(Map.of("code", "S" + row), GEOMETRY.createPoint(new Coordinate(row, row)));
    }

    /** Rows listed in {@code broken} lose their code. */
    private static IntFunction<Feature> stopsBrokenAt(Integer... broken) {
        List<Integer> rows = List.of(broken);
        return row -> rows.contains(row)
                ? new Feature(Map.of(), GEOMETRY.createPoint(new Coordinate(row, row)))
                : stop(row);
    }

    private static List<Feature> features(int count, IntFunction<Feature> generator) {
        return IntStream.range(0, count).mapToObj(generator).collect(Collectors.toList());
    }

    /** The source positioned on {@code startAt}, as {@code SourceDataset.features(startAt)} hands it over. */
    private static Iterator<Feature> from(List<Feature> source, int startAt) {
        return source.subList(startAt, source.size()).iterator();
    }

    private static LoadFixture fixture() {
        LoadFixture fixture = new LoadFixture();
        fixture.warehouse.putTable(TABLE, COLUMNS);
        return fixture;
    }

    // ============================================================================
    // Bulk
    // ============================================================================

    @Test
    @DisplayName("Every admitted feature lands in exactly one batch, the last one partial")
    void testBulk_BatchesAndPartialFlush() {
        LoadFixture fixture = fixture();

        LoadOutcome outcome = fixture.bulkLoader.load(context(25, 0, 10), features(25, BatchLoaderTest::stop).iterator());

        assertEquals(LoadJobStatus.COMPLETED, outcome.status());
        assertEquals(25, outcome.insertedFeatures());
        assertEquals(3, fixture.warehouse.bulkLoadCalls);
        List<Object> codes = fixture.warehouse.rows(TABLE).stream().map(r -> r.get("code")).collect(Collectors.toList());
        assertEquals(25, codes.stream().distinct().count());
        assertEquals("POINT (24 24)", fixture.warehouse.rows(TABLE).get(24).get("geometry"));
    }

    @Test
    @DisplayName("Interchange files are deleted after each load job, failed or not")
    void testBulk_FilesDeleted() {
        LoadFixture fixture = fixture();
        fixture.warehouse.failBulkLoadOnCall = 2;

        fixture.bulkLoader.load(context(30, 0, 10), features(30, BatchLoaderTest::stop).iterator());

        assertEquals(2, fixture.warehouse.loadedFiles.size());
        assertTrue(fixture.warehouse.loadedFiles.stream().noneMatch(Files::exists));
    }

    @Test
    @DisplayName("A failed load job interrupts the run, earlier batches stay committed")
    void testBulk_FailureInterrupts() {
        LoadFixture fixture = fixture();
        fixture.warehouse.failBulkLoadOnCall = 2;

        LoadOutcome outcome = fixture.bulkLoader.load(context(30, 0, 10), features(30, BatchLoaderTest::stop).iterator());

        assertEquals(LoadJobStatus.INTERRUPTED, outcome.status());
        assertEquals(10, outcome.insertedFeatures());
        assertEquals(10, outcome.resumeAt());
        assertEquals(10, fixture.warehouse.rows(TABLE).size());
        assertEquals(1.0, fixture.registry.counter("geoingest.bulk.load.failures").count());
    }

    @Test
    @DisplayName("A failure before any flush resumes at startAt")
    void testBulk_FailureOnFirstBatch() {
        LoadFixture fixture = fixture();
        fixture.warehouse.failBulkLoadOnCall = 1;

        LoadOutcome outcome = fixture.bulkLoader.load(context(30, 5, 10), from(features(30, BatchLoaderTest::stop), 5));

        assertEquals(LoadJobStatus.INTERRUPTED, outcome.status());
        assertEquals(0, outcome.insertedFeatures());
        assertEquals(5, outcome.resumeAt());
    }

    @Test
    @DisplayName("Row numbers continue from startAt")
    void testBulk_StartAtNumbersRows() {
        LoadFixture fixture = fixture();

        LoadOutcome outcome = fixture.bulkLoader.load(context(20, 15, 10),
                from(features(20, stopsBrokenAt(3, 7, 17)), 15));

        assertEquals(LoadJobStatus.COMPLETED, outcome.status());
        assertEquals(4, outcome.insertedFeatures());
        assertEquals(1, outcome.invalidFeatureCount());
        assertEquals(20, outcome.rowsVisited());
        assertEquals(20, outcome.resumeAt());
        assertEquals(1, fixture.failureRows());
        assertEquals(17L, ((Number) fixture.warehouse.rows(fixture.failures.table()).get(0).get("row")).longValue());
        assertEquals("S15", fixture.warehouse.rows(TABLE).get(0).get("code"));
    }

    @Test
    @DisplayName("Rejected rows are counted, quarantined once and never batched")
    void testBulk_RejectedRows() {
        LoadFixture fixture = fixture();

        LoadOutcome outcome = fixture.bulkLoader.load(context(12, 0, 5),
                features(12, stopsBrokenAt(2, 9)).iterator());

        assertEquals(LoadJobStatus.COMPLETED, outcome.status());
        assertEquals(10, outcome.insertedFeatures());
        assertEquals(2, outcome.invalidFeatureCount());
        assertEquals(2, fixture.failureRows());
        assertEquals(2.0, fixture.registry.counter("geoingest.features.rejected",
                "reason", ValidationErrorType.SCHEMAS_DONT_MATCH.name()).count());
    }

    @Test
    @DisplayName("Rows rejected after the last flush are quarantined again on resume")
    void testBulk_RejectedAfterLastFlushRequarantined() {
        LoadFixture fixture = fixture();
        fixture.warehouse.failBulkLoadOnCall = 2;
        List<Feature> source = features(20, stopsBrokenAt(12));

        LoadOutcome first = fixture.bulkLoader.load(context(20, 0, 10), source.iterator());
        assertEquals(10, first.resumeAt());
        assertEquals(1, fixture.failureRows());

        fixture.warehouse.failBulkLoadOnCall = 0;
        LoadOutcome second = fixture.bulkLoader.load(context(20, first.resumeAt(), 10),
                from(source, (int) first.resumeAt()));

        assertEquals(LoadJobStatus.COMPLETED, second.status());
        assertEquals(9, second.insertedFeatures());
        assertEquals(2, fixture.failureRows());
        assertEquals(19, fixture.warehouse.rows(TABLE).size());
    }

    @Test
    @DisplayName("Disabled validation admits every row")
    void testBulk_ValidationDisabled() {
        LoadFixture fixture = fixture();
        LoadOutcome outcome = fixture.bulkLoader.load(context(5, 0, 10, false), features(5, stopsBrokenAt(1)).iterator());

        assertEquals(5, outcome.insertedFeatures());
        assertEquals(0, fixture.failureRows());
    }

    @Test
    @DisplayName("Unreadable rows are quarantined and counted even with validation disabled")
    void testBulk_UnreadableRowQuarantined() {
        LoadFixture fixture = fixture();
        List<Feature> source = features(6, BatchLoaderTest::stop);
        source.set(3, Feature.unreadable(Map.of("raw_line", "{\"type\":\"Fea"), "Malformed JSON: end-of-input"));

        LoadOutcome outcome = fixture.bulkLoader.load(context(6, 0, 2, false), source.iterator());

        assertEquals(LoadJobStatus.COMPLETED, outcome.status());
        assertEquals(5, outcome.insertedFeatures());
        assertEquals(1, outcome.invalidFeatureCount());
        assertEquals(6, outcome.resumeAt());
        Map<String, Object> failure = fixture.warehouse.rows(fixture.failures.table()).get(0);
        assertEquals(3L, ((Number) failure.get("row")).longValue());
        assertEquals("UNREADABLE_FEATURE: Malformed JSON: end-of-input", failure.get("fail_reason"));
        assertTrue(failure.get("props").toString().contains("raw_line"));
        assertEquals(1.0, fixture.registry.counter("geoingest.features.rejected",
                "reason", ValidationErrorType.UNREADABLE_FEATURE.name()).count());
    }

    // ============================================================================
    // Streaming
    // ============================================================================

    @Test
    @DisplayName("Per-row insert errors are not fatal")
    void testStreaming_PartialRowErrors() {
        LoadFixture fixture = fixture();
        fixture.warehouse.rejectRow = row -> "S3".equals(row.get("code"));

        LoadOutcome outcome = fixture.streamingLoader.load(context(6, 0, 4), features(6, BatchLoaderTest::stop).iterator());

        assertEquals(LoadJobStatus.COMPLETED, outcome.status());
        assertEquals(5, outcome.insertedFeatures());
        assertEquals(1.0, fixture.registry.counter("geoingest.streaming.row.errors").count());
    }

    @Test
    @DisplayName("A failed insert call is skipped and the load goes on")
    void testStreaming_FailedChunkContinues() {
        LoadFixture fixture = fixture();
        fixture.warehouse.failInsertOnCall = 1;

        LoadOutcome outcome = fixture.streamingLoader.load(context(8, 0, 4), features(8, BatchLoaderTest::stop).iterator());

        assertEquals(LoadJobStatus.COMPLETED, outcome.status());
        assertEquals(4, outcome.insertedFeatures());
        assertEquals(8, outcome.resumeAt());
        assertEquals(4.0, fixture.registry.counter("geoingest.streaming.row.errors").count());
        assertEquals("S4", fixture.warehouse.rows(TABLE).get(0).get("code"));
    }

    @Test
    @DisplayName("Streaming rows carry geometry as WKT")
    void testStreaming_GeometryAsWkt() {
        LoadFixture fixture = fixture();

        fixture.streamingLoader.load(context(1, 0, 10), features(1, BatchLoaderTest::stop).iterator());

        assertEquals("POINT (0 0)", fixture.warehouse.rows(TABLE).get(0).get("geometry"));
    }
}
