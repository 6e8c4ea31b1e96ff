package com.di.geoingest.load;

import com.di.geoingest.config.DbConfigSnapshot;
import com.di.geoingest.config.GeoIngestProperties;
import com.di.geoingest.load.dto.DatabaseLoadRequest;
import com.di.geoingest.load.dto.FileLoadRequest;
import com.di.geoingest.load.metadata.LoadJob;
import com.di.geoingest.load.metadata.LoadJobRepository;
import com.di.geoingest.load.metadata.LoadJobStatus;
import com.di.geoingest.schema.SchemaTranslator;
import com.di.geoingest.schema.SourceSchema;
import com.di.geoingest.schema.SpatialClassification;
import com.di.geoingest.schema.TargetColumn;
import com.di.geoingest.source.Feature;
import com.di.geoingest.source.SourceDataset;
import com.di.geoingest.source.SourceDatasetFactory;
import com.di.geoingest.source.SourceFormat;
import com.di.geoingest.util.DurationFormatter;
import com.di.geoingest.util.InputValidator;
import com.di.geoingest.warehouse.TableRef;
import com.di.geoingest.warehouse.WarehouseClient;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs one load job end to end.
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │  OPEN      source dataset (file layer or database table)          │
 * │  SCHEMA    translate declared schema, create table if missing,    │
 * │            wait until the new table is visible                    │
 * │  PLAN      spatial file  → bulk, job size from the daily quota    │
 * │            otherwise     → streaming, fixed chunk size            │
 * │  LOAD      validate, quarantine, batch, flush                     │
 * │  REPAIR    relational tables only: WKT text → GEOGRAPHY          │
 * │  FINISH    one ledger row, whatever the outcome                   │
 * └───────────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * Problems found before the first row (unreadable source, bad table id, table creation) are
 * thrown to the caller and leave no ledger row.
 */
@Service
@Slf4j
public class LoadJobOrchestrator {

    public static final String MDC_JOB_ID = "jobId";

    /** Column that keeps a relational table's geometry as WKT text. */
    public static final String ORIGINAL_GEOMETRY = "original_geometry";

    // ---- collaborators ------------------------------------------------------
    private final SourceDatasetFactory sources;
    private final SchemaTranslator     translator;
    private final JobSizer             sizer;
    private final TableManager         tables;
    private final BulkLoader           bulkLoader;
    private final StreamingLoader      streamingLoader;
    private final LoadJobRepository    ledger;
    private final WarehouseClient      warehouse;
    private final LoadMetrics          metrics;

    // ---- settings -----------------------------------------------------------
    private final int defaultChunkSize;

    public LoadJobOrchestrator(SourceDatasetFactory sources,
                               SchemaTranslator translator,
                               JobSizer sizer,
                               TableManager tables,
                               BulkLoader bulkLoader,
                               StreamingLoader streamingLoader,
                               LoadJobRepository ledger,
                               WarehouseClient warehouse,
                               LoadMetrics metrics,
                               GeoIngestProperties properties) {
        this.sources = sources;
        this.translator = translator;
        this.sizer = sizer;
        this.tables = tables;
        this.bulkLoader = bulkLoader;
        this.streamingLoader = streamingLoader;
        this.ledger = ledger;
        this.warehouse = warehouse;
        this.metrics = metrics;
        this.defaultChunkSize = properties.getStreaming().getChunkSize();
    }

    /* ==================================================================== */
    /* Entry points                                                          */
    /* ==================================================================== */

    public LoadJob loadFile(FileLoadRequest request) {
        TableRef table = tables.resolve(request.getTableId());
        JobOptions options = new JobOptions(
                request.isValidateFeature(),
                request.getJobSize(),
                InputValidator.validateStartAt(request.getStartAt()),
                chunkSize(request.getChunkSize()));

        log.info("[ORCHESTRATOR] File load source={} layer={} table={} startAt={}",
                InputValidator.sanitizeForLogging(request.getSourcePath()),
                request.getLayerName(), table, options.startAt());

        try (SourceDataset dataset = sources.openFile(request.getSourcePath(), request.getLayerName())) {
            return run(dataset, table, options);
        }
    }

    public LoadJob loadDatabaseTable(DatabaseLoadRequest request) {
        TableRef table = tables.resolve(request.getTableId());
        JobOptions options = new JobOptions(
                request.isValidateFeature(),
                null,
                InputValidator.validateStartAt(request.getStartAt()),
                chunkSize(request.getChunkSize()));
        DbConfigSnapshot config = DbConfigSnapshot.of(request.getHost(), request.getPort(),
                request.getDatabase(), request.getUsername(), request.getPassword());

        log.info("[ORCHESTRATOR] Table sync source={} table={} target={} startAt={}",
                config.displayUrl(), request.getTable(), table, options.startAt());

        try (SourceDataset dataset = sources.openTable(config, request.getTable())) {
            return run(dataset, table, options);
        }
    }

    /**
     * Loads an already opened dataset. The caller keeps ownership of the dataset and closes it.
     */
    public LoadJob run(SourceDataset dataset, TableRef table, JobOptions options) {
        String jobId = UUID.randomUUID().toString();
        MDC.put(MDC_JOB_ID, jobId);
        try {
            return doRun(jobId, dataset, table, options);
        } finally {
            MDC.remove(MDC_JOB_ID);
        }
    }

    /* ==================================================================== */
    /* Job                                                                   */
    /* ==================================================================== */

    private LoadJob doRun(String jobId, SourceDataset dataset, TableRef table, JobOptions options) {
        Instant startTime = Instant.now();
        boolean relational = dataset.format() == SourceFormat.DATABASE_TABLE;

        // ── schema ──────────────────────────────────────────────────────
        SourceSchema declared = dataset.schema();
        String spatialTextField = null;
        if (relational && !declared.spatialFieldNames().isEmpty()) {
            spatialTextField = declared.spatialFieldNames().get(0);
            declared = declared.withSpatialFieldsAsText(ORIGINAL_GEOMETRY);
        }
        List<TargetColumn> columns = translator.translate(declared);
        boolean created = tables.ensureTable(table, columns, describe(dataset, startTime));
        if (created) {
            log.info("[ORCHESTRATOR] Created {} with {} columns", table, columns.size());
        }

        // ── plan ────────────────────────────────────────────────────────
        SpatialClassification classification = declared.classification();
        boolean bulk = !relational && classification == SpatialClassification.SPATIAL;
        long featureCount = dataset.featureCount();
        JobPlan plan = bulk
                ? sizer.plan(featureCount, options.startAt(), options.jobSize())
                : sizer.chunked(featureCount, options.startAt(), options.chunkSize());
        log.info("[ORCHESTRATOR] jobId={} path={} features={} jobSize={} jobCount={} optimum={}",
                jobId, bulk ? "bulk" : "streaming", featureCount, plan.jobSize(), plan.jobCount(),
                plan.optimumJobSize());

        LoadJobContext context = LoadJobContext.builder()
                .jobId(jobId)
                .sourcePath(dataset.path())
                .layerName(dataset.layerName())
                .format(dataset.format())
                .sourceSchema(declared)
                .classification(classification)
                .featureCount(featureCount)
                .table(table)
                .targetColumns(columns)
                .startAt(options.startAt())
                .jobSize(plan.jobSize())
                .jobCount(plan.jobCount())
                .validateFeature(options.validateFeature())
                .startTime(startTime)
                .build();

        // ── load ────────────────────────────────────────────────────────
        Iterator<Feature> features = dataset.features(options.startAt());
        if (spatialTextField != null) {
            features = renaming(features, spatialTextField, ORIGINAL_GEOMETRY);
        }
        LoadOutcome outcome = (bulk ? bulkLoader : streamingLoader).load(context, features);

        // ── repair ──────────────────────────────────────────────────────
        if (spatialTextField != null && outcome.insertedFeatures() > 0) {
            tables.repairGeometry(table, ORIGINAL_GEOMETRY, translator.getGeometryColumn());
        }

        return finish(context, outcome);
    }

    private LoadJob finish(LoadJobContext context, LoadOutcome outcome) {
        Instant endTime = Instant.now();
        LoadJob job = LoadJob.builder()
                .jobId(context.getJobId())
                .sourcePath(context.getSourcePath())
                .layerName(context.getLayerName())
                .tableId(context.getTable().toString())
                .inputFeatureCount(context.getFeatureCount())
                .jobSize(context.getJobSize())
                .jobCount(context.getJobCount())
                .startAt(context.getStartAt())
                .validateFeature(context.isValidateFeature())
                .invalidFeatureCount(outcome.invalidFeatureCount())
                .insertedFeatures(outcome.insertedFeatures())
                .tableRowCount(safeRowCount(context.getTable()))
                .resumeAt(outcome.resumeAt())
                .startTime(context.getStartTime())
                .endTime(endTime)
                .duration(DurationFormatter.format(Duration.between(context.getStartTime(), endTime)))
                .status(outcome.status())
                .errorMessage(outcome.errorMessage())
                .build();

        ledger.record(job);
        metrics.recordJob(outcome.status());

        if (outcome.status() == LoadJobStatus.COMPLETED) {
            log.info("[ORCHESTRATOR] jobId={} COMPLETED table={} inserted={} invalid={} duration={}",
                    job.getJobId(), job.getTableId(), job.getInsertedFeatures(),
                    job.getInvalidFeatureCount(), job.getDuration());
        } else {
            log.error("[ORCHESTRATOR] jobId={} INTERRUPTED table={} inserted={} invalid={} resumeAt={} error={}",
                    job.getJobId(), job.getTableId(), job.getInsertedFeatures(),
                    job.getInvalidFeatureCount(), job.getResumeAt(), job.getErrorMessage());
        }
        return job;
    }

    /* ==================================================================== */
    /* Helpers                                                               */
    /* ==================================================================== */

    private Long safeRowCount(TableRef table) {
        try {
            return warehouse.getRowCount(table);
        } catch (RuntimeException e) {
            log.warn("[ORCHESTRATOR] Could not read row count of {}: {}", table, e.getMessage());
            return null;
        }
    }

    private int chunkSize(Integer requested) {
        return InputValidator.validateChunkSize(requested != null ? requested : defaultChunkSize);
    }

    static String describe(SourceDataset dataset, Instant at) {
        StringBuilder description = new StringBuilder("Loaded from ").append(dataset.path());
        if (dataset.layerName() != null) {
            description.append(" layer ").append(dataset.layerName());
        }
        return description.append(" at ").append(at).toString();
    }

    /** Renames one property key in every feature, keeping its position. */
    static Iterator<Feature> renaming(Iterator<Feature> features, String from, String to) {
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return features.hasNext();
            }

            @Override
            public Feature next() {
                Feature feature = features.next();
                if (!feature.properties().containsKey(from)) {
                    return feature;
                }
                Map<String, Object> renamed = new LinkedHashMap<>();
                feature.properties().forEach((key, value) -> renamed.put(key.equals(from) ? to : key, value));
                return new Feature(renamed, feature.geometry(), feature.readError());
            }
        };
    }

    /**
     * Per-job knobs taken from the request.
     *
     * @param jobSize   requested bulk job size; {@code null} for the quota optimum
     * @param chunkSize rows per streaming insert
     */
    public record JobOptions(boolean validateFeature, Long jobSize, long startAt, int chunkSize) {
    }
}
