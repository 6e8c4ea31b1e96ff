package com.di.geoingest.load.metadata;

import com.di.geoingest.config.GeoIngestProperties;
import com.di.geoingest.schema.ColumnType;
import com.di.geoingest.schema.TargetColumn;
import com.di.geoingest.warehouse.InsertError;
import com.di.geoingest.warehouse.TableRef;
import com.di.geoingest.warehouse.WarehouseClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only writer for the {@code load_jobs} ledger table.
 *
 * <p>Writes are best-effort: a failed append is logged and reported as {@code false}, it never
 * changes the outcome of the job being recorded.
 */
@Repository
@Slf4j
public class LoadJobRepository {

    public static final List<TargetColumn> COLUMNS = List.of(
            TargetColumn.of("job_id", ColumnType.STRING),
            TargetColumn.of("source_path", ColumnType.STRING),
            TargetColumn.of("layer_name", ColumnType.STRING),
            TargetColumn.of("table_id", ColumnType.STRING),
            TargetColumn.of("input_feature_count", ColumnType.INT64),
            TargetColumn.of("job_size", ColumnType.INT64),
            TargetColumn.of("job_count", ColumnType.INT64),
            TargetColumn.of("start_at", ColumnType.INT64),
            TargetColumn.of("validate_feature", ColumnType.BOOL),
            TargetColumn.of("invalid_feature_count", ColumnType.INT64),
            TargetColumn.of("inserted_features", ColumnType.INT64),
            TargetColumn.of("table_row_count", ColumnType.INT64),
            TargetColumn.of("resume_at", ColumnType.INT64),
            TargetColumn.of("start_time", ColumnType.TIMESTAMP),
            TargetColumn.of("end_time", ColumnType.TIMESTAMP),
            TargetColumn.of("duration", ColumnType.STRING),
            TargetColumn.of("status", ColumnType.STRING),
            TargetColumn.of("error_message", ColumnType.STRING)
    );

    private final WarehouseClient warehouse;
    private final GeoIngestProperties.Ledger ledger;

    public LoadJobRepository(WarehouseClient warehouse, GeoIngestProperties properties) {
        this.warehouse = warehouse;
        this.ledger = properties.getLedger();
    }

    public TableRef table() {
        return new TableRef(warehouse.defaultProject(), ledger.getDataset(), ledger.getJobsTable());
    }

    public boolean record(LoadJob job) {
        try {
            TableRef table = table();
            List<InsertError> errors = warehouse.insertRows(table, List.of(toRow(job)));
            if (!errors.isEmpty()) {
                log.error("[LEDGER] Ledger row for {} rejected by {}: {}", job.getTableId(), table, errors.get(0).message());
                return false;
            }
            log.info("[LEDGER] Recorded {} job for {}: inserted={} invalid={}",
                    job.getStatus(), job.getTableId(), job.getInsertedFeatures(), job.getInvalidFeatureCount());
            return true;
        } catch (RuntimeException e) {
            log.error("[LEDGER] Could not record job for {}: {}", job.getTableId(), e.getMessage(), e);
            return false;
        }
    }

    static Map<String, Object> toRow(LoadJob job) {
        Map<String, Object> row = new LinkedHashMap<>();
        put(row, "job_id", job.getJobId());
        put(row, "source_path", job.getSourcePath());
        put(row, "layer_name", job.getLayerName());
        put(row, "table_id", job.getTableId());
        put(row, "input_feature_count", job.getInputFeatureCount());
        put(row, "job_size", job.getJobSize());
        put(row, "job_count", job.getJobCount());
        put(row, "start_at", job.getStartAt());
        put(row, "validate_feature", job.getValidateFeature());
        put(row, "invalid_feature_count", job.getInvalidFeatureCount());
        put(row, "inserted_features", job.getInsertedFeatures());
        put(row, "table_row_count", job.getTableRowCount());
        put(row, "resume_at", job.getResumeAt());
        put(row, "start_time", job.getStartTime() != null ? job.getStartTime().toString() : null);
        put(row, "end_time", job.getEndTime() != null ? job.getEndTime().toString() : null);
        put(row, "duration", job.getDuration());
        put(row, "status", job.getStatus() != null ? job.getStatus().name() : null);
        put(row, "error_message", job.getErrorMessage());
        return row;
    }

    private static void put(Map<String, Object> row, String key, Object value) {
        if (value != null) {
            row.put(key, value);
        }
    }
}
