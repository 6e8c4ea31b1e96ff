package com.di.geoingest.load.metadata;

import com.di.geoingest.config.GeoIngestProperties;
import com.di.geoingest.schema.ColumnType;
import com.di.geoingest.schema.TargetColumn;
import com.di.geoingest.warehouse.InsertError;
import com.di.geoingest.warehouse.TableRef;
import com.di.geoingest.warehouse.WarehouseClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only writer for the {@code load_failures} quarantine table. Best-effort like the ledger.
 */
@Repository
@Slf4j
public class LoadFailureRepository {

    public static final List<TargetColumn> COLUMNS = List.of(
            TargetColumn.of("job_id", ColumnType.STRING),
            TargetColumn.of("source_path", ColumnType.STRING),
            TargetColumn.of("layer_name", ColumnType.STRING),
            TargetColumn.of("table_id", ColumnType.STRING),
            TargetColumn.of("row", ColumnType.INT64),
            TargetColumn.of("props", ColumnType.JSON),
            TargetColumn.of("fail_time", ColumnType.TIMESTAMP),
            TargetColumn.of("fail_reason", ColumnType.STRING)
    );

    private final WarehouseClient warehouse;
    private final ObjectMapper objectMapper;
    private final GeoIngestProperties.Ledger ledger;

    public LoadFailureRepository(WarehouseClient warehouse, ObjectMapper objectMapper, GeoIngestProperties properties) {
        this.warehouse = warehouse;
        this.objectMapper = objectMapper;
        this.ledger = properties.getLedger();
    }

    public TableRef table() {
        return new TableRef(warehouse.defaultProject(), ledger.getDataset(), ledger.getFailuresTable());
    }

    public boolean record(LoadFailure failure) {
        try {
            List<InsertError> errors = warehouse.insertRows(table(), List.of(toRow(failure)));
            if (!errors.isEmpty()) {
                log.error("[FAILURES] Failure row {} of {} rejected: {}",
                        failure.getRow(), failure.getSourcePath(), errors.get(0).message());
                return false;
            }
            return true;
        } catch (RuntimeException e) {
            log.error("[FAILURES] Could not record failure of row {} of {}: {}",
                    failure.getRow(), failure.getSourcePath(), e.getMessage(), e);
            return false;
        }
    }

    Map<String, Object> toRow(LoadFailure failure) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("job_id", failure.getJobId());
        row.put("source_path", failure.getSourcePath());
        row.put("layer_name", failure.getLayerName());
        row.put("table_id", failure.getTableId());
        row.put("row", failure.getRow());
        row.put("props", serializeProps(failure.getProps()));
        row.put("fail_time", failure.getFailTime() != null ? failure.getFailTime().toString() : null);
        row.put("fail_reason", failure.getFailReason());
        row.values().removeIf(v -> v == null);
        return row;
    }

    private String serializeProps(Map<String, Object> props) {
        if (props == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(props);
        } catch (JsonProcessingException e) {
            log.warn("[FAILURES] Properties not serializable as JSON, storing them as a JSON string: {}", e.getMessage());
            return objectMapper.valueToTree(String.valueOf(props)).toString();
        }
    }
}
