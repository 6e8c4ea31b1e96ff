package com.di.geoingest.load;

import com.di.geoingest.load.dto.AddColumnsRequest;
import com.di.geoingest.load.dto.DatabaseLoadRequest;
import com.di.geoingest.load.dto.FileLoadRequest;
import com.di.geoingest.load.dto.LoadJobResponse;
import com.di.geoingest.load.dto.UnionTablesRequest;
import com.di.geoingest.load.metadata.LoadJob;
import com.di.geoingest.load.metadata.LoadJobStatus;
import com.di.geoingest.schema.ColumnMode;
import com.di.geoingest.schema.ColumnType;
import com.di.geoingest.schema.TargetColumn;
import com.di.geoingest.warehouse.TableRef;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * REST controller for load jobs and table housekeeping.
 *
 * <p><strong>Base path:</strong> {@code /api/load}
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>POST</td><td>/api/load/file</td>
 *     <td>Load a shapefile, geodatabase layer or GeoJSON sequence (synchronous)</td></tr>
 * <tr><td>POST</td><td>/api/load/database</td>
 *     <td>Sync a PostgreSQL/PostGIS table (synchronous)</td></tr>
 * <tr><td>POST</td><td>/api/load/union</td>
 *     <td>Union several tables into a new one</td></tr>
 * <tr><td>POST</td><td>/api/load/tables/{tableId}/columns</td>
 *     <td>Add columns to an existing table</td></tr>
 * <tr><td>GET</td><td>/api/load/tables/{tableId}/schema-diff?compareWith=a,b</td>
 *     <td>Fields unique to each side of a table comparison</td></tr>
 * <tr><td>GET</td><td>/api/load/datasets/{datasetId}/tables</td>
 *     <td>Fully-qualified ids of the tables in a dataset</td></tr>
 * </table>
 *
 * <p>Load endpoints block until the job ends and answer {@code 201} for a completed job,
 * {@code 500} for an interrupted one; either way the body carries the ledger row.
 */
@RestController
@RequestMapping("/api/load")
@Slf4j
@RequiredArgsConstructor
public class LoadJobController {

    private final LoadJobOrchestrator orchestrator;
    private final TableManager        tableManager;

    /* ------------------------------------------------------------------ */
    /* Load jobs                                                            */
    /* ------------------------------------------------------------------ */

    @PostMapping("/file")
    public ResponseEntity<LoadJobResponse> loadFile(@Valid @RequestBody FileLoadRequest request) {
        log.info("[CONTROLLER] POST /api/load/file source={} layer={} table={}",
                request.getSourcePath(), request.getLayerName(), request.getTableId());
        return respond(orchestrator.loadFile(request));
    }

    @PostMapping("/database")
    public ResponseEntity<LoadJobResponse> loadDatabase(@Valid @RequestBody DatabaseLoadRequest request) {
        log.info("[CONTROLLER] POST /api/load/database source={}:{}/{} table={} target={}",
                request.getHost(), request.getPort(), request.getDatabase(), request.getTable(), request.getTableId());
        return respond(orchestrator.loadDatabaseTable(request));
    }

    private static ResponseEntity<LoadJobResponse> respond(LoadJob job) {
        HttpStatus status = job.getStatus() == LoadJobStatus.COMPLETED
                ? HttpStatus.CREATED
                : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(LoadJobResponse.from(job));
    }

    /* ------------------------------------------------------------------ */
    /* Table housekeeping                                                   */
    /* ------------------------------------------------------------------ */

    /**
     * Returns {@code 201} with the union result, or {@code 409} when the output already exists and
     * overwrite was not requested.
     */
    @PostMapping("/union")
    public ResponseEntity<UnionResult> union(@Valid @RequestBody UnionTablesRequest request) {
        log.info("[CONTROLLER] POST /api/load/union sources={} output={} overwrite={}",
                request.getSourceTableIds(), request.getOutputTableId(), request.isOverwrite());
        List<TableRef> sources = request.getSourceTableIds().stream()
                .map(tableManager::resolve)
                .collect(Collectors.toList());
        UnionResult result = tableManager.unionTables(sources, tableManager.resolve(request.getOutputTableId()),
                request.isOverwrite());
        return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.CONFLICT).body(result);
    }

    @PostMapping("/tables/{tableId}/columns")
    public List<TargetColumn> addColumns(@PathVariable String tableId,
                                         @Valid @RequestBody AddColumnsRequest request) {
        log.info("[CONTROLLER] POST /api/load/tables/{}/columns count={}", tableId, request.getColumns().size());
        List<TargetColumn> columns = new ArrayList<>();
        for (AddColumnsRequest.ColumnRequest column : request.getColumns()) {
            columns.add(new TargetColumn(column.getName(),
                    parseEnum(ColumnType.class, column.getType(), "column type"),
                    column.getMode() == null ? ColumnMode.NULLABLE : parseEnum(ColumnMode.class, column.getMode(), "column mode"),
                    column.getDescription()));
        }
        return tableManager.addColumns(tableManager.resolve(tableId), columns);
    }

    @GetMapping("/tables/{tableId}/schema-diff")
    public List<SchemaDiff> schemaDiff(@PathVariable String tableId,
                                       @RequestParam List<String> compareWith) {
        TableRef base = tableManager.resolve(tableId);
        return compareWith.stream()
                .map(tableManager::resolve)
                .map(other -> tableManager.schemaDiff(base, other))
                .collect(Collectors.toList());
    }

    @GetMapping("/datasets/{datasetId}/tables")
    public List<String> listTables(@PathVariable String datasetId) {
        return tableManager.listTables(datasetId).stream()
                .map(TableRef::toString)
                .collect(Collectors.toList());
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String what) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + what + ": " + value, e);
        }
    }
}
