package com.di.geoingest.load;

import com.di.geoingest.load.metadata.LoadJobStatus;
import com.di.geoingest.source.Feature;
import com.di.geoingest.warehouse.InsertError;
import com.di.geoingest.warehouse.WarehouseClient;
import com.di.geoingest.warehouse.WarehouseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Non-spatial files and relational tables: rows go straight into the table with streaming
 * inserts, one call per chunk. Rejected rows and failed calls are logged and counted, they do not
 * stop the load. The job is only interrupted when rows were attempted and none were applied.
 */
@Slf4j
@Service
public class StreamingLoader extends BatchLoader {

    private final WarehouseClient warehouse;
    private final RowValueConverter converter;
    private final LoadMetrics metrics;

    public StreamingLoader(WarehouseClient warehouse,
                           RowValueConverter converter,
                           FeatureAdmission admission,
                           LoadMetrics metrics) {
        super(admission);
        this.warehouse = warehouse;
        this.converter = converter;
        this.metrics = metrics;
    }

    @Override
    protected String pathTag() {
        return "STREAMING";
    }

    @Override
    protected long flush(LoadJobContext context, List<Feature> batch) {
        long started = System.currentTimeMillis();
        List<Map<String, Object>> rows = new ArrayList<>(batch.size());
        for (Feature feature : batch) {
            rows.add(converter.toInsertRow(feature, context.getTargetColumns()));
        }

        long applied;
        try {
            List<InsertError> errors = warehouse.insertRows(context.getTable(), rows);
            Set<Long> failedRows = new HashSet<>();
            for (InsertError error : errors) {
                failedRows.add(error.rowIndex());
            }
            if (!failedRows.isEmpty()) {
                log.error("[STREAMING] {} of {} rows rejected by {}; first error: {}",
                        failedRows.size(), rows.size(), context.getTable(), errors.get(0).message());
                metrics.recordStreamingRowErrors(failedRows.size());
            }
            applied = rows.size() - failedRows.size();
        } catch (WarehouseException e) {
            log.error("[STREAMING] Insert of {} rows into {} failed: {}", rows.size(), context.getTable(), e.getMessage());
            metrics.recordStreamingRowErrors(rows.size());
            applied = 0;
        }

        metrics.recordFlush(LoadMetrics.PATH_STREAMING, batch.size(), System.currentTimeMillis() - started);
        metrics.recordInserted(LoadMetrics.PATH_STREAMING, applied);
        return applied;
    }

    @Override
    protected LoadJobStatus resolveStatus(boolean iterationComplete, long attempted, long applied) {
        if (attempted > 0 && applied == 0) {
            return LoadJobStatus.INTERRUPTED;
        }
        return super.resolveStatus(iterationComplete, attempted, applied);
    }
}
