package com.di.geoingest.load;

import com.di.geoingest.source.Feature;
import com.di.geoingest.warehouse.WarehouseClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Spatial path: each batch becomes one interchange file and one warehouse load job. Batches are
 * sized by {@link JobSizer} so the job count stays inside the per-table daily quota. A failed
 * load job interrupts the whole load.
 */
@Slf4j
@Service
public class BulkLoader extends BatchLoader {

    private final WarehouseClient warehouse;
    private final InterchangeFileWriter fileWriter;
    private final LoadMetrics metrics;

    public BulkLoader(WarehouseClient warehouse,
                      InterchangeFileWriter fileWriter,
                      FeatureAdmission admission,
                      LoadMetrics metrics) {
        super(admission);
        this.warehouse = warehouse;
        this.fileWriter = fileWriter;
        this.metrics = metrics;
    }

    @Override
    protected String pathTag() {
        return "BULK";
    }

    @Override
    protected long flush(LoadJobContext context, List<Feature> batch) {
        long started = System.currentTimeMillis();
        Path file = fileWriter.write(batch, context);
        try {
            long written = warehouse.bulkLoad(context.getTable(), file);
            log.debug("[BULK] Load job wrote {} rows for a batch of {}", written, batch.size());
        } catch (RuntimeException e) {
            metrics.recordBulkFailure();
            throw e;
        } finally {
            deleteQuietly(file);
        }
        metrics.recordFlush(LoadMetrics.PATH_BULK, batch.size(), System.currentTimeMillis() - started);
        metrics.recordInserted(LoadMetrics.PATH_BULK, batch.size());
        return batch.size();
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("[BULK] Could not delete interchange file {}: {}", file, e.getMessage());
        }
    }
}
