package com.di.geoingest.warehouse;

import com.di.geoingest.config.GeoIngestProperties;
import com.di.geoingest.schema.ColumnMode;
import com.di.geoingest.schema.ColumnType;
import com.di.geoingest.schema.TargetColumn;
import com.google.cloud.RetryOption;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.DatasetId;
import com.google.cloud.bigquery.DatasetInfo;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.FormatOptions;
import com.google.cloud.bigquery.InsertAllRequest;
import com.google.cloud.bigquery.InsertAllResponse;
import com.google.cloud.bigquery.Job;
import com.google.cloud.bigquery.JobId;
import com.google.cloud.bigquery.JobInfo;
import com.google.cloud.bigquery.JobInfo.CreateDisposition;
import com.google.cloud.bigquery.JobInfo.WriteDisposition;
import com.google.cloud.bigquery.JobStatistics;
import com.google.cloud.bigquery.LoadJobConfiguration;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.StandardSQLTypeName;
import com.google.cloud.bigquery.StandardTableDefinition;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableDataWriteChannel;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TableInfo;
import com.google.cloud.bigquery.TableResult;
import com.google.cloud.bigquery.WriteChannelConfiguration;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.threeten.bp.Duration;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link WarehouseClient} over the BigQuery client library.
 *
 * <p>Bulk loads submit a JSON load job with {@code WRITE_APPEND}. When a staging bucket is
 * configured the interchange file is uploaded to GCS first and loaded from its {@code gs://}
 * URI; otherwise it is streamed through a table write channel.
 */
@Slf4j
@Component
public class BigQueryWarehouseClient implements WarehouseClient {

    private final BigQuery bigQuery;
    private final Storage storage;
    private final GeoIngestProperties properties;

    public BigQueryWarehouseClient(BigQuery bigQuery,
                                   ObjectProvider<Storage> storage,
                                   GeoIngestProperties properties) {
        this.bigQuery = bigQuery;
        this.storage = storage.getIfAvailable();
        this.properties = properties;
    }

    @Override
    public String defaultProject() {
        String configured = properties.getProject();
        return configured != null && !configured.isBlank()
                ? configured
                : bigQuery.getOptions().getProjectId();
    }

    /* ------------------------------------------------------------------ */
    /* Datasets and tables                                                  */
    /* ------------------------------------------------------------------ */

    @Override
    public boolean datasetExists(String project, String dataset) {
        try {
            return bigQuery.getDataset(DatasetId.of(project, dataset)) != null;
        } catch (BigQueryException e) {
            throw new WarehouseException("Could not look up dataset " + project + "." + dataset, e);
        }
    }

    @Override
    public void createDataset(String project, String dataset) {
        try {
            bigQuery.create(DatasetInfo.newBuilder(DatasetId.of(project, dataset)).build());
            log.info("[WAREHOUSE] Created dataset {}.{}", project, dataset);
        } catch (BigQueryException e) {
            throw new WarehouseException("Could not create dataset " + project + "." + dataset, e);
        }
    }

    @Override
    public boolean tableExists(TableRef table) {
        try {
            Table found = bigQuery.getTable(toTableId(table));
            return found != null && found.exists();
        } catch (BigQueryException e) {
            throw new WarehouseException("Could not look up table " + table, e);
        }
    }

    @Override
    public void createTable(TableRef table, List<TargetColumn> columns, String description) {
        Schema schema = Schema.of(toFields(columns));
        TableInfo info = TableInfo.newBuilder(toTableId(table), StandardTableDefinition.of(schema))
                .setDescription(description)
                .build();
        try {
            bigQuery.create(info);
            log.info("[WAREHOUSE] Created table {} with {} columns", table, columns.size());
        } catch (BigQueryException e) {
            throw new WarehouseException("Could not create table " + table + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean deleteTable(TableRef table) {
        try {
            return bigQuery.delete(toTableId(table));
        } catch (BigQueryException e) {
            throw new WarehouseException("Could not delete table " + table, e);
        }
    }

    @Override
    public List<TargetColumn> getColumns(TableRef table) {
        Table found = requireTable(table);
        Schema schema = found.getDefinition().getSchema();
        List<TargetColumn> columns = new ArrayList<>();
        if (schema == null) {
            return columns;
        }
        for (Field field : schema.getFields()) {
            ColumnMode mode = field.getMode() == Field.Mode.REPEATED ? ColumnMode.REPEATED : ColumnMode.NULLABLE;
            columns.add(new TargetColumn(field.getName(), toColumnType(field.getType().getStandardType()),
                    mode, field.getDescription()));
        }
        return columns;
    }

    @Override
    public void addColumns(TableRef table, List<TargetColumn> columns) {
        Table found = requireTable(table);
        Schema current = found.getDefinition().getSchema();
        List<Field> fields = new ArrayList<>(current != null ? current.getFields() : List.of());
        fields.addAll(toFields(columns));
        try {
            found.toBuilder()
                    .setDefinition(StandardTableDefinition.of(Schema.of(fields)))
                    .build()
                    .update();
            log.info("[WAREHOUSE] Added {} column(s) to {}", columns.size(), table);
        } catch (BigQueryException e) {
            throw new WarehouseException("Could not add columns to " + table + ": " + e.getMessage(), e);
        }
    }

    @Override
    public long getRowCount(TableRef table) {
        Table found = requireTable(table);
        return found.getNumRows() != null ? found.getNumRows().longValue() : 0L;
    }


    @Override
    public List<TableRef> listTables(String project, String dataset) {
        List<TableRef> tables = new ArrayList<>();
        try {
            for (Table t : bigQuery.listTables(DatasetId.of(project, dataset)).iterateAll()) {
                tables.add(new TableRef(project, dataset, t.getTableId().getTable()));
            }
        } catch (BigQueryException e) {
            throw new WarehouseException("Could not list tables of " + project + "." + dataset, e);
        }
        return tables;
    }

    /* ------------------------------------------------------------------ */
    /* Writes                                                               */
    /* ------------------------------------------------------------------ */

    @Override
    public List<InsertError> insertRows(TableRef table, List<Map<String, Object>> rows) {
        InsertAllRequest.Builder request = InsertAllRequest.newBuilder(toTableId(table))
                .setSkipInvalidRows(true);
        rows.forEach(request::addRow);

        InsertAllResponse response;
        try {
            response = bigQuery.insertAll(request.build());
        } catch (BigQueryException e) {
            throw new WarehouseException("Streaming insert into " + table + " failed: " + e.getMessage(), e);
        }

        List<InsertError> errors = new ArrayList<>();
        if (response.hasErrors()) {
            for (Map.Entry<Long, List<BigQueryError>> entry : response.getInsertErrors().entrySet()) {
                String message = entry.getValue().isEmpty() ? "unknown" : entry.getValue().get(0).getMessage();
                errors.add(new InsertError(entry.getKey(), message));
            }
        }
        return errors;
    }

    @Override
    public long bulkLoad(TableRef table, Path interchangeFile) {
        String stagingBucket = properties.getBulk().getStagingBucket();
        if (storage != null && stagingBucket != null && !stagingBucket.isBlank()) {
            return loadFromStaging(table, interchangeFile, stagingBucket);
        }
        return loadThroughWriteChannel(table, interchangeFile);
    }

    private long loadThroughWriteChannel(TableRef table, Path interchangeFile) {
        WriteChannelConfiguration config = WriteChannelConfiguration.newBuilder(toTableId(table))
                .setFormatOptions(FormatOptions.json())
                .setWriteDisposition(WriteDisposition.WRITE_APPEND)
                .setCreateDisposition(CreateDisposition.CREATE_NEVER)
                .build();
        JobId jobId = newJobId(table);

        TableDataWriteChannel writer = bigQuery.writer(jobId, config);
        try (OutputStream out = Channels.newOutputStream(writer)) {
            Files.copy(interchangeFile, out);
        } catch (IOException | BigQueryException e) {
            throw new WarehouseException("Could not upload " + interchangeFile + " for " + table, e);
        }
        return awaitLoad(writer.getJob(), jobId, table);
    }

    private long loadFromStaging(TableRef table, Path interchangeFile, String bucket) {
        String prefix = properties.getBulk().getStagingPrefix();
        String objectName = (prefix == null || prefix.isBlank() ? "" : prefix + "/")
                + table.table() + "/" + interchangeFile.getFileName();
        BlobId blobId = BlobId.of(bucket, objectName);
        try {
            storage.createFrom(BlobInfo.newBuilder(blobId).setContentType("application/x-ndjson").build(),
                    interchangeFile);
        } catch (IOException e) {
            throw new WarehouseException("Could not stage " + interchangeFile + " to gs://" + bucket + "/" + objectName, e);
        }

        String uri = "gs://" + bucket + "/" + objectName;
        LoadJobConfiguration config = LoadJobConfiguration.newBuilder(toTableId(table), uri, FormatOptions.json())
                .setWriteDisposition(WriteDisposition.WRITE_APPEND)
                .setCreateDisposition(CreateDisposition.CREATE_NEVER)
                .setMaxBadRecords(0)
                .build();
        JobId jobId = newJobId(table);
        try {
            Job job = bigQuery.create(JobInfo.newBuilder(config).setJobId(jobId).build());
            log.debug("[WAREHOUSE] Load job {} submitted from {}", jobId.getJob(), uri);
            return awaitLoad(job, jobId, table);
        } catch (BigQueryException e) {
            throw new WarehouseException("Could not submit load job for " + table + ": " + e.getMessage(), e);
        } finally {
            try {
                storage.delete(blobId);
            } catch (RuntimeException e) {
                log.warn("[WAREHOUSE] Could not remove staged file {}: {}", uri, e.getMessage());
            }
        }
    }

    private long awaitLoad(Job job, JobId jobId, TableRef table) {
        if (job == null) {
            throw new WarehouseException("Load job " + jobId.getJob() + " for " + table + " was not created");
        }
        long timeoutMillis = properties.getBulk().getLoadTimeout().toMillis();
        try {
            job = job.waitFor(RetryOption.totalTimeout(Duration.ofMillis(timeoutMillis)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WarehouseException("Interrupted waiting for load job " + jobId.getJob(), e);
        } catch (BigQueryException e) {
            throw new WarehouseException("Load job " + jobId.getJob() + " failed: " + e.getMessage(), e);
        }

        if (job == null) {
            throw new WarehouseException("Load job timed out or no longer exists: " + jobId.getJob());
        }
        if (job.getStatus().getError() != null) {
            BigQueryError err = job.getStatus().getError();
            throw new WarehouseException("Load job " + jobId.getJob() + " into " + table + " failed: " + err.getMessage());
        }
        JobStatistics.LoadStatistics stats = job.getStatistics();
        return stats != null && stats.getOutputRows() != null ? stats.getOutputRows() : 0L;
    }

    /* ------------------------------------------------------------------ */
    /* Queries                                                              */
    /* ------------------------------------------------------------------ */

    @Override
    public List<Map<String, Object>> query(String sql) {
        QueryJobConfiguration config = QueryJobConfiguration.newBuilder(sql)
                .setUseLegacySql(false)
                .build();
        TableResult result;
        try {
            result = bigQuery.query(config);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WarehouseException("Interrupted running query", e);
        } catch (BigQueryException e) {
            throw new WarehouseException("Query failed: " + e.getMessage(), e);
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        Schema schema = result.getSchema();
        if (schema == null) {
            return rows;
        }
        List<Field> fields = schema.getFields();
        for (FieldValueList values : result.iterateAll()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < fields.size(); i++) {
                row.put(fields.get(i).getName(), toJavaValue(values.get(i)));
            }
            rows.add(row);
        }
        return rows;
    }

    /* ------------------------------------------------------------------ */
    /* Helpers                                                              */
    /* ------------------------------------------------------------------ */

    private Table requireTable(TableRef table) {
        Table found;
        try {
            found = bigQuery.getTable(toTableId(table));
        } catch (BigQueryException e) {
            throw new WarehouseException("Could not look up table " + table, e);
        }
        if (found == null) {
            throw new WarehouseException("Table not found: " + table);
        }
        return found;
    }

    private static JobId newJobId(TableRef table) {
        return JobId.newBuilder()
                .setProject(table.project())
                .setJob("geoingest-" + table.table() + "-" + UUID.randomUUID().toString().substring(0, 8))
                .build();
    }

    private static TableId toTableId(TableRef table) {
        return TableId.of(table.project(), table.dataset(), table.table());
    }

    private static List<Field> toFields(List<TargetColumn> columns) {
        List<Field> fields = new ArrayList<>(columns.size());
        for (TargetColumn column : columns) {
            Field.Builder builder = Field.newBuilder(column.name(), StandardSQLTypeName.valueOf(column.type().name()))
                    .setMode(column.isRepeated() ? Field.Mode.REPEATED : Field.Mode.NULLABLE);
            if (column.description() != null) {
                builder.setDescription(column.description());
            }
            fields.add(builder.build());
        }
        return fields;
    }

    private static ColumnType toColumnType(StandardSQLTypeName type) {
        switch (type) {
            case INT64:
                return ColumnType.INT64;
            case FLOAT64:
            case NUMERIC:
            case BIGNUMERIC:
                return ColumnType.FLOAT64;
            case BOOL:
                return ColumnType.BOOL;
            case DATE:
                return ColumnType.DATE;
            case DATETIME:
                return ColumnType.DATETIME;
            case TIMESTAMP:
                return ColumnType.TIMESTAMP;
            case TIME:
                return ColumnType.TIME;
            case BYTES:
                return ColumnType.BYTES;
            case JSON:
                return ColumnType.JSON;
            case GEOGRAPHY:
                return ColumnType.GEOGRAPHY;
            default:
                return ColumnType.STRING;
        }
    }

    private static Object toJavaValue(FieldValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.getAttribute() == FieldValue.Attribute.REPEATED) {
            List<Object> items = new ArrayList<>();
            for (FieldValue item : value.getRepeatedValue()) {
                items.add(toJavaValue(item));
            }
            return items;
        }
        if (value.getAttribute() == FieldValue.Attribute.RECORD) {
            return value.getRecordValue().toString();
        }
        return value.getValue();
    }
}
