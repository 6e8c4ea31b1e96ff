package com.di.geoingest.warehouse;

import com.di.geoingest.schema.TargetColumn;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Operations the loaders need from the analytical warehouse. Every method blocks until the
 * warehouse has answered; failures surface as {@link WarehouseException}.
 */
public interface WarehouseClient {

    /** Project used when a table id omits one. */
    String defaultProject();

    boolean datasetExists(String project, String dataset);

    void createDataset(String project, String dataset);

    boolean tableExists(TableRef table);

    void createTable(TableRef table, List<TargetColumn> columns, String description);

    boolean deleteTable(TableRef table);

    List<TargetColumn> getColumns(TableRef table);

    /** Appends columns to an existing table schema in place. */
    void addColumns(TableRef table, List<TargetColumn> columns);

    /**
     * Streams rows into the table, skipping invalid rows.
     *
     * @return per-row errors; empty when every row was applied
     */
    List<InsertError> insertRows(TableRef table, List<Map<String, Object>> rows);

    /**
     * Appends a newline-delimited JSON interchange file to the table with a load job.
     *
     * @return rows written by the job
     */
    long bulkLoad(TableRef table, Path interchangeFile);

    /** Runs a standard-SQL statement; DDL and DML return an empty list. */
    List<Map<String, Object>> query(String sql);

    long getRowCount(TableRef table);

    List<TableRef> listTables(String project, String dataset);
}
