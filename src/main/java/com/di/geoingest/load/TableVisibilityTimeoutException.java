package com.di.geoingest.load;

import com.di.geoingest.warehouse.TableRef;

/**
 * A freshly created table did not become visible within the configured wait.
 */
public class TableVisibilityTimeoutException extends RuntimeException {

    private final transient TableRef table;
    private final int attempts;

    public TableVisibilityTimeoutException(TableRef table, int attempts, long waitedMillis) {
        super("Table " + table + " not visible after " + attempts + " checks over " + waitedMillis + " ms");
        this.table = table;
        this.attempts = attempts;
    }

    public TableRef getTable() {
        return table;
    }

    public int getAttempts() {
        return attempts;
    }
}
