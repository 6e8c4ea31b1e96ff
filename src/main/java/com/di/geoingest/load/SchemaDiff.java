package com.di.geoingest.load;

import com.di.geoingest.warehouse.TableRef;

import java.util.List;

/**
 * Field names a table has that the base table lacks, and the other way round.
 */
public record SchemaDiff(TableRef base, TableRef table, List<String> onlyInTable, List<String> missingFromTable) {

    public boolean isIdentical() {
        return onlyInTable.isEmpty() && missingFromTable.isEmpty();
    }
}
