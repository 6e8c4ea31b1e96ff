package com.di.geoingest.load;

import com.di.geoingest.warehouse.TableRef;

import java.util.List;

/**
 * @param created {@code false} when the output table already existed and overwrite was off
 * @param columns output columns: {@code id}, the fields common to every source, {@code source_table}
 */
public record UnionResult(TableRef output, boolean created, List<TableRef> sources, List<String> columns, String sql) {
}
