package io.captionsync.engine;

import java.util.List;

/**
 * Shape of a replicated table. Tables without a declared primary key are keyed by {@code rowid}.
 */
record TableInfo(String name, List<String> pkColumns, List<String> columns) {

    TableInfo {
        pkColumns = List.copyOf(pkColumns);
        columns = List.copyOf(columns);
    }

    boolean hasColumn(String column) {
        return columns.contains(column);
    }
}
