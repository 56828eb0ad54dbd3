package io.captionsync.model;

import java.util.List;
import java.util.Map;

public record QueryResult(List<String> columns, List<Map<String, Object>> rows) {

    public QueryResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    public Object first(String column) {
        if (rows.isEmpty()) {
            return null;
        }
        return rows.get(0).get(column);
    }
}
