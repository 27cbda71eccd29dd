package work.lcod.multiverse.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable rows-and-columns value. Every row carries every column (missing cells are {@code null}) in column order.
 * Used for input data, for the universe listing and for extracted results.
 */
public record Table(List<String> columns, List<Map<String, Object>> rows) {
    public Table {
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(rows, "rows");
        var uniqueColumns = new LinkedHashSet<>(columns);
        if (uniqueColumns.size() != columns.size()) {
            throw new IllegalArgumentException("Duplicate column names: " + columns);
        }
        columns = List.copyOf(columns);
        var normalized = new ArrayList<Map<String, Object>>(rows.size());
        for (var row : rows) {
            for (var key : row.keySet()) {
                if (!uniqueColumns.contains(key)) {
                    throw new IllegalArgumentException("Row has unknown column '" + key + "'; columns are " + columns);
                }
            }
            var cells = new LinkedHashMap<String, Object>();
            for (var column : columns) {
                cells.put(column, row.get(column));
            }
            normalized.add(Collections.unmodifiableMap(cells));
        }
        rows = Collections.unmodifiableList(normalized);
    }

    public static Table of(List<String> columns, List<? extends Map<String, ?>> rows) {
        var copy = new ArrayList<Map<String, Object>>(rows.size());
        for (var row : rows) {
            copy.add(new LinkedHashMap<>(row));
        }
        return new Table(columns, copy);
    }

    public static Table empty(List<String> columns) {
        return new Table(columns, List.of());
    }

    public static Builder builder(String... columns) {
        return new Builder(Arrays.asList(columns));
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String name) {
        return columns.contains(name);
    }

    public Map<String, Object> row(int index) {
        return rows.get(index);
    }

    public Object get(int row, String column) {
        requireColumn(column);
        return rows.get(row).get(column);
    }

    /**
     * Values of one column, top to bottom.
     */
    public List<Object> column(String name) {
        requireColumn(name);
        var values = new ArrayList<>(rows.size());
        for (var row : rows) {
            values.add(row.get(name));
        }
        return Collections.unmodifiableList(values);
    }

    private void requireColumn(String name) {
        if (!columns.contains(name)) {
            throw new IllegalArgumentException("Unknown column '" + name + "'; columns are " + columns);
        }
    }

    @Override
    public String toString() {
        return "Table" + columns + "[" + rows.size() + " rows]";
    }

    public static final class Builder {
        private final List<String> columns;
        private final List<Map<String, Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = new ArrayList<>(columns);
        }

        public Builder addRow(Object... values) {
            if (values.length != columns.size()) {
                throw new IllegalArgumentException("Expected " + columns.size() + " values but got " + values.length);
            }
            var row = new LinkedHashMap<String, Object>();
            for (int i = 0; i < values.length; i++) {
                row.put(columns.get(i), values[i]);
            }
            rows.add(row);
            return this;
        }

        public Builder addRow(Map<String, ?> row) {
            rows.add(new LinkedHashMap<>(row));
            return this;
        }

        public Table build() {
            return new Table(columns, rows);
        }
    }
}
