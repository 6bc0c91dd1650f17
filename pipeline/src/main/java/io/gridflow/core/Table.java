package io.gridflow.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Ordered rows of column name to scalar value. Every row carries every column; a cell that was absent
 * in the input is stored as null. Instances are immutable.
 */
public final class Table {
    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private Table(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    /**
     * Concatenates tables in the given order. The result has the union of all columns in first-seen order.
     */
    public static Table concat(List<Table> parts) {
        Set<String> union = new LinkedHashSet<>();
        for (Table t : parts) union.addAll(t.columns);
        Builder b = builder(new ArrayList<>(union));
        for (Table t : parts) {
            for (Map<String, Object> row : t.rows) b.addRow(row);
        }
        return b.build();
    }

    public List<String> columns() { return columns; }
    public List<Map<String, Object>> rows() { return rows; }
    public int size() { return rows.size(); }
    public boolean isEmpty() { return rows.isEmpty(); }
    public boolean hasColumn(String column) { return columns.contains(column); }

    public Object get(int row, String column) {
        return rows.get(row).get(column);
    }

    /**
     * Renames every column through {@code renamer}. Two columns mapping to the same name is rejected.
     */
    public Table renameColumns(UnaryOperator<String> renamer) {
        Map<String, String> mapping = new LinkedHashMap<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String c : columns) {
            String renamed = Objects.requireNonNull(renamer.apply(c), "renamed column");
            if (!seen.add(renamed)) {
                throw new IllegalArgumentException("Duplicate column after rename: '" + renamed + "' (from '" + c + "')");
            }
            mapping.put(c, renamed);
        }
        Builder b = builder(new ArrayList<>(mapping.values()));
        for (Map<String, Object> row : rows) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : mapping.entrySet()) out.put(e.getValue(), row.get(e.getKey()));
            b.addRow(out);
        }
        return b.build();
    }

    /** Stable sort: rows comparing equal keep their relative order. */
    public Table sorted(Comparator<Map<String, Object>> order) {
        List<Map<String, Object>> copy = new ArrayList<>(rows);
        copy.sort(order);
        return new Table(columns, Collections.unmodifiableList(copy));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Table that)) return false;
        return columns.equals(that.columns) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Table{" +
                "columns=" + columns +
                ", rows=" + rows.size() +
                '}';
    }

    public static final class Builder {
        private final List<String> columns;
        private final List<Map<String, Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            Set<String> unique = new LinkedHashSet<>(columns);
            if (unique.size() != columns.size()) {
                throw new IllegalArgumentException("Duplicate column names: " + columns);
            }
            this.columns = List.copyOf(columns);
        }

        /** Adds a row; keys outside the column set are rejected and missing keys become null. */
        public Builder addRow(Map<String, ?> row) {
            for (String key : row.keySet()) {
                if (!columns.contains(key)) throw new IllegalArgumentException("Unknown column: '" + key + "'");
            }
            Map<String, Object> out = new LinkedHashMap<>();
            for (String c : columns) out.put(c, row.get(c));
            rows.add(Collections.unmodifiableMap(out));
            return this;
        }

        public Table build() {
            return new Table(columns, Collections.unmodifiableList(new ArrayList<>(rows)));
        }
    }
}
