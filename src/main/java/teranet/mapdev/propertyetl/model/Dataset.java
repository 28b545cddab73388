package teranet.mapdev.propertyetl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * In-memory tabular batch of listing records.
 *
 * Each row maps column name to value. A {@code null} value is a missing value;
 * rows that do not carry a declared column read as missing for that column.
 *
 * Instances are immutable: every operation that changes content returns a new
 * dataset and leaves this one untouched. Columns keep their declaration order
 * and rows keep their input order.
 */
public final class Dataset {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private Dataset(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = Collections.unmodifiableList(columns);
        this.rows = Collections.unmodifiableList(rows);
    }

    public static Dataset empty() {
        return new Dataset(new ArrayList<>(), new ArrayList<>());
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public List<String> getColumns() {
        return columns;
    }

    public int size() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * Read-only view of one row.
     */
    public Map<String, Object> getRow(int index) {
        return Collections.unmodifiableMap(rows.get(index));
    }

    public List<Map<String, Object>> getRows() {
        List<Map<String, Object>> views = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            views.add(Collections.unmodifiableMap(row));
        }
        return views;
    }

    public Object getValue(int rowIndex, String column) {
        return rows.get(rowIndex).get(column);
    }

    /**
     * Values of one column in row order, missing values included as {@code null}.
     */
    public List<Object> getColumnValues(String column) {
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    /**
     * Returns a copy where {@code column} holds the value computed for each row.
     * Existing columns are replaced in place; new columns are appended.
     */
    public Dataset withColumn(String column, Function<Map<String, Object>, Object> valueFunction) {
        List<String> newColumns = new ArrayList<>(columns);
        if (!newColumns.contains(column)) {
            newColumns.add(column);
        }

        List<Map<String, Object>> newRows = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> copy = new LinkedHashMap<>(row);
            copy.put(column, valueFunction.apply(Collections.unmodifiableMap(row)));
            newRows.add(copy);
        }
        return new Dataset(newColumns, newRows);
    }

    /**
     * Returns a copy holding only the rows at the given indexes, in the order given.
     */
    public Dataset selectRows(List<Integer> rowIndexes) {
        List<Map<String, Object>> selected = new ArrayList<>(rowIndexes.size());
        for (Integer index : rowIndexes) {
            selected.add(new LinkedHashMap<>(rows.get(index)));
        }
        return new Dataset(new ArrayList<>(columns), selected);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dataset)) {
            return false;
        }
        Dataset other = (Dataset) o;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Dataset{columns=" + columns + ", rows=" + rows.size() + "}";
    }

    /**
     * Accumulates rows for a new dataset. Unknown keys in an added row become
     * additional columns in first-seen order.
     */
    public static final class Builder {
        private final LinkedHashSet<String> columns;
        private final List<Map<String, Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = new LinkedHashSet<>(columns);
        }

        public Builder addRow(Map<String, Object> row) {
            columns.addAll(row.keySet());
            rows.add(new LinkedHashMap<>(row));
            return this;
        }

        public Builder addRow(List<Object> values) {
            List<String> names = new ArrayList<>(columns);
            if (values.size() > names.size()) {
                throw new IllegalArgumentException(
                        "Row has " + values.size() + " values but only " + names.size() + " columns are declared");
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < names.size(); i++) {
                row.put(names.get(i), i < values.size() ? values.get(i) : null);
            }
            rows.add(row);
            return this;
        }

        public Dataset build() {
            return new Dataset(new ArrayList<>(columns), new ArrayList<>(rows));
        }
    }
}
