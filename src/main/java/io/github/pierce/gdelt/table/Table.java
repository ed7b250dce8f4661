package io.github.pierce.gdelt.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntPredicate;
import java.util.function.UnaryOperator;

/**
 * Immutable in-memory table: an ordered list of unique column names and rows of
 * nullable cell values.
 *
 * <p>Every transform returns a new table; the receiver is never modified. Cells keep
 * whatever object the producer stored (usually {@code String}), so callers that compare
 * values across tables should go through {@link Values}.</p>
 */
public final class Table {

    private static final Table EMPTY = new Table(List.of(), List.of());

    private final List<String> columns;
    private final Map<String, Integer> index;
    private final List<Object[]> rows;

    private Table(List<String> columns, List<Object[]> rows) {
        this.columns = List.copyOf(columns);
        this.index = new HashMap<>();
        for (int i = 0; i < this.columns.size(); i++) {
            if (index.put(this.columns.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + this.columns.get(i));
            }
        }
        this.rows = rows;
    }

    public static Table empty() {
        return EMPTY;
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public static Builder builder(String... columns) {
        return new Builder(Arrays.asList(columns));
    }

    /**
     * Convenience factory, mostly for fixtures: every row must have one value per column.
     */
    public static Table of(List<String> columns, List<? extends List<?>> rows) {
        Builder builder = builder(columns);
        for (List<?> row : rows) {
            builder.addRow(row);
        }
        return builder.build();
    }

    public List<String> columns() {
        return columns;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return index.containsKey(column);
    }

    /**
     * Returns the position of a column, or -1 when the table does not have it.
     */
    public int indexOf(String column) {
        Integer position = index.get(column);
        return position == null ? -1 : position;
    }

    /**
     * Returns the subset of the given columns that this table does not have, in the given order.
     */
    public List<String> missingColumns(Collection<String> required) {
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!hasColumn(column)) {
                missing.add(column);
            }
        }
        return missing;
    }

    public Object get(int row, int column) {
        return rows.get(row)[column];
    }

    public Object get(int row, String column) {
        return rows.get(row)[requireColumn(column)];
    }

    public List<Object> row(int row) {
        return Collections.unmodifiableList(Arrays.asList(rows.get(row).clone()));
    }

    public List<Object> column(String column) {
        int position = requireColumn(column);
        List<Object> values = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            values.add(row[position]);
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Adds a column at the end, or replaces an existing column in place.
     */
    public Table withColumn(String name, List<?> values) {
        if (values.size() != rows.size()) {
            throw new IllegalArgumentException(String.format(
                    "Column '%s' has %d values but the table has %d rows", name, values.size(), rows.size()));
        }
        int existing = indexOf(name);
        List<String> newColumns = new ArrayList<>(columns);
        int target = existing;
        if (existing < 0) {
            newColumns.add(name);
            target = columns.size();
        }
        List<Object[]> newRows = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            Object[] copy = Arrays.copyOf(rows.get(r), newColumns.size());
            copy[target] = values.get(r);
            newRows.add(copy);
        }
        return new Table(newColumns, newRows);
    }

    /**
     * Inserts a constant-valued column in first position, replacing any column of the same name.
     */
    public Table withLeadingColumn(String name, Object constant) {
        Table base = hasColumn(name) ? dropColumns(List.of(name)) : this;
        List<String> newColumns = new ArrayList<>(base.columns.size() + 1);
        newColumns.add(name);
        newColumns.addAll(base.columns);
        List<Object[]> newRows = new ArrayList<>(base.rows.size());
        for (Object[] row : base.rows) {
            Object[] copy = new Object[row.length + 1];
            copy[0] = constant;
            System.arraycopy(row, 0, copy, 1, row.length);
            newRows.add(copy);
        }
        return new Table(newColumns, newRows);
    }

    /**
     * Removes the given columns; names the table does not have are ignored.
     */
    public Table dropColumns(Collection<String> toDrop) {
        Set<String> drop = new HashSet<>(toDrop);
        List<String> keep = new ArrayList<>();
        for (String column : columns) {
            if (!drop.contains(column)) {
                keep.add(column);
            }
        }
        if (keep.size() == columns.size()) {
            return this;
        }
        return select(keep);
    }

    public Table select(List<String> selected) {
        int[] positions = new int[selected.size()];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = requireColumn(selected.get(i));
        }
        List<Object[]> newRows = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            Object[] copy = new Object[positions.length];
            for (int i = 0; i < positions.length; i++) {
                copy[i] = row[positions[i]];
            }
            newRows.add(copy);
        }
        return new Table(selected, newRows);
    }

    public Table renameColumns(UnaryOperator<String> renamer) {
        List<String> renamed = new ArrayList<>(columns.size());
        for (String column : columns) {
            renamed.add(renamer.apply(column));
        }
        return new Table(renamed, rows);
    }

    /**
     * Keeps the rows whose index satisfies the predicate, preserving order.
     */
    public Table filterRows(IntPredicate keep) {
        List<Object[]> kept = new ArrayList<>();
        for (int r = 0; r < rows.size(); r++) {
            if (keep.test(r)) {
                kept.add(rows.get(r));
            }
        }
        return new Table(columns, kept);
    }

    /**
     * Stacks tables vertically. The result has the union of all columns in first-seen
     * order; cells of columns a table does not have are null.
     */
    public static Table concat(List<Table> tables) {
        if (tables.isEmpty()) {
            return EMPTY;
        }
        Set<String> union = new LinkedHashSet<>();
        int total = 0;
        for (Table table : tables) {
            union.addAll(table.columns);
            total += table.rowCount();
        }
        List<String> unionColumns = new ArrayList<>(union);
        Map<String, Integer> unionIndex = new HashMap<>();
        for (int i = 0; i < unionColumns.size(); i++) {
            unionIndex.put(unionColumns.get(i), i);
        }
        List<Object[]> newRows = new ArrayList<>(total);
        for (Table table : tables) {
            int[] mapping = new int[table.columns.size()];
            for (int i = 0; i < mapping.length; i++) {
                mapping[i] = unionIndex.get(table.columns.get(i));
            }
            for (Object[] row : table.rows) {
                Object[] copy = new Object[unionColumns.size()];
                for (int i = 0; i < mapping.length; i++) {
                    copy[mapping[i]] = row[i];
                }
                newRows.add(copy);
            }
        }
        return new Table(unionColumns, newRows);
    }

    private int requireColumn(String column) {
        Integer position = index.get(column);
        if (position == null) {
            throw new IllegalArgumentException("Unknown column '" + column + "', available: " + columns);
        }
        return position;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Table other)) return false;
        if (!columns.equals(other.columns) || rows.size() != other.rows.size()) {
            return false;
        }
        for (int r = 0; r < rows.size(); r++) {
            if (!Arrays.equals(rows.get(r), other.rows.get(r))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(columns, rows.size());
        for (Object[] row : rows) {
            result = 31 * result + Arrays.hashCode(row);
        }
        return result;
    }

    @Override
    public String toString() {
        return String.format("Table[rows=%d, columns=%s]", rows.size(), columns);
    }

    /**
     * Row-by-row builder; the built table takes ownership of the collected rows.
     */
    public static final class Builder {
        private final List<String> columns;
        private final List<Object[]> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = List.copyOf(columns);
        }

        public Builder addRow(Object... values) {
            if (values.length != columns.size()) {
                throw new IllegalArgumentException(String.format(
                        "Row has %d values but %d columns are declared", values.length, columns.size()));
            }
            rows.add(values.clone());
            return this;
        }

        public Builder addRow(List<?> values) {
            return addRow(values.toArray());
        }

        public int rowCount() {
            return rows.size();
        }

        public Table build() {
            return new Table(columns, new ArrayList<>(rows));
        }
    }
}
