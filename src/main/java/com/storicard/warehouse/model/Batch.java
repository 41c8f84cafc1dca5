package com.storicard.warehouse.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * An in-memory tabular extraction: ordered, uniquely named columns and rows of equal width.
 * Instances are immutable; transformations return new batches.
 */
@EqualsAndHashCode
@ToString
public final class Batch {

    private final List<String> columns;
    private final List<List<Object>> rows;

    public Batch(List<String> columns, List<List<Object>> rows) {
        Set<String> seen = new HashSet<>();
        for (String column : columns) {
            if (column == null) {
                throw new IllegalArgumentException("Column names must not be null");
            }
            if (!seen.add(column)) {
                throw new IllegalArgumentException("Duplicate column name: " + column);
            }
        }
        List<List<Object>> copied = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<Object> row = rows.get(i);
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException("Row " + i + " has " + row.size()
                    + " values but the batch has " + columns.size() + " columns");
            }
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.columns = List.copyOf(columns);
        this.rows = Collections.unmodifiableList(copied);
    }

    public static Batch empty() {
        return new Batch(List.of(), List.of());
    }

    /**
     * Builds a batch from row maps. The column set is the union of all keys in first-seen order;
     * keys missing from a row become null.
     */
    public static Batch fromRecords(List<? extends Map<String, ?>> records) {
        Set<String> columnSet = new LinkedHashSet<>();
        for (Map<String, ?> record : records) {
            columnSet.addAll(record.keySet());
        }
        List<String> columns = new ArrayList<>(columnSet);
        List<List<Object>> rows = new ArrayList<>(records.size());
        for (Map<String, ?> record : records) {
            List<Object> row = new ArrayList<>(columns.size());
            for (String column : columns) {
                row.add(record.get(column));
            }
            rows.add(row);
        }
        return new Batch(columns, rows);
    }

    public List<String> columns() {
        return columns;
    }

    public List<List<Object>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean hasColumns() {
        return !columns.isEmpty();
    }

    public int indexOf(String column) {
        return columns.indexOf(column);
    }

    /**
     * Renames columns present in the mapping; other columns keep their names.
     */
    public Batch renameColumns(Map<String, String> renames) {
        List<String> renamed = new ArrayList<>(columns.size());
        for (String column : columns) {
            renamed.add(renames.getOrDefault(column, column));
        }
        return new Batch(renamed, rows);
    }

    /**
     * Applies {@code mapper} to every value of {@code column}. Absent columns are ignored.
     */
    public Batch mapColumn(String column, Function<Object, Object> mapper) {
        int index = indexOf(column);
        if (index < 0) {
            return this;
        }
        List<List<Object>> mapped = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> copy = new ArrayList<>(row);
            copy.set(index, mapper.apply(row.get(index)));
            mapped.add(copy);
        }
        return new Batch(columns, mapped);
    }

    public Map<String, Object> record(int rowIndex) {
        List<Object> row = rows.get(rowIndex);
        Map<String, Object> record = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            record.put(columns.get(i), row.get(i));
        }
        return record;
    }
}
