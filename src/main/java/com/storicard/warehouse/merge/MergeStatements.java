package com.storicard.warehouse.merge;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.storicard.warehouse.merge.SqlIdentifiers.columnList;
import static com.storicard.warehouse.merge.SqlIdentifiers.qualify;
import static com.storicard.warehouse.merge.SqlIdentifiers.quote;

/**
 * SQL text for the steps of one upsert-merge. Built once per merge from a directive and the
 * staged batch's columns; every identifier goes through {@link SqlIdentifiers}.
 */
public class MergeStatements {

    private final MergeDirective directive;
    private final List<String> columns;
    private final String target;
    private final String temp;
    private final String key;

    public MergeStatements(MergeDirective directive, List<String> columns) {
        this.directive = directive;
        this.columns = List.copyOf(columns);
        this.target = qualify(directive.getSchema(), directive.getTable());
        this.temp = quote(directive.tempTable());
        this.key = quote(directive.getPrimaryKey());
    }

    public String tempTable() {
        return temp;
    }

    public String createTempTable() {
        return "CREATE TEMPORARY TABLE " + temp + " (LIKE " + target + ")";
    }

    /**
     * The update step, or empty when there is nothing to set besides the key.
     */
    public Optional<String> update() {
        List<String> nonKey = columns.stream()
            .filter(column -> !column.equals(directive.getPrimaryKey()))
            .collect(Collectors.toList());
        if (nonKey.isEmpty()) {
            return Optional.empty();
        }
        String assignments = nonKey.stream()
            .map(column -> quote(column) + " = t2." + quote(column))
            .collect(Collectors.joining(", "));
        return Optional.of("UPDATE " + target + " AS t1 SET " + assignments
            + " FROM " + temp + " AS t2"
            + " WHERE t1." + key + " = t2." + key);
    }

    public String insertMissing() {
        return "INSERT INTO " + target + " (" + columnList(columns) + ")"
            + " SELECT " + columnList(columns, "t2")
            + " FROM " + temp + " AS t2"
            + " LEFT JOIN " + target + " AS t1 ON t2." + key + " = t1." + key
            + " WHERE t1." + key + " IS NULL";
    }

    public String dropTempTable() {
        return "DROP TABLE IF EXISTS " + temp;
    }
}
