package com.storicard.warehouse.merge;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Quoting for identifiers and string literals embedded in generated SQL.
 * Identifiers are always double-quoted so names with spaces, dots or mixed case survive as-is.
 */
public final class SqlIdentifiers {

    private SqlIdentifiers() {
    }

    public static String quote(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier must not be empty");
        }
        if (identifier.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Identifier contains a NUL character");
        }
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    public static String qualify(String schema, String table) {
        return quote(schema) + "." + quote(table);
    }

    /**
     * Quoted, comma separated column list, each optionally prefixed by a table alias.
     */
    public static String columnList(List<String> columns, String alias) {
        String prefix = alias == null ? "" : alias + ".";
        return columns.stream()
            .map(column -> prefix + quote(column))
            .collect(Collectors.joining(", "));
    }

    public static String columnList(List<String> columns) {
        return columnList(columns, null);
    }

    public static String literal(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
