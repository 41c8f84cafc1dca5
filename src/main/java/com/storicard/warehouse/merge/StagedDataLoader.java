package com.storicard.warehouse.merge;

import org.springframework.jdbc.core.JdbcOperations;

import java.util.List;

/**
 * Bulk-loads a staged batch into the merge's temp table.
 */
public interface StagedDataLoader {

    /**
     * Loads the data found at the directive's locator into {@code tempTable}, restricted to
     * {@code columns}. Runs on the caller's transactional connection.
     *
     * @param jdbc       operations bound to the merge transaction
     * @param tempTable  already quoted temp table name
     * @param columns    the staged batch's columns, unquoted
     * @param directive  the merge being performed
     * @return number of rows loaded, or -1 when the warehouse does not report it
     */
    long load(JdbcOperations jdbc, String tempTable, List<String> columns, MergeDirective directive);
}
