package com.storicard.warehouse.merge;

import com.storicard.warehouse.exception.LoadFormatException;
import com.storicard.warehouse.exception.MergeConstraintViolationException;
import com.storicard.warehouse.exception.WarehouseConnectionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.util.StringUtils;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Upsert-merges a staged batch into a warehouse table through a temp table:
 * <ol>
 *   <li>create a temp table shaped like the target</li>
 *   <li>bulk-load the staged batch into it, restricted to the batch's columns</li>
 *   <li>unless insert-only, update target rows whose key matches a temp row</li>
 *   <li>insert temp rows whose key is absent from the target (anti-join)</li>
 *   <li>drop the temp table</li>
 * </ol>
 *
 * All statements run on the caller's transaction; the engine neither commits, rolls back nor
 * retries. Nothing here locks the target table, so two merges racing on the same table can both
 * insert the same new key.
 */
@Slf4j
@RequiredArgsConstructor
public class MergeEngine {

    enum Step { CREATE_TEMP_TABLE, LOAD, UPDATE, INSERT, DROP_TEMP_TABLE }

    private final StagedDataLoader loader;

    public void merge(JdbcOperations jdbc, MergeDirective directive, List<String> batchColumns) {
        validate(directive, batchColumns);
        MergeStatements sql = new MergeStatements(directive, batchColumns);
        String target = directive.qualifiedTable();

        log.info("Merging {} into {} (key {}, insertOnly={})",
            directive.getStagedDataLocator(), target, directive.getPrimaryKey(), directive.isInsertOnly());

        execute(jdbc, Step.CREATE_TEMP_TABLE, target, sql.createTempTable());

        long loaded = run(Step.LOAD, target,
            () -> loader.load(jdbc, sql.tempTable(), batchColumns, directive));
        log.info("Loaded {} staged row(s) into {}", loaded < 0 ? "?" : loaded, directive.tempTable());

        if (directive.isInsertOnly()) {
            log.debug("Insert-only merge, skipping update of {}", target);
        } else {
            Optional<String> update = sql.update();
            if (update.isPresent()) {
                int updated = execute(jdbc, Step.UPDATE, target, update.get());
                log.info("Updated {} row(s) in {}", updated, target);
            } else {
                log.debug("Batch has no columns besides {}, skipping update", directive.getPrimaryKey());
            }
        }

        int inserted = execute(jdbc, Step.INSERT, target, sql.insertMissing());
        log.info("Inserted {} new row(s) into {}", inserted, target);

        execute(jdbc, Step.DROP_TEMP_TABLE, target, sql.dropTempTable());
    }

    private int execute(JdbcOperations jdbc, Step step, String target, String statement) {
        log.debug("Executing: {}", statement);
        return run(step, target, () -> jdbc.update(statement));
    }

    private <T> T run(Step step, String target, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw translate(step, target, e);
        }
    }

    static RuntimeException translate(Step step, String target, DataAccessException e) {
        if (e instanceof DataAccessResourceFailureException) {
            return new WarehouseConnectionException(
                "Lost warehouse connection during " + step + " of merge into " + target, e);
        }
        if (step == Step.LOAD) {
            return new LoadFormatException(
                "Staged data could not be loaded for merge into " + target + ": " + e.getMessage(), e);
        }
        if (step == Step.INSERT && e instanceof DataIntegrityViolationException) {
            return new MergeConstraintViolationException(
                "Insert into " + target + " violated a constraint: " + e.getMessage(), e);
        }
        return e;
    }

    static void validate(MergeDirective directive, List<String> batchColumns) {
        requireText(directive.getSchema(), "schema");
        requireText(directive.getTable(), "table");
        requireText(directive.getPrimaryKey(), "primary key");
        requireText(directive.getStagedDataLocator(), "staged data locator");
        if (batchColumns == null || batchColumns.isEmpty()) {
            throw new IllegalArgumentException("Batch for " + directive.qualifiedTable() + " has no columns");
        }
        Set<String> seen = new HashSet<>();
        for (String column : batchColumns) {
            if (!StringUtils.hasLength(column)) {
                throw new IllegalArgumentException("Batch for " + directive.qualifiedTable() + " has an empty column name");
            }
            if (!seen.add(column)) {
                throw new IllegalArgumentException("Duplicate batch column: " + column);
            }
        }
        if (!seen.contains(directive.getPrimaryKey())) {
            throw new IllegalArgumentException("Primary key " + directive.getPrimaryKey()
                + " is not among the batch columns " + batchColumns);
        }
    }

    private static void requireText(String value, String name) {
        if (!StringUtils.hasText(value)) {
            throw new IllegalArgumentException("Merge directive " + name + " must not be blank");
        }
    }
}
