package com.storicard.warehouse.merge;

import com.storicard.warehouse.exception.MergeAbortedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;

/**
 * Runs one merge inside its own warehouse transaction. Success commits every step; any failure
 * rolls the whole merge back and surfaces as a {@link MergeAbortedException}.
 */
@Slf4j
public class WarehouseMergeService {

    private final JdbcOperations warehouseJdbc;
    private final TransactionOperations warehouseTransaction;
    private final MergeEngine mergeEngine;

    public WarehouseMergeService(JdbcOperations warehouseJdbc,
                                 TransactionOperations warehouseTransaction,
                                 MergeEngine mergeEngine) {
        this.warehouseJdbc = warehouseJdbc;
        this.warehouseTransaction = warehouseTransaction;
        this.mergeEngine = mergeEngine;
    }

    public void merge(MergeDirective directive, List<String> batchColumns) {
        try {
            warehouseTransaction.executeWithoutResult(
                status -> mergeEngine.merge(warehouseJdbc, directive, batchColumns));
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Merge into {} rolled back", directive.qualifiedTable(), e);
            throw new MergeAbortedException(directive.qualifiedTable(), e);
        }
        log.info("Merge into {} committed", directive.qualifiedTable());
    }
}
