package com.storicard.warehouse.source;

import com.storicard.warehouse.merge.SqlIdentifiers;
import com.storicard.warehouse.model.Batch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.support.JdbcUtils;

import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the whole source transactions table into a {@link Batch}, keeping the source's column
 * names and order.
 */
@Slf4j
public class TransactionSourceReader {

    private final JdbcOperations sourceJdbc;
    private final String schema;
    private final String table;

    public TransactionSourceReader(JdbcOperations sourceJdbc, String schema, String table) {
        this.sourceJdbc = sourceJdbc;
        this.schema = schema;
        this.table = table;
    }

    public Batch read() {
        String sql = "SELECT * FROM " + SqlIdentifiers.qualify(schema, table);
        log.debug("Executing: {}", sql);
        Batch batch = sourceJdbc.query(sql, toBatch());
        log.info("Read {} row(s) from {}.{}", batch.rowCount(), schema, table);
        return batch;
    }

    private static ResultSetExtractor<Batch> toBatch() {
        return rs -> {
            ResultSetMetaData metaData = rs.getMetaData();
            int width = metaData.getColumnCount();
            List<String> columns = new ArrayList<>(width);
            for (int i = 1; i <= width; i++) {
                columns.add(JdbcUtils.lookupColumnName(metaData, i));
            }
            List<List<Object>> rows = new ArrayList<>();
            while (rs.next()) {
                List<Object> row = new ArrayList<>(width);
                for (int i = 1; i <= width; i++) {
                    row.add(JdbcUtils.getResultSetValue(rs, i));
                }
                rows.add(row);
            }
            return new Batch(columns, rows);
        };
    }
}
