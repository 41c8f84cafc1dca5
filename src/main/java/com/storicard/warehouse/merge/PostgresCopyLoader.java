package com.storicard.warehouse.merge;

import com.storicard.warehouse.exception.LoadFormatException;
import com.storicard.warehouse.staging.StagingLocator;
import com.storicard.warehouse.staging.StagingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.copy.CopyManager;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.storicard.warehouse.merge.SqlIdentifiers.columnList;

/**
 * Streams every staged object under the locator into the temp table with
 * {@code COPY ... FROM STDIN}, one COPY per object, on the merge transaction's connection.
 * Load options use PostgreSQL COPY syntax, e.g. {@code WITH (FORMAT csv, HEADER true)}.
 */
@Slf4j
@RequiredArgsConstructor
public class PostgresCopyLoader implements StagedDataLoader {

    private final StagingStore stagingStore;

    @Override
    public long load(JdbcOperations jdbc, String tempTable, List<String> columns, MergeDirective directive) {
        StagingLocator locator = StagingLocator.parse(directive.getStagedDataLocator());
        String sql = copyStatement(tempTable, columns, directive);

        List<String> keys;
        try (Stream<String> listed = stagingStore.listKeys(locator.getBucket(), locator.getPrefix())) {
            keys = listed.sorted().collect(Collectors.toList());
        }
        log.debug("Executing: {} for {} staged object(s)", sql, keys.size());

        Long loaded = jdbc.execute((ConnectionCallback<Long>) connection -> {
            CopyManager copyManager = connection.unwrap(PGConnection.class).getCopyAPI();
            long rows = 0;
            for (String key : keys) {
                try (InputStream in = stagingStore.open(locator.getBucket(), key)) {
                    rows += copyManager.copyIn(sql, in);
                } catch (IOException e) {
                    throw new LoadFormatException("Could not stream staged object "
                        + locator.objectUri(key) + " into " + tempTable, e);
                }
            }
            return rows;
        });
        return loaded == null ? -1 : loaded;
    }

    String copyStatement(String tempTable, List<String> columns, MergeDirective directive) {
        String sql = "COPY " + tempTable + " (" + columnList(columns) + ") FROM STDIN";
        if (StringUtils.hasText(directive.getLoadOptions())) {
            sql += " " + directive.getLoadOptions().trim();
        }
        return sql;
    }
}
