package com.storicard.warehouse.merge;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.util.StringUtils;

import java.util.List;

import static com.storicard.warehouse.merge.SqlIdentifiers.columnList;
import static com.storicard.warehouse.merge.SqlIdentifiers.literal;

/**
 * Loads staged objects with Redshift's server-side COPY. Every object under the locator prefix
 * is read by the cluster, so the bucket prefix must hold only this dataset's files.
 */
@Slf4j
public class RedshiftCopyLoader implements StagedDataLoader {

    private static final String MASK = "'****'";

    private final String iamRole;
    private final String accessKeyId;
    private final String secretAccessKey;

    public RedshiftCopyLoader(String iamRole, String accessKeyId, String secretAccessKey) {
        if (!StringUtils.hasText(iamRole)
            && (!StringUtils.hasText(accessKeyId) || !StringUtils.hasText(secretAccessKey))) {
            throw new IllegalArgumentException(
                "Redshift COPY needs either an IAM role or an access key id and secret access key");
        }
        this.iamRole = iamRole;
        this.accessKeyId = accessKeyId;
        this.secretAccessKey = secretAccessKey;
    }

    @Override
    public long load(JdbcOperations jdbc, String tempTable, List<String> columns, MergeDirective directive) {
        log.debug("Executing: {}", copyStatement(tempTable, columns, directive, true));
        return jdbc.update(copyStatement(tempTable, columns, directive, false));
    }

    String copyStatement(String tempTable, List<String> columns, MergeDirective directive, boolean masked) {
        StringBuilder sql = new StringBuilder()
            .append("COPY ").append(tempTable)
            .append(" (").append(columnList(columns)).append(")")
            .append(" FROM ").append(literal(directive.getStagedDataLocator()));
        if (StringUtils.hasText(iamRole)) {
            sql.append(" IAM_ROLE ").append(masked ? MASK : literal(iamRole));
        } else {
            sql.append(" ACCESS_KEY_ID ").append(masked ? MASK : literal(accessKeyId))
                .append(" SECRET_ACCESS_KEY ").append(masked ? MASK : literal(secretAccessKey));
        }
        if (StringUtils.hasText(directive.getLoadOptions())) {
            sql.append(' ').append(directive.getLoadOptions().trim());
        }
        return sql.toString();
    }
}
