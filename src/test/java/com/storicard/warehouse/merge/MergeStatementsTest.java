package com.storicard.warehouse.merge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MergeStatements Unit Tests")
class MergeStatementsTest {

    private final MergeDirective directive = MergeDirective.builder()
        .schema("public")
        .table("trades")
        .primaryKey("id")
        .stagedDataLocator("s3://storicard-trades/trades_")
        .loadOptions("JSON AS 'auto'")
        .build();

    @Test
    @DisplayName("Should create the temp table like the schema-qualified target")
    void shouldCreateTempTableLikeTarget() {
        MergeStatements sql = new MergeStatements(directive, List.of("id", "price"));

        assertThat(sql.tempTable()).isEqualTo("\"trades_temp\"");
        assertThat(sql.createTempTable())
            .isEqualTo("CREATE TEMPORARY TABLE \"trades_temp\" (LIKE \"public\".\"trades\")");
    }

    @Test
    @DisplayName("Should update only non-key columns, joined on the primary key")
    void shouldUpdateNonKeyColumns() {
        MergeStatements sql = new MergeStatements(directive, List.of("id", "price", "side"));

        assertThat(sql.update()).contains(
            "UPDATE \"public\".\"trades\" AS t1 SET \"price\" = t2.\"price\", \"side\" = t2.\"side\""
                + " FROM \"trades_temp\" AS t2 WHERE t1.\"id\" = t2.\"id\"");
    }

    @Test
    @DisplayName("Should have no update when the batch holds only the key")
    void shouldSkipUpdateForKeyOnlyBatch() {
        MergeStatements sql = new MergeStatements(directive, List.of("id"));

        assertThat(sql.update()).isEmpty();
    }

    @Test
    @DisplayName("Should insert batch columns of temp rows whose key is missing from the target")
    void shouldInsertWithAntiJoin() {
        MergeStatements sql = new MergeStatements(directive, List.of("id", "price"));

        assertThat(sql.insertMissing()).isEqualTo(
            "INSERT INTO \"public\".\"trades\" (\"id\", \"price\")"
                + " SELECT t2.\"id\", t2.\"price\" FROM \"trades_temp\" AS t2"
                + " LEFT JOIN \"public\".\"trades\" AS t1 ON t2.\"id\" = t1.\"id\""
                + " WHERE t1.\"id\" IS NULL");
    }

    @Test
    @DisplayName("Should quote awkward column names the same way in every statement")
    void shouldQuoteAwkwardColumnsConsistently() {
        MergeStatements sql = new MergeStatements(directive, List.of("id", "price.amount", "Side \"B\""));

        assertThat(sql.update()).hasValueSatisfying(update -> assertThat(update)
            .contains("\"price.amount\" = t2.\"price.amount\"")
            .contains("\"Side \"\"B\"\"\" = t2.\"Side \"\"B\"\"\""));
        assertThat(sql.insertMissing())
            .contains("(\"id\", \"price.amount\", \"Side \"\"B\"\"\")")
            .contains("SELECT t2.\"id\", t2.\"price.amount\", t2.\"Side \"\"B\"\"\"");
    }

    @Test
    @DisplayName("Should drop the temp table")
    void shouldDropTempTable() {
        assertThat(new MergeStatements(directive, List.of("id")).dropTempTable())
            .isEqualTo("DROP TABLE IF EXISTS \"trades_temp\"");
    }
}
