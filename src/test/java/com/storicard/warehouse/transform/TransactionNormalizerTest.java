package com.storicard.warehouse.transform;

import com.storicard.warehouse.model.Batch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TransactionNormalizer Unit Tests")
class TransactionNormalizerTest {

    private final TransactionNormalizer normalizer = new TransactionNormalizer();

    @Test
    @DisplayName("Should rename source columns and type dates and amounts")
    void shouldNormalizeSourceRow() {
        // Given
        Batch source = new Batch(
            List.of("Account No", "DATE", "TRANSACTION DETAILS", "CHIP USED", "VALUE DATE",
                " WITHDRAWAL AMT ", " DEPOSIT AMT ", "BALANCE AMT"),
            List.of(Arrays.asList("409000611074'", "29-Jun-17", "TRF FROM  Indiaforensic SERVICES", null,
                "29-Jun-17", " ", " 1,000,000.00 ", "1,000,000.00")));

        // When
        Batch normalized = normalizer.normalize(source);

        // Then
        assertThat(normalized.columns()).containsExactly("account_no", "date", "transaction_details",
            "chip_used", "value_date", "withdrawal_amt", "deposit_amt", "balance_amt");
        assertThat(normalized.record(0))
            .containsEntry("account_no", "409000611074'")
            .containsEntry("date", LocalDate.of(2017, 6, 29))
            .containsEntry("value_date", LocalDate.of(2017, 6, 29))
            .containsEntry("withdrawal_amt", null)
            .containsEntry("deposit_amt", new BigDecimal("1000000.00"))
            .containsEntry("balance_amt", new BigDecimal("1000000.00"));
    }

    @Test
    @DisplayName("Should keep columns it does not know about")
    void shouldKeepUnknownColumns() {
        Batch source = new Batch(List.of("Account No", "branch"), List.of(Arrays.asList("1'", "Mumbai")));

        assertThat(normalizer.normalize(source).columns()).containsExactly("account_no", "branch");
    }

    @Test
    @DisplayName("Should convert amount text and numbers to decimals")
    void shouldConvertAmounts() {
        assertThat(TransactionNormalizer.toAmount(" 2,500.75 ")).isEqualByComparingTo("2500.75");
        assertThat(TransactionNormalizer.toAmount(42)).isEqualByComparingTo("42");
        assertThat(TransactionNormalizer.toAmount("nan")).isNull();
        assertThat(TransactionNormalizer.toAmount(null)).isNull();
    }

    @Test
    @DisplayName("Should treat non-finite floating point amounts as missing")
    void shouldMapNonFiniteDoublesToNull() {
        assertThat(TransactionNormalizer.toAmount(Double.NaN)).isNull();
        assertThat(TransactionNormalizer.toAmount(Double.POSITIVE_INFINITY)).isNull();
        assertThat(TransactionNormalizer.toAmount(Float.NaN)).isNull();
        assertThat(TransactionNormalizer.toAmount(1234.5d)).isEqualByComparingTo("1234.5");
    }

    @Test
    @DisplayName("Should name the column holding a value that is not an amount")
    void shouldRejectNonNumericAmount() {
        Batch source = new Batch(List.of("BALANCE AMT"), List.of(Arrays.asList("abc")));

        assertThatThrownBy(() -> normalizer.normalize(source))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("balance_amt");
    }

    @Test
    @DisplayName("Should name the column holding a value that is not a date")
    void shouldRejectInvalidDate() {
        Batch source = new Batch(List.of("DATE"), List.of(Arrays.asList("someday")));

        assertThatThrownBy(() -> normalizer.normalize(source))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("date");
    }
}
