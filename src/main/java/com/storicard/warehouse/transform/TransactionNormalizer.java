package com.storicard.warehouse.transform;

import com.storicard.warehouse.model.Batch;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Brings source transaction rows into the warehouse shape: snake_case column names, typed dates
 * and decimal amounts.
 */
public class TransactionNormalizer {

    static final Map<String, String> COLUMN_RENAMES = columnRenames();

    static final List<String> DATE_COLUMNS = List.of("date", "value_date");

    static final List<String> AMOUNT_COLUMNS = List.of("withdrawal_amt", "deposit_amt", "balance_amt");

    public Batch normalize(Batch source) {
        Batch batch = source.renameColumns(COLUMN_RENAMES);
        for (String column : DATE_COLUMNS) {
            batch = batch.mapColumn(column, value -> parse(column, value, FlexibleDateParsers::toLocalDate));
        }
        for (String column : AMOUNT_COLUMNS) {
            batch = batch.mapColumn(column, value -> parse(column, value, TransactionNormalizer::toAmount));
        }
        return batch;
    }

    /**
     * Amounts arrive as text like {@code " 1,000.00 "}. Blank, {@code nan} and non-finite numbers mean no amount.
     */
    static BigDecimal toAmount(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                return null;
            }
            return new BigDecimal(value.toString());
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        String text = value.toString().trim().replace(",", "");
        if (text.isEmpty() || text.equalsIgnoreCase("nan") || text.equalsIgnoreCase("null")) {
            return null;
        }
        return new BigDecimal(text);
    }

    private static <T> T parse(String column, Object value, Function<Object, T> parser) {
        try {
            return parser.apply(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Column " + column + " has a non-numeric value: " + value, e);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Column " + column + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, String> columnRenames() {
        Map<String, String> renames = new LinkedHashMap<>();
        renames.put("Account No", "account_no");
        renames.put("DATE", "date");
        renames.put("TRANSACTION DETAILS", "transaction_details");
        renames.put("CHIP USED", "chip_used");
        renames.put("VALUE DATE", "value_date");
        renames.put(" WITHDRAWAL AMT ", "withdrawal_amt");
        renames.put(" DEPOSIT AMT ", "deposit_amt");
        renames.put("BALANCE AMT", "balance_amt");
        return Map.copyOf(renames);
    }
}
