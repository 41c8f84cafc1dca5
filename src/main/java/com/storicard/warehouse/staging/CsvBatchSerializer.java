package com.storicard.warehouse.staging;

import com.storicard.warehouse.model.Batch;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * RFC 4180 CSV with {@code \n} record separators. Nulls and non-finite floating point values are
 * written as empty fields; decimals and floating point numbers never use exponent notation.
 */
public class CsvBatchSerializer implements BatchSerializer {

    private final boolean header;

    public CsvBatchSerializer(boolean header) {
        this.header = header;
    }

    @Override
    public byte[] serialize(Batch batch) {
        CSVFormat format = CSVFormat.RFC4180.builder()
            .setRecordSeparator('\n')
            .build();
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            if (header) {
                printer.printRecord(batch.columns());
            }
            for (List<Object> row : batch.rows()) {
                printer.printRecord(row.stream().map(CsvBatchSerializer::plain).toArray());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write CSV", e);
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static Object plain(Object value) {
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                return null;
            }
            return new BigDecimal(value.toString()).toPlainString();
        }
        return value;
    }
}
