package com.storicard.warehouse.transform;

import com.storicard.warehouse.model.Batch;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns trade documents into rows. Every element of a document's {@code data} array is one trade;
 * nested objects are flattened into {@code parent.child} columns and arrays are kept whole.
 */
@Slf4j
public class TradeDocumentFlattener {

    static final String DATA_FIELD = "data";
    static final String SEPARATOR = ".";

    public Batch flatten(List<Document> documents) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (Document document : documents) {
            Object data = document.get(DATA_FIELD);
            if (!(data instanceof List)) {
                log.warn("Trade document {} has no {} array, skipping", document.get("_id"), DATA_FIELD);
                continue;
            }
            for (Object trade : (List<?>) data) {
                if (!(trade instanceof Map)) {
                    log.warn("Skipping non-object trade entry in document {}", document.get("_id"));
                    continue;
                }
                Map<String, Object> record = new LinkedHashMap<>();
                flattenInto(record, null, (Map<?, ?>) trade);
                records.add(record);
            }
        }
        log.debug("Flattened {} document(s) into {} trade row(s)", documents.size(), records.size());
        return Batch.fromRecords(records);
    }

    private static void flattenInto(Map<String, Object> record, String prefix, Map<?, ?> object) {
        for (Map.Entry<?, ?> entry : object.entrySet()) {
            String name = prefix == null ? String.valueOf(entry.getKey()) : prefix + SEPARATOR + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map && !((Map<?, ?>) value).isEmpty()) {
                flattenInto(record, name, (Map<?, ?>) value);
            } else {
                record.put(name, plain(value));
            }
        }
    }

    /**
     * BSON-specific values become JSON-friendly ones; containers are converted recursively.
     */
    static Object plain(Object value) {
        if (value instanceof ObjectId) {
            return ((ObjectId) value).toHexString();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant().toString();
        }
        if (value instanceof Decimal128) {
            return ((Decimal128) value).bigDecimalValue();
        }
        if (value instanceof Map) {
            Map<String, Object> converted = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> converted.put(String.valueOf(k), plain(v)));
            return converted;
        }
        if (value instanceof List) {
            List<Object> converted = new ArrayList<>();
            for (Object element : (List<?>) value) {
                converted.add(plain(element));
            }
            return converted;
        }
        return value;
    }
}
