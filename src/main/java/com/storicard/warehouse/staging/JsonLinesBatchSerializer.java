package com.storicard.warehouse.staging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storicard.warehouse.model.Batch;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * One JSON object per row, keyed by column name, separated by {@code \n}.
 */
public class JsonLinesBatchSerializer implements BatchSerializer {

    private final ObjectMapper objectMapper;

    public JsonLinesBatchSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] serialize(Batch batch) {
        StringBuilder lines = new StringBuilder();
        for (int i = 0; i < batch.rowCount(); i++) {
            try {
                lines.append(objectMapper.writeValueAsString(batch.record(i))).append('\n');
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("Could not encode row " + i + " as JSON", e);
            }
        }
        return lines.toString().getBytes(StandardCharsets.UTF_8);
    }
}
