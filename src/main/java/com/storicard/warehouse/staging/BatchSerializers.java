package com.storicard.warehouse.staging;

import com.fasterxml.jackson.databind.ObjectMapper;

public final class BatchSerializers {

    private BatchSerializers() {
    }

    public static BatchSerializer forFormat(StagingFormat format, boolean csvHeader, ObjectMapper objectMapper) {
        if (format == StagingFormat.JSON_LINES) {
            return new JsonLinesBatchSerializer(objectMapper);
        }
        return new CsvBatchSerializer(csvHeader);
    }
}
