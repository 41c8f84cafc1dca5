package com.storicard.warehouse.staging;

/**
 * Encodings a batch can be staged in.
 */
public enum StagingFormat {

    CSV(".csv"),
    JSON_LINES(".json");

    private final String extension;

    StagingFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
