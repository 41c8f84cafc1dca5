package com.storicard.warehouse.merge;

/**
 * How staged data reaches the warehouse.
 */
public enum LoadMode {

    /** Server-side {@code COPY ... FROM 's3://...'}; the warehouse reads the bucket itself. */
    REDSHIFT,

    /** Client-side {@code COPY ... FROM STDIN}; objects are streamed from the staging store. */
    POSTGRES
}
