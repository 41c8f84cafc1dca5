package com.storicard.warehouse.staging;

import com.storicard.warehouse.model.Batch;

/**
 * Encodes a batch into the bytes of one staged object.
 */
public interface BatchSerializer {

    byte[] serialize(Batch batch);
}
