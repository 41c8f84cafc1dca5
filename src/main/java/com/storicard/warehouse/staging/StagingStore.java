package com.storicard.warehouse.staging;

import java.io.InputStream;
import java.util.stream.Stream;

/**
 * Bulk object storage used to stage batches before they are loaded into the warehouse.
 */
public interface StagingStore {

    void put(String bucket, String key, byte[] content);

    /**
     * Keys under {@code prefix}, fetched lazily page by page. The stream must be closed; it cannot
     * resume mid-listing, so a retry lists again from the start.
     */
    Stream<String> listKeys(String bucket, String prefix);

    InputStream open(String bucket, String key);

    void delete(String bucket, String key);

    /**
     * Deletes every object under {@code prefix} as the listing proceeds.
     *
     * @return number of deleted objects
     */
    default int deleteAll(String bucket, String prefix) {
        int deleted = 0;
        try (Stream<String> keys = listKeys(bucket, prefix)) {
            for (String key : (Iterable<String>) keys::iterator) {
                delete(bucket, key);
                deleted++;
            }
        }
        return deleted;
    }
}
