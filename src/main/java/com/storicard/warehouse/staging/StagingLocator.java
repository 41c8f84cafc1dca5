package com.storicard.warehouse.staging;

import lombok.Value;

/**
 * An {@code s3://bucket[/prefix]} location of staged data.
 */
@Value
public class StagingLocator {

    private static final String SCHEME = "s3://";

    String bucket;
    String prefix;

    public static StagingLocator of(String bucket, String prefix) {
        if (bucket == null || bucket.isBlank() || bucket.contains("/")) {
            throw new IllegalArgumentException("Invalid staging bucket: " + bucket);
        }
        return new StagingLocator(bucket, prefix == null ? "" : prefix);
    }

    public static StagingLocator parse(String locator) {
        if (locator == null || !locator.startsWith(SCHEME)) {
            throw new IllegalArgumentException("Staging locator must start with " + SCHEME + ": " + locator);
        }
        String path = locator.substring(SCHEME.length());
        int slash = path.indexOf('/');
        if (slash < 0) {
            return of(path, "");
        }
        return of(path.substring(0, slash), path.substring(slash + 1));
    }

    public String objectUri(String key) {
        return SCHEME + bucket + "/" + key;
    }

    @Override
    public String toString() {
        return prefix.isEmpty() ? SCHEME + bucket : SCHEME + bucket + "/" + prefix;
    }
}
