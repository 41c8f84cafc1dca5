package com.storicard.warehouse.staging;

import com.storicard.warehouse.exception.StoreConnectionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.InputStream;
import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link StagingStore} backed by S3. Listing walks {@code ListObjectsV2} pages lazily, one
 * request per page as the stream is consumed.
 */
@Slf4j
@RequiredArgsConstructor
public class S3StagingStore implements StagingStore {

    private final S3Client s3Client;

    @Override
    public void put(String bucket, String key, byte[] content) {
        PutObjectRequest request = PutObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .build();
        call("put", bucket, key, () -> s3Client.putObject(request, RequestBody.fromBytes(content)));
        log.info("Staged {} bytes at s3://{}/{}", content.length, bucket, key);
    }

    @Override
    public Stream<String> listKeys(String bucket, String prefix) {
        ListObjectsV2Request.Builder request = ListObjectsV2Request.builder().bucket(bucket);
        if (prefix != null && !prefix.isEmpty()) {
            request.prefix(prefix);
        }
        Iterator<S3Object> objects = s3Client.listObjectsV2Paginator(request.build()).contents().iterator();
        Iterator<String> keys = new Iterator<>() {
            @Override
            public boolean hasNext() {
                return call("list", bucket, prefix, objects::hasNext);
            }

            @Override
            public String next() {
                return call("list", bucket, prefix, objects::next).key();
            }
        };
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(keys, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @Override
    public InputStream open(String bucket, String key) {
        GetObjectRequest request = GetObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .build();
        return call("get", bucket, key, () -> s3Client.getObject(request));
    }

    @Override
    public void delete(String bucket, String key) {
        DeleteObjectRequest request = DeleteObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .build();
        call("delete", bucket, key, () -> s3Client.deleteObject(request));
        log.debug("Deleted s3://{}/{}", bucket, key);
    }

    private static <T> T call(String operation, String bucket, String key, Supplier<T> action) {
        try {
            return action.get();
        } catch (SdkException e) {
            throw new StoreConnectionException(
                "S3 " + operation + " failed for s3://" + bucket + "/" + (key == null ? "" : key), e);
        }
    }
}
