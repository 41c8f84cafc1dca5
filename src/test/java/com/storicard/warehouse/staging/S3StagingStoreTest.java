package com.storicard.warehouse.staging;

import com.storicard.warehouse.exception.StoreConnectionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.paginators.ListObjectsV2Iterable;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("S3StagingStore Unit Tests")
class S3StagingStoreTest {

    @Mock
    private S3Client s3Client;

    private S3StagingStore store;

    @BeforeEach
    void setUp() {
        store = new S3StagingStore(s3Client);
    }

    @Test
    @DisplayName("Should upload staged content to the given bucket and key")
    void shouldPutObject() {
        // When
        store.put("storicard-trades", "trades_20240101T000000000Z.json", "{}\n".getBytes());

        // Then
        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(request.capture(), any(RequestBody.class));
        assertThat(request.getValue().bucket()).isEqualTo("storicard-trades");
        assertThat(request.getValue().key()).isEqualTo("trades_20240101T000000000Z.json");
    }

    @Test
    @DisplayName("Should list keys across every page under the prefix")
    void shouldListAllPages() {
        // Given
        stubListing();

        // When
        List<String> keys;
        try (Stream<String> listed = store.listKeys("bucket", "trades_")) {
            keys = listed.collect(Collectors.toList());
        }

        // Then
        assertThat(keys).containsExactly("trades_1.json", "trades_2.json", "trades_3.json");
        ArgumentCaptor<ListObjectsV2Request> requests = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(s3Client, times(2)).listObjectsV2(requests.capture());
        assertThat(requests.getAllValues()).allSatisfy(r -> assertThat(r.prefix()).isEqualTo("trades_"));
    }

    @Test
    @DisplayName("Should delete every listed object and report how many")
    void shouldDeleteAllUnderPrefix() {
        // Given
        stubListing();

        // When
        int deleted = store.deleteAll("bucket", "trades_");

        // Then
        assertThat(deleted).isEqualTo(3);
        ArgumentCaptor<DeleteObjectRequest> requests = ArgumentCaptor.forClass(DeleteObjectRequest.class);
        verify(s3Client, times(3)).deleteObject(requests.capture());
        assertThat(requests.getAllValues()).extracting(DeleteObjectRequest::key)
            .containsExactly("trades_1.json", "trades_2.json", "trades_3.json");
    }

    @Test
    @DisplayName("Should report unreachable storage as a store connection failure")
    void shouldTranslateClientFailureOnPut() {
        // Given
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
            .thenThrow(SdkClientException.create("Unable to execute HTTP request"));

        // When / Then
        assertThatThrownBy(() -> store.put("bucket", "key.csv", new byte[0]))
            .isInstanceOf(StoreConnectionException.class)
            .hasMessageContaining("s3://bucket/key.csv")
            .hasCauseInstanceOf(SdkClientException.class);
    }

    @Test
    @DisplayName("Should report S3 service errors as store failures")
    void shouldTranslateServiceErrors() {
        // Given
        S3Exception accessDenied = (S3Exception) S3Exception.builder()
            .message("Access Denied")
            .statusCode(403)
            .build();
        when(s3Client.getObject(any(GetObjectRequest.class))).thenThrow(accessDenied);
        when(s3Client.deleteObject(any(DeleteObjectRequest.class))).thenThrow(accessDenied);

        // When / Then
        assertThatThrownBy(() -> store.open("bucket", "trades_1.json"))
            .isInstanceOf(StoreConnectionException.class)
            .hasMessageContaining("s3://bucket/trades_1.json")
            .hasCause(accessDenied);
        assertThatThrownBy(() -> store.delete("bucket", "trades_1.json"))
            .isInstanceOf(StoreConnectionException.class)
            .hasCause(accessDenied);
    }

    @Test
    @DisplayName("Should translate failures raised while paging through a listing")
    void shouldTranslateClientFailureWhileListing() {
        // Given
        when(s3Client.listObjectsV2Paginator(any(ListObjectsV2Request.class)))
            .thenAnswer(invocation -> new ListObjectsV2Iterable(s3Client, invocation.getArgument(0)));
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class)))
            .thenThrow(SdkClientException.create("Connection reset"));

        // When / Then
        assertThatThrownBy(() -> store.deleteAll("bucket", "trades_"))
            .isInstanceOf(StoreConnectionException.class);
    }

    private void stubListing() {
        when(s3Client.listObjectsV2Paginator(any(ListObjectsV2Request.class)))
            .thenAnswer(invocation -> new ListObjectsV2Iterable(s3Client, invocation.getArgument(0)));
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenAnswer(invocation -> {
            ListObjectsV2Request request = invocation.getArgument(0);
            if (request.continuationToken() == null) {
                return ListObjectsV2Response.builder()
                    .contents(object("trades_1.json"), object("trades_2.json"))
                    .isTruncated(true)
                    .nextContinuationToken("page-2")
                    .build();
            }
            return ListObjectsV2Response.builder()
                .contents(object("trades_3.json"))
                .isTruncated(false)
                .build();
        });
    }

    private static S3Object object(String key) {
        return S3Object.builder().key(key).build();
    }
}
