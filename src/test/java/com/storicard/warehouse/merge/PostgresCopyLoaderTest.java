package com.storicard.warehouse.merge;

import com.storicard.warehouse.exception.StoreConnectionException;
import com.storicard.warehouse.staging.StagingStore;
import com.storicard.warehouse.support.InMemoryStagingStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.postgresql.PGConnection;
import org.postgresql.copy.CopyManager;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcOperations;

import java.io.InputStream;
import java.sql.Connection;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("PostgresCopyLoader Unit Tests")
class PostgresCopyLoaderTest {

    private static final String BUCKET = "warehouse-staging";
    private static final List<String> COLUMNS = List.of("id", "val");

    private final MergeDirective directive = MergeDirective.builder()
        .schema("public")
        .table("items")
        .primaryKey("id")
        .stagedDataLocator("s3://" + BUCKET + "/items_")
        .loadOptions(" WITH (FORMAT csv, HEADER true) ")
        .build();

    @Test
    @DisplayName("Should copy from STDIN into the quoted column list with trimmed options")
    void shouldBuildCopyFromStdin() {
        PostgresCopyLoader loader = new PostgresCopyLoader(new InMemoryStagingStore());

        assertThat(loader.copyStatement("\"items_temp\"", List.of("id", "Val X"), directive))
            .isEqualTo("COPY \"items_temp\" (\"id\", \"Val X\") FROM STDIN WITH (FORMAT csv, HEADER true)");
    }

    @Test
    @DisplayName("Should omit options when none are given")
    void shouldOmitBlankOptions() {
        PostgresCopyLoader loader = new PostgresCopyLoader(new InMemoryStagingStore());
        MergeDirective plain = directive.toBuilder().loadOptions("").build();

        assertThat(loader.copyStatement("\"items_temp\"", List.of("id"), plain))
            .isEqualTo("COPY \"items_temp\" (\"id\") FROM STDIN");
    }

    @Test
    @DisplayName("Should stream every staged object under the prefix in key order and sum the rows")
    void shouldCopyEveryObjectInKeyOrder() throws Exception {
        // Given
        InMemoryStagingStore stagingStore = spy(new InMemoryStagingStore());
        stagingStore.put(BUCKET, "items_2.csv", "id,val\n3,c\n");
        stagingStore.put(BUCKET, "items_1.csv", "id,val\n1,a\n2,b\n");
        stagingStore.put(BUCKET, "other_1.csv", "id,val\n9,z\n");
        PostgresCopyLoader loader = new PostgresCopyLoader(stagingStore);
        String sql = loader.copyStatement("\"items_temp\"", COLUMNS, directive);
        CopyManager copyManager = mock(CopyManager.class);
        when(copyManager.copyIn(eq(sql), any(InputStream.class))).thenReturn(2L, 1L);

        // When
        long loaded = loader.load(jdbcOver(copyManager), "\"items_temp\"", COLUMNS, directive);

        // Then
        assertThat(loaded).isEqualTo(3);
        InOrder order = inOrder(stagingStore);
        order.verify(stagingStore).open(BUCKET, "items_1.csv");
        order.verify(stagingStore).open(BUCKET, "items_2.csv");
        verify(stagingStore, never()).open(BUCKET, "other_1.csv");
    }

    @Test
    @DisplayName("Should surface an unreachable object store while streaming")
    void shouldPropagateStoreFailure() throws Exception {
        // Given
        StagingStore stagingStore = mock(StagingStore.class);
        StoreConnectionException unreachable = new StoreConnectionException(
            "S3 get failed for s3://" + BUCKET + "/items_1.csv", new RuntimeException("connection reset"));
        when(stagingStore.listKeys(BUCKET, "items_")).thenReturn(Stream.of("items_1.csv"));
        when(stagingStore.open(BUCKET, "items_1.csv")).thenThrow(unreachable);
        PostgresCopyLoader loader = new PostgresCopyLoader(stagingStore);

        // When / Then
        assertThatThrownBy(() -> loader.load(jdbcOver(mock(CopyManager.class)), "\"items_temp\"", COLUMNS, directive))
            .isSameAs(unreachable);
    }

    private static JdbcOperations jdbcOver(CopyManager copyManager) throws Exception {
        PGConnection pgConnection = mock(PGConnection.class);
        when(pgConnection.getCopyAPI()).thenReturn(copyManager);
        Connection connection = mock(Connection.class);
        when(connection.unwrap(PGConnection.class)).thenReturn(pgConnection);
        JdbcOperations jdbc = mock(JdbcOperations.class);
        when(jdbc.execute(any(ConnectionCallback.class))).thenAnswer(invocation -> {
            ConnectionCallback<?> callback = invocation.getArgument(0);
            return callback.doInConnection(connection);
        });
        return jdbc;
    }
}
