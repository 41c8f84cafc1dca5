package com.storicard.warehouse.source;

import org.bson.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoOperations;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TradeSourceReader Unit Tests")
class TradeSourceReaderTest {

    @Mock
    private MongoOperations mongoOperations;

    @Test
    @DisplayName("Should read every document of the configured collection")
    void shouldReadCollection() {
        // Given
        List<Document> documents = List.of(new Document("data", List.of(new Document("id", "T-1"))));
        when(mongoOperations.findAll(Document.class, "trades")).thenReturn(documents);

        // When
        List<Document> read = new TradeSourceReader(mongoOperations, "trades").read();

        // Then
        assertThat(read).isEqualTo(documents);
    }
}
