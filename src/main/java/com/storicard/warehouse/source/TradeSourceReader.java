package com.storicard.warehouse.source;

import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoOperations;

import java.util.List;

/**
 * Fetches every trade document from the document store.
 */
@Slf4j
public class TradeSourceReader {

    private final MongoOperations mongoOperations;
    private final String collection;

    public TradeSourceReader(MongoOperations mongoOperations, String collection) {
        this.mongoOperations = mongoOperations;
        this.collection = collection;
    }

    public List<Document> read() {
        List<Document> documents = mongoOperations.findAll(Document.class, collection);
        log.info("Read {} document(s) from {}", documents.size(), collection);
        return documents;
    }
}
