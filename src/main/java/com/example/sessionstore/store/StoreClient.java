package com.example.sessionstore.store;

import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.query.Criteria;

import java.util.List;

public interface StoreClient {

    /**
     * Finds documents in every daily partition of {@code prefix} that overlaps [from, to].
     * Partitions are read in day order, so a start time sort stays global.
     */
    List<Document> find(String prefix, long from, long to, Criteria filter, Sort sort);

    List<String> partitions(String prefix, long from, long to);
}
