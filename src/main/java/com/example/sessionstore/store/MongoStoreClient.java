package com.example.sessionstore.store;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

@Component
public class MongoStoreClient implements StoreClient {

    private static final Logger logger = LoggerFactory.getLogger(MongoStoreClient.class);

    private final MongoTemplate mongo;
    private final DateTimeFormatter suffixFormat;

    @Autowired
    public MongoStoreClient(MongoTemplate mongo,
                            @Value("${app.store.partition-pattern:yyyyMMdd}") String partitionPattern) {
        this.mongo = mongo;
        this.suffixFormat = DateTimeFormatter.ofPattern(partitionPattern);
    }

    @Override
    public List<Document> find(String prefix, long from, long to, Criteria filter, Sort sort) {
        List<Document> out = new ArrayList<>();
        for (String collection : partitions(prefix, from, to)) {
            Query q = filter == null ? new Query() : new Query(filter);
            if (sort != null && sort.isSorted()) q.with(sort);
            List<Document> docs = mongo.find(q, Document.class, collection);
            logger.debug("Collection {}: {} documents", collection, docs.size());
            out.addAll(docs);
        }
        return out;
    }

    /**
     * Existing partitions of {@code prefix} whose day falls in the range, oldest first.
     * Collection names are listed once per call, so the cost does not grow with the range width.
     */
    @Override
    public List<String> partitions(String prefix, long from, long to) {
        if (to < from) return List.of();

        LocalDate first = LocalDate.ofInstant(Instant.ofEpochMilli(from), ZoneOffset.UTC);
        LocalDate last = LocalDate.ofInstant(Instant.ofEpochMilli(to), ZoneOffset.UTC);
        String head = prefix + "_";

        TreeMap<LocalDate, String> names = new TreeMap<>();
        for (String name : mongo.getCollectionNames()) {
            if (!name.startsWith(head)) continue;

            LocalDate day;
            try {
                day = LocalDate.parse(name.substring(head.length()), suffixFormat);
            } catch (DateTimeParseException e) {
                // e.g. rtpr_rtp_raw_backup
                logger.trace("Not a partition of {}: {}", prefix, name);
                continue;
            }
            if (!day.isBefore(first) && !day.isAfter(last)) {
                names.put(day, name);
            }
        }
        return new ArrayList<>(names.values());
    }
}
