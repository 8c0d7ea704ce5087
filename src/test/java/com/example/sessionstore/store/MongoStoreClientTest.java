package com.example.sessionstore.store;

import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoStoreClientTest {

    private static final long FROM = Instant.parse("2024-01-01T10:00:00Z").toEpochMilli();
    private static final long TO = Instant.parse("2024-01-03T01:00:00Z").toEpochMilli();

    @Mock
    private MongoTemplate mongo;

    private MongoStoreClient storeClient;

    @BeforeEach
    void setUp() {
        storeClient = new MongoStoreClient(mongo, "yyyyMMdd");
    }

    @Test
    void testPartitions_SkipsMissingDays() {
        when(mongo.getCollectionNames()).thenReturn(Set.of(
                "rtpr_rtp_raw_20240103", "rtpr_rtp_raw_20240101", "rtpr_rtp_raw_20231231",
                "rtpr_rtp_index_20240101", "rtpr_rtp_raw_backup", "hosts"));

        List<String> partitions = storeClient.partitions("rtpr_rtp_raw", FROM, TO);

        assertEquals(List.of("rtpr_rtp_raw_20240101", "rtpr_rtp_raw_20240103"), partitions);
    }

    @Test
    void testPartitions_WideRangeListsCollectionsOnce() {
        when(mongo.getCollectionNames()).thenReturn(Set.of("rtpr_rtp_raw_20240102"));

        List<String> partitions = storeClient.partitions("rtpr_rtp_raw", Long.MIN_VALUE, Long.MAX_VALUE);

        assertEquals(List.of("rtpr_rtp_raw_20240102"), partitions);
        verify(mongo, times(1)).getCollectionNames();
        verify(mongo, never()).collectionExists(anyString());
    }

    @Test
    void testPartitions_EmptyRange() {
        assertTrue(storeClient.partitions("rtpr_rtp_raw", TO, FROM).isEmpty());
        verifyNoInteractions(mongo);
    }

    @Test
    void testFind_ConcatenatesPartitionsInDayOrder() {
        // Given
        when(mongo.getCollectionNames()).thenReturn(Set.of(
                "sip_call_raw_20240101", "sip_call_raw_20240102", "sip_call_raw_20240103"));
        when(mongo.find(any(Query.class), eq(Document.class), eq("sip_call_raw_20240101")))
                .thenReturn(List.of(new Document("n", 1)));
        when(mongo.find(any(Query.class), eq(Document.class), eq("sip_call_raw_20240102")))
                .thenReturn(List.of(new Document("n", 2)));
        when(mongo.find(any(Query.class), eq(Document.class), eq("sip_call_raw_20240103")))
                .thenReturn(List.of(new Document("n", 3)));

        // When
        List<Document> docs = storeClient.find("sip_call_raw", FROM, TO,
                Criteria.where("call_id").in(List.of("call-1")), Sort.by(Sort.Direction.ASC, "created_at"));

        // Then
        assertEquals(3, docs.size());
        assertEquals(1, docs.get(0).get("n"));
        assertEquals(3, docs.get(2).get("n"));

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongo).find(query.capture(), eq(Document.class), eq("sip_call_raw_20240101"));
        assertTrue(query.getValue().getQueryObject().containsKey("call_id"));
        assertEquals(1, query.getValue().getSortObject().get("created_at"));
    }
}
