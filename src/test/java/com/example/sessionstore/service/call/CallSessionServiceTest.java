package com.example.sessionstore.service.call;

import com.example.sessionstore.model.SessionRequest;
import com.example.sessionstore.store.StoreClient;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CallSessionServiceTest {

    @Mock
    private StoreClient store;

    private CallSessionService callSessionService;

    @BeforeEach
    void setUp() {
        callSessionService = new CallSessionService(store);
        ReflectionTestUtils.setField(callSessionService, "terminationTimeout", 10000L);
    }

    @Test
    void testFindInRaw_WidensWindowByTimeout() {
        // Given
        SessionRequest req = SessionRequest.builder()
                .createdAt(100000L)
                .terminatedAt(200000L)
                .callId(List.of("call-1", "call-2"))
                .build();
        when(store.find(eq("sip_call_raw"), eq(90000L), eq(210000L), any(Criteria.class), any(Sort.class)))
                .thenReturn(List.of(new Document("call_id", "call-1")));

        // When
        List<Document> messages = callSessionService.findInRawBySessionRequest(req);

        // Then
        assertEquals(1, messages.size());

        ArgumentCaptor<Criteria> filter = ArgumentCaptor.forClass(Criteria.class);
        ArgumentCaptor<Sort> sort = ArgumentCaptor.forClass(Sort.class);
        verify(store).find(eq("sip_call_raw"), eq(90000L), eq(210000L), filter.capture(), sort.capture());

        Document criteria = filter.getValue().getCriteriaObject();
        Document createdAt = (Document) criteria.get("created_at");
        assertEquals(90000L, createdAt.get("$gte"));
        assertEquals(210000L, createdAt.get("$lte"));
        assertEquals(List.of("call-1", "call-2"), ((Document) criteria.get("call_id")).get("$in"));
        assertEquals(Sort.Direction.ASC, sort.getValue().getOrderFor("created_at").getDirection());
    }

    @Test
    void testFindInRaw_WindowSaturatesAtLongBounds() {
        SessionRequest req = SessionRequest.builder()
                .createdAt(Long.MIN_VALUE + 1)
                .terminatedAt(Long.MAX_VALUE - 1)
                .callId(List.of("call-1"))
                .build();
        when(store.find(eq("sip_call_raw"), anyLong(), anyLong(), any(Criteria.class), any(Sort.class)))
                .thenReturn(List.of());

        callSessionService.findInRawBySessionRequest(req);

        verify(store).find(eq("sip_call_raw"), eq(Long.MIN_VALUE), eq(Long.MAX_VALUE), any(Criteria.class), any(Sort.class));
    }

    @Test
    void testFindInRaw_MissingTerminatedAt() {
        SessionRequest req = SessionRequest.builder().createdAt(0L).callId(List.of("call-1")).build();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> callSessionService.findInRawBySessionRequest(req));

        assertEquals("terminated_at", e.getMessage());
        verifyNoInteractions(store);
    }
}
