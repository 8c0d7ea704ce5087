package com.example.sessionstore.service;

import com.example.sessionstore.model.SessionRequest;
import com.example.sessionstore.store.StoreClient;
import org.bson.Document;

import java.util.List;

public abstract class SessionService {

    protected final StoreClient store;

    protected SessionService(StoreClient store) {
        this.store = store;
    }

    public abstract List<Document> findInRawBySessionRequest(SessionRequest req);

    /**
     * Fails with the key of the first missing field as the message.
     */
    public static void requireFields(SessionRequest req) {
        if (req == null) throw new IllegalArgumentException("request");
        if (req.getCreatedAt() == null) throw new IllegalArgumentException("created_at");
        if (req.getTerminatedAt() == null) throw new IllegalArgumentException("terminated_at");
        if (req.getCallId() == null) throw new IllegalArgumentException("call_id");
    }

    /** {@code time + timeout}, saturating at {@code Long.MAX_VALUE}. */
    protected static long after(long time, long timeout) {
        return time > Long.MAX_VALUE - timeout ? Long.MAX_VALUE : time + timeout;
    }

    /** {@code time - timeout}, saturating at {@code Long.MIN_VALUE}. */
    protected static long before(long time, long timeout) {
        return time < Long.MIN_VALUE + timeout ? Long.MIN_VALUE : time - timeout;
    }
}
