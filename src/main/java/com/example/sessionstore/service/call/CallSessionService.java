package com.example.sessionstore.service.call;

import com.example.sessionstore.model.SessionRequest;
import com.example.sessionstore.service.SessionService;
import com.example.sessionstore.store.StoreClient;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class CallSessionService extends SessionService {

    private static final Logger logger = LoggerFactory.getLogger(CallSessionService.class);

    static final String SIP_CALL_RAW = "sip_call_raw";

    @Value("${session.call.termination-timeout:10000}")
    private long terminationTimeout = 10000;

    public CallSessionService(StoreClient store) {
        super(store);
    }

    /**
     * Raw SIP messages of the requested calls, widened by the termination timeout on both sides.
     */
    @Override
    public List<Document> findInRawBySessionRequest(SessionRequest req) {
        requireFields(req);

        long from = before(req.getCreatedAt(), terminationTimeout);
        long to = after(req.getTerminatedAt(), terminationTimeout);

        Criteria filter = Criteria.where("created_at").gte(from).lte(to)
                .and("call_id").in(req.getCallId());

        List<Document> messages = store.find(SIP_CALL_RAW, from, to, filter, Sort.by(Sort.Direction.ASC, "created_at"));
        logger.debug("Found {} raw SIP messages for call ids {}", messages.size(), req.getCallId());
        return messages;
    }
}
