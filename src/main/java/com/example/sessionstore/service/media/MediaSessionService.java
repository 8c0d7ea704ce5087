package com.example.sessionstore.service.media;

import com.example.sessionstore.model.LegSession;
import com.example.sessionstore.model.MediaSession;
import com.example.sessionstore.model.MediaStatistic;
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

import java.util.*;
import java.util.stream.Collectors;

import static com.example.sessionstore.service.media.ReportFields.CALL_ID;
import static com.example.sessionstore.service.media.ReportFields.STARTED_AT;

@Service
public class MediaSessionService extends SessionService {

    private static final Logger logger = LoggerFactory.getLogger(MediaSessionService.class);

    public static final String RTP = "rtp";
    public static final String RTCP = "rtcp";

    private final BlockAggregator aggregator;

    @Value("${session.media.block-count:28}")
    private int blockCount = 28;

    @Value("${session.media.termination-timeout:60000}")
    private long terminationTimeout = 60000;

    public MediaSessionService(StoreClient store, BlockAggregator aggregator) {
        super(store);
        this.aggregator = aggregator;
    }

    /**
     * One entry per leg id seen in either stream: {@code {"rtp": leg|null, "rtcp": leg|null}}.
     */
    public List<Map<String, LegSession>> details(SessionRequest req) {
        requireFields(req);

        Map<String, LegSession> rtp = findLegSessions(RTP, req.getCreatedAt(), req.getTerminatedAt(), req.getCallId());
        Map<String, LegSession> rtcp = findLegSessions(RTCP, req.getCreatedAt(), req.getTerminatedAt(), req.getCallId());

        Set<String> legIds = new LinkedHashSet<>(rtp.keySet());
        legIds.addAll(rtcp.keySet());

        List<Map<String, LegSession>> result = new ArrayList<>(legIds.size());
        for (String legId : legIds) {
            Map<String, LegSession> entry = new LinkedHashMap<>();
            entry.put(RTP, rtp.get(legId));
            entry.put(RTCP, rtcp.get(legId));
            result.add(entry);
        }
        logger.debug("Media details for {}: {} legs", req.getCallId(), result.size());
        return result;
    }

    /**
     * Raw RTP reports followed by raw RTCP reports of the requested calls.
     */
    @Override
    public List<Document> findInRawBySessionRequest(SessionRequest req) {
        requireFields(req);

        List<Document> reports = new ArrayList<>();
        reports.addAll(find(rawCollection(RTP), req.getCreatedAt(), req.getTerminatedAt(), req.getCallId()));
        reports.addAll(find(rawCollection(RTCP), req.getCreatedAt(), req.getTerminatedAt(), req.getCallId()));
        return reports;
    }

    Map<String, LegSession> findLegSessions(String stream, long createdAt, long terminatedAt, List<String> callId) {
        Map<String, List<Document>> indexByLeg = find(indexCollection(stream), createdAt, terminatedAt, callId).stream()
                .collect(Collectors.groupingBy(LegSessions::generateLegId, LinkedHashMap::new, Collectors.toList()));

        Map<String, LegSession> sessions = new LinkedHashMap<>();
        indexByLeg.forEach((legId, documents) -> sessions.put(legId, LegSessions.createLegSession(documents, blockCount)));

        // Raw reports of one call often cover several legs
        List<Document> reports = new ArrayList<>();
        Set<Object> seen = new HashSet<>();

        sessions.forEach((legId, legSession) -> {
            List<Document> legReports = filterByLeg(reports, legId);

            if (legReports.isEmpty()) {
                for (Document report : find(rawCollection(stream), legSession.getCreatedAt(), legSession.getTerminatedAt(),
                        List.of(legSession.getCallId()))) {
                    Object id = report.get("_id");
                    if (id == null || seen.add(id)) {
                        reports.add(report);
                    }
                }
                legReports = filterByLeg(reports, legId);
            }

            legReports.stream()
                    .collect(Collectors.groupingBy(LegSessions::generatePartyId, LinkedHashMap::new, Collectors.toList()))
                    .forEach((partyId, partyReports) -> updateMediaSession(legSession, partyId, partyReports));
        });

        logger.debug("Stream {}: {} leg sessions, {} raw reports", stream, sessions.size(), reports.size());
        return sessions;
    }

    private void updateMediaSession(LegSession legSession, String partyId, List<Document> reports) {
        MediaSession target = aggregator.select(legSession, reports.get(0));
        if (target == null) {
            return;
        }
        if (!target.getBlocks().isEmpty()) {
            logger.warn("Leg {}: sub-session already aggregated, skipping party {}", legSession.getLegId(), partyId);
            return;
        }

        List<MediaStatistic> blocks = aggregator.aggregate(legSession, target, reports, blockCount);
        target.getBlocks().addAll(blocks);
    }

    private List<Document> find(String collection, long createdAt, long terminatedAt, List<String> callId) {
        long to = after(terminatedAt, terminationTimeout);
        Criteria filter = Criteria.where(STARTED_AT).gte(createdAt).lte(to)
                .and(CALL_ID).in(callId);

        return store.find(collection, createdAt, to, filter, Sort.by(Sort.Direction.ASC, STARTED_AT));
    }

    private static List<Document> filterByLeg(List<Document> reports, String legId) {
        return reports.stream()
                .filter(r -> legId.equals(LegSessions.generateLegId(r)))
                .collect(Collectors.toList());
    }

    static String indexCollection(String stream) {
        return "rtpr_" + stream + "_index";
    }

    static String rawCollection(String stream) {
        return "rtpr_" + stream + "_raw";
    }
}
