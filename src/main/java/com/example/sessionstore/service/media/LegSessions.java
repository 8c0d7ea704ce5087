package com.example.sessionstore.service.media;

import com.example.sessionstore.model.LegSession;
import com.example.sessionstore.model.MediaSession;
import org.bson.Document;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import static com.example.sessionstore.service.media.ReportFields.*;

/**
 * Leg and party identification, and leg session construction from index reports.
 */
public final class LegSessions {

    private LegSessions() {
    }

    /**
     * Same value for both directions of a leg and for its RTP and RTCP reports:
     * endpoints are sorted and odd (RTCP) ports fold onto the paired even port.
     */
    public static String generateLegId(Document report) {
        String src = endpoint(report.getString(SRC_ADDR), getInt(report, SRC_PORT) & ~1);
        String dst = endpoint(report.getString(DST_ADDR), getInt(report, DST_PORT) & ~1);
        String callId = report.getString(CALL_ID);
        return src.compareTo(dst) <= 0
                ? callId + ":" + src + ":" + dst
                : callId + ":" + dst + ":" + src;
    }

    public static String generatePartyId(Document report) {
        return report.getString(CALL_ID)
                + ":" + endpoint(report.getString(SRC_ADDR), getInt(report, SRC_PORT))
                + ":" + endpoint(report.getString(DST_ADDR), getInt(report, DST_PORT));
    }

    /**
     * The earliest index report fixes the leg orientation. Reports flowing the same way
     * (ports within 0..1) make the {@code out} sub-session, the rest make {@code in}.
     */
    public static LegSession createLegSession(List<Document> indexReports, int blockCount) {
        if (indexReports.isEmpty()) {
            throw new IllegalArgumentException("Leg session requires at least one index report");
        }
        List<Document> sorted = new ArrayList<>(indexReports);
        sorted.sort(Comparator.comparingLong(r -> getLong(r, STARTED_AT)));
        Document first = sorted.get(0);

        LegSession leg = LegSession.builder()
                .legId(generateLegId(first))
                .callId(first.getString(CALL_ID))
                .srcAddr(first.getString(SRC_ADDR))
                .srcPort(getInt(first, SRC_PORT))
                .dstAddr(first.getString(DST_ADDR))
                .dstPort(getInt(first, DST_PORT))
                .blockCount(blockCount)
                .build();

        List<Document> out = new ArrayList<>();
        List<Document> in = new ArrayList<>();
        for (Document report : sorted) {
            if (isSameDirection(leg, report)) {
                out.add(report);
            } else {
                in.add(report);
            }
        }

        leg.setOut(createMediaSession(out, leg.getSrcAddr(), leg.getSrcPort(), leg.getDstAddr(), leg.getDstPort()));
        leg.setIn(createMediaSession(in, leg.getDstAddr(), leg.getDstPort(), leg.getSrcAddr(), leg.getSrcPort()));

        long createdAt = sorted.stream().mapToLong(r -> getLong(r, STARTED_AT)).min().getAsLong();
        long terminatedAt = sorted.stream().mapToLong(r -> getLong(r, STARTED_AT) + getLong(r, DURATION)).max().getAsLong();
        leg.setCreatedAt(createdAt);
        leg.setTerminatedAt(terminatedAt);
        leg.setDuration(terminatedAt - createdAt);
        return leg;
    }

    /**
     * Port heuristic: RTP and RTCP ports of one flow are adjacent, so a report whose
     * ports are 0 or 1 above the leg's ports flows in the leg's direction.
     */
    public static boolean isSameDirection(LegSession leg, Document report) {
        int srcDiff = getInt(report, SRC_PORT) - leg.getSrcPort();
        int dstDiff = getInt(report, DST_PORT) - leg.getDstPort();
        return srcDiff >= 0 && srcDiff <= 1 && dstDiff >= 0 && dstDiff <= 1;
    }

    static MediaSession createMediaSession(List<Document> reports, String srcAddr, int srcPort, String dstAddr, int dstPort) {
        MediaSession session = MediaSession.builder()
                .srcAddr(srcAddr)
                .srcPort(srcPort)
                .dstAddr(dstAddr)
                .dstPort(dstPort)
                .build();
        if (reports.isEmpty()) {
            return session;
        }

        long createdAt = Long.MAX_VALUE;
        long terminatedAt = Long.MIN_VALUE;
        for (Document report : reports) {
            long startedAt = getLong(report, STARTED_AT);
            createdAt = Math.min(createdAt, startedAt);
            terminatedAt = Math.max(terminatedAt, startedAt + getLong(report, DURATION));
            if (session.getCodec() == null) {
                session.setCodec(report.getString(CODEC));
            }
            if (session.getPayloadType() == null && report.get(PAYLOAD_TYPE) instanceof Number) {
                session.setPayloadType(getInt(report, PAYLOAD_TYPE));
            }
        }
        session.setCreatedAt(createdAt);
        session.setTerminatedAt(terminatedAt);
        session.setDuration(terminatedAt - createdAt);
        session.setReportCount(reports.size());
        return session;
    }

    private static String endpoint(String addr, int port) {
        return Objects.toString(addr, "") + ":" + port;
    }
}
