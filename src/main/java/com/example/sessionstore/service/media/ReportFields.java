package com.example.sessionstore.service.media;

import org.bson.Document;

/**
 * Field names of {@code rtpr_*} report documents.
 */
public final class ReportFields {

    public static final String CALL_ID = "call_id";
    public static final String STARTED_AT = "started_at";
    public static final String DURATION = "duration";
    public static final String SRC_ADDR = "src_addr";
    public static final String SRC_PORT = "src_port";
    public static final String DST_ADDR = "dst_addr";
    public static final String DST_PORT = "dst_port";
    public static final String CODEC = "codec";
    public static final String PAYLOAD_TYPE = "payload_type";

    public static final String EXPECTED = "expected_packet_count";
    public static final String RECEIVED = "received_packet_count";
    public static final String LOST = "lost_packet_count";
    public static final String REJECTED = "rejected_packet_count";

    public static final String JITTER = "avg_jitter";
    public static final String R_FACTOR = "r_factor";
    public static final String MOS = "mos";

    static final String[] PACKET_COUNTERS = {EXPECTED, RECEIVED, LOST, REJECTED};

    private ReportFields() {
    }

    static long getLong(Document report, String field) {
        Object v = report.get(field);
        return v instanceof Number ? ((Number) v).longValue() : 0L;
    }

    static int getInt(Document report, String field) {
        Object v = report.get(field);
        return v instanceof Number ? ((Number) v).intValue() : 0;
    }

    static Double getDouble(Document report, String field) {
        Object v = report.get(field);
        return v instanceof Number ? ((Number) v).doubleValue() : null;
    }
}
