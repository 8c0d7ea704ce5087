package com.example.sessionstore.service.media;

import org.bson.Document;

import java.util.ArrayList;
import java.util.List;

import static com.example.sessionstore.service.media.ReportFields.*;

/**
 * Cuts a report into chunks aligned to block boundaries.
 */
public final class ReportSplitter {

    private ReportSplitter() {
    }

    /**
     * Chunk durations are {@code remaining}, then {@code blockWidth} as many times as needed,
     * then whatever is left (never zero). Packet counters are apportioned by duration,
     * the last chunk taking the rounding remainder, so the totals match the source report.
     * Gauges (jitter, r-factor, MOS) are copied into every chunk.
     */
    public static List<Document> split(Document report, long remaining, long blockWidth) {
        long duration = getLong(report, DURATION);
        if (blockWidth <= 0) {
            throw new IllegalArgumentException("Block width must be positive: " + blockWidth);
        }
        if (remaining < 0 || remaining >= duration) {
            throw new IllegalArgumentException("Report duration " + duration + " does not exceed remaining " + remaining);
        }

        List<Long> durations = new ArrayList<>();
        durations.add(remaining);
        long rest = duration - remaining;
        while (rest > blockWidth) {
            durations.add(blockWidth);
            rest -= blockWidth;
        }
        durations.add(rest);

        List<Document> chunks = new ArrayList<>(durations.size());
        long startedAt = getLong(report, STARTED_AT);
        long[] assigned = new long[PACKET_COUNTERS.length];

        for (int i = 0; i < durations.size(); i++) {
            long chunkDuration = durations.get(i);
            boolean last = i == durations.size() - 1;

            Document chunk = new Document(report);
            chunk.put(STARTED_AT, startedAt);
            chunk.put(DURATION, chunkDuration);

            for (int c = 0; c < PACKET_COUNTERS.length; c++) {
                long total = getLong(report, PACKET_COUNTERS[c]);
                long share = last ? total - assigned[c] : total * chunkDuration / duration;
                assigned[c] += share;
                chunk.put(PACKET_COUNTERS[c], share);
            }

            chunks.add(chunk);
            startedAt += chunkDuration;
        }
        return chunks;
    }
}
