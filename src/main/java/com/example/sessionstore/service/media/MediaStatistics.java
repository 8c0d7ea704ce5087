package com.example.sessionstore.service.media;

import com.example.sessionstore.model.MediaStatistic;
import org.bson.Document;

import static com.example.sessionstore.service.media.ReportFields.*;

/**
 * Folds report documents into {@link MediaStatistic} blocks.
 */
public final class MediaStatistics {

    private MediaStatistics() {
    }

    public static MediaStatistic create(Document report) {
        MediaStatistic block = new MediaStatistic();
        update(block, report);
        return block;
    }

    public static void update(MediaStatistic block, Document report) {
        MediaStatistic.Packets packets = block.getPackets();
        long expected = getLong(report, EXPECTED);
        packets.setExpected(packets.getExpected() + expected);
        packets.setReceived(packets.getReceived() + getLong(report, RECEIVED));
        packets.setLost(packets.getLost() + getLong(report, LOST));
        packets.setRejected(packets.getRejected() + getLong(report, REJECTED));

        // Reports without packets still count once
        long weight = Math.max(expected, 1L);
        fold(block.getJitter(), getDouble(report, JITTER), weight);
        fold(block.getRfactor(), getDouble(report, R_FACTOR), weight);
        fold(block.getMos(), getDouble(report, MOS), weight);

        block.setFractionLost(packets.getExpected() == 0 ? 0.0
                : (double) packets.getLost() / packets.getExpected());
    }

    static void fold(MediaStatistic.Gauge gauge, Double value, long weight) {
        if (value == null) return;

        gauge.setMin(gauge.getMin() == null ? value : Math.min(gauge.getMin(), value));
        gauge.setMax(gauge.getMax() == null ? value : Math.max(gauge.getMax(), value));

        long samples = gauge.getSamples() + weight;
        double avg = gauge.getAvg() == null ? value
                : (gauge.getAvg() * gauge.getSamples() + value * weight) / samples;
        gauge.setAvg(avg);
        gauge.setSamples(samples);
    }
}
