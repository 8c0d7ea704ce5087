package com.example.sessionstore.service.media;

import com.example.sessionstore.model.LegSession;
import com.example.sessionstore.model.MediaSession;
import com.example.sessionstore.model.MediaStatistic;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import static com.example.sessionstore.service.media.ReportFields.*;

/**
 * Partitions a leg's time span into a fixed number of blocks and folds
 * the reports of one party into them.
 *
 * <p>Nothing here mutates the leg or its sub-sessions: {@link #aggregate} returns
 * a new block list and the caller decides where it goes.</p>
 */
@Component
public class BlockAggregator {

    private static final Logger logger = LoggerFactory.getLogger(BlockAggregator.class);

    /**
     * Picks the sub-session a party's reports belong to. Ports of the first report within
     * 0..1 of the leg's ports mean {@code out}, anything else means {@code in}.
     */
    public MediaSession select(LegSession leg, Document firstReport) {
        return LegSessions.isSameDirection(leg, firstReport) ? leg.getOut() : leg.getIn();
    }

    /**
     * Builds exactly {@code blockCount} blocks covering the whole leg, or no blocks at all
     * when the target sub-session has no duration.
     *
     * @param leg        leg whose span is divided
     * @param target     sub-session the reports belong to, gives the leading gap
     * @param reports    reports of one party
     * @param blockCount number of blocks per leg
     */
    public List<MediaStatistic> aggregate(LegSession leg, MediaSession target, List<Document> reports, int blockCount) {
        if (target == null || target.getDuration() == 0) {
            return Collections.emptyList();
        }
        if (blockCount <= 0) {
            throw new IllegalArgumentException("Block count must be positive: " + blockCount);
        }

        List<Document> ordered = new ArrayList<>(reports);
        ordered.sort(Comparator.comparingLong(r -> getLong(r, STARTED_AT)));

        List<MediaStatistic> blocks = new ArrayList<>(blockCount);
        long blockWidth = Math.max(1L, leg.getDuration() / blockCount);

        long remaining;
        MediaStatistic current = new MediaStatistic();

        long gap = Math.max(0L, target.getCreatedAt() - leg.getCreatedAt());
        if (gap == 0) {
            remaining = blockWidth;
        } else {
            long emptyBlocks = gap / blockWidth;
            for (long i = 0; i < emptyBlocks && blocks.size() < blockCount; i++) {
                blocks.add(new MediaStatistic());
            }
            remaining = blockWidth - (gap % blockWidth);
        }

        for (Document report : ordered) {
            long duration = getLong(report, DURATION);

            if (duration < remaining) {
                MediaStatistics.update(current, report);
                remaining -= duration;
            } else if (duration > remaining) {
                List<Document> chunks = ReportSplitter.split(report, remaining, blockWidth);

                MediaStatistics.update(current, chunks.get(0));
                for (int i = 1; i < chunks.size(); i++) {
                    append(blocks, current, blockCount);
                    current = MediaStatistics.create(chunks.get(i));
                }
                remaining = blockWidth - getLong(chunks.get(chunks.size() - 1), DURATION);
                if (remaining == 0) {
                    // last chunk filled its block exactly
                    append(blocks, current, blockCount);
                    current = new MediaStatistic();
                    remaining = blockWidth;
                }
            } else {
                MediaStatistics.update(current, report);
                append(blocks, current, blockCount);
                current = new MediaStatistic();
                remaining = blockWidth;
            }
        }

        if (current.getPackets().getExpected() != 0 && blocks.size() < blockCount) {
            blocks.add(current);
        }

        while (blocks.size() < blockCount) {
            blocks.add(new MediaStatistic());
        }
        return blocks;
    }

    // Data past the last block is dropped
    private static void append(List<MediaStatistic> blocks, MediaStatistic block, int blockCount) {
        if (blocks.size() < blockCount) {
            blocks.add(block);
        } else {
            logger.debug("Dropping block beyond block count {}", blockCount);
        }
    }
}
