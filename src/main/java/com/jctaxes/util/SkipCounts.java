package com.jctaxes.util;

import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tallies records that were skipped (or merely flagged) during a stage, by reason, along with the number of records
 * seen, and logs progress every so often. Bad records never abort a run, so this summary is how the operator finds
 * out about them.
 */
public class SkipCounts {

    private final Logger logger;

    private final String stage;

    private final int logFrequency;

    private final TObjectIntMap<String> countsByReason = new TObjectIntHashMap<>();

    private int seen = 0;

    public SkipCounts (Logger logger, String stage, int logFrequency) {
        this.logger = logger;
        this.stage = stage;
        this.logFrequency = logFrequency;
    }

    public SkipCounts (Logger logger, String stage) {
        this(logger, stage, 10_000);
    }

    /** Record that one more record has been examined. */
    public void seen () {
        seen += 1;
        if (logFrequency > 0 && seen % logFrequency == 0) {
            logger.info("{}: {} records processed", stage, seen);
        }
    }

    public void skipped (String reason) {
        countsByReason.adjustOrPutValue(reason, 1, 1);
    }

    public int getCount (String reason) {
        return countsByReason.get(reason);
    }

    public int getTotalSkipped () {
        int total = 0;
        for (int count : countsByReason.values()) {
            total += count;
        }
        return total;
    }

    /** Log one summary line, then one line per reason in alphabetical order. */
    public void logSummary () {
        int total = getTotalSkipped();
        if (total == 0) {
            logger.info("{}: {} records processed, none skipped or flagged.", stage, seen);
            return;
        }
        logger.warn("{}: {} records processed, {} skipped or flagged.", stage, seen, total);
        List<String> reasons = new ArrayList<>(countsByReason.keySet());
        Collections.sort(reasons);
        for (String reason : reasons) {
            logger.warn("  {}: {}", reason, countsByReason.get(reason));
        }
    }

}
