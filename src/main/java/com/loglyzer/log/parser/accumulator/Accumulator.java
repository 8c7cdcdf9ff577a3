package com.loglyzer.log.parser.accumulator;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.loglyzer.log.parser.LogLevel;
import com.loglyzer.log.parser.LogRecord;
import com.loglyzer.log.parser.model.ErrorFrequency;
import com.loglyzer.log.parser.model.Statistics;

/**
 * Counts records per level and feeds ERROR messages to an {@link ErrorMessageAccumulator}.
 * <p>
 * Only records that passed filtering should be accumulated; {@link #getTotal()} is the
 * size of that filtered view.
 */
public class Accumulator {

    private final long[] levelCounts = new long[LogLevel.values().length];
    private final ErrorMessageAccumulator errorMessageAccumulator = new ErrorMessageAccumulator();
    private long total;

    public void accumulate(LogRecord record) {
        if (record == null) {
            return;
        }
        total++;
        levelCounts[record.getLevel().ordinal()]++;

        if (record.getLevel() == LogLevel.ERROR) {
            errorMessageAccumulator.accumulate(record.getMessage());
        }
    }

    public long getTotal() {
        return total;
    }

    public long getCount(LogLevel level) {
        return levelCounts[level.ordinal()];
    }

    public Map<LogLevel, Long> getCountsByLevel() {
        Map<LogLevel, Long> counts = new EnumMap<>(LogLevel.class);
        for (LogLevel level : LogLevel.values()) {
            counts.put(level, levelCounts[level.ordinal()]);
        }
        return counts;
    }

    public ErrorMessageAccumulator getErrorMessageAccumulator() {
        return errorMessageAccumulator;
    }

    public Statistics toStatistics(List<ErrorFrequency> topErrors) {
        return new Statistics(total, getCountsByLevel(), topErrors);
    }
}
