package com.loglyzer.log.parser.accumulator;

import java.util.HashMap;
import java.util.Map;

/**
 * Frequency table of ERROR message text. Messages are keyed exactly as parsed,
 * no further normalization is applied.
 */
public class ErrorMessageAccumulator {

    private final Map<String, Long> messageCounts = new HashMap<>();

    public void accumulate(String message) {
        if (message == null) {
            return;
        }
        messageCounts.merge(message, 1L, Long::sum);
    }

    public long getCount(String message) {
        return messageCounts.getOrDefault(message, 0L);
    }

    /**
     * Returns a copy of the frequency table
     */
    public Map<String, Long> getMessageCounts() {
        return new HashMap<>(messageCounts);
    }

    public int getDistinctMessageCount() {
        return messageCounts.size();
    }

    public long getTotalErrorCount() {
        return messageCounts.values().stream()
            .mapToLong(Long::longValue)
            .sum();
    }
}
