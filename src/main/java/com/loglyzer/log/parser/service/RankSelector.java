package com.loglyzer.log.parser.service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.loglyzer.log.parser.accumulator.ErrorMessageAccumulator;
import com.loglyzer.log.parser.model.ErrorFrequency;

/**
 * Picks the most frequent error messages from a frequency table.
 * <p>
 * Entries are ordered by count descending, ties broken by message text ascending, so
 * the result does not depend on the iteration order of the table.
 */
public class RankSelector {

    public static final Comparator<ErrorFrequency> RANK_ORDER =
            Comparator.comparingLong(ErrorFrequency::getCount).reversed()
                    .thenComparing(ErrorFrequency::getMessage);

    public static List<ErrorFrequency> topErrors(ErrorMessageAccumulator accumulator, int limit) {
        return topErrors(accumulator.getMessageCounts(), limit);
    }

    /**
     * @throws IllegalArgumentException if {@code limit} is negative
     */
    public static List<ErrorFrequency> topErrors(Map<String, Long> messageCounts, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0: " + limit);
        }
        if (limit == 0 || messageCounts.isEmpty()) {
            return List.of();
        }
        return messageCounts.entrySet().stream()
                .map(entry -> new ErrorFrequency(entry.getKey(), entry.getValue()))
                .sorted(RANK_ORDER)
                .limit(limit)
                .collect(Collectors.toList());
    }
}
