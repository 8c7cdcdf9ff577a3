package com.loglyzer.log.parser.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.loglyzer.log.parser.LogLevel;

/**
 * Immutable summary of one analysis run: total record count, per-level counts and the
 * ranked most frequent error messages.
 * <p>
 * Every {@link LogLevel} has an entry in {@link #getCountsByLevel()}, iterated in
 * declaration order.
 */
public final class Statistics {

    private final long total;
    private final Map<LogLevel, Long> countsByLevel;
    private final List<ErrorFrequency> topErrors;

    public Statistics(long total, Map<LogLevel, Long> countsByLevel, List<ErrorFrequency> topErrors) {
        if (total < 0) {
            throw new IllegalArgumentException("total must be >= 0: " + total);
        }
        EnumMap<LogLevel, Long> counts = new EnumMap<>(LogLevel.class);
        for (LogLevel level : LogLevel.values()) {
            Long count = countsByLevel == null ? null : countsByLevel.get(level);
            counts.put(level, count == null ? 0L : count);
        }
        this.total = total;
        this.countsByLevel = Collections.unmodifiableMap(counts);
        this.topErrors = topErrors == null ? List.of() : List.copyOf(topErrors);
    }

    public static Statistics empty() {
        return new Statistics(0, null, null);
    }

    public long getTotal() {
        return total;
    }

    public Map<LogLevel, Long> getCountsByLevel() {
        return countsByLevel;
    }

    public long getCount(LogLevel level) {
        return countsByLevel.get(level);
    }

    public List<ErrorFrequency> getTopErrors() {
        return topErrors;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Statistics other = (Statistics) obj;
        return total == other.total
                && countsByLevel.equals(other.countsByLevel)
                && topErrors.equals(other.topErrors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(total, countsByLevel, topErrors);
    }

    @Override
    public String toString() {
        return "Statistics[total=" + total + ", countsByLevel=" + countsByLevel + ", topErrors=" + topErrors + "]";
    }
}
