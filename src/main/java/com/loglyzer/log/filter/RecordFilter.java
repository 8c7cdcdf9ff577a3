package com.loglyzer.log.filter;

import java.util.Locale;
import java.util.stream.Stream;

import com.loglyzer.log.parser.LogLevel;
import com.loglyzer.log.parser.LogRecord;

/**
 * Selects the records matching a {@link FilterCriteria}. Filtering is lazy and keeps
 * input order.
 */
public class RecordFilter {

    private final FilterCriteria criteria;
    private final String loweredSearchTerm;

    public RecordFilter(FilterCriteria criteria) {
        this.criteria = criteria == null ? FilterCriteria.none() : criteria;
        this.loweredSearchTerm = this.criteria.getSearchTerm()
                .map(term -> term.toLowerCase(Locale.ROOT))
                .orElse(null);
    }

    public Stream<LogRecord> apply(Stream<LogRecord> records) {
        if (!criteria.isActive()) {
            return records;
        }
        return records.filter(this::matches);
    }

    public boolean matches(LogRecord record) {
        if (criteria.isErrorsOnly() && record.getLevel() != LogLevel.ERROR) {
            return false;
        }
        if (loweredSearchTerm != null
                && !record.getMessage().toLowerCase(Locale.ROOT).contains(loweredSearchTerm)) {
            return false;
        }
        return true;
    }
}
