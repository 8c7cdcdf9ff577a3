package com.loglyzer.log.filter;

import java.util.Optional;

/**
 * Record selection options. Active predicates are combined with AND.
 */
public final class FilterCriteria {

    private static final FilterCriteria NONE = new FilterCriteria(false, null);

    private final boolean errorsOnly;
    private final String searchTerm;

    /**
     * @param searchTerm case-insensitive message substring, trimmed; null or blank means no search
     */
    public FilterCriteria(boolean errorsOnly, String searchTerm) {
        this.errorsOnly = errorsOnly;
        this.searchTerm = (searchTerm == null || searchTerm.isBlank()) ? null : searchTerm.trim();
    }

    public static FilterCriteria none() {
        return NONE;
    }

    public boolean isErrorsOnly() {
        return errorsOnly;
    }

    public Optional<String> getSearchTerm() {
        return Optional.ofNullable(searchTerm);
    }

    public boolean isActive() {
        return errorsOnly || searchTerm != null;
    }

    @Override
    public String toString() {
        return "FilterCriteria[errorsOnly=" + errorsOnly + ", searchTerm=" + searchTerm + "]";
    }
}
