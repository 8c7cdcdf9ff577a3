package com.loglyzer.log.parser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import com.loglyzer.log.filter.FilterCriteria;

/**
 * Analysis settings with their defaults, optionally overridden from a properties file.
 * <p>
 * Supported keys:
 * <ul>
 * <li>filter.errorsOnly: true/false</li>
 * <li>filter.search: case-insensitive message substring, trimmed</li>
 * <li>report.top: number of top errors, 0 or more</li>
 * <li>report.format: text, json or csv</li>
 * <li>report.details: true/false, list filtered entries in text output</li>
 * </ul>
 */
public class AnalyzerConfig {

    public static final int DEFAULT_TOP = 5;

    private boolean errorsOnly = false;
    private String searchTerm;
    private int top = DEFAULT_TOP;
    private OutputFormat format = OutputFormat.TEXT;
    private boolean details = false;

    public static AnalyzerConfig load(Path file) throws IOException {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        AnalyzerConfig config = new AnalyzerConfig();
        config.loadFromProperties(props);
        return config;
    }

    /**
     * @throws IllegalArgumentException if a value cannot be interpreted
     */
    public void loadFromProperties(Properties props) {
        String value = props.getProperty("filter.errorsOnly");
        if (value != null && !value.trim().isEmpty()) {
            errorsOnly = parseBoolean("filter.errorsOnly", value);
        }

        value = props.getProperty("filter.search");
        if (value != null && !value.trim().isEmpty()) {
            setSearchTerm(value);
        }

        value = props.getProperty("report.top");
        if (value != null && !value.trim().isEmpty()) {
            try {
                setTop(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("report.top is not a number: " + value, e);
            }
        }

        value = props.getProperty("report.format");
        if (value != null && !value.trim().isEmpty()) {
            format = OutputFormat.fromName(value);
        }

        value = props.getProperty("report.details");
        if (value != null && !value.trim().isEmpty()) {
            details = parseBoolean("report.details", value);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be true or false: " + value);
    }

    public FilterCriteria toFilterCriteria() {
        return new FilterCriteria(errorsOnly, searchTerm);
    }

    public boolean isErrorsOnly() {
        return errorsOnly;
    }

    public void setErrorsOnly(boolean errorsOnly) {
        this.errorsOnly = errorsOnly;
    }

    public String getSearchTerm() {
        return searchTerm;
    }

    /**
     * Surrounding whitespace is removed; a blank term means no search.
     */
    public void setSearchTerm(String searchTerm) {
        this.searchTerm = (searchTerm == null || searchTerm.isBlank()) ? null : searchTerm.trim();
    }

    public int getTop() {
        return top;
    }

    /**
     * @throws IllegalArgumentException if {@code top} is negative
     */
    public void setTop(int top) {
        if (top < 0) {
            throw new IllegalArgumentException("Top error count must be 0 or more: " + top);
        }
        this.top = top;
    }

    public OutputFormat getFormat() {
        return format;
    }

    public void setFormat(OutputFormat format) {
        this.format = format;
    }

    public boolean isDetails() {
        return details;
    }

    public void setDetails(boolean details) {
        this.details = details;
    }
}
