package com.loglyzer.log.parser;

import com.loglyzer.log.parser.report.CsvReportRenderer;
import com.loglyzer.log.parser.report.JsonReportRenderer;
import com.loglyzer.log.parser.report.ReportRenderer;
import com.loglyzer.log.parser.report.TextReportRenderer;

public enum OutputFormat {
    TEXT,
    JSON,
    CSV;

    public ReportRenderer createRenderer() {
        switch (this) {
            case JSON:
                return new JsonReportRenderer();
            case CSV:
                return new CsvReportRenderer();
            case TEXT:
            default:
                return new TextReportRenderer();
        }
    }

    /**
     * Case-insensitive lookup by name.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static OutputFormat fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Output format must not be null");
        }
        for (OutputFormat format : values()) {
            if (format.name().equalsIgnoreCase(name.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + name + " (expected text, json or csv)");
    }
}
