package com.loglyzer.log.parser.report;

import java.util.List;

import com.loglyzer.log.parser.LogLevel;
import com.loglyzer.log.parser.LogRecord;
import com.loglyzer.log.parser.model.ErrorFrequency;
import com.loglyzer.log.parser.model.Statistics;

/**
 * One CSV row per metric under the header {@code category,name,count}:
 * <pre>
 * category,name,count
 * total,,5
 * level,INFO,3
 * level,WARNING,0
 * level,ERROR,2
 * level,DEBUG,0
 * error,disk full,2
 * </pre>
 * Error rows follow rank order. Rows end with {@code \n}.
 */
public class CsvReportRenderer implements ReportRenderer {

    private static final String NEWLINE = "\n";

    private final String[] headers = new String[] { "category", "name", "count" };

    @Override
    public String render(Statistics statistics, List<LogRecord> details) {
        StringBuilder out = new StringBuilder();
        out.append(String.join(",", headers)).append(NEWLINE);

        appendRow(out, "total", "", statistics.getTotal());
        for (LogLevel level : LogLevel.values()) {
            appendRow(out, "level", level.getToken(), statistics.getCount(level));
        }
        for (ErrorFrequency error : statistics.getTopErrors()) {
            appendRow(out, "error", error.getMessage(), error.getCount());
        }
        return out.toString();
    }

    private void appendRow(StringBuilder out, String category, String name, long count) {
        out.append(category)
            .append(',')
            .append(escapeCsv(name))
            .append(',')
            .append(count)
            .append(NEWLINE);
    }

    static String escapeCsv(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
