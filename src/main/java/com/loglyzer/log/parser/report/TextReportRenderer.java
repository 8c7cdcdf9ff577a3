package com.loglyzer.log.parser.report;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import com.loglyzer.log.parser.LogLevel;
import com.loglyzer.log.parser.LogRecord;
import com.loglyzer.log.parser.model.ErrorFrequency;
import com.loglyzer.log.parser.model.Statistics;

/**
 * Human readable tables: totals, per-level counts, top errors and an optional record listing.
 */
public class TextReportRenderer implements ReportRenderer {

    static final int MAX_MESSAGE_WIDTH = 80;

    private static final String NEWLINE = "\n";
    private static final int LEVEL_WIDTH = 10;
    private static final int COUNT_WIDTH = 11;
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");

    @Override
    public String render(Statistics statistics, List<LogRecord> details) {
        StringBuilder out = new StringBuilder();

        out.append("Log Analysis Results").append(NEWLINE);
        out.append("=".repeat(20)).append(NEWLINE);
        out.append("Total entries: ").append(statistics.getTotal()).append(NEWLINE);
        out.append(NEWLINE);

        appendLevelTable(out, statistics);
        out.append(NEWLINE);
        appendTopErrors(out, statistics.getTopErrors());

        if (details != null) {
            out.append(NEWLINE);
            appendDetails(out, details);
        }
        return out.toString();
    }

    private void appendLevelTable(StringBuilder out, Statistics statistics) {
        String format = "%-" + LEVEL_WIDTH + "s %" + COUNT_WIDTH + "s";
        out.append(String.format(Locale.ROOT, format, "Level", "Count")).append(NEWLINE);
        out.append("=".repeat(LEVEL_WIDTH + COUNT_WIDTH + 1)).append(NEWLINE);
        for (LogLevel level : LogLevel.values()) {
            out.append(String.format(Locale.ROOT, format, level.getToken(), statistics.getCount(level)))
                .append(NEWLINE);
        }
    }

    private void appendTopErrors(StringBuilder out, List<ErrorFrequency> topErrors) {
        out.append("Top Errors").append(NEWLINE);
        if (topErrors.isEmpty()) {
            out.append("No errors found.").append(NEWLINE);
            return;
        }

        final int messageWidth = Math.min(
            Math.max("Message".length(),
                topErrors.stream()
                    .mapToInt(error -> error.getMessage().length())
                    .max()
                    .orElse(0)),
            MAX_MESSAGE_WIDTH);

        String format = "%-" + messageWidth + "s %" + COUNT_WIDTH + "s";
        out.append(String.format(Locale.ROOT, format, "Message", "Occurrences")).append(NEWLINE);
        out.append("=".repeat(messageWidth + COUNT_WIDTH + 1)).append(NEWLINE);
        for (ErrorFrequency error : topErrors) {
            out.append(String.format(Locale.ROOT, format,
                    truncateString(singleLine(error.getMessage()), messageWidth), error.getCount()))
                .append(NEWLINE);
        }
    }

    private void appendDetails(StringBuilder out, List<LogRecord> details) {
        out.append("Entries").append(NEWLINE);
        if (details.isEmpty()) {
            out.append("No matching entries.").append(NEWLINE);
            return;
        }

        String format = "%-19s %-" + LEVEL_WIDTH + "s %s";
        out.append(String.format(Locale.ROOT, format, "Timestamp", "Level", "Message")).append(NEWLINE);
        out.append("=".repeat(19 + LEVEL_WIDTH + 2 + "Message".length())).append(NEWLINE);
        for (LogRecord record : details) {
            out.append(String.format(Locale.ROOT, format,
                    TIMESTAMP_FORMAT.format(record.getTimestamp()),
                    record.getLevel().getToken(),
                    truncateString(singleLine(record.getMessage()), MAX_MESSAGE_WIDTH)))
                .append(NEWLINE);
        }
    }

    // Keeps one table row per entry
    private static String singleLine(String value) {
        return value.replace('\r', ' ').replace('\n', ' ');
    }

    static String truncateString(String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        if (value.length() <= maxLength) {
            return value;
        }
        if (maxLength <= 3) {
            return value.substring(0, cutIndex(value, maxLength));
        }
        return value.substring(0, cutIndex(value, maxLength - 3)) + "...";
    }

    // Never splits a surrogate pair
    private static int cutIndex(String value, int end) {
        if (end > 0 && Character.isHighSurrogate(value.charAt(end - 1))) {
            return end - 1;
        }
        return end;
    }
}
