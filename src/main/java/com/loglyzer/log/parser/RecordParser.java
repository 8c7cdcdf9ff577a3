package com.loglyzer.log.parser;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses lines of the form {@code YYYY-MM-DD HH:MM:SS [LEVEL] Message}.
 * <p>
 * The whole line must match. Level tokens are matched literally in upper case and
 * the date and time must denote a real calendar instant, otherwise the line is
 * reported as malformed. Parsing never throws for bad input.
 */
public class RecordParser {

    private static final Pattern LINE_PATTERN = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2}) (\\d{2}:\\d{2}:\\d{2}) \\[(INFO|WARNING|ERROR|DEBUG)\\] (.*)$",
            Pattern.DOTALL);

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

    public ParseOutcome parse(String line) {
        if (line == null) {
            return ParseOutcome.malformed(null);
        }

        Matcher matcher = LINE_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return ParseOutcome.malformed(line);
        }

        LocalDateTime timestamp;
        try {
            LocalDate date = LocalDate.parse(matcher.group(1), DATE_FORMAT);
            LocalTime time = LocalTime.parse(matcher.group(2), TIME_FORMAT);
            timestamp = LocalDateTime.of(date, time);
        } catch (DateTimeParseException e) {
            return ParseOutcome.malformed(line);
        }

        LogLevel level = LogLevel.findByToken(matcher.group(3));
        if (level == null) {
            return ParseOutcome.malformed(line);
        }

        return ParseOutcome.ok(new LogRecord(timestamp, level, matcher.group(4).trim()));
    }
}
