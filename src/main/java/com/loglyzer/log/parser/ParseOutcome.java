package com.loglyzer.log.parser;

/**
 * Result of parsing one line: either a record or the raw text of a malformed line.
 */
public final class ParseOutcome {

    private final LogRecord record;
    private final String rawLine;

    private ParseOutcome(LogRecord record, String rawLine) {
        this.record = record;
        this.rawLine = rawLine;
    }

    public static ParseOutcome ok(LogRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }
        return new ParseOutcome(record, null);
    }

    public static ParseOutcome malformed(String rawLine) {
        return new ParseOutcome(null, rawLine);
    }

    public boolean isOk() {
        return record != null;
    }

    public boolean isMalformed() {
        return record == null;
    }

    /**
     * @throws IllegalStateException if the line was malformed
     */
    public LogRecord getRecord() {
        if (record == null) {
            throw new IllegalStateException("Malformed line has no record");
        }
        return record;
    }

    /**
     * The original text of a malformed line, null for a successful parse.
     */
    public String getRawLine() {
        return rawLine;
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + record + ")" : "Malformed(" + rawLine + ")";
    }
}
