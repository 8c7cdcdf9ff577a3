package com.loglyzer.log.parser;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One structured entry decoded from a single log line.
 */
public final class LogRecord {

    private final LocalDateTime timestamp;
    private final LogLevel level;
    private final String message;

    public LogRecord(LocalDateTime timestamp, LogLevel level, String message) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.level = Objects.requireNonNull(level, "level");
        this.message = Objects.requireNonNull(message, "message");
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public LogLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        LogRecord other = (LogRecord) obj;
        return timestamp.equals(other.timestamp)
                && level == other.level
                && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, level, message);
    }

    @Override
    public String toString() {
        return timestamp + " [" + level.getToken() + "] " + message;
    }
}
