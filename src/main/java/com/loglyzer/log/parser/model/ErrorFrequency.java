package com.loglyzer.log.parser.model;

import java.util.Objects;

/**
 * A distinct ERROR message and the number of times it occurred.
 */
public final class ErrorFrequency {

    private final String message;
    private final long count;

    public ErrorFrequency(String message, long count) {
        this.message = Objects.requireNonNull(message, "message");
        this.count = count;
    }

    public String getMessage() {
        return message;
    }

    public long getCount() {
        return count;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        ErrorFrequency other = (ErrorFrequency) obj;
        return count == other.count && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, count);
    }

    @Override
    public String toString() {
        return "(" + message + ", " + count + ")";
    }
}
