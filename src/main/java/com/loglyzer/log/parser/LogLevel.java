package com.loglyzer.log.parser;

/**
 * Severity of a log record. Declaration order is the order levels are reported in.
 */
public enum LogLevel {
    INFO("INFO"),
    WARNING("WARNING"),
    ERROR("ERROR"),
    DEBUG("DEBUG");

    LogLevel(final String pToken) {
        this.token = pToken;
    }

    private final String token;

    /**
     * The literal token that appears between brackets in a log line.
     */
    public String getToken() {
        return token;
    }

    /**
     * Exact, case-sensitive lookup of a bracket token. Returns null for unknown tokens.
     */
    public static LogLevel findByToken(final String pToken) {
        if (pToken == null) {
            return null;
        }
        for (LogLevel level : values()) {
            if (level.token.equals(pToken)) {
                return level;
            }
        }
        return null;
    }
}
