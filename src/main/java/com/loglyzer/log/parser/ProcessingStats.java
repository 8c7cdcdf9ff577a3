package com.loglyzer.log.parser;

/**
 * Line counts collected while reading one input.
 */
public class ProcessingStats {
    public final long linesRead;
    public final long malformedLines;

    public ProcessingStats(long linesRead, long malformedLines) {
        this.linesRead = linesRead;
        this.malformedLines = malformedLines;
    }

    public long getParsedLines() {
        return linesRead - malformedLines;
    }

    @Override
    public String toString() {
        return "ProcessingStats[linesRead=" + linesRead + ", malformedLines=" + malformedLines + "]";
    }
}
