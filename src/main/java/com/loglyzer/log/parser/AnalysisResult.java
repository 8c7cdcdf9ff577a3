package com.loglyzer.log.parser;

import com.loglyzer.log.parser.model.Statistics;

/**
 * Rendered output of a run together with the data it was rendered from.
 */
public class AnalysisResult {

    private final String output;
    private final Statistics statistics;
    private final ProcessingStats processingStats;

    public AnalysisResult(String output, Statistics statistics, ProcessingStats processingStats) {
        this.output = output;
        this.statistics = statistics;
        this.processingStats = processingStats;
    }

    public String getOutput() {
        return output;
    }

    public Statistics getStatistics() {
        return statistics;
    }

    public ProcessingStats getProcessingStats() {
        return processingStats;
    }

    public long getMalformedCount() {
        return processingStats.malformedLines;
    }
}
