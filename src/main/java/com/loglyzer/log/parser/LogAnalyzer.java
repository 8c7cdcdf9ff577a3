package com.loglyzer.log.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.loglyzer.log.filter.FilterCriteria;
import com.loglyzer.log.filter.RecordFilter;
import com.loglyzer.log.parser.accumulator.Accumulator;
import com.loglyzer.log.parser.model.ErrorFrequency;
import com.loglyzer.log.parser.model.Statistics;
import com.loglyzer.log.parser.service.RankSelector;

/**
 * Runs the parse, filter, aggregate, rank and render pipeline over one sequence of lines.
 * <p>
 * The line stream is consumed exactly once and is not closed here. Malformed lines are
 * counted in the returned {@link ProcessingStats} and otherwise ignored.
 */
public class LogAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(LogAnalyzer.class);

    private static final int MAX_LOGGED_MALFORMED = 3;

    private final RecordParser recordParser;
    private final boolean debug;

    public LogAnalyzer() {
        this(false);
    }

    /**
     * @param debug log the first few malformed lines
     */
    public LogAnalyzer(boolean debug) {
        this.recordParser = new RecordParser();
        this.debug = debug;
    }

    public AnalysisResult analyze(Stream<String> lines, FilterCriteria criteria, int topN, OutputFormat format) {
        return analyze(lines, criteria, topN, format, false);
    }

    /**
     * @param includeDetails keep the filtered records and pass them to the renderer
     * @throws IllegalArgumentException if {@code topN} is negative
     */
    public AnalysisResult analyze(Stream<String> lines, FilterCriteria criteria, int topN, OutputFormat format,
            boolean includeDetails) {
        if (topN < 0) {
            throw new IllegalArgumentException("topN must be >= 0: " + topN);
        }
        if (format == null) {
            throw new IllegalArgumentException("format must not be null");
        }

        AtomicLong linesRead = new AtomicLong();
        AtomicLong malformedLines = new AtomicLong();
        Accumulator accumulator = new Accumulator();
        List<LogRecord> details = includeDetails ? new ArrayList<>() : null;

        Stream<LogRecord> records = lines
                .map(line -> {
                    linesRead.incrementAndGet();
                    return recordParser.parse(line);
                })
                .filter(outcome -> {
                    if (outcome.isMalformed()) {
                        long count = malformedLines.incrementAndGet();
                        if (debug && count <= MAX_LOGGED_MALFORMED) {
                            logger.warn("Malformed line {}: {}", linesRead.get(), abbreviate(outcome.getRawLine()));
                        }
                        return false;
                    }
                    return true;
                })
                .map(ParseOutcome::getRecord);

        new RecordFilter(criteria).apply(records).forEachOrdered(record -> {
            accumulator.accumulate(record);
            if (details != null) {
                details.add(record);
            }
        });

        List<ErrorFrequency> topErrors = RankSelector.topErrors(accumulator.getErrorMessageAccumulator(), topN);
        Statistics statistics = accumulator.toStatistics(topErrors);
        ProcessingStats processingStats = new ProcessingStats(linesRead.get(), malformedLines.get());

        if (processingStats.linesRead > 0 && processingStats.getParsedLines() == 0) {
            logger.warn("No lines matched the expected 'YYYY-MM-DD HH:MM:SS [LEVEL] message' layout");
        }
        logger.debug("Analysis complete - Lines: {} read, {} malformed | Records: {} after filtering",
                processingStats.linesRead, processingStats.malformedLines, statistics.getTotal());

        String output = format.createRenderer().render(statistics, details);
        return new AnalysisResult(output, statistics, processingStats);
    }

    private static String abbreviate(String line) {
        if (line == null) {
            return "null";
        }
        return line.substring(0, Math.min(200, line.length()));
    }
}
