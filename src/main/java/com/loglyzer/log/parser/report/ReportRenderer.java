package com.loglyzer.log.parser.report;

import java.util.List;

import com.loglyzer.log.parser.LogRecord;
import com.loglyzer.log.parser.model.Statistics;

/**
 * Turns analysis results into the final output payload. Implementations are pure:
 * the same input always yields the same text.
 */
public interface ReportRenderer {

    /**
     * @param statistics aggregated results of the run
     * @param details filtered records to list after the summary, or null for no listing.
     *                Renderers without a detail section ignore it.
     */
    String render(Statistics statistics, List<LogRecord> details);

    default String render(Statistics statistics) {
        return render(statistics, null);
    }
}
