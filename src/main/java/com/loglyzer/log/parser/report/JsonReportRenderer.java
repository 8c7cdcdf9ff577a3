package com.loglyzer.log.parser.report;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.loglyzer.log.parser.LogLevel;
import com.loglyzer.log.parser.LogRecord;
import com.loglyzer.log.parser.model.ErrorFrequency;
import com.loglyzer.log.parser.model.Statistics;

/**
 * Renders statistics as a pretty printed JSON document with the fields
 * {@code total}, {@code countsByLevel} and {@code topErrors}.
 */
public class JsonReportRenderer implements ReportRenderer {

    private static final ObjectMapper mapper = new ObjectMapper();

    // Always "\n", never the platform separator
    private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

    private static final ObjectWriter writer = mapper.writer(new DefaultPrettyPrinter()
            .withObjectIndenter(INDENTER)
            .withArrayIndenter(INDENTER));

    @Override
    public String render(Statistics statistics, List<LogRecord> details) {
        ObjectNode report = toJson(statistics);
        try {
            return writer.writeValueAsString(report) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report", e);
        }
    }

    ObjectNode toJson(Statistics statistics) {
        ObjectNode report = mapper.createObjectNode();
        report.put("total", statistics.getTotal());

        ObjectNode countsByLevel = mapper.createObjectNode();
        for (LogLevel level : LogLevel.values()) {
            countsByLevel.put(level.getToken(), statistics.getCount(level));
        }
        report.set("countsByLevel", countsByLevel);

        ArrayNode topErrors = mapper.createArrayNode();
        for (ErrorFrequency error : statistics.getTopErrors()) {
            ObjectNode entry = mapper.createObjectNode();
            entry.put("message", error.getMessage());
            entry.put("count", error.getCount());
            topErrors.add(entry);
        }
        report.set("topErrors", topErrors);

        return report;
    }
}
