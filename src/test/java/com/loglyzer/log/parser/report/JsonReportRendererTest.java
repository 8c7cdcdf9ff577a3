package com.loglyzer.log.parser.report;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import com.loglyzer.log.parser.LogLevel;
import com.loglyzer.log.parser.model.ErrorFrequency;
import com.loglyzer.log.parser.model.Statistics;

public class JsonReportRendererTest {

    private final JsonReportRenderer renderer = new JsonReportRenderer();

    @Test
    public void testFieldsRoundTrip() {
        Map<LogLevel, Long> counts = new EnumMap<>(LogLevel.class);
        counts.put(LogLevel.INFO, 4L);
        counts.put(LogLevel.WARNING, 1L);
        counts.put(LogLevel.ERROR, 3L);
        counts.put(LogLevel.DEBUG, 2L);
        Statistics stats = new Statistics(10, counts, List.of(
                new ErrorFrequency("disk full", 2),
                new ErrorFrequency("timeout", 1)));

        JSONObject result = new JSONObject(renderer.render(stats));

        assertEquals(10, result.getLong("total"));
        JSONObject levels = result.getJSONObject("countsByLevel");
        assertEquals(4, levels.length());
        assertEquals(4, levels.getLong("INFO"));
        assertEquals(1, levels.getLong("WARNING"));
        assertEquals(3, levels.getLong("ERROR"));
        assertEquals(2, levels.getLong("DEBUG"));

        JSONArray topErrors = result.getJSONArray("topErrors");
        assertEquals(2, topErrors.length());
        assertEquals("disk full", topErrors.getJSONObject(0).getString("message"));
        assertEquals(2, topErrors.getJSONObject(0).getLong("count"));
        assertEquals("timeout", topErrors.getJSONObject(1).getString("message"));
        assertEquals(1, topErrors.getJSONObject(1).getLong("count"));
    }

    @Test
    public void testEmptyStatisticsAreValidJson() {
        JSONObject result = new JSONObject(renderer.render(Statistics.empty()));

        assertEquals(0, result.getLong("total"));
        assertEquals(0, result.getJSONObject("countsByLevel").getLong("ERROR"));
        assertEquals(0, result.getJSONArray("topErrors").length());
    }

    @Test
    public void testSpecialCharactersAreEscaped() {
        String message = "quote \" backslash \\ newline \n tab \t unicode é";
        Statistics stats = new Statistics(1, Map.of(LogLevel.ERROR, 1L), List.of(new ErrorFrequency(message, 1)));

        JSONObject result = new JSONObject(renderer.render(stats));

        assertEquals(message, result.getJSONArray("topErrors").getJSONObject(0).getString("message"));
    }

    @Test
    public void testFieldOrder() {
        String output = renderer.render(Statistics.empty());

        int total = output.indexOf("\"total\"");
        int levels = output.indexOf("\"countsByLevel\"");
        int topErrors = output.indexOf("\"topErrors\"");
        assertTrue(total >= 0 && total < levels && levels < topErrors);
        assertTrue(output.indexOf("\"INFO\"") < output.indexOf("\"WARNING\""));
        assertTrue(output.indexOf("\"ERROR\"") < output.indexOf("\"DEBUG\""));
    }

    @Test
    public void testOutputIsDeterministic() {
        Statistics stats = new Statistics(2, Map.of(LogLevel.ERROR, 2L), List.of(new ErrorFrequency("e", 2)));
        String first = renderer.render(stats);

        assertEquals(first, renderer.render(stats));
        assertFalse(first.contains("\r"));
        assertTrue(first.endsWith("}\n"));
    }
}
