package com.loglyzer.log.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.zip.GZIPOutputStream;

import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

public class LoglyzerTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private String sampleLog;

    @BeforeEach
    public void setUp() throws Exception {
        out = new StringWriter();
        err = new StringWriter();
        sampleLog = LogAnalyzerTest.sampleLog().toString();
    }

    private int run(String... args) {
        CommandLine cmd = Loglyzer.createCommandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    public void testDefaultTextReport() {
        assertEquals(0, run(sampleLog));

        String output = out.toString();
        assertTrue(output.startsWith("Log Analysis Results\n"));
        assertTrue(output.contains("Total entries: 10\n"));
        assertTrue(output.contains("Database query failed: syntax error"));
        assertEquals("", err.toString());
    }

    @Test
    public void testJsonWithFilters() {
        assertEquals(0, run("--format", "json", "--errors-only", "--search", "DATABASE", sampleLog));

        JSONObject json = new JSONObject(out.toString());
        assertEquals(2, json.getLong("total"));
        assertEquals(0, json.getJSONObject("countsByLevel").getLong("INFO"));
        assertEquals(2, json.getJSONObject("countsByLevel").getLong("ERROR"));
        assertEquals(1, json.getJSONArray("topErrors").length());
    }

    @Test
    public void testFormatIsCaseInsensitive() {
        assertEquals(0, run("-f", "CSV", "--top", "1", sampleLog));

        assertEquals("category,name,count\n"
                + "total,,10\n"
                + "level,INFO,4\n"
                + "level,WARNING,1\n"
                + "level,ERROR,4\n"
                + "level,DEBUG,1\n"
                + "error,Database query failed: syntax error,2\n", out.toString());
    }

    @Test
    public void testDetailsOption() {
        assertEquals(0, run("-e", "-d", sampleLog));

        String output = out.toString();
        assertTrue(output.contains("Entries\n"));
        assertTrue(output.contains("2024-01-15 10:31:20 ERROR      Connection timeout\n"));
        assertFalse(output.contains("Application started"));
    }

    @Test
    public void testVerboseReportsMalformedLines() {
        assertEquals(0, run("--verbose", sampleLog));

        String diagnostics = err.toString();
        assertTrue(diagnostics.contains("[VERBOSE] Analysing file: " + sampleLog));
        assertTrue(diagnostics.contains("[VERBOSE] Malformed lines skipped: 2"));
        assertFalse(out.toString().contains("[VERBOSE]"));
    }

    @Test
    public void testNegativeTopIsUsageError() {
        assertEquals(2, run("--top", "-1", sampleLog));

        assertEquals("", out.toString());
        assertTrue(err.toString().contains("--top"));
    }

    @Test
    public void testUnknownFormatIsUsageError() {
        assertEquals(2, run("--format", "xml", sampleLog));
        assertEquals("", out.toString());
    }

    @Test
    public void testMissingFileArgumentIsUsageError() {
        assertEquals(2, run());
    }

    @Test
    public void testUnreadableFileFails() {
        String missing = tempDir.resolve("missing.log").toString();

        assertEquals(Loglyzer.EXIT_IO_ERROR, run(missing));
        assertEquals("", out.toString());
        assertTrue(err.toString().contains("Failed to read file"));
    }

    @Test
    public void testConfigFileSuppliesDefaults() throws Exception {
        String config = Paths.get(getClass().getResource("/loglyzer-test.properties").toURI()).toString();

        assertEquals(0, run("--config", config, sampleLog));

        JSONObject json = new JSONObject(out.toString());
        assertEquals(4, json.getLong("total"));
        assertEquals(2, json.getJSONArray("topErrors").length());
    }

    @Test
    public void testCommandLineOverridesConfigFile() throws Exception {
        String config = Paths.get(getClass().getResource("/loglyzer-test.properties").toURI()).toString();

        assertEquals(0, run("--config", config, "--format", "csv", "--top", "0", sampleLog));

        assertTrue(out.toString().startsWith("category,name,count\ntotal,,4\n"));
        assertFalse(out.toString().contains("error,"));
    }

    @Test
    public void testInvalidConfigFileIsUsageError() throws Exception {
        Path config = tempDir.resolve("bad.properties");
        Files.writeString(config, "report.format=yaml\n", StandardCharsets.UTF_8);

        assertEquals(2, run("--config", config.toString(), sampleLog));
        assertEquals("", out.toString());
        assertTrue(err.toString().contains("Invalid config file"));
    }

    @Test
    public void testNonAsciiMessagesAreWrittenAsUtf8() throws Exception {
        Path log = tempDir.resolve("accents.log");
        Files.writeString(log, "2024-01-15 10:00:00 [ERROR] Échec de connexion\n", StandardCharsets.UTF_8);

        PrintStream originalOut = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        int exitCode;
        try {
            System.setOut(new PrintStream(captured, true, StandardCharsets.ISO_8859_1));
            exitCode = Loglyzer.createCommandLine().execute("-f", "json", log.toString());
        } finally {
            System.setOut(originalOut);
        }

        assertEquals(0, exitCode);
        JSONObject json = new JSONObject(captured.toString(StandardCharsets.UTF_8));
        assertEquals("Échec de connexion", json.getJSONArray("topErrors").getJSONObject(0).getString("message"));
    }

    @Test
    public void testTruncatedGzipFailsWithoutOutput() throws Exception {
        ByteArrayOutputStream compressed = new ByteArrayOutputStream();
        try (OutputStream gzip = new GZIPOutputStream(compressed)) {
            for (int i = 0; i < 5000; i++) {
                String line = "2024-01-15 10:00:00 [ERROR] request " + i + " failed with code " + (i * 7919 % 10007) + "\n";
                gzip.write(line.getBytes(StandardCharsets.UTF_8));
            }
        }
        byte[] bytes = compressed.toByteArray();
        Path log = tempDir.resolve("cut.log.gz");
        Files.write(log, Arrays.copyOf(bytes, bytes.length / 2));

        assertEquals(Loglyzer.EXIT_IO_ERROR, run(log.toString()));
        assertEquals("", out.toString());
        assertTrue(err.toString().contains("Failed to read file"));
    }

    @Test
    public void testSearchTermIsTrimmedOnCommandLine() {
        assertEquals(0, run("-f", "csv", "--search", "  timeout  ", sampleLog));

        assertTrue(out.toString().startsWith("category,name,count\ntotal,,1\n"));
    }
}
