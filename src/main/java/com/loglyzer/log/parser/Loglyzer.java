package com.loglyzer.log.parser;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command line entry point: reads one log file, analyzes it and prints the report to stdout.
 * <p>
 * Exit codes: 0 on success, 1 when the input cannot be read, 2 for invalid options or
 * configuration.
 */
@Command(name = "loglyzer", mixinStandardHelpOptions = true, version = "1.0",
         description = "Analyze log files and extract patterns")
public class Loglyzer implements Callable<Integer> {

    static final Logger logger = LoggerFactory.getLogger(Loglyzer.class);

    public static final int EXIT_IO_ERROR = 1;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "Path to the log file to analyze (.gz supported)")
    private Path input;

    @Option(names = { "-f", "--format" }, description = "Output format: ${COMPLETION-CANDIDATES} (default: text)")
    private OutputFormat format;

    @Option(names = { "-e", "--errors-only" }, description = "Show only ERROR-level logs")
    private Boolean errorsOnly;

    @Option(names = { "--top" }, description = "Show top N most frequent errors (default: 5)")
    private Integer top;

    @Option(names = { "--search" }, description = "Filter logs containing specific text (case-insensitive)")
    private String search;

    @Option(names = { "-d", "--details" }, description = "List the matching entries after the summary (text format only)")
    private Boolean details;

    @Option(names = { "-v", "--verbose" }, description = "Verbose output")
    private boolean verbose = false;

    @Option(names = { "--debug" }, description = "Log samples of malformed lines")
    private boolean debug = false;

    @Option(names = { "--config" }, description = "Properties file with default settings")
    private Path configFile;

    private final LogLineReader lineReader = new LogLineReader();

    @Override
    public Integer call() {
        AnalyzerConfig config = loadConfiguration();
        applyCommandLine(config);

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (verbose) {
            err.printf("[VERBOSE] Analysing file: %s%n", input);
            err.printf("[VERBOSE] Format: %s%n", config.getFormat());
            err.printf("[VERBOSE] Top errors: %d%n", config.getTop());
            err.printf("[VERBOSE] Errors only: %s%n", config.isErrorsOnly());
            err.printf("[VERBOSE] Search filter: %s%n", config.getSearchTerm());
            err.flush();
        }

        boolean includeDetails = config.isDetails() && config.getFormat() == OutputFormat.TEXT;
        if (config.isDetails() && !includeDetails) {
            logger.warn("Entry listing is only available for text output, ignoring it for {}", config.getFormat());
        }

        long start = System.currentTimeMillis();
        AnalysisResult result;
        try (Stream<String> lines = lineReader.lines(input)) {
            result = new LogAnalyzer(debug).analyze(lines, config.toFilterCriteria(), config.getTop(),
                    config.getFormat(), includeDetails);
        } catch (IOException e) {
            return reportReadFailure(err, e);
        } catch (UncheckedIOException e) {
            return reportReadFailure(err, e.getCause());
        }

        out.print(result.getOutput());
        out.flush();

        if (verbose) {
            ProcessingStats stats = result.getProcessingStats();
            err.printf("[VERBOSE] Lines read: %d%n", stats.linesRead);
            err.printf("[VERBOSE] Malformed lines skipped: %d%n", stats.malformedLines);
            err.printf("[VERBOSE] Completed in %d ms%n", System.currentTimeMillis() - start);
            err.flush();
        }
        return 0;
    }

    private AnalyzerConfig loadConfiguration() {
        if (configFile == null) {
            return new AnalyzerConfig();
        }
        try {
            AnalyzerConfig config = AnalyzerConfig.load(configFile);
            logger.info("Loaded configuration from: {}", configFile);
            return config;
        } catch (IOException e) {
            throw new ParameterException(spec.commandLine(),
                    "Could not read config file " + configFile + ": " + describe(e), e);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(),
                    "Invalid config file " + configFile + ": " + e.getMessage(), e);
        }
    }

    // Command line values win over the config file
    private void applyCommandLine(AnalyzerConfig config) {
        if (top != null) {
            if (top < 0) {
                throw new ParameterException(spec.commandLine(),
                        "Invalid value for option '--top': must be 0 or more but was " + top);
            }
            config.setTop(top);
        }
        if (format != null) {
            config.setFormat(format);
        }
        if (errorsOnly != null) {
            config.setErrorsOnly(errorsOnly);
        }
        if (search != null) {
            config.setSearchTerm(search);
        }
        if (details != null) {
            config.setDetails(details);
        }
    }

    private int reportReadFailure(PrintWriter err, IOException e) {
        logger.debug("Failed to read {}", input, e);
        err.println("Failed to read file: " + describe(e));
        err.flush();
        return EXIT_IO_ERROR;
    }

    private static String describe(IOException e) {
        if (e instanceof NoSuchFileException) {
            return "No such file: " + e.getMessage();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Report and diagnostics are written as UTF-8 regardless of the platform charset,
     * matching how input is decoded.
     */
    public static CommandLine createCommandLine() {
        return new CommandLine(new Loglyzer())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setOut(new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true))
                .setErr(new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8), true));
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
