/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch.cli;

import com.urbanairship.dimstitch.BatchFetcher;
import com.urbanairship.dimstitch.BatchPlanner;
import com.urbanairship.dimstitch.ConfigException;
import com.urbanairship.dimstitch.DateRange;
import com.urbanairship.dimstitch.FetchException;
import com.urbanairship.dimstitch.FetchFailurePolicy;
import com.urbanairship.dimstitch.GroupRole;
import com.urbanairship.dimstitch.JoinPolicy;
import com.urbanairship.dimstitch.StitchPipeline;
import com.urbanairship.dimstitch.StitchResult;
import com.urbanairship.dimstitch.config.ConfigLoader;
import com.urbanairship.dimstitch.config.DownloadConfiguration;
import com.urbanairship.dimstitch.metrics.Metrics;
import com.urbanairship.dimstitch.output.CsvEmitter;
import com.urbanairship.dimstitch.output.HeaderTranslator;
import com.urbanairship.dimstitch.reporting.AnalyticsReportingFetcher;
import com.urbanairship.dimstitch.reporting.DimensionFilterExpression;
import com.urbanairship.dimstitch.reporting.GoogleReportsClient;
import com.urbanairship.dimstitch.reporting.ReportsClient;
import org.apache.commons.lang.StringUtils;
import org.apache.log4j.Level;
import org.apache.log4j.LogManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "dimstitch", mixinStandardHelpOptions = true, version = "dimension-stitch 1.0",
        description = {
                "Download Google Analytics dimensions in batches of at most " +
                        BatchPlanner.MAX_DIMENSIONS_PER_REQUEST + " and stitch them into one table.",
                "Dates are YYYY-MM-DD, today, yesterday or NdaysAgo. The end date defaults to the start date.",
                "Filters follow the Reporting API v4 format, for example:",
                "  --filter \"ga:dimension1 BEGINS_WITH 0123 AND ga:browser EXACT Firefox\""},
        exitCodeListHeading = "Exit codes:%n",
        exitCodeList = {
                "0:Download complete",
                "1:Unexpected I/O failure",
                "2:Invalid arguments",
                "3:Invalid configuration",
                "4:A batch could not be fetched"})
public class DownloadCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(DownloadCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_IO_ERROR = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_CONFIG_ERROR = 3;
    public static final int EXIT_FETCH_ERROR = 4;

    private static final String BASE_LOGGER = "com.urbanairship.dimstitch";

    /**
     * Builds the reporting client once the configuration is loaded.
     */
    interface ReportsClientFactory {
        ReportsClient create(DownloadConfiguration config) throws ConfigException;
    }

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "START-DATE", description = "First day to download")
    private String startDate;

    @Parameters(index = "1", arity = "0..1", paramLabel = "END-DATE", description = "Last day to download")
    private String endDate;

    @Option(names = {"-c", "--config"}, paramLabel = "FILE", defaultValue = ConfigLoader.DEFAULT_CONFIG_FILE,
            description = "Configuration file (default: ${DEFAULT-VALUE})")
    private Path configFile;

    @Option(names = {"-o", "--output-file"}, paramLabel = "FILE", description = "Write to a file instead of stdout")
    private Path outputFile;

    @Option(names = {"-d", "--delimiter"}, paramLabel = "CHAR", description = "Field delimiter, \\t for tab")
    private String delimiter;

    @Option(names = {"-f", "--filter"}, paramLabel = "FILTER", description = "Filter the results")
    private String filter;

    @Option(names = {"-u", "--users"}, description = "Only download the user dimensions")
    private boolean usersOnly;

    @Option(names = {"-r", "--results"}, description = "Only download the results dimensions")
    private boolean resultsOnly;

    @Option(names = {"-v", "--validate"}, description = "Print the number of user and results rows, nothing else")
    private boolean validate;

    @Option(names = {"-s", "--skip-header"}, description = "Leave out the header row")
    private boolean skipHeader;

    @Option(names = "--dimension-names", description = "Add dimension ids to translated header names")
    private boolean dimensionNames;

    @Option(names = "--skip-translation", description = "Use dimension ids as header names")
    private boolean skipTranslation;

    @Option(names = "--left-join", description = "Keep rows that a batch has no match for")
    private boolean leftJoin;

    @Option(names = "--best-effort", description = "Skip batches that fail instead of giving up")
    private boolean bestEffort;

    @Option(names = {"-x", "--debug-mode"}, description = "Log requests and row counts, and report metrics")
    private boolean debugMode;

    private final ReportsClientFactory clientFactory;

    public DownloadCommand() {
        this(new ReportsClientFactory() {
            @Override
            public ReportsClient create(DownloadConfiguration config) throws ConfigException {
                return GoogleReportsClient.create(config);
            }
        });
    }

    DownloadCommand(ReportsClientFactory clientFactory) {
        this.clientFactory = clientFactory;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new DownloadCommand()).execute(args));
    }

    @Override
    public Integer call() {
        if (debugMode) {
            LogManager.getLogger(BASE_LOGGER).setLevel(Level.DEBUG);
        }
        try {
            return download();
        } finally {
            if (debugMode) {
                Metrics.report(log);
            }
        }
    }

    private int download() {
        DateRange dateRange;
        try {
            dateRange = DateRange.of(startDate, endDate);
        } catch (IllegalArgumentException e) {
            return usageError(e.getMessage());
        }

        Optional<String> filterExpression = Optional.empty();
        if (StringUtils.isNotBlank(filter)) {
            try {
                DimensionFilterExpression.parse(filter);
            } catch (IllegalArgumentException e) {
                return usageError(e.getMessage());
            }
            filterExpression = Optional.of(filter);
        }

        Character separator = parseDelimiter(delimiter);
        if (separator == null) {
            return usageError("Delimiter must be a single character, got \"" + delimiter + "\"");
        }
        if (usersOnly && resultsOnly) {
            return usageError("--users and --results can't be used together");
        }
        if (dimensionNames && skipTranslation) {
            return usageError("--dimension-names and --skip-translation can't be used together");
        }

        DownloadConfiguration config;
        ReportsClient client;
        try {
            config = overrideFromOptions(new ConfigLoader().load(configFile));
            client = clientFactory.create(config);
        } catch (ConfigException e) {
            log.error("Configuration error: " + e.getMessage(), e);
            spec.commandLine().getErr().println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        try (BatchFetcher batchFetcher = new BatchFetcher(new AnalyticsReportingFetcher(client, config),
                config.fetchThreads, config.fetchFailurePolicy)) {
            StitchPipeline pipeline = new StitchPipeline(config.schema, new BatchPlanner(), batchFetcher,
                    config.joinPolicy);

            if (validate) {
                Map<String, Integer> counts = pipeline.countUsersAndResults(dateRange, filterExpression);
                PrintWriter out = spec.commandLine().getOut();
                for (Map.Entry<String, Integer> count : counts.entrySet()) {
                    out.println(count.getKey() + ": " + count.getValue() + " rows");
                }
                out.flush();
                return EXIT_OK;
            }

            StitchResult result;
            if (usersOnly) {
                result = pipeline.runSingle(GroupRole.USER, dateRange, filterExpression);
            } else if (resultsOnly) {
                result = pipeline.runSingle(GroupRole.RESULTS, dateRange, filterExpression);
            } else {
                result = pipeline.run(dateRange, filterExpression);
            }

            write(result, config, separator);
            return EXIT_OK;
        } catch (ConfigException e) {
            log.error("Configuration error: " + e.getMessage(), e);
            spec.commandLine().getErr().println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (FetchException e) {
            log.error("Download failed", e);
            spec.commandLine().getErr().println("Download failed: " + e.getMessage());
            return EXIT_FETCH_ERROR;
        } catch (IOException e) {
            log.error("Unexpected I/O failure", e);
            spec.commandLine().getErr().println("Unexpected I/O failure: " + e.getMessage());
            return EXIT_IO_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while downloading", e);
            spec.commandLine().getErr().println("Interrupted");
            return EXIT_IO_ERROR;
        }
    }

    private DownloadConfiguration overrideFromOptions(DownloadConfiguration config) {
        DownloadConfiguration.Builder builder = DownloadConfiguration.newBuilder(config);
        if (leftJoin) {
            builder.setJoinPolicy(JoinPolicy.LEFT);
        }
        if (bestEffort) {
            builder.setFetchFailurePolicy(FetchFailurePolicy.BEST_EFFORT);
        }
        return builder.build();
    }

    private void write(StitchResult result, DownloadConfiguration config, char separator) throws IOException {
        HeaderTranslator.Style style = skipTranslation ? HeaderTranslator.Style.ID :
                dimensionNames ? HeaderTranslator.Style.LABEL_AND_ID : HeaderTranslator.Style.LABEL;
        CsvEmitter emitter = new CsvEmitter(new HeaderTranslator(config.schema, style), separator, skipHeader,
                config.invalidValue);

        if (outputFile == null) {
            emitter.emit(result, spec.commandLine().getOut());
            return;
        }
        int rows;
        try (Writer out = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
            rows = emitter.emit(result, out);
        }
        log.info("Download complete, " + rows + " rows, output file: " + outputFile);
    }

    /**
     * @return the delimiter character, or null if the option isn't a single character
     */
    static Character parseDelimiter(String delimiter) {
        if (delimiter == null) {
            return CsvEmitter.DEFAULT_DELIMITER;
        }
        if ("\\t".equals(delimiter)) {
            return '\t';
        }
        return delimiter.length() == 1 ? delimiter.charAt(0) : null;
    }

    private int usageError(String message) {
        CommandLine commandLine = spec.commandLine();
        commandLine.getErr().println(message);
        commandLine.usage(commandLine.getErr());
        return EXIT_USAGE;
    }
}
