package org.carball.sqlinspector.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.sqlinspector.cache.QueryResultCache;
import org.carball.sqlinspector.config.ConfigurationLoader;
import org.carball.sqlinspector.config.InspectorConfig;
import org.carball.sqlinspector.config.OutputFormat;
import org.carball.sqlinspector.exception.SqlInspectorException;
import org.carball.sqlinspector.execution.JdbcQueryExecutor;
import org.carball.sqlinspector.inspector.InspectionSnapshot;
import org.carball.sqlinspector.inspector.SqlInspector;
import org.carball.sqlinspector.model.execution.QueryResultSet;
import org.carball.sqlinspector.model.query.AggregationResult;
import org.carball.sqlinspector.model.query.QueryGroup;
import org.carball.sqlinspector.model.query.QueryRecord;
import org.carball.sqlinspector.output.InspectionReport;
import org.carball.sqlinspector.parser.QueryLogFileConnector;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Slf4j
public class SqlInspectorCLI {

    private static final String VERSION = "1.0.0";

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_REJECTED = 2;
    static final int EXIT_FAILED = 3;

    private final PrintStream out;
    private final PrintStream err;

    SqlInspectorCLI(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new SqlInspectorCLI(System.out, System.err).run(args));
    }

    int run(String[] args) {
        if (args.length < 2 || isHelpRequested(args)) {
            printUsage();
            return args.length < 2 && !isHelpRequested(args) ? EXIT_USAGE : EXIT_OK;
        }

        try {
            CliOptions options = parseArgs(args);
            InspectorConfig config = new ConfigurationLoader().loadConfiguration(options.configFile, args);

            switch (options.command) {
                case "analyze":
                    return analyze(options, config);
                case "select":
                case "explain":
                    return execute(options, config);
                default:
                    throw new IllegalArgumentException("Unknown command: " + options.command);
            }
        } catch (SqlInspectorException e) {
            err.println("Rejected (" + e.getStatusCode() + "): " + e.getMessage());
            log.debug("Rejection details", e);
            return e.getStatusCode() >= 500 ? EXIT_FAILED : EXIT_REJECTED;
        } catch (IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            err.println("Run with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return EXIT_FAILED;
        } catch (IllegalStateException e) {
            err.println("Invalid query log: " + e.getMessage());
            log.debug("Query log error details", e);
            return EXIT_FAILED;
        }
    }

    private int analyze(CliOptions options, InspectorConfig config) throws IOException {
        Path logFile = Paths.get(options.argument);
        if (!Files.exists(logFile)) {
            throw new IllegalArgumentException("Query log file not found: " + logFile);
        }

        QueryLogFileConnector connector = new QueryLogFileConnector(logFile.toString());
        List<QueryRecord> records = connector.getAllQueries();
        if (options.verbose) {
            out.println("Loaded " + records.size() + " queries from " + logFile);
        }

        SqlInspector inspector = new SqlInspector(config, new QueryResultCache(config.getCacheCapacity()));
        InspectionSnapshot snapshot = inspector.inspect(records);

        InspectionReport report = new InspectionReport(snapshot.key(), snapshot.result(), connector.getRequestMetadata());
        writeReport(report, options);
        printSummary(snapshot.result());
        return EXIT_OK;
    }

    private int execute(CliOptions options, InspectorConfig config) {
        String jdbcUrl = options.jdbcUrl != null ? options.jdbcUrl : config.getJdbcUrl();
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("A JDBC URL is required for " + options.command
                    + ". Use --jdbc-url or --inspector.jdbc-url");
        }

        InspectorConfig executionConfig = config.toBuilder()
                .jdbcUrl(jdbcUrl)
                .executionAvailable(true)
                .build();
        SqlInspector inspector = new SqlInspector(executionConfig,
                new QueryResultCache(executionConfig.getCacheCapacity()),
                new JdbcQueryExecutor(jdbcUrl));

        QueryResultSet resultSet = "explain".equals(options.command)
                ? inspector.explain(options.argument)
                : inspector.selectAgain(options.argument);
        printResultSet(resultSet);
        return EXIT_OK;
    }

    private CliOptions parseArgs(String[] args) {
        CliOptions options = new CliOptions();
        options.command = args[0].toLowerCase(Locale.ROOT);
        options.argument = args[1];

        for (int i = 2; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--inspector.")) {
                // handled by ConfigurationLoader
                i++;
                continue;
            }
            switch (arg) {
                case "--output":
                case "-o":
                    options.outputFile = requireValue(args, ++i, "Output file not specified");
                    break;
                case "--format":
                case "-f":
                    String format = requireValue(args, ++i, "Output format not specified");
                    try {
                        options.outputFormat = OutputFormat.valueOf(format.toUpperCase(Locale.ROOT));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;
                case "--config":
                case "-c":
                    options.configFile = Paths.get(requireValue(args, ++i, "Config file not specified"));
                    break;
                case "--jdbc-url":
                    options.jdbcUrl = requireValue(args, ++i, "JDBC URL not specified");
                    break;
                case "--verbose":
                case "-v":
                    options.verbose = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        return options;
    }

    private void writeReport(InspectionReport report, CliOptions options) throws IOException {
        String baseFileName = removeFileExtension(options.outputFile);

        if (options.outputFormat == OutputFormat.JSON || options.outputFormat == OutputFormat.BOTH) {
            Path jsonFile = Paths.get(baseFileName + ".json");
            Files.writeString(jsonFile, report.toJson());
            out.println("Wrote " + jsonFile);
        }
        if (options.outputFormat == OutputFormat.MARKDOWN || options.outputFormat == OutputFormat.BOTH) {
            Path markdownFile = Paths.get(baseFileName + ".md");
            Files.writeString(markdownFile, report.toMarkdown());
            out.println("Wrote " + markdownFile);
        }
    }

    private void printSummary(AggregationResult result) {
        out.println();
        out.println("=".repeat(60));
        out.println("SQL INSPECTION SUMMARY");
        out.println("=".repeat(60));
        out.printf(Locale.ROOT, "Queries executed:        %d%n", result.totalExecutionCount());
        out.printf(Locale.ROOT, "Distinct statements:     %d%n", result.groups().size());
        out.printf(Locale.ROOT, "Total SQL time:          %.2f ms%n", result.totalSqlTimeMs());
        out.printf(Locale.ROOT, "SQL time rendering:      %.2f ms%n", result.sqlTimeDuringRenderingMs());
        out.printf(Locale.ROOT, "Avoidable time:          %.2f ms%n", result.avoidableTimeMs());

        if (!result.repeatedGroupIds().isEmpty()) {
            out.println();
            out.println("Repeated statements:");
            for (Integer id : result.repeatedGroupIds()) {
                QueryGroup group = result.groups().get(id);
                out.printf(Locale.ROOT, "  #%-3d x%-4d %s%n", id, group.executionCount(), group.statement().replaceAll("\\s+", " "));
            }
        }
    }

    private void printResultSet(QueryResultSet resultSet) {
        out.println(resultSet.sql());
        out.println("-".repeat(60));
        out.println(String.join(" | ", resultSet.headers()));
        for (List<Object> row : resultSet.rows()) {
            out.println(row.stream().map(String::valueOf).collect(Collectors.joining(" | ")));
        }
        out.printf(Locale.ROOT, "%n%d row(s) in %.2f ms%n", resultSet.rowCount(), resultSet.durationMs());
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index];
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private void printUsage() {
        out.println("SQL Inspector v" + VERSION);
        out.println();
        out.println("Usage:");
        out.println("  java -jar sql-inspector.jar analyze <query-log.json> [options]");
        out.println("  java -jar sql-inspector.jar select <token> --jdbc-url <url> [options]");
        out.println("  java -jar sql-inspector.jar explain <token> --jdbc-url <url> [options]");
        out.println();
        out.println("Options:");
        out.println("  --output, -o        Report file (default: inspection.json)");
        out.println("  --format, -f        Report format: json|markdown|both (default: json)");
        out.println("  --config, -c        YAML file with inspector settings");
        out.println("  --jdbc-url          Database to re-run a verified statement against");
        out.println("  --verbose, -v       Enable verbose output");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println(ConfigurationLoader.getConfigurationHelp());
    }

    private static final class CliOptions {
        private String command;
        private String argument;
        private String outputFile = "inspection.json";
        private OutputFormat outputFormat = OutputFormat.JSON;
        private Path configFile;
        private String jdbcUrl;
        private boolean verbose;
    }
}
