package org.carball.qdsclean.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_DATABASE = "QDS_CLEAN_DATABASE";
    static final String ENV_JDBC_URL = "QDS_CLEAN_JDBC_URL";
    static final String ENV_USER = "QDS_CLEAN_USER";
    static final String ENV_PASSWORD = "QDS_CLEAN_PASSWORD";
    static final String ENV_RETENTION_HOURS = "QDS_CLEAN_RETENTION_HOURS";
    static final String ENV_MIN_EXECUTION_COUNT = "QDS_CLEAN_MIN_EXECUTION_COUNT";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > settings file > defaults
     */
    public CleanupConfig loadConfiguration(String[] args) throws IOException {
        log.debug("Loading configuration");

        CleanupConfig.CleanupConfigBuilder builder = CleanupConfig.builder();

        // 1. Settings file named by --config
        String settingsPath = extractSettingsPath(args);
        if (settingsPath != null) {
            loadSettingsFile(Paths.get(settingsPath)).applyTo(builder);
            log.info("Loaded cleanup settings from: {}", settingsPath);
        }

        // 2. Environment variables
        applyEnvironmentVariables(builder);

        // 3. CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        CleanupConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    public CleanupSettingsFile loadSettingsFile(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Settings file not found: " + path);
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(path.toFile(), CleanupSettingsFile.class);
    }

    private void applyEnvironmentVariables(CleanupConfig.CleanupConfigBuilder builder) {
        if (environment.containsKey(ENV_DATABASE)) {
            builder.databaseName(environment.get(ENV_DATABASE));
        }
        if (environment.containsKey(ENV_JDBC_URL)) {
            builder.jdbcUrl(environment.get(ENV_JDBC_URL));
        }
        if (environment.containsKey(ENV_USER)) {
            builder.user(environment.get(ENV_USER));
        }
        if (environment.containsKey(ENV_PASSWORD)) {
            builder.password(environment.get(ENV_PASSWORD));
        }
        Integer retentionHours = readIntVariable(ENV_RETENTION_HOURS);
        if (retentionHours != null) {
            builder.retentionHours(retentionHours);
        }
        Integer minExecutionCount = readIntVariable(ENV_MIN_EXECUTION_COUNT);
        if (minExecutionCount != null) {
            builder.minExecutionCount(minExecutionCount);
        }
    }

    private Integer readIntVariable(String name) {
        if (!environment.containsKey(name)) {
            return null;
        }
        try {
            return Integer.parseInt(environment.get(name).trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid value for {}: {}", name, e.getMessage());
            return null;
        }
    }

    private void applyCLIArguments(CleanupConfig.CleanupConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--database":
                case "-d":
                    builder.databaseName(requireValue(args, i++));
                    break;
                case "--clean-adhoc-stale":
                    builder.cleanAdhocStale(parseBoolean(arg, requireValue(args, i++)));
                    break;
                case "--clean-stale":
                    builder.cleanStale(parseBoolean(arg, requireValue(args, i++)));
                    break;
                case "--clean-internal":
                    builder.cleanInternal(parseBoolean(arg, requireValue(args, i++)));
                    break;
                case "--clean-orphan":
                    builder.cleanOrphan(parseBoolean(arg, requireValue(args, i++)));
                    break;
                case "--retention-hours":
                    builder.retentionHours(parseInt(arg, requireValue(args, i++)));
                    break;
                case "--min-execution-count":
                    builder.minExecutionCount(parseInt(arg, requireValue(args, i++)));
                    break;
                case "--report-as-table":
                    builder.reportAsTable(true);
                    break;
                case "--report-as-text":
                    builder.reportAsText(true);
                    break;
                case "--report-output-table":
                    builder.reportOutputTable(requireValue(args, i++));
                    break;
                case "--details-as-table":
                    builder.queryDetailsAsTable(true);
                    break;
                case "--details-output-table":
                    builder.queryDetailsOutputTable(requireValue(args, i++));
                    break;
                case "--report-json":
                    builder.reportJsonFile(requireValue(args, i++));
                    break;
                case "--runtime-stats-row-bytes":
                    builder.runtimeStatsRowBytes(parseInt(arg, requireValue(args, i++)));
                    break;
                case "--wait-stats-row-bytes":
                    builder.waitStatsRowBytes(parseInt(arg, requireValue(args, i++)));
                    break;
                case "--jdbc-url":
                    builder.jdbcUrl(requireValue(args, i++));
                    break;
                case "--user":
                    builder.user(requireValue(args, i++));
                    break;
                case "--password":
                    builder.password(requireValue(args, i++));
                    break;
                case "--snapshot-file":
                    builder.snapshotFile(requireValue(args, i++));
                    break;
                case "--config":
                    // Value already consumed by extractSettingsPath()
                    requireValue(args, i++);
                    break;
                case "--test":
                    builder.test(true);
                    break;
                case "--verbose":
                case "-v":
                    builder.verbose(true);
                    break;
                case "--debug":
                    builder.debug(true);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
    }

    private static String requireValue(String[] args, int optionIndex) {
        if (optionIndex + 1 >= args.length) {
            throw new IllegalArgumentException("Value not specified for " + args[optionIndex]);
        }
        return args[optionIndex + 1];
    }

    private static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value for " + option + ": " + value);
        }
    }

    private static boolean parseBoolean(String option, String value) {
        switch (value.toLowerCase()) {
            case "true":
            case "1":
            case "yes":
                return true;
            case "false":
            case "0":
            case "no":
                return false;
            default:
                throw new IllegalArgumentException("Invalid boolean value for " + option + ": " + value);
        }
    }

    private static String extractSettingsPath(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    /**
     * Returns help text for the configuration options.
     */
    public static String getOptionsHelp() {
        return """
            Options:
              --database, -d <name>            Database whose Query Store is cleaned (required)
              --clean-adhoc-stale <bool>       Clean stale ad-hoc queries only (default: false)
              --clean-stale <bool>             Clean all stale queries (default: true)
              --clean-internal <bool>          Clean internal maintenance queries (default: true)
              --clean-orphan <bool>            Clean queries of dropped objects (default: true)
              --retention-hours <num>          Hours since last execution (default: 168)
              --min-execution-count <num>      Executions needed to keep a query (default: 2)
              --report-as-table                Print the summary report as a table
              --report-as-text                 Print the summary report as text
              --report-output-table <name>     Table receiving the summary report
              --details-as-table               Print the query details report
              --details-output-table <name>    Table receiving the query details report
              --report-json <file>             Write both reports to a JSON file
              --runtime-stats-row-bytes <num>  Bytes per runtime statistics row (default: 653)
              --wait-stats-row-bytes <num>     Bytes per wait statistics row (default: 315)
              --jdbc-url <url>                 SQL Server JDBC URL
              --user <name>                    SQL Server login
              --password <secret>              SQL Server password
              --snapshot-file <file>           Preview against a JSON Query Store export instead
              --config <file>                  YAML settings file
              --test                           Select and report only, remove nothing
              --verbose, -v                    Log selection counts and removals
              --debug                          Also log the administrative statements

            Environment Variables:
              QDS_CLEAN_DATABASE               Same as --database
              QDS_CLEAN_JDBC_URL               Same as --jdbc-url
              QDS_CLEAN_USER                   Same as --user
              QDS_CLEAN_PASSWORD               Same as --password
              QDS_CLEAN_RETENTION_HOURS        Same as --retention-hours
              QDS_CLEAN_MIN_EXECUTION_COUNT    Same as --min-execution-count

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file
              4. Built-in defaults
            """;
    }
}
