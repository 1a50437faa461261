package org.carball.qdsclean.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.qdsclean.cleanup.CleanupException;
import org.carball.qdsclean.cleanup.CleanupResult;
import org.carball.qdsclean.cleanup.DatabaseUnavailableException;
import org.carball.qdsclean.cleanup.QueryStoreCleaner;
import org.carball.qdsclean.config.CleanupConfig;
import org.carball.qdsclean.config.ConfigurationLoader;
import org.carball.qdsclean.model.cleanup.QueryCategory;
import org.carball.qdsclean.report.JdbcReportSink;
import org.carball.qdsclean.report.OutputTableName;
import org.carball.qdsclean.report.ReportSink;
import org.carball.qdsclean.store.ConnectionFactory;
import org.carball.qdsclean.store.InMemoryQueryStore;
import org.carball.qdsclean.store.JdbcQueryStore;
import org.carball.qdsclean.store.JdbcQueryStoreAdministration;
import org.carball.qdsclean.store.QueryStoreSnapshotLoader;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Arrays;
import java.util.Map;

@Slf4j
public class QueryStoreCleanupCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║            SQL Server Query Store Cleanup v%s              ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length == 0 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length == 0 ? 1 : 0);
        }

        try {
            CleanupConfig config = new ConfigurationLoader().loadConfiguration(args);

            System.out.println("\n🧹 Starting Query Store cleanup...");
            System.out.println("   Database: " + config.getDatabaseName());
            System.out.println("   Categories: " + config.getEnabledCategories().stream()
                    .map(QueryCategory::getLabel).toList());
            System.out.println("   Stale criteria: " + config.getThresholds().describe());
            if (config.isSnapshotMode()) {
                System.out.println("   Source: snapshot file " + config.getSnapshotFile());
            }
            if (config.isTest()) {
                System.out.println("   Mode: test (nothing will be removed)");
            }
            System.out.println();

            CleanupResult result = createCleaner(config).run();

            printSummary(result);
            System.out.println("\n✅ Cleanup complete!");

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (DatabaseUnavailableException e) {
            System.err.println("\n❌ " + e.getMessage());
            log.debug("Precondition failure details", e);
            System.exit(1);
        } catch (CleanupException e) {
            System.err.println("\n❌ Cleanup error: " + e.getMessage());
            log.debug("Cleanup error details", e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        }
    }

    static QueryStoreCleaner createCleaner(CleanupConfig config) throws IOException {
        if (config.isSnapshotMode()) {
            InMemoryQueryStore store = new QueryStoreSnapshotLoader().load(Paths.get(config.getSnapshotFile()));
            return new QueryStoreCleaner(config, store, store, null, System.out, Clock.systemUTC());
        }

        ConnectionFactory connectionFactory = new ConnectionFactory(config.resolveJdbcUrl(),
                config.getUser(), config.getPassword(), config.getDatabaseName());
        log.debug("Connecting with {}", connectionFactory);

        ReportSink sink = null;
        if (config.getReportOutputTable() != null || config.getQueryDetailsOutputTable() != null) {
            sink = new JdbcReportSink(connectionFactory,
                    parseTableName(config.getReportOutputTable()),
                    parseTableName(config.getQueryDetailsOutputTable()));
        }

        return new QueryStoreCleaner(config,
                new JdbcQueryStore(connectionFactory, Clock.systemUTC()),
                new JdbcQueryStoreAdministration(connectionFactory),
                sink, System.out, Clock.systemUTC());
    }

    private static OutputTableName parseTableName(String name) {
        return name == null ? null : OutputTableName.parse(name);
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar qds-cleanup.jar --database <name> --jdbc-url <url> [options]");
        System.out.println("       java -jar qds-cleanup.jar --database <name> --snapshot-file <file> [options]");
        System.out.println();
        System.out.print(ConfigurationLoader.getOptionsHelp());
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  # Preview what would be removed, with the summary as text");
        System.out.println("  java -jar qds-cleanup.jar -d Sales --jdbc-url \"jdbc:sqlserver://db01;encrypt=false\" "
                + "--test --report-as-text");
        System.out.println();
        System.out.println("  # Clean stale ad-hoc queries only and keep the summary in a table");
        System.out.println("  java -jar qds-cleanup.jar -d Sales --jdbc-url \"jdbc:sqlserver://db01\" "
                + "--clean-stale false --clean-adhoc-stale true --report-output-table dbo.QDSCleanSummary");
        System.out.println();
        System.out.println("  # Analyze an exported Query Store offline");
        System.out.println("  java -jar qds-cleanup.jar -d Sales --snapshot-file query-store-export.json "
                + "--test --report-json cleanup-report.json");
    }

    private static void printSummary(CleanupResult result) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 CLEANUP SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nServer: " + result.getServerName());
        System.out.println("Database: " + result.getDatabaseName());
        System.out.println("Execution time: " + result.getExecutionTime());

        System.out.println("\nCandidates per category:");
        for (Map.Entry<QueryCategory, Integer> entry : result.getCandidateCounts().entrySet()) {
            System.out.printf("  %-12s %d%n", entry.getKey().getLabel(), entry.getValue());
        }

        if (result.getDeletion().dryRun()) {
            System.out.println("\nQueries that would be removed: " + result.getDeletion().queriesRemoved());
            System.out.println("Plans that would be unforced: " + result.getDeletion().plansUnforced());
        } else {
            System.out.println("\nQueries removed: " + result.getDeletion().queriesRemoved());
            System.out.println("Plans unforced: " + result.getDeletion().plansUnforced());
        }

        if (result.getTotalCandidates() == 0) {
            System.out.println("\n💡 Nothing matched the cleanup criteria.");
        }
    }
}
