package org.carball.qdsclean.cleanup;

import lombok.extern.slf4j.Slf4j;
import org.carball.qdsclean.config.CleanupConfig;
import org.carball.qdsclean.model.cleanup.CandidateSet;
import org.carball.qdsclean.model.cleanup.QueryCategory;
import org.carball.qdsclean.model.report.CategorySummary;
import org.carball.qdsclean.model.report.QueryDetail;
import org.carball.qdsclean.model.report.ReportHeader;
import org.carball.qdsclean.report.CandidateFootprints;
import org.carball.qdsclean.report.CleanupReportExporter;
import org.carball.qdsclean.report.QueryDetailFormatter;
import org.carball.qdsclean.report.QueryDetailReporter;
import org.carball.qdsclean.report.ReportSink;
import org.carball.qdsclean.report.SizeEstimator;
import org.carball.qdsclean.report.SummaryReportFormatter;
import org.carball.qdsclean.selector.CandidateSelector;
import org.carball.qdsclean.store.QueryStoreAdministration;
import org.carball.qdsclean.store.QueryStoreRepository;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one cleanup of a database's Query Store: check the database, select candidates,
 * report on them, then remove them.
 * <p>
 * Reports are produced before anything is removed, so a dry run reports exactly what a
 * real run would remove.
 */
@Slf4j
public class QueryStoreCleaner {

    private final CleanupConfig config;
    private final QueryStoreRepository repository;
    private final QueryStoreAdministration administration;
    private final ReportSink reportSink;
    private final PrintStream out;
    private final Clock clock;

    /**
     * @param reportSink destination for the report output tables, or null when none is configured
     * @param out        console receiving the table and text renderings
     */
    public QueryStoreCleaner(CleanupConfig config, QueryStoreRepository repository,
                             QueryStoreAdministration administration, ReportSink reportSink,
                             PrintStream out, Clock clock) {
        this.config = config;
        this.repository = repository;
        this.administration = administration;
        this.reportSink = reportSink;
        this.out = out;
        this.clock = clock;
    }

    public CleanupResult run() {
        config.validate();
        String databaseName = config.getDatabaseName();

        checkDatabaseAvailable(databaseName);

        OffsetDateTime executionTime = OffsetDateTime.now(clock);
        String serverName = readServerName(databaseName);
        ReportHeader header = new ReportHeader(executionTime, serverName, databaseName, config.toParameters());

        CandidateSelector selector = new CandidateSelector(repository, databaseName, config.isVerbose());
        CandidateSet candidates = selector.select(config.getEnabledCategories(), config.getThresholds());

        List<CategorySummary> summary = List.of();
        List<QueryDetail> details = List.of();
        if (config.isSummaryRequested() || config.isDetailsRequested()) {
            CandidateFootprints footprints = loadFootprints(candidates, databaseName);
            if (config.isSummaryRequested()) {
                summary = reportSummary(header, candidates, footprints);
            }
            if (config.isDetailsRequested()) {
                details = reportDetails(header, candidates, footprints);
            }
            if (config.getReportJsonFile() != null) {
                exportJson(header, summary, details);
            }
        }

        DeletionEngine engine = new DeletionEngine(administration, databaseName,
                config.isTest(), config.isVerbose(), config.isDebug());
        DeletionResult deletion = engine.delete(candidates);

        if (deletion.dryRun()) {
            log.info("Test run on [{}]: {} queries would be removed", databaseName, deletion.queriesRemoved());
        } else {
            log.info("Removed {} queries from [{}], {} plans unforced",
                    deletion.queriesRemoved(), databaseName, deletion.plansUnforced());
        }

        Map<QueryCategory, Integer> counts = new LinkedHashMap<>();
        for (QueryCategory category : config.getEnabledCategories()) {
            counts.put(category, candidates.getCount(category));
        }

        return CleanupResult.builder()
                .executionTime(executionTime)
                .serverName(serverName)
                .databaseName(databaseName)
                .candidateCounts(counts)
                .summary(summary)
                .details(details)
                .deletion(deletion)
                .build();
    }

    private void checkDatabaseAvailable(String databaseName) {
        Optional<String> state;
        try {
            state = repository.findDatabaseState(databaseName);
        } catch (SQLException e) {
            throw new CleanupException("Failed to read the state of database [" + databaseName + "]: "
                    + e.getMessage(), databaseName, e);
        }
        if (state.isEmpty()) {
            throw new DatabaseUnavailableException("The database [" + databaseName + "] does not exist", databaseName);
        }
        if (!"ONLINE".equalsIgnoreCase(state.get())) {
            throw new DatabaseUnavailableException("The database [" + databaseName + "] is not online", databaseName);
        }
    }

    private String readServerName(String databaseName) {
        try {
            return repository.getServerName();
        } catch (SQLException e) {
            throw new CleanupException("Failed to read the server name: " + e.getMessage(), databaseName, e);
        }
    }

    private CandidateFootprints loadFootprints(CandidateSet candidates, String databaseName) {
        try {
            return CandidateFootprints.load(repository, candidates);
        } catch (SQLException e) {
            throw new CleanupException("Failed to read the footprint of the selected queries in database ["
                    + databaseName + "]: " + e.getMessage(), databaseName, e);
        }
    }

    private List<CategorySummary> reportSummary(ReportHeader header, CandidateSet candidates,
                                                CandidateFootprints footprints) {
        SizeEstimator estimator = new SizeEstimator(config.getRuntimeStatsRowBytes(), config.getWaitStatsRowBytes());
        List<CategorySummary> summary = estimator.summarize(candidates, footprints);

        if (config.isReportAsTable()) {
            out.print(SummaryReportFormatter.toTable(header, summary));
        }
        if (config.isReportAsText()) {
            out.print(SummaryReportFormatter.toText(summary));
        }
        if (config.getReportOutputTable() != null) {
            if (reportSink == null) {
                log.warn("No report sink configured, summary not written to {}", config.getReportOutputTable());
            } else {
                try {
                    reportSink.writeSummary(header, summary);
                } catch (SQLException e) {
                    throw new CleanupException("Failed to write the summary report to "
                            + config.getReportOutputTable() + ": " + e.getMessage(), header.databaseName(), e);
                }
            }
        }
        return summary;
    }

    private List<QueryDetail> reportDetails(ReportHeader header, CandidateSet candidates,
                                            CandidateFootprints footprints) {
        List<QueryDetail> details = new QueryDetailReporter().details(candidates, footprints);

        if (config.isQueryDetailsAsTable()) {
            out.print(QueryDetailFormatter.toTable(header, details));
        }
        if (config.getQueryDetailsOutputTable() != null) {
            if (reportSink == null) {
                log.warn("No report sink configured, query details not written to {}",
                        config.getQueryDetailsOutputTable());
            } else {
                try {
                    reportSink.writeDetails(header, details);
                } catch (SQLException e) {
                    throw new CleanupException("Failed to write the query details report to "
                            + config.getQueryDetailsOutputTable() + ": " + e.getMessage(), header.databaseName(), e);
                }
            }
        }
        return details;
    }

    private void exportJson(ReportHeader header, List<CategorySummary> summary, List<QueryDetail> details) {
        try {
            new CleanupReportExporter().export(Paths.get(config.getReportJsonFile()), header, summary, details);
        } catch (IOException e) {
            throw new CleanupException("Failed to export the cleanup report to " + config.getReportJsonFile()
                    + ": " + e.getMessage(), header.databaseName(), e);
        }
    }
}
