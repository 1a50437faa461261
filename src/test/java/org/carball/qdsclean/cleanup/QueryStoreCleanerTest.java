package org.carball.qdsclean.cleanup;

import org.carball.qdsclean.config.CleanupConfig;
import org.carball.qdsclean.model.cleanup.QueryCategory;
import org.carball.qdsclean.model.report.CategorySummary;
import org.carball.qdsclean.model.report.QueryDetail;
import org.carball.qdsclean.model.report.ReportHeader;
import org.carball.qdsclean.model.store.PlanRecord;
import org.carball.qdsclean.model.store.QueryRecord;
import org.carball.qdsclean.model.store.RuntimeStatsEntry;
import org.carball.qdsclean.report.ReportSink;
import org.carball.qdsclean.store.InMemoryQueryStore;
import org.carball.qdsclean.store.QueryStoreFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class QueryStoreCleanerTest {

    @TempDir
    Path tempDir;

    private InMemoryQueryStore store;
    private ByteArrayOutputStream console;

    @BeforeEach
    void setUp() {
        store = QueryStoreFixtures.scenarioStore();
        console = new ByteArrayOutputStream();
    }

    @Test
    void shouldRemoveEveryCandidateWithDefaultSettings() {
        // When
        CleanupResult result = cleaner(baseConfig().build(), store, null).run();

        // Then - Q1 stale ad-hoc, Q2 orphan, Q3 forced internal
        assertThat(store.containsQuery(1)).isFalse();
        assertThat(store.containsQuery(2)).isFalse();
        assertThat(store.containsQuery(3)).isFalse();
        assertThat(store.containsQuery(6)).isFalse();
        assertThat(store.getQueries()).extracting(QueryRecord::queryId).containsExactly(4L, 5L);

        assertThat(result.getServerName()).isEqualTo("SQL01");
        assertThat(result.getExecutionTime()).isEqualTo(QueryStoreFixtures.NOW);
        assertThat(result.getCandidateCounts()).containsExactly(
                entry(QueryCategory.STALE, 3),
                entry(QueryCategory.INTERNAL, 1),
                entry(QueryCategory.ORPHAN, 1));
        assertThat(result.getTotalCandidates()).isEqualTo(5);
        assertThat(result.getDeletion().queriesRemoved()).isEqualTo(4);
        assertThat(result.getSummary()).isEmpty();
        assertThat(result.getDetails()).isEmpty();
    }

    @Test
    void shouldUnforceInternalQueryPlanBeforeRemovingIt() {
        cleaner(baseConfig().cleanStale(false).cleanOrphan(false).build(), store, null).run();

        assertThat(store.getAdministrativeCalls()).containsExactly("unforce_plan(3,30)", "remove_query(3)");
    }

    @Test
    void shouldReportSameFiguresInTestModeAsInRealRun() {
        // Given
        CleanupConfig reporting = baseConfig().reportAsText(true).queryDetailsAsTable(true).build();
        InMemoryQueryStore dryStore = QueryStoreFixtures.scenarioStore();

        // When
        CleanupResult dryRun = cleaner(reporting.toBuilder().test(true).build(), dryStore, null).run();
        CleanupResult realRun = cleaner(reporting, store, null).run();

        // Then
        assertThat(dryRun.getSummary()).isNotEmpty().isEqualTo(realRun.getSummary());
        assertThat(dryRun.getDetails()).isNotEmpty().isEqualTo(realRun.getDetails());
        assertThat(dryRun.getDeletion().dryRun()).isTrue();
        assertThat(dryRun.getDeletion().queriesRemoved()).isEqualTo(realRun.getDeletion().queriesRemoved());
        assertThat(dryStore.getAdministrativeCalls()).isEmpty();
        assertThat(dryStore.getQueries()).hasSize(6);
    }

    @Test
    void shouldProduceSameReportsOnRepeatedTestRuns() {
        CleanupConfig config = baseConfig().test(true).reportAsTable(true).queryDetailsAsTable(true).build();

        CleanupResult first = cleaner(config, store, null).run();
        CleanupResult second = cleaner(config, store, null).run();

        assertThat(second.getSummary()).isEqualTo(first.getSummary());
        assertThat(second.getDetails()).isEqualTo(first.getDetails());
    }

    @Test
    void shouldPrintTextSummaryToConsole() {
        cleaner(baseConfig().test(true).reportAsText(true).build(), store, null).run();

        String output = console.toString(StandardCharsets.UTF_8);
        assertThat(output).contains("Stale queries found", "Internal queries found", "Orphan queries found");
        assertThat(output).contains("# of Plans : 3");
    }

    @Test
    void shouldPrintNothingWhenNoReportIsRequested() {
        cleaner(baseConfig().test(true).build(), store, null).run();

        assertThat(console.size()).isZero();
    }

    @Test
    void shouldReportQueryInTwoCategoriesTwiceAndRemoveItOnce() {
        // Given - query 7 is both internal and a stale ad-hoc query
        store.addQuery(new QueryRecord(7, 107, 0, QueryStoreFixtures.NOW.minusHours(200), true), "SELECT 7")
                .addPlan(new PlanRecord(70, 7, false, null))
                .addRuntimeStats(new RuntimeStatsEntry(7001, 70, 1));
        CleanupConfig config = baseConfig()
                .cleanAdhocStale(true).cleanStale(false).cleanOrphan(false)
                .reportAsTable(true).queryDetailsAsTable(true)
                .build();

        // When
        CleanupResult result = cleaner(config, store, null).run();

        // Then
        assertThat(result.getSummary()).extracting(CategorySummary::category)
                .containsExactly(QueryCategory.ADHOC_STALE, QueryCategory.INTERNAL);
        assertThat(result.getDetails()).filteredOn(d -> d.getQueryId() == 7).hasSize(2);
        assertThat(store.getAdministrativeCalls()).filteredOn(call -> call.equals("remove_query(7)")).hasSize(1);
        assertThat(store.containsQuery(7)).isFalse();
    }

    @Test
    void shouldSkipAdhocStalePassWhenStaleIsEnabled() {
        CleanupResult result = cleaner(baseConfig().cleanAdhocStale(true).test(true).build(), store, null).run();

        assertThat(result.getCandidateCounts()).doesNotContainKey(QueryCategory.ADHOC_STALE);
    }

    @Test
    void shouldWriteReportsToSink() {
        // Given
        RecordingSink sink = new RecordingSink();
        CleanupConfig config = baseConfig()
                .reportOutputTable("dbo.QDSCleanSummary")
                .queryDetailsOutputTable("dbo.QDSCleanQueryDetails")
                .build();

        // When
        cleaner(config, store, sink).run();

        // Then
        assertThat(sink.headers).hasSize(2).allSatisfy(header -> {
            assertThat(header.databaseName()).isEqualTo("Sales");
            assertThat(header.serverName()).isEqualTo("SQL01");
            assertThat(header.parameters().retentionHours()).isEqualTo(168);
        });
        assertThat(sink.summary).extracting(CategorySummary::category)
                .containsExactly(QueryCategory.INTERNAL, QueryCategory.ORPHAN, QueryCategory.STALE);
        assertThat(sink.details).extracting(QueryDetail::getQueryId).containsExactly(3L, 2L, 1L, 6L);
        assertThat(console.size()).isZero();
    }

    @Test
    void shouldExportJsonReport() throws Exception {
        Path file = tempDir.resolve("report.json");

        CleanupResult result = cleaner(baseConfig().test(true).reportJsonFile(file.toString()).build(), store, null)
                .run();

        assertThat(file).exists();
        assertThat(Files.readString(file)).contains("\"query_type\" : \"Stale\"", "\"database_name\" : \"Sales\"");
        assertThat(result.getSummary()).hasSize(3);
        assertThat(result.getDetails()).hasSize(4);
    }

    @Test
    void shouldRejectMissingDatabase() {
        CleanupConfig config = baseConfig().databaseName("Inventory").build();

        assertThatThrownBy(() -> cleaner(config, store, null).run())
                .isInstanceOf(DatabaseUnavailableException.class)
                .hasMessage("The database [Inventory] does not exist");
        assertThat(store.getAdministrativeCalls()).isEmpty();
    }

    @Test
    void shouldRejectOfflineDatabase() {
        InMemoryQueryStore offline = new InMemoryQueryStore("Sales", "OFFLINE", "SQL01", QueryStoreFixtures.CLOCK);

        assertThatThrownBy(() -> cleaner(baseConfig().build(), offline, null).run())
                .isInstanceOf(DatabaseUnavailableException.class)
                .hasMessage("The database [Sales] is not online");
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        CleanupConfig config = baseConfig().retentionHours(-1).build();

        assertThatThrownBy(() -> cleaner(config, store, null).run())
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.getAdministrativeCalls()).isEmpty();
    }

    private CleanupConfig.CleanupConfigBuilder baseConfig() {
        return CleanupConfig.builder()
                .databaseName(QueryStoreFixtures.DATABASE)
                .jdbcUrl("jdbc:sqlserver://localhost");
    }

    private QueryStoreCleaner cleaner(CleanupConfig config, InMemoryQueryStore target, ReportSink sink) {
        return new QueryStoreCleaner(config, target, target, sink,
                new PrintStream(console, true, StandardCharsets.UTF_8), QueryStoreFixtures.CLOCK);
    }

    private static class RecordingSink implements ReportSink {

        private final List<ReportHeader> headers = new ArrayList<>();
        private final List<CategorySummary> summary = new ArrayList<>();
        private final List<QueryDetail> details = new ArrayList<>();

        @Override
        public void writeSummary(ReportHeader header, List<CategorySummary> rows) {
            headers.add(header);
            summary.addAll(rows);
        }

        @Override
        public void writeDetails(ReportHeader header, List<QueryDetail> rows) {
            headers.add(header);
            details.addAll(rows);
        }
    }
}
