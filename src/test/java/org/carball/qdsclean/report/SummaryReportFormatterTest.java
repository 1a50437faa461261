package org.carball.qdsclean.report;

import org.carball.qdsclean.model.cleanup.QueryCategory;
import org.carball.qdsclean.model.report.CategorySummary;
import org.carball.qdsclean.model.report.CleanupParameters;
import org.carball.qdsclean.model.report.ReportHeader;
import org.carball.qdsclean.store.QueryStoreFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SummaryReportFormatterTest {

    private static final List<CategorySummary> ROWS = List.of(
            new CategorySummary(QueryCategory.INTERNAL, 1, 1, 0, 0, 0, 0),
            new CategorySummary(QueryCategory.STALE, 2, 3, 2, 4, 2, 1));

    @Test
    void shouldRenderFramedBlockPerCategory() {
        // When
        String text = SummaryReportFormatter.toText(ROWS);

        // Then
        assertThat(text).contains("*".repeat(34));
        assertThat(text).contains("*      Stale queries found       *");
        assertThat(text).contains("# of Queries : 2\n# of Plans : 3\nKBs of query texts : 2\n"
                + "KBs of execution plans : 4\nKBs of runtime stats : 2\nKBs of wait stats : 1\n");
    }

    @Test
    void shouldRenderBlocksInSelectionOrder() {
        String text = SummaryReportFormatter.toText(List.of(
                new CategorySummary(QueryCategory.ORPHAN, 1, 1, 0, 0, 0, 0),
                new CategorySummary(QueryCategory.ADHOC_STALE, 1, 1, 0, 0, 0, 0)));

        assertThat(text.indexOf("Adhoc Stale queries found")).isLessThan(text.indexOf("Orphan queries found"));
    }

    @Test
    void shouldRenderNothingForEmptySummary() {
        assertThat(SummaryReportFormatter.toText(List.of())).isEmpty();
    }

    @Test
    void shouldRenderTableWithHeaderColumns() {
        ReportHeader header = new ReportHeader(QueryStoreFixtures.NOW, "SQL01", "Sales",
                new CleanupParameters(false, true, 168, 2, true, true));

        String table = SummaryReportFormatter.toTable(header, ROWS);

        assertThat(table.lines().findFirst()).hasValueSatisfying(line -> assertThat(line)
                .contains("ExecutionTime", "ServerName", "QueryType", "WaitStatsKBs"));
        assertThat(table.lines().filter(line -> line.contains("SQL01") && line.contains("Sales"))).hasSize(2);
    }
}
