package org.carball.qdsclean.report;

import org.carball.qdsclean.model.cleanup.QueryCategory;
import org.carball.qdsclean.model.report.CategorySummary;
import org.carball.qdsclean.model.report.ReportHeader;

import java.util.List;

/**
 * Console renderings of the summary report.
 */
public final class SummaryReportFormatter {

    private static final int BOX_WIDTH = 34;

    private SummaryReportFormatter() {
        // Utility class - prevent instantiation
    }

    /**
     * One framed block per category, in selection order.
     */
    public static String toText(List<CategorySummary> rows) {
        StringBuilder text = new StringBuilder();
        for (QueryCategory category : QueryCategory.values()) {
            rows.stream()
                    .filter(row -> row.category() == category)
                    .findFirst()
                    .ifPresent(row -> appendBlock(text, row));
        }
        return text.toString();
    }

    public static String toTable(ReportHeader header, List<CategorySummary> rows) {
        StringBuilder table = new StringBuilder();
        String format = "%-34s %-20s %-20s %-10s %10s %10s %12s %10s %11s %12s%n";
        table.append(String.format(format, "ExecutionTime", "ServerName", "DatabaseName", "QueryType",
                "QueryCount", "PlanCount", "QueryTextKBs", "PlanXMLKBs", "RunStatsKBs", "WaitStatsKBs"));
        table.append("-".repeat(160)).append('\n');
        for (CategorySummary row : rows) {
            table.append(String.format(format,
                    header.executionTime(),
                    header.serverName(),
                    header.databaseName(),
                    row.category().getLabel(),
                    row.queryCount(),
                    row.planCount(),
                    row.queryTextKBs(),
                    row.planXmlKBs(),
                    row.runStatsKBs(),
                    row.waitStatsKBs()));
        }
        return table.toString();
    }

    private static void appendBlock(StringBuilder text, CategorySummary row) {
        String stars = "*".repeat(BOX_WIDTH);
        text.append('\n');
        text.append(stars).append('\n');
        text.append(centered(row.category().getDisplayName() + " queries found")).append('\n');
        text.append(stars).append('\n');
        text.append("# of Queries : ").append(row.queryCount()).append('\n');
        text.append("# of Plans : ").append(row.planCount()).append('\n');
        text.append("KBs of query texts : ").append(row.queryTextKBs()).append('\n');
        text.append("KBs of execution plans : ").append(row.planXmlKBs()).append('\n');
        text.append("KBs of runtime stats : ").append(row.runStatsKBs()).append('\n');
        text.append("KBs of wait stats : ").append(row.waitStatsKBs()).append('\n');
        text.append('\n');
    }

    private static String centered(String title) {
        int inner = BOX_WIDTH - 2;
        int left = Math.max(0, (inner - title.length()) / 2);
        int right = Math.max(0, inner - title.length() - left);
        return "*" + " ".repeat(left) + title + " ".repeat(right) + "*";
    }
}
