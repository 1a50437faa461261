package org.carball.qdsclean.report;

import org.carball.qdsclean.model.report.QueryDetail;
import org.carball.qdsclean.model.report.ReportHeader;
import org.carball.qdsclean.util.QueryTextCompression;

import java.util.List;

/**
 * Console rendering of the query details report, with the query text decompressed and shortened.
 */
public final class QueryDetailFormatter {

    static final int TEXT_PREVIEW_LENGTH = 80;

    private QueryDetailFormatter() {
        // Utility class - prevent instantiation
    }

    public static String toTable(ReportHeader header, List<QueryDetail> details) {
        StringBuilder table = new StringBuilder();
        String format = "%-10s %-40s %10s %-34s %14s  %s%n";
        table.append("Query details for ").append(header.databaseName())
                .append(" on ").append(header.serverName())
                .append(" at ").append(header.executionTime()).append('\n');
        table.append(String.format(format, "QueryType", "ObjectName", "QueryId", "LastExecutionTime",
                "ExecutionCount", "QueryText"));
        table.append("-".repeat(160)).append('\n');
        for (QueryDetail detail : details) {
            table.append(String.format(format,
                    detail.getCategory().getLabel(),
                    detail.getObjectName(),
                    detail.getQueryId(),
                    detail.getLastExecutionTime(),
                    detail.getExecutionCount(),
                    preview(QueryTextCompression.decompress(detail.getQueryText()))));
        }
        return table.toString();
    }

    static String preview(String sqlText) {
        if (sqlText == null) {
            return "";
        }
        String collapsed = sqlText.replaceAll("\\s+", " ").trim();
        return collapsed.length() > TEXT_PREVIEW_LENGTH
                ? collapsed.substring(0, TEXT_PREVIEW_LENGTH) + "..."
                : collapsed;
    }
}
