package org.carball.qdsclean.report;

import lombok.extern.slf4j.Slf4j;
import org.carball.qdsclean.model.report.CategorySummary;
import org.carball.qdsclean.model.report.QueryDetail;
import org.carball.qdsclean.model.report.ReportHeader;
import org.carball.qdsclean.store.ConnectionFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Comparator;
import java.util.List;

/**
 * Inserts report rows into caller-named tables. Inserts name their columns, so destination
 * tables may carry extra columns.
 * <pre>
 * CREATE TABLE [dbo].[QDSCleanSummary] (
 *     [ExecutionTime] DATETIMEOFFSET(7) NOT NULL, [ServerName] SYSNAME NOT NULL,
 *     [DatabaseName] SYSNAME NOT NULL, [QueryType] NVARCHAR(16) NOT NULL,
 *     [QueryCount] BIGINT NULL, [PlanCount] BIGINT NULL, [QueryTextKBs] BIGINT NULL,
 *     [PlanXMLKBs] BIGINT NULL, [RunStatsKBs] BIGINT NULL, [WaitStatsKBs] BIGINT NULL,
 *     [CleanupParameters] XML NULL)
 *
 * CREATE TABLE [dbo].[QDSCleanQueryDetails] (
 *     [ExecutionTime] DATETIMEOFFSET(7) NOT NULL, [ServerName] SYSNAME NOT NULL,
 *     [DatabaseName] SYSNAME NOT NULL, [QueryType] NVARCHAR(16) NOT NULL,
 *     [ObjectName] NVARCHAR(260) NULL, [QueryId] BIGINT NOT NULL,
 *     [LastExecutionTime] DATETIMEOFFSET(7) NULL, [ExecutionCount] BIGINT NULL,
 *     [QueryText] VARBINARY(MAX) NULL, [CleanupParameters] XML NULL)
 * </pre>
 */
@Slf4j
public class JdbcReportSink implements ReportSink {

    private static final String SUMMARY_INSERT = """
        INSERT INTO %s (
            [ExecutionTime], [ServerName], [DatabaseName], [QueryType],
            [QueryCount], [PlanCount], [QueryTextKBs], [PlanXMLKBs], [RunStatsKBs], [WaitStatsKBs],
            [CleanupParameters]
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
    """;

    private static final String DETAILS_INSERT = """
        INSERT INTO %s (
            [ExecutionTime], [ServerName], [DatabaseName], [QueryType],
            [ObjectName], [QueryId], [LastExecutionTime], [ExecutionCount], [QueryText],
            [CleanupParameters]
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
    """;

    private final ConnectionFactory connectionFactory;
    private final OutputTableName summaryTable;
    private final OutputTableName detailsTable;

    /**
     * Either table may be null, in which case that report is not persisted.
     */
    public JdbcReportSink(ConnectionFactory connectionFactory, OutputTableName summaryTable,
                          OutputTableName detailsTable) {
        this.connectionFactory = connectionFactory;
        this.summaryTable = summaryTable;
        this.detailsTable = detailsTable;
    }

    @Override
    public void writeSummary(ReportHeader header, List<CategorySummary> rows) throws SQLException {
        if (summaryTable == null) {
            return;
        }
        String sql = String.format(SUMMARY_INSERT, summaryTable.toSql());
        log.debug("Writing {} summary rows:\n{}", rows.size(), sql);

        List<CategorySummary> ordered = rows.stream()
                .sorted(Comparator.comparing(row -> row.category().getLabel()))
                .toList();

        try (Connection conn = connectionFactory.open()) {
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (CategorySummary row : ordered) {
                    bindHeader(stmt, header);
                    stmt.setString(4, row.category().getLabel());
                    stmt.setLong(5, row.queryCount());
                    stmt.setLong(6, row.planCount());
                    stmt.setLong(7, row.queryTextKBs());
                    stmt.setLong(8, row.planXmlKBs());
                    stmt.setLong(9, row.runStatsKBs());
                    stmt.setLong(10, row.waitStatsKBs());
                    stmt.setString(11, header.parameters().toXml());
                    stmt.addBatch();
                }
                stmt.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
        log.info("Summary report written to {}", summaryTable);
    }

    @Override
    public void writeDetails(ReportHeader header, List<QueryDetail> details) throws SQLException {
        if (detailsTable == null) {
            return;
        }
        String sql = String.format(DETAILS_INSERT, detailsTable.toSql());
        log.debug("Writing {} query detail rows:\n{}", details.size(), sql);

        List<QueryDetail> ordered = details.stream()
                .sorted(Comparator.comparing((QueryDetail d) -> d.getCategory().getLabel())
                        .thenComparingLong(QueryDetail::getQueryId))
                .toList();

        try (Connection conn = connectionFactory.open()) {
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (QueryDetail detail : ordered) {
                    bindHeader(stmt, header);
                    stmt.setString(4, detail.getCategory().getLabel());
                    stmt.setString(5, detail.getObjectName());
                    stmt.setLong(6, detail.getQueryId());
                    if (detail.getLastExecutionTime() != null) {
                        stmt.setObject(7, detail.getLastExecutionTime());
                    } else {
                        stmt.setNull(7, Types.TIMESTAMP_WITH_TIMEZONE);
                    }
                    stmt.setLong(8, detail.getExecutionCount());
                    if (detail.getQueryText() != null) {
                        stmt.setBytes(9, detail.getQueryText());
                    } else {
                        stmt.setNull(9, Types.VARBINARY);
                    }
                    stmt.setString(10, header.parameters().toXml());
                    stmt.addBatch();
                }
                stmt.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
        log.info("Query details report written to {}", detailsTable);
    }

    private static void bindHeader(PreparedStatement stmt, ReportHeader header) throws SQLException {
        stmt.setObject(1, header.executionTime());
        stmt.setString(2, header.serverName());
        stmt.setString(3, header.databaseName());
    }
}
