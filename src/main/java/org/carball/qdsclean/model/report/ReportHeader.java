package org.carball.qdsclean.model.report;

import java.time.OffsetDateTime;

/**
 * Identity columns shared by every row a cleanup run reports.
 */
public record ReportHeader(
        OffsetDateTime executionTime,
        String serverName,
        String databaseName,
        CleanupParameters parameters
) {}
