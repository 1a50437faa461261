package org.carball.qdsclean.report;

import org.carball.qdsclean.model.report.CategorySummary;
import org.carball.qdsclean.model.report.QueryDetail;
import org.carball.qdsclean.model.report.ReportHeader;

import java.sql.SQLException;
import java.util.List;

/**
 * Destination that keeps report rows after the run.
 */
public interface ReportSink {

    void writeSummary(ReportHeader header, List<CategorySummary> rows) throws SQLException;

    void writeDetails(ReportHeader header, List<QueryDetail> details) throws SQLException;
}
