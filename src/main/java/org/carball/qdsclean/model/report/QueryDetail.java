package org.carball.qdsclean.model.report;

import lombok.Builder;
import lombok.Value;
import org.carball.qdsclean.model.cleanup.QueryCategory;

import java.time.OffsetDateTime;

/**
 * One query selected under one category, as listed in the query details report.
 * The query text is GZIP-compressed; see {@code QueryTextCompression}.
 */
@Value
@Builder
public class QueryDetail {

    public static final String ADHOC_QUERY_LABEL = "*** adhoc query ***";
    public static final String DELETED_OBJECT_LABEL = "*** deleted object ***";

    QueryCategory category;
    String objectName;
    long queryId;
    OffsetDateTime lastExecutionTime;
    long executionCount;
    byte[] queryText;
}
