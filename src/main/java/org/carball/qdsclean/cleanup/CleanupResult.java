package org.carball.qdsclean.cleanup;

import lombok.Builder;
import lombok.Value;
import org.carball.qdsclean.model.cleanup.QueryCategory;
import org.carball.qdsclean.model.report.CategorySummary;
import org.carball.qdsclean.model.report.QueryDetail;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class CleanupResult {

    OffsetDateTime executionTime;
    String serverName;
    String databaseName;

    /** Rows selected per enabled category, in selection order. */
    Map<QueryCategory, Integer> candidateCounts;

    /** Empty unless a summary output was requested. */
    @Builder.Default
    List<CategorySummary> summary = List.of();

    /** Empty unless a details output was requested. */
    @Builder.Default
    List<QueryDetail> details = List.of();

    DeletionResult deletion;

    public int getTotalCandidates() {
        return candidateCounts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
