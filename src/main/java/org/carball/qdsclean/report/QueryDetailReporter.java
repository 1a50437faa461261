package org.carball.qdsclean.report;

import lombok.extern.slf4j.Slf4j;
import org.carball.qdsclean.model.cleanup.CandidateSet;
import org.carball.qdsclean.model.cleanup.DeletionCandidate;
import org.carball.qdsclean.model.cleanup.QueryCategory;
import org.carball.qdsclean.model.report.QueryDetail;
import org.carball.qdsclean.model.store.PlanFootprint;
import org.carball.qdsclean.model.store.QueryFootprint;
import org.carball.qdsclean.util.QueryTextCompression;
import org.carball.qdsclean.util.SqlIdentifiers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lists every selected query once per category it was selected under.
 */
@Slf4j
public class QueryDetailReporter {

    private static final Comparator<QueryDetail> REPORT_ORDER = Comparator
            .comparing((QueryDetail d) -> d.getCategory().getLabel())
            .thenComparing(QueryDetail::getObjectName)
            .thenComparingLong(QueryDetail::getQueryId);

    public List<QueryDetail> details(CandidateSet candidates, CandidateFootprints footprints) {
        // (category, query) -> plans selected for it
        Map<QueryCategory, Map<Long, Set<Long>>> plansByQuery = new LinkedHashMap<>();
        for (DeletionCandidate candidate : candidates.getCandidates()) {
            plansByQuery.computeIfAbsent(candidate.category(), c -> new LinkedHashMap<>())
                    .computeIfAbsent(candidate.queryId(), q -> new LinkedHashSet<>())
                    .add(candidate.planId());
        }

        List<QueryDetail> details = new ArrayList<>();
        plansByQuery.forEach((category, queries) -> queries.forEach((queryId, planIds) -> {
            QueryFootprint query = footprints.query(queryId).orElse(null);
            if (query == null) {
                log.debug("Query {} is no longer in the store, leaving it out of the details", queryId);
                return;
            }
            long executions = planIds.stream()
                    .map(footprints::plan)
                    .flatMap(Optional::stream)
                    .mapToLong(PlanFootprint::executionCount)
                    .sum();
            details.add(QueryDetail.builder()
                    .category(category)
                    .objectName(objectLabel(query))
                    .queryId(queryId)
                    .lastExecutionTime(query.lastExecutionTime())
                    .executionCount(executions)
                    .queryText(QueryTextCompression.compress(query.queryText()))
                    .build());
        }));

        details.sort(REPORT_ORDER);
        return details;
    }

    /**
     * Schema-qualified owner name, or a sentinel for ad-hoc queries and dropped owners.
     */
    static String objectLabel(QueryFootprint query) {
        if (query.objectId() == 0) {
            return QueryDetail.ADHOC_QUERY_LABEL;
        }
        if (!query.isObjectResolved()) {
            return QueryDetail.DELETED_OBJECT_LABEL;
        }
        return SqlIdentifiers.qualifiedName(query.objectSchema(), query.objectName());
    }
}
