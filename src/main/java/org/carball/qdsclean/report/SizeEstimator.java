package org.carball.qdsclean.report;

import org.carball.qdsclean.model.cleanup.CandidateSet;
import org.carball.qdsclean.model.cleanup.DeletionCandidate;
import org.carball.qdsclean.model.cleanup.QueryCategory;
import org.carball.qdsclean.model.report.CategorySummary;
import org.carball.qdsclean.model.store.PlanFootprint;
import org.carball.qdsclean.model.store.QueryFootprint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Estimates, per category, the space the selected entries hold.
 * <p>
 * Query text and plan sizes are measured; statistics sizes are row counts times a fixed
 * per-row size, since the engine stores them in fixed-width rows.
 * <p>
 * Each query's text is counted once per category, and each plan's payload and statistics rows
 * once per category. A query selected with two plans therefore contributes its text once, where
 * a sum over the joined (query, plan, statistics) rows would count it once per plan. The figures
 * are smaller than such join-level sums whenever a query has several selected plans.
 */
public class SizeEstimator {

    public static final int DEFAULT_RUNTIME_STATS_ROW_BYTES = 653;
    public static final int DEFAULT_WAIT_STATS_ROW_BYTES = 315;

    private final int runtimeStatsRowBytes;
    private final int waitStatsRowBytes;

    public SizeEstimator() {
        this(DEFAULT_RUNTIME_STATS_ROW_BYTES, DEFAULT_WAIT_STATS_ROW_BYTES);
    }

    public SizeEstimator(int runtimeStatsRowBytes, int waitStatsRowBytes) {
        this.runtimeStatsRowBytes = runtimeStatsRowBytes;
        this.waitStatsRowBytes = waitStatsRowBytes;
    }

    /**
     * One row per category that selected anything, ordered by category label.
     */
    public List<CategorySummary> summarize(CandidateSet candidates, CandidateFootprints footprints) {
        List<CategorySummary> rows = new ArrayList<>();
        for (QueryCategory category : QueryCategory.values()) {
            List<DeletionCandidate> selected = candidates.forCategory(category);
            if (!selected.isEmpty()) {
                rows.add(summarize(category, selected, footprints));
            }
        }
        rows.sort(Comparator.comparing(row -> row.category().getLabel()));
        return rows;
    }

    private CategorySummary summarize(QueryCategory category, List<DeletionCandidate> selected,
                                      CandidateFootprints footprints) {
        Set<Long> queryIds = new LinkedHashSet<>();
        Set<Long> planIds = new LinkedHashSet<>();
        for (DeletionCandidate candidate : selected) {
            queryIds.add(candidate.queryId());
            planIds.add(candidate.planId());
        }

        long textBytes = queryIds.stream()
                .map(footprints::query)
                .flatMap(Optional::stream)
                .mapToLong(QueryFootprint::queryTextBytes)
                .sum();

        long planBytes = 0;
        long runtimeRows = 0;
        long waitRows = 0;
        for (Long planId : planIds) {
            PlanFootprint plan = footprints.plan(planId).orElse(null);
            if (plan != null) {
                planBytes += plan.planBytes();
                runtimeRows += plan.runtimeStatsRows();
                waitRows += plan.waitStatsRows();
            }
        }

        return new CategorySummary(
                category,
                queryIds.size(),
                planIds.size(),
                textBytes / 1024,
                planBytes / 1024,
                runtimeRows * runtimeStatsRowBytes / 1024,
                waitRows * waitStatsRowBytes / 1024
        );
    }
}
