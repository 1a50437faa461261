package org.carball.qdsclean.report;

import org.carball.qdsclean.model.cleanup.CandidateSet;
import org.carball.qdsclean.model.store.PlanFootprint;
import org.carball.qdsclean.model.store.QueryFootprint;
import org.carball.qdsclean.store.QueryStoreRepository;

import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Footprints of every query and plan in a candidate set, read once and shared by both reports.
 */
public class CandidateFootprints {

    private final Map<Long, QueryFootprint> queries = new HashMap<>();
    private final Map<Long, PlanFootprint> plans = new HashMap<>();

    public static CandidateFootprints load(QueryStoreRepository repository, CandidateSet candidates)
            throws SQLException {
        CandidateFootprints footprints = new CandidateFootprints();
        if (candidates.isEmpty()) {
            return footprints;
        }
        repository.findQueryFootprints(candidates.getQueryIds())
                .forEach(q -> footprints.queries.put(q.queryId(), q));
        repository.findPlanFootprints(candidates.getPlanIds())
                .forEach(p -> footprints.plans.put(p.planId(), p));
        return footprints;
    }

    public Optional<QueryFootprint> query(long queryId) {
        return Optional.ofNullable(queries.get(queryId));
    }

    public Optional<PlanFootprint> plan(long planId) {
        return Optional.ofNullable(plans.get(planId));
    }
}
