package org.carball.qdsclean.model.store;

/**
 * A row of sys.query_store_plan.
 */
public record PlanRecord(
        long planId,
        long queryId,
        boolean forced,
        String queryPlan
) {

    public PlanRecord withForced(boolean forced) {
        return new PlanRecord(planId, queryId, forced, queryPlan);
    }
}
