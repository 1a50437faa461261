package org.carball.qdsclean.store;

import java.sql.SQLException;

/**
 * Mutating Query Store procedures. A query with a forced plan cannot be removed
 * until the plan is unforced.
 */
public interface QueryStoreAdministration {

    void unforcePlan(long queryId, long planId) throws SQLException;

    /**
     * Removes the query together with its plans and their statistics.
     */
    void removeQuery(long queryId) throws SQLException;

    /**
     * Text of the unforce call, as logged in debug mode.
     */
    default String describeUnforcePlan(long queryId, long planId) {
        return "unforce_plan(query_id = " + queryId + ", plan_id = " + planId + ")";
    }

    default String describeRemoveQuery(long queryId) {
        return "remove_query(query_id = " + queryId + ")";
    }
}
