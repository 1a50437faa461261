package org.carball.qdsclean.cleanup;

import lombok.extern.slf4j.Slf4j;
import org.carball.qdsclean.model.cleanup.CandidateSet;
import org.carball.qdsclean.model.cleanup.DeletionCandidate;
import org.carball.qdsclean.store.QueryStoreAdministration;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Drains a candidate set through the store's administrative procedures, one query at a time.
 * Candidates are taken highest plan id first, so a query's forced plan is unforced before
 * the query is removed. The set passed in is emptied, in test mode too; a failure leaves
 * the rows not yet processed in it.
 */
@Slf4j
public class DeletionEngine {

    private final QueryStoreAdministration administration;
    private final String databaseName;
    private final boolean test;
    private final boolean verbose;
    private final boolean debug;

    public DeletionEngine(QueryStoreAdministration administration, String databaseName,
                          boolean test, boolean verbose, boolean debug) {
        this.administration = administration;
        this.databaseName = databaseName;
        this.test = test;
        this.verbose = verbose;
        this.debug = debug;
    }

    public DeletionResult delete(CandidateSet candidates) {
        List<Long> removed = new ArrayList<>();
        int unforced = 0;

        while (!candidates.isEmpty()) {
            DeletionCandidate next = highestPlan(candidates.getCandidates());
            long queryId = next.queryId();
            long planId = next.planId();

            try {
                if (planId != 0) {
                    if (verbose) {
                        log.info("Unforce plan : {} for query : {}", planId, queryId);
                    }
                    logStatement(administration.describeUnforcePlan(queryId, planId));
                    if (!test) {
                        administration.unforcePlan(queryId, planId);
                    }
                    unforced++;
                }

                if (verbose) {
                    log.info("Remove query : {}", queryId);
                }
                logStatement(administration.describeRemoveQuery(queryId));
                if (!test) {
                    administration.removeQuery(queryId);
                }
            } catch (SQLException e) {
                throw new CleanupException("Failed to remove query " + queryId + " (plan " + planId
                        + ") from database [" + databaseName + "]: " + e.getMessage(),
                        databaseName, queryId, planId, e);
            }

            removed.add(queryId);
            candidates.removeQuery(queryId);
        }

        log.debug("{} {} queries, {} plans unforced", test ? "Would remove" : "Removed", removed.size(), unforced);
        return new DeletionResult(removed.size(), unforced, test, List.copyOf(removed));
    }

    // First arrival wins ties
    private static DeletionCandidate highestPlan(List<DeletionCandidate> pending) {
        DeletionCandidate best = pending.get(0);
        for (DeletionCandidate candidate : pending) {
            if (candidate.planId() > best.planId()) {
                best = candidate;
            }
        }
        return best;
    }

    private void logStatement(String statement) {
        if (debug) {
            log.info(statement);
        } else {
            log.debug(statement);
        }
    }
}
