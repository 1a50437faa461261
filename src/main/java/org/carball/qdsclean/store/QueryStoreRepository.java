package org.carball.qdsclean.store;

import org.carball.qdsclean.config.RetentionThresholds;
import org.carball.qdsclean.model.cleanup.DeletionCandidate;
import org.carball.qdsclean.model.cleanup.QueryCategory;
import org.carball.qdsclean.model.store.PlanFootprint;
import org.carball.qdsclean.model.store.QueryFootprint;

import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the Query Store of one database.
 */
public interface QueryStoreRepository {

    /**
     * Returns the state of the named database (for example {@code ONLINE}), or empty if it does not exist.
     */
    Optional<String> findDatabaseState(String databaseName) throws SQLException;

    String getServerName() throws SQLException;

    long countQueries() throws SQLException;

    /**
     * Returns one candidate per (query, plan) pair matching the category's retention predicate.
     */
    List<DeletionCandidate> findCandidates(QueryCategory category, RetentionThresholds thresholds) throws SQLException;

    List<QueryFootprint> findQueryFootprints(Collection<Long> queryIds) throws SQLException;

    List<PlanFootprint> findPlanFootprints(Collection<Long> planIds) throws SQLException;
}
