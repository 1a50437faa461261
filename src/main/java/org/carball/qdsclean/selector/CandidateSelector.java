package org.carball.qdsclean.selector;

import lombok.extern.slf4j.Slf4j;
import org.carball.qdsclean.cleanup.CleanupException;
import org.carball.qdsclean.config.RetentionThresholds;
import org.carball.qdsclean.model.cleanup.CandidateSet;
import org.carball.qdsclean.model.cleanup.DeletionCandidate;
import org.carball.qdsclean.model.cleanup.QueryCategory;
import org.carball.qdsclean.store.QueryStoreRepository;

import java.sql.SQLException;
import java.util.List;

/**
 * Runs the enabled category queries against the store and collects their rows into one candidate set.
 */
@Slf4j
public class CandidateSelector {

    private final QueryStoreRepository repository;
    private final String databaseName;
    private final boolean verbose;

    public CandidateSelector(QueryStoreRepository repository, String databaseName, boolean verbose) {
        this.repository = repository;
        this.databaseName = databaseName;
        this.verbose = verbose;
    }

    /**
     * Selects candidates for each category in the given order. A failing category aborts the whole
     * selection; no partial set is returned.
     */
    public CandidateSet select(List<QueryCategory> categories, RetentionThresholds thresholds) {
        CandidateSet candidates = new CandidateSet();

        if (verbose) {
            try {
                log.info("Total queries: {}", repository.countQueries());
            } catch (SQLException e) {
                throw new CleanupException("Failed to count queries in database [" + databaseName + "]: "
                        + e.getMessage(), databaseName, e);
            }
        }

        for (QueryCategory category : categories) {
            List<DeletionCandidate> selected;
            try {
                selected = repository.findCandidates(category, thresholds);
            } catch (SQLException e) {
                throw new CleanupException("Failed to select " + category.getLabel() + " queries in database ["
                        + databaseName + "]: " + e.getMessage(), databaseName, e);
            }
            candidates.addAll(category, selected);

            if (verbose) {
                if (category == QueryCategory.ADHOC_STALE || category == QueryCategory.STALE) {
                    log.info("{} queries criteria: {}", category.getDisplayName(), thresholds.describe());
                }
                log.info("{} queries found: {}", category.getDisplayName(), selected.size());
            } else {
                log.debug("{} queries found: {}", category.getDisplayName(), selected.size());
            }
        }

        return candidates;
    }
}
