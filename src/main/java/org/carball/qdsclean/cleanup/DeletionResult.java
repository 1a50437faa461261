package org.carball.qdsclean.cleanup;

import java.util.List;

/**
 * Outcome of a deletion pass. In a dry run the counts are what would have been removed.
 */
public record DeletionResult(
        int queriesRemoved,
        int plansUnforced,
        boolean dryRun,
        List<Long> removedQueryIds
) {}
