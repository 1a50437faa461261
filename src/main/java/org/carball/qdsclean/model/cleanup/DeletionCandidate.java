package org.carball.qdsclean.model.cleanup;

/**
 * A (query, plan) pair selected for removal under one category.
 * The same query may appear once per category it matched.
 */
public record DeletionCandidate(
        QueryCategory category,
        long queryId,
        long planId,
        boolean forced
) {}
