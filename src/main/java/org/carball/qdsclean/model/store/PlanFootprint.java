package org.carball.qdsclean.model.store;

/**
 * Storage footprint of a plan: payload size plus the statistics rows hanging off it.
 */
public record PlanFootprint(
        long planId,
        long queryId,
        long planBytes,
        long runtimeStatsRows,
        long waitStatsRows,
        long executionCount
) {}
