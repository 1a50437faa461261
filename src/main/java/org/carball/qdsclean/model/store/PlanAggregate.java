package org.carball.qdsclean.model.store;

import java.time.OffsetDateTime;

/**
 * Aggregated state of one (query, plan) pair, the grain retention predicates are evaluated at.
 *
 * @param executionCount    sum of count_executions over the plan's runtime statistics
 * @param hasRuntimeStats   whether the plan has any runtime statistics row at all
 */
public record PlanAggregate(
        long queryId,
        long planId,
        long objectId,
        boolean forced,
        boolean internal,
        long executionCount,
        OffsetDateTime lastExecutionTime,
        boolean hasRuntimeStats
) {}
