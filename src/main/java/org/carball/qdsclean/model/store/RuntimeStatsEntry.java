package org.carball.qdsclean.model.store;

/**
 * One runtime statistics interval of a plan.
 */
public record RuntimeStatsEntry(long runtimeStatsId, long planId, long countExecutions) {}
