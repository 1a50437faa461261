package org.carball.qdsclean.model.store;

/**
 * One wait statistics row of a plan.
 */
public record WaitStatsEntry(long waitStatsId, long planId) {}
