package org.carball.qdsclean.config;

/**
 * Thresholds of the stale predicates: a query is stale when it ran fewer than
 * {@code minExecutionCount} times and not within the last {@code retentionHours}.
 */
public record RetentionThresholds(int retentionHours, int minExecutionCount) {

    public static final int DEFAULT_RETENTION_HOURS = 168;
    public static final int DEFAULT_MIN_EXECUTION_COUNT = 2;

    public static RetentionThresholds defaults() {
        return new RetentionThresholds(DEFAULT_RETENTION_HOURS, DEFAULT_MIN_EXECUTION_COUNT);
    }

    public String describe() {
        return String.format("executed less than %d times, and not executed for the last %d hours",
                minExecutionCount, retentionHours);
    }
}
