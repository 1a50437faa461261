package org.carball.qdsclean.selector;

import org.carball.qdsclean.config.RetentionThresholds;
import org.carball.qdsclean.model.cleanup.QueryCategory;
import org.carball.qdsclean.model.store.PlanAggregate;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.function.LongPredicate;

import static org.assertj.core.api.Assertions.assertThat;

class RetentionPredicatesTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 6, 1, 12, 0, 0, 0, ZoneOffset.UTC);
    private static final RetentionThresholds THRESHOLDS = RetentionThresholds.defaults();
    private static final LongPredicate NO_OBJECTS = id -> false;

    @Test
    void shouldSelectRarelyExecutedOldAdhocQueryAsStaleAndAdhocStale() {
        // Given - ad-hoc, 1 execution, last run 200 hours ago
        PlanAggregate aggregate = aggregate(0, 1, NOW.minusHours(200), false, true);

        // When/Then
        assertThat(RetentionPredicates.isStale(aggregate, THRESHOLDS, NOW)).isTrue();
        assertThat(RetentionPredicates.isAdhocStale(aggregate, THRESHOLDS, NOW)).isTrue();
        assertThat(RetentionPredicates.classify(aggregate, THRESHOLDS, NOW, NO_OBJECTS))
                .containsExactlyInAnyOrder(QueryCategory.ADHOC_STALE, QueryCategory.STALE);
    }

    @Test
    void shouldKeepQueryExecutedAtLeastMinimumTimes() {
        PlanAggregate aggregate = aggregate(0, 2, NOW.minusHours(500), false, true);

        assertThat(RetentionPredicates.isStale(aggregate, THRESHOLDS, NOW)).isFalse();
    }

    @Test
    void shouldKeepQueryExecutedWithinRetentionWindow() {
        PlanAggregate aggregate = aggregate(0, 1, NOW.minusHours(167), false, true);

        assertThat(RetentionPredicates.isStale(aggregate, THRESHOLDS, NOW)).isFalse();
    }

    @Test
    void shouldKeepQueryExecutedExactlyAtCutoff() {
        PlanAggregate aggregate = aggregate(0, 1, NOW.minusHours(168), false, true);

        assertThat(RetentionPredicates.isStale(aggregate, THRESHOLDS, NOW)).isFalse();
    }

    @Test
    void shouldNeverSelectPlanWithoutRuntimeStatsAsStale() {
        PlanAggregate aggregate = aggregate(0, 0, NOW.minusHours(1000), false, false);

        assertThat(RetentionPredicates.isStale(aggregate, THRESHOLDS, NOW)).isFalse();
        assertThat(RetentionPredicates.isAdhocStale(aggregate, THRESHOLDS, NOW)).isFalse();
    }

    @Test
    void shouldNotSelectNeverExecutedQueryAsStale() {
        PlanAggregate aggregate = aggregate(0, 0, null, false, true);

        assertThat(RetentionPredicates.isStale(aggregate, THRESHOLDS, NOW)).isFalse();
    }

    @Test
    void shouldSelectNothingAsStaleWhenMinimumIsZero() {
        PlanAggregate aggregate = aggregate(0, 0, NOW.minusHours(1000), false, true);

        assertThat(RetentionPredicates.isStale(aggregate, new RetentionThresholds(168, 0), NOW)).isFalse();
    }

    @Test
    void shouldNotSelectObjectOwnedQueryAsAdhocStale() {
        PlanAggregate aggregate = aggregate(42, 1, NOW.minusHours(200), false, true);

        assertThat(RetentionPredicates.isStale(aggregate, THRESHOLDS, NOW)).isTrue();
        assertThat(RetentionPredicates.isAdhocStale(aggregate, THRESHOLDS, NOW)).isFalse();
    }

    @Test
    void shouldSelectInternalQueryRegardlessOfActivity() {
        PlanAggregate aggregate = aggregate(0, 10_000, NOW.minusMinutes(5), true, true);

        assertThat(RetentionPredicates.classify(aggregate, THRESHOLDS, NOW, NO_OBJECTS))
                .containsExactly(QueryCategory.INTERNAL);
    }

    @Test
    void shouldSelectQueryOfDroppedObjectAsOrphan() {
        PlanAggregate dropped = aggregate(42, 100, NOW, false, true);
        PlanAggregate existing = aggregate(43, 100, NOW, false, true);
        LongPredicate catalog = id -> id == 43;

        assertThat(RetentionPredicates.isOrphan(dropped, catalog)).isTrue();
        assertThat(RetentionPredicates.isOrphan(existing, catalog)).isFalse();
    }

    @Test
    void shouldNeverSelectAdhocQueryAsOrphan() {
        PlanAggregate aggregate = aggregate(0, 100, NOW, false, true);

        assertThat(RetentionPredicates.isOrphan(aggregate, NO_OBJECTS)).isFalse();
    }

    @Test
    void shouldRetainActiveOwnedQuery() {
        PlanAggregate aggregate = aggregate(43, 100, NOW.minusHours(1), false, true);

        assertThat(RetentionPredicates.classify(aggregate, THRESHOLDS, NOW, id -> true)).isEmpty();
    }

    @Test
    void shouldComputeCutoffFromRetentionHours() {
        assertThat(RetentionPredicates.retentionCutoff(new RetentionThresholds(24, 2), NOW))
                .isEqualTo(NOW.minusDays(1));
    }

    private static PlanAggregate aggregate(long objectId, long executions, OffsetDateTime lastExecution,
                                           boolean internal, boolean hasRuntimeStats) {
        return new PlanAggregate(1, 10, objectId, false, internal, executions, lastExecution, hasRuntimeStats);
    }
}
