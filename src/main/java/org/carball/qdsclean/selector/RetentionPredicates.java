package org.carball.qdsclean.selector;

import org.carball.qdsclean.config.RetentionThresholds;
import org.carball.qdsclean.model.cleanup.QueryCategory;
import org.carball.qdsclean.model.store.PlanAggregate;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.LongPredicate;

/**
 * Retention predicates over the aggregated state of a (query, plan) pair.
 */
public final class RetentionPredicates {

    private RetentionPredicates() {
        // Utility class - prevent instantiation
    }

    /**
     * Stale ad-hoc query: not owned by any object, rarely executed and not executed recently.
     */
    public static boolean isAdhocStale(PlanAggregate aggregate, RetentionThresholds thresholds, OffsetDateTime now) {
        return aggregate.objectId() == 0 && isStale(aggregate, thresholds, now);
    }

    /**
     * Stale query of any ownership. Plans without runtime statistics never qualify.
     */
    public static boolean isStale(PlanAggregate aggregate, RetentionThresholds thresholds, OffsetDateTime now) {
        return aggregate.hasRuntimeStats()
                && aggregate.executionCount() < thresholds.minExecutionCount()
                && aggregate.lastExecutionTime() != null
                && aggregate.lastExecutionTime().isBefore(retentionCutoff(thresholds, now));
    }

    public static boolean isInternal(PlanAggregate aggregate) {
        return aggregate.internal();
    }

    /**
     * Query owned by an object that is no longer in the catalog.
     */
    public static boolean isOrphan(PlanAggregate aggregate, LongPredicate objectExists) {
        return aggregate.objectId() != 0 && !objectExists.test(aggregate.objectId());
    }

    public static boolean matches(QueryCategory category, PlanAggregate aggregate, RetentionThresholds thresholds,
                                  OffsetDateTime now, LongPredicate objectExists) {
        switch (category) {
            case ADHOC_STALE:
                return isAdhocStale(aggregate, thresholds, now);
            case STALE:
                return isStale(aggregate, thresholds, now);
            case INTERNAL:
                return isInternal(aggregate);
            case ORPHAN:
                return isOrphan(aggregate, objectExists);
            default:
                throw new IllegalArgumentException("Unsupported category: " + category);
        }
    }

    /**
     * All categories the aggregate falls into. Empty when it should be retained.
     */
    public static Set<QueryCategory> classify(PlanAggregate aggregate, RetentionThresholds thresholds,
                                              OffsetDateTime now, LongPredicate objectExists) {
        Set<QueryCategory> categories = EnumSet.noneOf(QueryCategory.class);
        for (QueryCategory category : QueryCategory.values()) {
            if (matches(category, aggregate, thresholds, now, objectExists)) {
                categories.add(category);
            }
        }
        return categories;
    }

    public static OffsetDateTime retentionCutoff(RetentionThresholds thresholds, OffsetDateTime now) {
        return now.minusHours(thresholds.retentionHours());
    }
}
