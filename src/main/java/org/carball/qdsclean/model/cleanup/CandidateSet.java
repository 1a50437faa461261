package org.carball.qdsclean.model.cleanup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Working collection of deletion candidates, kept in arrival order.
 */
public class CandidateSet {

    private final List<DeletionCandidate> candidates = new ArrayList<>();
    private final Map<QueryCategory, Integer> categoryCounts = new EnumMap<>(QueryCategory.class);

    /**
     * Appends the rows one category produced and records their count.
     */
    public void addAll(QueryCategory category, List<DeletionCandidate> selected) {
        for (DeletionCandidate candidate : selected) {
            if (candidate.category() != category) {
                throw new IllegalArgumentException("Candidate for query " + candidate.queryId()
                        + " belongs to " + candidate.category().getLabel() + ", not " + category.getLabel());
            }
        }
        candidates.addAll(selected);
        categoryCounts.merge(category, selected.size(), Integer::sum);
    }

    /**
     * Drops every row of the query. The recorded category counts keep their selection values.
     */
    public void removeQuery(long queryId) {
        candidates.removeIf(c -> c.queryId() == queryId);
    }

    public List<DeletionCandidate> getCandidates() {
        return Collections.unmodifiableList(candidates);
    }

    public List<DeletionCandidate> forCategory(QueryCategory category) {
        return candidates.stream()
                .filter(c -> c.category() == category)
                .collect(Collectors.toList());
    }

    /** Row count recorded per selected category, including categories that found nothing. */
    public Map<QueryCategory, Integer> getCategoryCounts() {
        return Collections.unmodifiableMap(categoryCounts);
    }

    public int getCount(QueryCategory category) {
        return categoryCounts.getOrDefault(category, 0);
    }

    public Set<Long> getQueryIds() {
        return candidates.stream()
                .map(DeletionCandidate::queryId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<Long> getPlanIds() {
        return candidates.stream()
                .map(DeletionCandidate::planId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public int size() {
        return candidates.size();
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}
